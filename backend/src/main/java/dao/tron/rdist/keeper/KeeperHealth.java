package dao.tron.rdist.keeper;

import dao.tron.rdist.ring.EvictionRisk;

import java.util.List;

/**
 * @param secondsSinceLastSuccess -1 when no tick has succeeded yet
 */
public record KeeperHealth(
        boolean healthy,
        long secondsSinceLastSuccess,
        KeeperState state,
        int slotsAtRisk,
        List<EvictionRisk> evictionRisks,
        long alertCount,
        String lastAlert
) {}
