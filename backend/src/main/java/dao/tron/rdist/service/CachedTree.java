package dao.tron.rdist.service;

import java.util.List;

/**
 * Derived Merkle tree of one sealed epoch. Rebuildable at any time; never authoritative.
 */
public record CachedTree(
        long epoch,
        String channel,
        byte[] root,
        List<List<byte[]>> levels,
        int count,
        long builtAt
) {}
