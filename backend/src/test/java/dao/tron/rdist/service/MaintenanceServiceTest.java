package dao.tron.rdist.service;

import dao.tron.rdist.ledger.PositionState;
import dao.tron.rdist.model.ClaimStatus;
import dao.tron.rdist.support.DistributorFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class MaintenanceServiceTest {

    private static final String CHANNEL = "alpha";

    private DistributorFixture f;

    @BeforeEach
    void setUp() {
        f = new DistributorFixture();
        f.clock.setEpochSecond(10_000);
    }

    private static PositionState position(boolean paused, long deposits, boolean active, long lockEnd) {
        return new PositionState(paused, BigInteger.valueOf(deposits), BigInteger.ZERO, active, lockEnd);
    }

    @Test
    @DisplayName("Compound runs when deposits are waiting and nothing is locked")
    void testCompoundRuns() {
        f.ledger.setPosition(position(false, 1_000, false, 0));

        MaintenanceResult result = f.maintenance.compound(CHANNEL, false);

        assertEquals("DONE", result.outcome());
        assertEquals("compound-1", result.detail());
        assertEquals(1, f.ledger.compoundCalls.get());
    }

    @Test
    @DisplayName("Compound is skipped while paused, locked or with nothing to stake")
    void testCompoundGating() {
        f.ledger.setPosition(position(true, 1_000, false, 0));
        assertEquals("SKIPPED", f.maintenance.compound(CHANNEL, false).outcome());

        f.ledger.setPosition(position(false, 0, false, 0));
        assertEquals("SKIPPED", f.maintenance.compound(CHANNEL, false).outcome());

        f.ledger.setPosition(position(false, 1_000, true, 10_001));
        assertEquals("SKIPPED", f.maintenance.compound(CHANNEL, false).outcome());

        assertEquals(0, f.ledger.compoundCalls.get());

        f.ledger.setPosition(position(false, 0, true, 10_000));
        assertEquals("DONE", f.maintenance.compound(CHANNEL, false).outcome(), "matured position rolls over");
    }

    @Test
    @DisplayName("Withdrawals above deposits leave nothing stakeable")
    void testStakeableNeverNegative() {
        PositionState p = new PositionState(false, BigInteger.TEN, BigInteger.valueOf(50), false, 0);

        assertEquals(BigInteger.ZERO, p.stakeable());
        assertFalse(p.isCompoundable(0));
    }

    @Test
    @DisplayName("Dry-run compound simulates instead of sending")
    void testCompoundDryRun() {
        f.ledger.setPosition(position(false, 1_000, false, 0));

        MaintenanceResult ok = f.maintenance.compound(CHANNEL, true);
        f.ledger.failSimulationsWith("StakeLocked()");
        MaintenanceResult failed = f.maintenance.compound(CHANNEL, true);

        assertEquals("SIMULATED", ok.outcome());
        assertEquals("FAILED", failed.outcome());
        assertEquals(2, f.ledger.simulateCompoundCalls.get());
        assertEquals(0, f.ledger.compoundCalls.get());
    }

    @Test
    @DisplayName("Pending claims already settled on the ledger are confirmed")
    void testReconcile() {
        f.participate(CHANNEL, 0, "alice", 10);
        f.participate(CHANNEL, 0, "bob", 20);
        f.sealAndPublish(CHANNEL, 0);
        f.claims.getProof(0, CHANNEL, "alice");
        f.claims.getProof(0, CHANNEL, "bob");
        f.ledger.setClaimed(CHANNEL, 0, 1);

        MaintenanceResult dry = f.maintenance.reconcileClaims(CHANNEL, true);
        assertEquals(1, dry.count());
        assertEquals(ClaimStatus.PENDING, f.claimRepository.find("bob", 0, CHANNEL).orElseThrow().getStatus());

        MaintenanceResult live = f.maintenance.reconcileClaims(CHANNEL, false);

        assertEquals("DONE", live.outcome());
        assertEquals(1, live.count());
        assertEquals(ClaimStatus.CONFIRMED, f.claimRepository.find("bob", 0, CHANNEL).orElseThrow().getStatus());
        assertEquals(ClaimStatus.PENDING, f.claimRepository.find("alice", 0, CHANNEL).orElseThrow().getStatus());
        assertTrue(f.mirror.isClaimed(CHANNEL, 0, 1));
        assertEquals(0, f.maintenance.reconcileClaims(CHANNEL, false).count());
    }
}
