package dao.tron.rdist.keeper;

import dao.tron.rdist.metrics.DistributorMetrics;
import dao.tron.rdist.support.DistributorFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeeperHealthServiceTest {

    private DistributorFixture f;
    private TickHistory history;
    private KeeperService keeper;
    private KeeperHealthService health;

    @BeforeEach
    void setUp() {
        f = new DistributorFixture(2, 16);
        f.keeperProps.setHealthStaleAfterSeconds(300);
        history = new TickHistory(f.keeperProps);
        keeper = new KeeperService(f.sealer, f.publisher, f.maintenance, f.store, f.sealedRepository,
                new ChannelLock(), history, f.alerts, f.metrics, f.keeperProps,
                new RetryExecutor(RetryPolicy.from(f.keeperProps), ms -> { }), f.clock);
        health = new KeeperHealthService(history, keeper, f.mirror, f.alerts, f.keeperProps, f.ringProps, f.metrics,
                f.clock);
    }

    @Test
    @DisplayName("Unhealthy before the first successful tick")
    void testNoTickYet() {
        KeeperHealth h = health.health();

        assertFalse(h.healthy());
        assertEquals(-1, h.secondsSinceLastSuccess());
        assertEquals(KeeperState.IDLE, h.state());
    }

    @Test
    @DisplayName("Healthy after a tick, stale once the threshold passes")
    void testStaleness() {
        f.participate("alpha", 0, "alice", 10);
        f.closeEpoch(0);
        keeper.runTick();

        assertTrue(health.health().healthy());

        f.clock.advanceSeconds(301);
        KeeperHealth stale = health.health();
        assertFalse(stale.healthy());
        assertEquals(301, stale.secondsSinceLastSuccess());
    }

    @Test
    @DisplayName("Slots with unclaimed rewards near eviction are counted")
    void testEvictionRisk() {
        f.participate("alpha", 0, "alice", 10);
        f.participate("alpha", 1, "bob", 110);
        f.closeEpoch(1);
        keeper.runTick();

        KeeperHealth h = health.health();

        assertEquals(2, h.slotsAtRisk());
        assertEquals(0, h.evictionRisks().get(0).epoch());
        assertEquals(1, h.evictionRisks().get(0).evictionsAway());
        assertEquals(2.0, f.meterRegistry.get(DistributorMetrics.METRIC_SLOTS_NEAR_EVICTION).gauge().value());
    }

    @Test
    @DisplayName("History keeps the newest reports up to its size")
    void testHistoryBounded() {
        f.keeperProps.setHistorySize(2);
        TickHistory small = new TickHistory(f.keeperProps);
        for (int i = 1; i <= 3; i++) {
            TickReport r = new TickReport();
            r.setTickId(i);
            small.record(r);
        }

        assertEquals(2, small.recent().size());
        assertEquals(3, small.recent().get(0).getTickId());
        assertTrue(small.lastSuccessAt().isEmpty());
    }
}
