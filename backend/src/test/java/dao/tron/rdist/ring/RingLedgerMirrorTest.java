package dao.tron.rdist.ring;

import dao.tron.rdist.config.RingProperties;
import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.IntegrityException;
import dao.tron.rdist.exception.PolicyException;
import dao.tron.rdist.util.CryptoUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RingLedgerMirrorTest {

    private static RingLedgerMirror mirror(int slots, int maxClaims, SlotPolicy policy) {
        RingProperties props = new RingProperties();
        props.setSlots(slots);
        props.setMaxClaims(maxClaims);
        props.setSlotPolicy(policy);
        return new RingLedgerMirror(props);
    }

    private static byte[] root(long epoch) {
        return CryptoUtil.keccak256("root-" + epoch);
    }

    @Test
    @DisplayName("FIFO: a full ring evicts the oldest slot and remembers the epoch")
    void testFifoEviction() {
        RingLedgerMirror m = mirror(3, 8, SlotPolicy.FIFO);
        for (long e = 1; e <= 3; e++) {
            assertTrue(m.occupy("alpha", e, root(e), 4).isEmpty());
        }

        Optional<SlotView> evicted = m.occupy("alpha", 4, root(4), 4);

        assertTrue(evicted.isPresent());
        assertEquals(1, evicted.get().epoch());
        assertEquals(4, evicted.get().unclaimedCount());
        assertEquals(SlotStatus.EVICTED, m.statusOf("alpha", 1));
        assertEquals(SlotStatus.OCCUPIED, m.statusOf("alpha", 4));
        assertEquals(SlotStatus.EMPTY, m.statusOf("alpha", 99));
        assertEquals(3, m.slots("alpha").size());
    }

    @Test
    @DisplayName("An evicted epoch can be neither re-occupied nor claimed")
    void testEvictedIsTerminal() {
        RingLedgerMirror m = mirror(1, 8, SlotPolicy.FIFO);
        m.occupy("alpha", 1, root(1), 2);
        m.occupy("alpha", 2, root(2), 2);

        PolicyException reoccupy = assertThrows(PolicyException.class, () -> m.occupy("alpha", 1, root(1), 2));
        PolicyException claim = assertThrows(PolicyException.class, () -> m.markClaimed("alpha", 1, 0));

        assertEquals(DistributorErrorCode.SLOT_EVICTED, reoccupy.getErrorCode());
        assertEquals(DistributorErrorCode.SLOT_EVICTED, claim.getErrorCode());
    }

    @Test
    @DisplayName("Same epoch and root is a no-op; a different root is an integrity error")
    void testReoccupy() {
        RingLedgerMirror m = mirror(2, 8, SlotPolicy.FIFO);
        m.occupy("alpha", 1, root(1), 3);
        m.markClaimed("alpha", 1, 2);

        assertTrue(m.occupy("alpha", 1, root(1), 3).isEmpty());
        assertTrue(m.isClaimed("alpha", 1, 2), "bits survive a no-op re-occupy");

        IntegrityException e = assertThrows(IntegrityException.class, () -> m.occupy("alpha", 1, root(2), 3));
        assertEquals(DistributorErrorCode.SLOT_CONFLICT, e.getErrorCode());
    }

    @Test
    @DisplayName("Claim bits flip once")
    void testClaimBits() {
        RingLedgerMirror m = mirror(2, 16, SlotPolicy.FIFO);
        m.occupy("alpha", 1, root(1), 10);

        assertFalse(m.isClaimed("alpha", 1, 9));
        assertTrue(m.markClaimed("alpha", 1, 9));
        assertFalse(m.markClaimed("alpha", 1, 9));
        assertTrue(m.isClaimed("alpha", 1, 9));
        assertFalse(m.isClaimed("alpha", 1, 8));
        assertEquals(1, m.find("alpha", 1).orElseThrow().claimedCount());

        assertThrows(IllegalArgumentException.class, () -> m.markClaimed("alpha", 1, 10));
        assertThrows(IllegalArgumentException.class, () -> m.isClaimed("alpha", 1, 16));
    }

    @Test
    @DisplayName("Claim count above slot capacity is rejected")
    void testCapacity() {
        RingLedgerMirror m = mirror(2, 4, SlotPolicy.FIFO);

        PolicyException e = assertThrows(PolicyException.class, () -> m.occupy("alpha", 1, root(1), 5));

        assertEquals(DistributorErrorCode.CAPACITY_EXCEEDED, e.getErrorCode());
    }

    @Test
    @DisplayName("Epoch modulo: slot is epoch mod K")
    void testEpochModulo() {
        RingLedgerMirror m = mirror(4, 8, SlotPolicy.EPOCH_MODULO);
        m.occupy("alpha", 5, root(5), 1);
        m.occupy("alpha", 6, root(6), 1);

        Optional<SlotView> evicted = m.occupy("alpha", 9, root(9), 1);

        assertEquals(5, evicted.orElseThrow().epoch());
        assertEquals(1, m.find("alpha", 9).orElseThrow().slotIndex());
        assertEquals(2, m.find("alpha", 6).orElseThrow().slotIndex());
        assertEquals(SlotStatus.EVICTED, m.statusOf("alpha", 5));
    }

    @Test
    @DisplayName("Slots with unclaimed leaves close to eviction are reported")
    void testSlotsNearEviction() {
        RingLedgerMirror m = mirror(3, 8, SlotPolicy.FIFO);
        m.occupy("alpha", 1, root(1), 2);
        m.occupy("alpha", 2, root(2), 1);

        List<EvictionRisk> risks = m.slotsNearEviction(2);

        assertEquals(1, risks.size());
        assertEquals(1, risks.get(0).epoch());
        assertEquals(2, risks.get(0).evictionsAway());
        assertEquals(2, risks.get(0).unclaimedCount());

        m.markClaimed("alpha", 1, 0);
        m.markClaimed("alpha", 1, 1);
        assertTrue(m.slotsNearEviction(2).isEmpty(), "fully claimed slots are not at risk");
        assertEquals(1, m.slotsNearEviction(3).size());
    }

    @Test
    @DisplayName("Channels have independent rings")
    void testChannelsIndependent() {
        RingLedgerMirror m = mirror(1, 8, SlotPolicy.FIFO);
        m.occupy("alpha", 1, root(1), 1);
        m.occupy("beta", 1, root(1), 1);

        assertEquals(SlotStatus.OCCUPIED, m.statusOf("alpha", 1));
        assertEquals(SlotStatus.OCCUPIED, m.statusOf("beta", 1));
    }
}
