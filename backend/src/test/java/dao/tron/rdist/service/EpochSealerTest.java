package dao.tron.rdist.service;

import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.IntegrityException;
import dao.tron.rdist.exception.InvalidInputException;
import dao.tron.rdist.exception.PolicyException;
import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.RejectedEpoch;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.model.SealedParticipant;
import dao.tron.rdist.support.DistributorFixture;
import dao.tron.rdist.util.CryptoUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EpochSealerTest {

    private DistributorFixture f;

    @BeforeEach
    void setUp() {
        f = new DistributorFixture();
    }

    @Test
    @DisplayName("Participants are indexed by first_seen ascending")
    void testOrderingByFirstSeen() {
        f.participate("alpha", 100, "C", 10_030);
        f.participate("alpha", 100, "A", 10_010);
        f.participate("alpha", 100, "B", 10_020);
        f.closeEpoch(100);

        SealedEpoch sealed = f.sealer.sealEpoch(100, "alpha");
        List<SealedParticipant> rows = f.sealedRepository.findParticipants(sealed.key());

        assertEquals(3, sealed.getParticipantCount());
        assertEquals(List.of("A", "B", "C"), rows.stream().map(SealedParticipant::participantId).toList());
        assertEquals(List.of(0, 1, 2), rows.stream().map(SealedParticipant::index).toList());
        rows.forEach(r -> assertEquals(BigInteger.valueOf(500), r.amount()));
    }

    @Test
    @DisplayName("Equal first_seen breaks ties by participant id")
    void testTieBreakById() {
        f.participate("alpha", 5, "zed", 550);
        f.participate("alpha", 5, "amy", 550);
        f.participate("alpha", 5, "bob", 540);
        f.closeEpoch(5);

        SealedEpoch sealed = f.sealer.sealEpoch(5, "alpha");

        assertEquals(List.of("bob", "amy", "zed"),
                f.sealedRepository.findParticipants(sealed.key()).stream().map(SealedParticipant::participantId).toList());
    }

    @Test
    @DisplayName("Repeated sightings collapse to the earliest one")
    void testDuplicateParticipants() {
        f.participate("alpha", 5, "A", 560);
        f.participate("alpha", 5, "B", 550);
        f.participate("alpha", 5, "A", 520);
        f.closeEpoch(5);

        SealedEpoch sealed = f.sealer.sealEpoch(5, "alpha");

        assertEquals(2, sealed.getParticipantCount());
        assertEquals("A", f.sealedRepository.findParticipants(sealed.key()).get(0).participantId());
    }

    @Test
    @DisplayName("Sealing twice returns the first snapshot unchanged")
    void testIdempotentSeal() {
        f.participate("alpha", 2, "A", 210);
        f.closeEpoch(2);
        SealedEpoch first = f.sealer.sealEpoch(2, "alpha");

        // A late row must not change the sealed snapshot
        f.participate("alpha", 2, "B", 205);
        f.clock.advanceSeconds(1000);
        SealedEpoch second = f.sealer.sealEpoch(2, "alpha");

        assertEquals(first, second);
        assertEquals(1, f.sealedRepository.findParticipants(first.key()).size());
    }

    @Test
    @DisplayName("Zero participants seal to the empty root")
    void testEmptyEpoch() {
        f.closeEpoch(9);

        SealedEpoch sealed = f.sealer.sealEpoch(9, "alpha");

        assertTrue(sealed.isEmpty());
        assertEquals(CryptoUtil.toHex0x(MerkleTreeService.EMPTY_ROOT), sealed.getRootHex());
        assertFalse(sealed.isPublished());
    }

    @Test
    @DisplayName("Open epochs cannot be sealed")
    void testEpochNotClosed() {
        f.clock.setEpochSecond(105); // epoch 1 open, epoch 0 inside the seal delay

        InvalidInputException e = assertThrows(InvalidInputException.class, () -> f.sealer.sealEpoch(0, "alpha"));

        assertEquals(DistributorErrorCode.EPOCH_NOT_CLOSED, e.getErrorCode());
        assertTrue(f.sealedRepository.find(new EpochKey(0, "alpha")).isEmpty());
    }

    @Test
    @DisplayName("More participants than a ring slot holds is rejected")
    void testCapacityExceeded() {
        f = new DistributorFixture(4, 2);
        f.participate("alpha", 1, "A", 110);
        f.participate("alpha", 1, "B", 111);
        f.participate("alpha", 1, "C", 112);
        f.closeEpoch(1);

        PolicyException e = assertThrows(PolicyException.class, () -> f.sealer.sealEpoch(1, "alpha"));

        assertEquals(DistributorErrorCode.CAPACITY_EXCEEDED, e.getErrorCode());
        assertTrue(f.sealedRepository.find(new EpochKey(1, "alpha")).isEmpty());
    }

    @Test
    @DisplayName("A rejected epoch stays rejected and is no longer due")
    void testRejectionIsTerminal() {
        f = new DistributorFixture(4, 2);
        f.participate("alpha", 1, "A", 110);
        f.participate("alpha", 1, "B", 111);
        f.participate("alpha", 1, "C", 112);
        f.participate("alpha", 2, "A", 210);
        f.closeEpoch(2);
        assertThrows(PolicyException.class, () -> f.sealer.sealEpoch(1, "alpha"));

        RejectedEpoch rejected = f.sealedRepository.findRejected(new EpochKey(1, "alpha")).orElseThrow();
        assertEquals(DistributorErrorCode.CAPACITY_EXCEEDED, rejected.errorCode());
        assertEquals(f.clock.instant().getEpochSecond(), rejected.rejectedAt());
        assertEquals(List.of(2L), f.sealer.findDueEpochs("alpha", false));

        f.clock.advanceSeconds(500);
        PolicyException again = assertThrows(PolicyException.class, () -> f.sealer.sealEpoch(1, "alpha"));
        assertEquals(DistributorErrorCode.CAPACITY_EXCEEDED, again.getErrorCode());
        assertEquals(rejected, f.sealedRepository.findRejected(new EpochKey(1, "alpha")).orElseThrow());
        assertEquals(1, f.sealedRepository.findAllRejected().size());
    }

    @Test
    @DisplayName("Stored root matches a rebuild from the sealed participants")
    void testRebuildReproducesRoot() {
        for (int i = 0; i < 7; i++) {
            f.participate("alpha", 3, "user-" + i, 300 + i);
        }
        f.closeEpoch(3);
        SealedEpoch sealed = f.sealer.sealEpoch(3, "alpha");

        CachedTree tree = f.treeCache.rebuild(sealed);

        assertEquals(sealed.getRootHex(), CryptoUtil.toHex0x(tree.root()));
        assertEquals(7, tree.count());
    }

    @Test
    @DisplayName("A stored root that no longer rebuilds is an integrity error")
    void testRebuildMismatch() {
        f.participate("alpha", 3, "user-a", 300);
        f.participate("alpha", 3, "user-b", 301);
        f.closeEpoch(3);
        SealedEpoch tampered = f.sealer.sealEpoch(3, "alpha").copy();
        tampered.setRootHex(CryptoUtil.toHex0x(CryptoUtil.keccak256("tampered")));

        IntegrityException e = assertThrows(IntegrityException.class, () -> f.treeCache.rebuild(tampered));

        assertEquals(DistributorErrorCode.ROOT_MISMATCH, e.getErrorCode());
        assertEquals(0, f.treeCache.size());
    }

    @Test
    @DisplayName("Due epochs are closed, unsealed and optionally include the latest empty one")
    void testFindDueEpochs() {
        f.participate("alpha", 1, "A", 110);
        f.participate("alpha", 4, "A", 410);
        f.clock.setEpochSecond(415);

        assertEquals(List.of(1L), f.sealer.findDueEpochs("alpha", false));
        assertEquals(List.of(1L, 3L), f.sealer.findDueEpochs("alpha", true));

        f.sealer.sealEpoch(1, "alpha");
        assertEquals(List.of(3L), f.sealer.findDueEpochs("alpha", true));
    }
}
