package dao.tron.rdist.service;

import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.IntegrityException;
import dao.tron.rdist.exception.PolicyException;
import dao.tron.rdist.exception.TransientLedgerException;
import dao.tron.rdist.exception.UnconfirmedSubmissionException;
import dao.tron.rdist.model.ClaimStatus;
import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.ring.SlotStatus;
import dao.tron.rdist.support.DistributorFixture;
import dao.tron.rdist.util.CryptoUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PublisherServiceTest {

    private static final String CHANNEL = "alpha";
    private static final EpochKey KEY = new EpochKey(0, CHANNEL);

    private DistributorFixture f;

    @BeforeEach
    void setUp() {
        f = new DistributorFixture();
        f.participate(CHANNEL, 0, "alice", 10);
        f.participate(CHANNEL, 0, "bob", 20);
    }

    private SealedEpoch seal() {
        f.closeEpoch(0);
        return f.sealer.sealEpoch(0, CHANNEL);
    }

    @Test
    @DisplayName("Publishing writes the root once, marks the epoch and occupies a ring slot")
    void testPublish() {
        SealedEpoch sealed = seal();

        PublishResult result = f.publisher.publish(KEY, false);

        assertEquals(PublishOutcome.PUBLISHED, result.outcome());
        assertEquals("tx-1", result.txId());
        assertEquals(1, f.ledger.publishCalls.get());
        SealedEpoch stored = f.sealedRepository.find(KEY).orElseThrow();
        assertTrue(stored.isPublished());
        assertEquals("tx-1", stored.getPublishTxId());
        assertEquals(SlotStatus.OCCUPIED, f.mirror.statusOf(CHANNEL, 0));
        assertEquals(sealed.getRootHex(), f.mirror.find(CHANNEL, 0).orElseThrow().rootHex());
    }

    @Test
    @DisplayName("Publishing again is a no-op without any ledger call")
    void testRepublishNoop() {
        seal();
        f.publisher.publish(KEY, false);
        int reads = f.ledger.readSlotCalls.get();

        PublishResult again = f.publisher.publish(KEY, false);

        assertEquals(PublishOutcome.ALREADY_PUBLISHED, again.outcome());
        assertEquals("tx-1", again.txId());
        assertEquals(1, f.ledger.publishCalls.get());
        assertEquals(reads, f.ledger.readSlotCalls.get());
    }

    @Test
    @DisplayName("A root already on the ledger is adopted without a second transaction")
    void testAdoptAfterCrash() {
        SealedEpoch sealed = seal();
        f.ledger.putSlot(CHANNEL, 0, sealed.getRootHex(), sealed.getParticipantCount());

        PublishResult result = f.publisher.publish(KEY, false);

        assertEquals(PublishOutcome.ADOPTED, result.outcome());
        assertEquals(0, f.ledger.publishCalls.get());
        assertTrue(f.sealedRepository.find(KEY).orElseThrow().isPublished());
        assertEquals(SlotStatus.OCCUPIED, f.mirror.statusOf(CHANNEL, 0));
    }

    @Test
    @DisplayName("A different root on the ledger is an integrity failure")
    void testLedgerConflict() {
        seal();
        f.ledger.putSlot(CHANNEL, 0, CryptoUtil.toHex0x(CryptoUtil.keccak256("other")), 2);

        IntegrityException e = assertThrows(IntegrityException.class, () -> f.publisher.publish(KEY, false));

        assertEquals(DistributorErrorCode.SLOT_CONFLICT, e.getErrorCode());
        assertEquals(1, f.alerts.getAlertCount());
        assertFalse(f.sealedRepository.find(KEY).orElseThrow().isPublished());
        assertEquals(0, f.ledger.publishCalls.get());
    }

    @Test
    @DisplayName("Empty epochs are closed locally without a ledger write")
    void testEmptyEpochSkipped() {
        f.closeEpoch(5);
        f.sealer.sealEpoch(5, CHANNEL);

        PublishResult result = f.publisher.publish(new EpochKey(5, CHANNEL), false);

        assertEquals(PublishOutcome.SKIPPED_EMPTY, result.outcome());
        assertEquals(0, f.ledger.readSlotCalls.get());
        assertTrue(f.sealedRepository.find(new EpochKey(5, CHANNEL)).orElseThrow().isPublished());
        assertEquals(SlotStatus.EMPTY, f.mirror.statusOf(CHANNEL, 5));
    }

    @Test
    @DisplayName("Empty epochs are published when configured to")
    void testEmptyEpochPublished() {
        f.keeperProps.setPublishEmptyEpochs(true);
        f.rewire();
        f.closeEpoch(5);
        f.sealer.sealEpoch(5, CHANNEL);

        PublishResult result = f.publisher.publish(new EpochKey(5, CHANNEL), false);

        assertEquals(PublishOutcome.PUBLISHED, result.outcome());
        assertEquals(CryptoUtil.toHex0x(MerkleTreeService.EMPTY_ROOT),
                f.mirror.find(CHANNEL, 5).orElseThrow().rootHex());
    }

    @Test
    @DisplayName("Publishing an unsealed epoch is rejected")
    void testNotSealed() {
        PolicyException e = assertThrows(PolicyException.class, () -> f.publisher.publish(KEY, false));
        assertEquals(DistributorErrorCode.NOT_SEALED, e.getErrorCode());
    }

    @Test
    @DisplayName("Dry-run reaches the same decision as live mode and changes nothing")
    void testDryRunMatchesLive() {
        seal();

        PublishResult dry = f.publisher.publish(KEY, true);

        assertEquals(PublishOutcome.SIMULATED, dry.outcome());
        assertEquals(1, f.ledger.simulatePublishCalls.get());
        assertEquals(0, f.ledger.publishCalls.get());
        assertFalse(f.sealedRepository.find(KEY).orElseThrow().isPublished());
        assertEquals(SlotStatus.EMPTY, f.mirror.statusOf(CHANNEL, 0));

        PublishResult live = f.publisher.publish(KEY, false);
        assertEquals(PublishOutcome.PUBLISHED, live.outcome());
    }

    @Test
    @DisplayName("Dry-run and live reject a ledger conflict identically")
    void testDryRunConflict() {
        seal();
        f.ledger.putSlot(CHANNEL, 0, CryptoUtil.toHex0x(CryptoUtil.keccak256("other")), 2);

        IntegrityException dry = assertThrows(IntegrityException.class, () -> f.publisher.publish(KEY, true));
        IntegrityException live = assertThrows(IntegrityException.class, () -> f.publisher.publish(KEY, false));

        assertEquals(dry.getErrorCode(), live.getErrorCode());
    }

    @Test
    @DisplayName("Dry-run adoption leaves local state untouched")
    void testDryRunAdopt() {
        SealedEpoch sealed = seal();
        f.ledger.putSlot(CHANNEL, 0, sealed.getRootHex(), 2);

        assertEquals(PublishOutcome.ADOPTED, f.publisher.publish(KEY, true).outcome());
        assertFalse(f.sealedRepository.find(KEY).orElseThrow().isPublished());
        assertEquals(SlotStatus.EMPTY, f.mirror.statusOf(CHANNEL, 0));
    }

    @Test
    @DisplayName("A failed simulation is reported, not thrown")
    void testSimulationFailure() {
        seal();
        f.ledger.failSimulationsWith("REVERT opcode executed");

        PublishResult result = f.publisher.publish(KEY, true);

        assertEquals(PublishOutcome.SIMULATION_FAILED, result.outcome());
        assertEquals("REVERT opcode executed", result.message());
    }

    @Test
    @DisplayName("A ledger timeout leaves the epoch unpublished so it can be retried")
    void testTransientFailure() {
        seal();
        f.ledger.failNext(1);

        assertThrows(TransientLedgerException.class, () -> f.publisher.publish(KEY, false));
        assertFalse(f.sealedRepository.find(KEY).orElseThrow().isPublished());

        assertEquals(PublishOutcome.PUBLISHED, f.publisher.publish(KEY, false).outcome());
        assertEquals(1, f.ledger.publishCalls.get());
    }

    @Test
    @DisplayName("An epoch larger than a ring slot is refused")
    void testCapacity() {
        seal();
        f.ringProps.setMaxClaims(1);
        f.rewire();

        PolicyException e = assertThrows(PolicyException.class, () -> f.publisher.publish(KEY, false));

        assertEquals(DistributorErrorCode.CAPACITY_EXCEEDED, e.getErrorCode());
        assertEquals(0, f.ledger.readSlotCalls.get());
    }

    @Test
    @DisplayName("The ring mirror is rebuilt from published epochs and confirmed claims")
    void testRestoreMirror() {
        f.sealAndPublish(CHANNEL, 0);
        f.claims.getProof(0, CHANNEL, "bob");
        f.claims.confirmClaim("bob", 0, CHANNEL, "tx-claim");
        assertEquals(ClaimStatus.CONFIRMED, f.claimRepository.find("bob", 0, CHANNEL).orElseThrow().getStatus());

        f.rewire();
        assertEquals(SlotStatus.EMPTY, f.mirror.statusOf(CHANNEL, 0));

        assertEquals(1, f.publisher.restoreMirror(CHANNEL));
        assertEquals(SlotStatus.OCCUPIED, f.mirror.statusOf(CHANNEL, 0));
        assertTrue(f.mirror.isClaimed(CHANNEL, 0, 1));
        assertFalse(f.mirror.isClaimed(CHANNEL, 0, 0));
        assertEquals(0, f.publisher.restoreMirror(CHANNEL), "restoring twice does nothing");
    }

    @Test
    @DisplayName("A publish whose confirmation timed out is looked up, not sent again")
    void testUnconfirmedPublishRecovered() {
        seal();
        f.ledger.loseNextConfirmation();

        UnconfirmedSubmissionException e = assertThrows(UnconfirmedSubmissionException.class,
                () -> f.publisher.publish(KEY, false));
        assertEquals("tx-1", e.getTxId());
        assertEquals(1, f.publisher.pendingCount());
        assertFalse(f.sealedRepository.find(KEY).orElseThrow().isPublished());

        // The slot read still shows nothing; only the receipt lookup knows the tx landed
        PublishResult retried = f.publisher.publish(KEY, false);

        assertEquals(PublishOutcome.PUBLISHED, retried.outcome());
        assertEquals("tx-1", retried.txId());
        assertEquals(1, f.ledger.publishCalls.get());
        assertEquals(1, f.ledger.receiptLookups.get());
        assertEquals(0, f.publisher.pendingCount());
        assertEquals("tx-1", f.sealedRepository.find(KEY).orElseThrow().getPublishTxId());
        assertEquals(SlotStatus.OCCUPIED, f.mirror.statusOf(CHANNEL, 0));
    }

    @Test
    @DisplayName("An unconfirmed publish is retried only after it has expired unseen")
    void testUnconfirmedPublishExpires() {
        seal();
        f.ledger.loseNextConfirmation();
        f.ledger.hideReceipts(true);
        assertThrows(UnconfirmedSubmissionException.class, () -> f.publisher.publish(KEY, false));

        f.clock.advanceSeconds(30);
        TransientLedgerException stillPending = assertThrows(TransientLedgerException.class,
                () -> f.publisher.publish(KEY, false));
        assertEquals(DistributorErrorCode.LEDGER_TIMEOUT, stillPending.getErrorCode());
        assertEquals(1, f.ledger.publishCalls.get());

        f.clock.advanceSeconds(f.ledgerProps.getPolling().getPendingTxExpirySeconds());
        PublishResult result = f.publisher.publish(KEY, false);

        assertEquals(PublishOutcome.PUBLISHED, result.outcome());
        assertEquals("tx-2", result.txId());
        assertEquals(2, f.ledger.publishCalls.get());
        assertEquals(0, f.publisher.pendingCount());
    }
}
