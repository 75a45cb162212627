package dao.tron.rdist.service;

import dao.tron.rdist.config.KeeperProperties;
import dao.tron.rdist.config.LedgerProperties;
import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.IntegrityException;
import dao.tron.rdist.exception.PolicyException;
import dao.tron.rdist.exception.TransientLedgerException;
import dao.tron.rdist.exception.UnconfirmedSubmissionException;
import dao.tron.rdist.ledger.LedgerSimulation;
import dao.tron.rdist.ledger.OnChainSlot;
import dao.tron.rdist.ledger.PublishReceipt;
import dao.tron.rdist.ledger.RingLedgerClient;
import dao.tron.rdist.model.ClaimRecord;
import dao.tron.rdist.model.ClaimStatus;
import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.repository.ClaimRecordRepository;
import dao.tron.rdist.repository.SealedEpochRepository;
import dao.tron.rdist.ring.RingLedgerMirror;
import dao.tron.rdist.ring.SlotStatus;
import dao.tron.rdist.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Puts sealed roots on the ledger.
 * <p>
 * Every publish re-reads the on-ledger slot first, so calling it again after a crash, a timeout or
 * a duplicate tick never produces a second transaction. A publish whose confirmation timed out is
 * remembered by txId and looked up on the next attempt; it is only sent again once it has expired. In dry-run mode the same checks run and
 * the mutation is simulated; neither local nor ledger state changes.
 */
@Slf4j
@Service
public class PublisherService {

    private final RingLedgerClient ledgerClient;
    private final SealedEpochRepository sealedRepository;
    private final ClaimRecordRepository claimRepository;
    private final RingLedgerMirror mirror;
    private final EpochTreeCache treeCache;
    private final AlertService alertService;
    private final KeeperProperties keeperProps;
    private final long pendingTxExpirySeconds;
    private final Clock clock;

    private final Map<EpochKey, PendingPublish> pending = new ConcurrentHashMap<>();

    private record PendingPublish(String txId, long broadcastAt) {}

    public PublisherService(RingLedgerClient ledgerClient,
                            SealedEpochRepository sealedRepository,
                            ClaimRecordRepository claimRepository,
                            RingLedgerMirror mirror,
                            EpochTreeCache treeCache,
                            AlertService alertService,
                            KeeperProperties keeperProps,
                            LedgerProperties ledgerProps,
                            Clock clock) {
        this.ledgerClient = ledgerClient;
        this.sealedRepository = sealedRepository;
        this.claimRepository = claimRepository;
        this.mirror = mirror;
        this.treeCache = treeCache;
        this.alertService = alertService;
        this.keeperProps = keeperProps;
        this.pendingTxExpirySeconds = ledgerProps.getPolling().getPendingTxExpirySeconds();
        this.clock = clock;
    }

    public PublishResult publish(EpochKey key, boolean dryRun) {
        SealedEpoch sealed = sealedRepository.find(key)
                .orElseThrow(() -> new PolicyException(DistributorErrorCode.NOT_SEALED, "epoch " + key + " is not sealed"));
        String mode = dryRun ? "dry-run" : "live";

        if (sealed.isPublished()) {
            log.debug("Epoch {} already published (tx={}), nothing to do", key, sealed.getPublishTxId());
            return new PublishResult(key, PublishOutcome.ALREADY_PUBLISHED, sealed.getPublishTxId(), 0L, "already published");
        }

        if (sealed.isEmpty() && !keeperProps.isPublishEmptyEpochs()) {
            log.info("publishRoot skipped: epoch={}, reason=empty, mode={}", key, mode);
            if (!dryRun) {
                sealedRepository.markPublished(key, null, now());
            }
            return new PublishResult(key, PublishOutcome.SKIPPED_EMPTY, null, 0L, "empty epoch");
        }

        validate(sealed);

        if (!dryRun) {
            PublishResult recovered = resolvePending(sealed);
            if (recovered != null) return recovered;
        }

        OnChainSlot onChain = ledgerClient.readSlot(key.channel(), key.epoch());
        if (onChain.present()) {
            if (!onChain.rootHex().equalsIgnoreCase(sealed.getRootHex())) {
                IntegrityException e = new IntegrityException(DistributorErrorCode.SLOT_CONFLICT,
                        "ledger holds root " + onChain.rootHex() + " for " + key + ", sealed root is " + sealed.getRootHex());
                alertService.raise("publish", e);
                throw e;
            }
            log.info("publishRoot not needed: epoch={}, root={}, onLedgerSlot={}, mode={}",
                    key, sealed.getRootHex(), onChain.slotIndex(), mode);
            if (!dryRun) {
                sealedRepository.markPublished(key, null, now());
                occupy(sealed);
            }
            return new PublishResult(key, PublishOutcome.ADOPTED, null, 0L, "root already on ledger");
        }

        log.info("publishRoot: epoch={}, root={}, claimCount={}, mode={}",
                key, sealed.getRootHex(), sealed.getParticipantCount(), mode);

        if (dryRun) {
            LedgerSimulation sim = ledgerClient.simulatePublishRoot(
                    key.channel(), key.epoch(), sealed.getRootHex(), sealed.getParticipantCount());
            if (sim.success()) {
                log.info("publishRoot simulated: epoch={}, energyEstimate={}", key, sim.energyEstimate());
                return new PublishResult(key, PublishOutcome.SIMULATED, null, sim.energyEstimate(), sim.message());
            }
            log.warn("publishRoot simulation failed: epoch={}, reason={}", key, sim.message());
            return new PublishResult(key, PublishOutcome.SIMULATION_FAILED, null, 0L, sim.message());
        }

        PublishReceipt receipt;
        try {
            receipt = ledgerClient.publishRoot(
                    key.channel(), key.epoch(), sealed.getRootHex(), sealed.getParticipantCount());
        } catch (UnconfirmedSubmissionException e) {
            pending.put(key, new PendingPublish(e.getTxId(), now()));
            log.warn("publishRoot unconfirmed: epoch={}, txId={}, reason={}", key, e.getTxId(), e.getMessage());
            throw e;
        }
        return confirmed(sealed, receipt);
    }

    /**
     * Looks up an earlier unconfirmed publish of {@code sealed}. Returns null when publishing
     * should go ahead: nothing is pending, the transaction failed, or it expired unseen.
     *
     * @throws TransientLedgerException while the transaction may still land
     */
    private PublishResult resolvePending(SealedEpoch sealed) {
        EpochKey key = sealed.key();
        PendingPublish p = pending.get(key);
        if (p == null) return null;

        Optional<PublishReceipt> receipt;
        try {
            receipt = ledgerClient.findPublishReceipt(p.txId());
        } catch (PolicyException e) {
            if (e.getErrorCode() != DistributorErrorCode.LEDGER_REJECTED) throw e;
            pending.remove(key);
            log.warn("Pending publishRoot failed on-chain: epoch={}, txId={}, reason={}", key, p.txId(), e.getMessage());
            return null;
        }
        if (receipt.isPresent()) {
            pending.remove(key);
            log.info("Pending publishRoot found: epoch={}, txId={}", key, p.txId());
            return confirmed(sealed, receipt.get());
        }
        long age = now() - p.broadcastAt();
        if (age < pendingTxExpirySeconds) {
            throw new TransientLedgerException(DistributorErrorCode.LEDGER_TIMEOUT,
                    "publishRoot " + p.txId() + " for " + key + " not confirmed after " + age + "s");
        }
        pending.remove(key);
        log.warn("Pending publishRoot expired unseen: epoch={}, txId={}, age={}s", key, p.txId(), age);
        return null;
    }

    private PublishResult confirmed(SealedEpoch sealed, PublishReceipt receipt) {
        EpochKey key = sealed.key();
        String txId = receipt.submission().txId();
        sealedRepository.markPublished(key, txId, now());
        occupy(sealed);
        log.info("publishRoot confirmed: epoch={}, txId={}, block={}, energy={}",
                key, txId, receipt.submission().blockNumber(), receipt.submission().energyUsed());
        return new PublishResult(key, PublishOutcome.PUBLISHED, txId, receipt.submission().energyUsed(), "ok");
    }

    /**
     * Unconfirmed publishes still being looked up.
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Replays published epochs of {@code channel} into an empty ring mirror, oldest first, and
     * re-sets the bits of confirmed claims. Used after a restart.
     */
    public int restoreMirror(String channel) {
        if (!mirror.slots(channel).isEmpty()) return 0;
        int restored = 0;
        for (SealedEpoch e : sealedRepository.findAll()) {
            if (!e.getChannel().equals(channel) || !e.isPublished()) continue;
            if (e.isEmpty() && !keeperProps.isPublishEmptyEpochs()) continue;
            if (mirror.statusOf(channel, e.getEpoch()) != SlotStatus.EMPTY) continue;
            occupy(e);
            restored++;
        }
        for (ClaimRecord r : claimRepository.findByStatus(ClaimStatus.CONFIRMED)) {
            if (r.getChannel().equals(channel) && mirror.statusOf(channel, r.getEpoch()) == SlotStatus.OCCUPIED) {
                mirror.markClaimed(channel, r.getEpoch(), r.getIndex());
            }
        }
        if (restored > 0) {
            log.info("Ring mirror restored: channel={}, epochs={}", channel, restored);
        }
        return restored;
    }

    private void validate(SealedEpoch sealed) {
        if (sealed.getParticipantCount() > mirror.getMaxClaims()) {
            throw new PolicyException(DistributorErrorCode.CAPACITY_EXCEEDED,
                    "epoch " + sealed.key() + " has " + sealed.getParticipantCount()
                            + " leaves, ring capacity is " + mirror.getMaxClaims());
        }
        CryptoUtil.fromHex32(sealed.getRootHex());
        try {
            treeCache.rebuild(sealed);
        } catch (IntegrityException e) {
            alertService.raise("publish", e);
            throw e;
        }
    }

    private void occupy(SealedEpoch sealed) {
        mirror.occupy(sealed.getChannel(), sealed.getEpoch(),
                CryptoUtil.fromHex32(sealed.getRootHex()), sealed.getParticipantCount());
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
