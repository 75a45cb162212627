package dao.tron.rdist.service;

import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.PolicyException;
import dao.tron.rdist.ledger.LedgerSimulation;
import dao.tron.rdist.ledger.LedgerSubmission;
import dao.tron.rdist.ledger.PositionState;
import dao.tron.rdist.ledger.RingLedgerClient;
import dao.tron.rdist.model.ClaimRecord;
import dao.tron.rdist.model.ClaimStatus;
import dao.tron.rdist.repository.ClaimRecordRepository;
import dao.tron.rdist.ring.RingLedgerMirror;
import dao.tron.rdist.ring.SlotStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Ledger-gated housekeeping run by the keeper after publishing.
 */
@Slf4j
@Service
public class MaintenanceService {

    private final RingLedgerClient ledgerClient;
    private final ClaimRecordRepository claimRepository;
    private final ClaimService claimService;
    private final RingLedgerMirror mirror;
    private final Clock clock;

    public MaintenanceService(RingLedgerClient ledgerClient,
                              ClaimRecordRepository claimRepository,
                              ClaimService claimService,
                              RingLedgerMirror mirror,
                              Clock clock) {
        this.ledgerClient = ledgerClient;
        this.claimRepository = claimRepository;
        this.claimService = claimService;
        this.mirror = mirror;
        this.clock = clock;
    }

    /**
     * Compounds the channel's position once it matured on-ledger.
     */
    public MaintenanceResult compound(String channel, boolean dryRun) {
        PositionState position = ledgerClient.readPosition(channel);
        long now = clock.instant().getEpochSecond();
        if (!position.isCompoundable(now)) {
            log.debug("compound skipped: channel={}, paused={}, active={}, lockEnd={}, stakeable={}",
                    channel, position.paused(), position.active(), position.lockEnd(), position.stakeable());
            return new MaintenanceResult(channel, "compound", "SKIPPED", 0, "not matured");
        }

        log.info("compound: channel={}, stakeable={}, active={}, lockEnd={}, mode={}",
                channel, position.stakeable(), position.active(), position.lockEnd(), dryRun ? "dry-run" : "live");

        if (dryRun) {
            LedgerSimulation sim = ledgerClient.simulateCompound(channel);
            if (sim.success()) {
                log.info("compound simulated: channel={}, energyEstimate={}", channel, sim.energyEstimate());
                return new MaintenanceResult(channel, "compound", "SIMULATED", 1, "energy=" + sim.energyEstimate());
            }
            log.warn("compound simulation failed: channel={}, reason={}", channel, sim.message());
            return new MaintenanceResult(channel, "compound", "FAILED", 0, sim.message());
        }

        try {
            LedgerSubmission tx = ledgerClient.compound(channel);
            log.info("compound confirmed: channel={}, txId={}", channel, tx.txId());
            return new MaintenanceResult(channel, "compound", "DONE", 1, tx.txId());
        } catch (PolicyException e) {
            // Lost a race with another cranker or the lock was extended; not an error
            if (e.getErrorCode() == DistributorErrorCode.LEDGER_REJECTED && isExpectedSkip(e.getMessage())) {
                log.debug("compound skipped by ledger: channel={}, reason={}", channel, e.getMessage());
                return new MaintenanceResult(channel, "compound", "SKIPPED", 0, e.getMessage());
            }
            throw e;
        }
    }

    /**
     * Confirms pending claims of {@code channel} whose claimed bit is already set on-ledger.
     */
    public MaintenanceResult reconcileClaims(String channel, boolean dryRun) {
        int reconciled = 0;
        for (ClaimRecord r : claimRepository.findByStatus(ClaimStatus.PENDING)) {
            if (!r.getChannel().equals(channel)) continue;
            if (mirror.statusOf(channel, r.getEpoch()) != SlotStatus.OCCUPIED) continue;
            if (!ledgerClient.isClaimed(channel, r.getEpoch(), r.getIndex())) continue;

            if (dryRun) {
                log.info("reconcile would confirm: identity={}, epoch={}, channel={}", r.getIdentity(), r.getEpoch(), channel);
            } else {
                claimService.confirmClaim(r.getIdentity(), r.getEpoch(), channel, r.getTxRef());
            }
            reconciled++;
        }
        if (reconciled > 0) {
            log.info("Claims reconciled: channel={}, count={}, mode={}", channel, reconciled, dryRun ? "dry-run" : "live");
        }
        return new MaintenanceResult(channel, "reconcile", dryRun ? "SIMULATED" : "DONE", reconciled, null);
    }

    private static boolean isExpectedSkip(String message) {
        return message != null && (message.contains("NothingToCompound") || message.contains("StakeLocked"));
    }
}
