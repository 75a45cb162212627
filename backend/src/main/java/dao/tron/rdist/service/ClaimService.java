package dao.tron.rdist.service;

import dao.tron.rdist.config.LedgerProperties;
import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.InvalidInputException;
import dao.tron.rdist.exception.PolicyException;
import dao.tron.rdist.ledger.RingContractAbi;
import dao.tron.rdist.ledger.RingLedgerClient;
import dao.tron.rdist.model.AvailableClaim;
import dao.tron.rdist.model.ClaimProof;
import dao.tron.rdist.model.ClaimRecord;
import dao.tron.rdist.model.ClaimStatus;
import dao.tron.rdist.model.ClaimTransaction;
import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.model.SealedParticipant;
import dao.tron.rdist.repository.ClaimRecordRepository;
import dao.tron.rdist.repository.SealedEpochRepository;
import dao.tron.rdist.ring.RingLedgerMirror;
import dao.tron.rdist.ring.SlotStatus;
import dao.tron.rdist.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.tron.trident.abi.FunctionEncoder;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Serves claims to participants: what they can claim, the proof, and an unsigned claim
 * transaction. Tracks each attempt as a {@link ClaimRecord}.
 */
@Slf4j
@Service
public class ClaimService {

    private static final Pattern TRON_ADDRESS = Pattern.compile("T[1-9A-HJ-NP-Za-km-z]{33}");

    private final ClaimValidator validator;
    private final SealedEpochRepository sealedRepository;
    private final ClaimRecordRepository claimRepository;
    private final RingLedgerMirror mirror;
    private final RingLedgerClient ledgerClient;
    private final LedgerProperties ledgerProps;
    private final Clock clock;

    public ClaimService(ClaimValidator validator,
                        SealedEpochRepository sealedRepository,
                        ClaimRecordRepository claimRepository,
                        RingLedgerMirror mirror,
                        RingLedgerClient ledgerClient,
                        LedgerProperties ledgerProps,
                        Clock clock) {
        this.validator = validator;
        this.sealedRepository = sealedRepository;
        this.claimRepository = claimRepository;
        this.mirror = mirror;
        this.ledgerClient = ledgerClient;
        this.ledgerProps = ledgerProps;
        this.clock = clock;
    }

    /**
     * Published, still-claimable epochs in which {@code identity} participated.
     */
    public List<AvailableClaim> getAvailableClaims(String identity) {
        if (identity == null || !ClaimValidator.IDENTITY.matcher(identity).matches()) {
            throw new InvalidInputException("identity must match " + ClaimValidator.IDENTITY.pattern());
        }
        List<AvailableClaim> out = new ArrayList<>();
        for (SealedParticipant p : sealedRepository.findByParticipant(identity)) {
            Optional<SealedEpoch> sealed = sealedRepository.find(new EpochKey(p.epoch(), p.channel()));
            if (sealed.isEmpty() || !sealed.get().isPublished()) continue;
            if (mirror.statusOf(p.channel(), p.epoch()) != SlotStatus.OCCUPIED) continue;
            if (mirror.isClaimed(p.channel(), p.epoch(), p.index())) continue;
            boolean confirmed = claimRepository.find(identity, p.epoch(), p.channel())
                    .map(r -> r.getStatus() == ClaimStatus.CONFIRMED)
                    .orElse(false);
            if (confirmed) continue;
            out.add(new AvailableClaim(p.epoch(), p.channel(), p.index()));
        }
        out.sort(Comparator.comparingLong(AvailableClaim::epoch).thenComparing(AvailableClaim::channel));
        return out;
    }

    /**
     * Validates the claim and returns its proof. The first call opens a pending record; later
     * calls while it is pending return the same proof flagged as reissued.
     */
    public ClaimProof getProof(long epoch, String channel, String identity) {
        ValidatedClaim claim = validator.validate(identity, epoch, channel);
        if (!claim.isReissue()) {
            openRecord(identity, epoch, channel, claim.participant().index());
        }
        log.info("Claim proof served: identity={}, epoch={}, channel={}, index={}, reissued={}",
                identity, epoch, channel, claim.participant().index(), claim.isReissue());
        return claim.proof();
    }

    /**
     * Builds the unsigned {@code claim} call for {@code claimerAddress} to sign and broadcast.
     */
    public ClaimTransaction submitClaimTransaction(long epoch, String channel, String identity, String claimerAddress) {
        if (claimerAddress == null || !TRON_ADDRESS.matcher(claimerAddress).matches()) {
            throw new InvalidInputException("claimerAddress must be a base58 TRON address");
        }
        ClaimProof proof = getProof(epoch, channel, identity);
        String callData = FunctionEncoder.encode(RingContractAbi.claim(
                channel, epoch, proof.index(), identity, proof.amount(), proof.proof()));
        return new ClaimTransaction(
                ledgerClient.getContractAddress(),
                claimerAddress,
                RingContractAbi.CLAIM,
                "0x" + CryptoUtil.cleanHex(callData),
                ledgerProps.getFeeLimit(),
                proof);
    }

    /**
     * Marks a pending claim confirmed and flips its bit in the ring mirror. Confirming twice
     * returns the stored record.
     */
    public ClaimRecord confirmClaim(String identity, long epoch, String channel, String txRef) {
        long now = clock.instant().getEpochSecond();
        Optional<ClaimRecord> updated = claimRepository.transition(
                identity, epoch, channel, ClaimStatus.PENDING, ClaimStatus.CONFIRMED, txRef, now);
        if (updated.isEmpty()) {
            ClaimRecord current = claimRepository.find(identity, epoch, channel)
                    .orElseThrow(() -> new PolicyException(DistributorErrorCode.NOT_PARTICIPANT,
                            "no claim in progress for " + identity + " in " + channel + "#" + epoch));
            if (current.getStatus() == ClaimStatus.CONFIRMED) return current;
            throw new InvalidInputException(
                    "claim for " + identity + " in " + channel + "#" + epoch + " is " + current.getStatus());
        }
        ClaimRecord record = updated.get();
        if (!mirror.markClaimed(channel, epoch, record.getIndex())) {
            log.debug("Claim bit already set: channel={}, epoch={}, index={}", channel, epoch, record.getIndex());
        }
        log.info("Claim confirmed: identity={}, epoch={}, channel={}, txRef={}", identity, epoch, channel, txRef);
        return record;
    }

    /**
     * Marks a pending claim failed. A later {@link #getProof} opens a new attempt.
     */
    public ClaimRecord failClaim(String identity, long epoch, String channel, String txRef) {
        long now = clock.instant().getEpochSecond();
        ClaimRecord record = claimRepository.transition(
                        identity, epoch, channel, ClaimStatus.PENDING, ClaimStatus.FAILED, txRef, now)
                .orElseThrow(() -> new InvalidInputException(
                        "no pending claim for " + identity + " in " + channel + "#" + epoch));
        log.warn("Claim failed: identity={}, epoch={}, channel={}, txRef={}, attempts={}",
                identity, epoch, channel, txRef, record.getAttempts());
        return record;
    }

    public List<ClaimRecord> getClaimRecords(String identity) {
        return claimRepository.findByIdentity(identity);
    }

    private void openRecord(String identity, long epoch, String channel, int index) {
        long now = clock.instant().getEpochSecond();
        Optional<ClaimRecord> existing = claimRepository.find(identity, epoch, channel);
        if (existing.isPresent() && existing.get().getStatus() == ClaimStatus.FAILED) {
            claimRepository.transition(identity, epoch, channel, ClaimStatus.FAILED, ClaimStatus.PENDING, null, now);
            return;
        }
        ClaimRecord record = new ClaimRecord();
        record.setIdentity(identity);
        record.setEpoch(epoch);
        record.setChannel(channel);
        record.setIndex(index);
        record.setStatus(ClaimStatus.PENDING);
        record.setAttempts(1);
        record.setUpdatedAt(now);
        claimRepository.insertIfAbsent(record);
    }
}
