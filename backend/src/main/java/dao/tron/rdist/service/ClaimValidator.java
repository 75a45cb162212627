package dao.tron.rdist.service;

import dao.tron.rdist.exception.ClaimRejectedException;
import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.IntegrityException;
import dao.tron.rdist.exception.InvalidInputException;
import dao.tron.rdist.model.ClaimProof;
import dao.tron.rdist.model.ClaimRecord;
import dao.tron.rdist.model.ClaimStatus;
import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.model.SealedParticipant;
import dao.tron.rdist.repository.ClaimRecordRepository;
import dao.tron.rdist.repository.SealedEpochRepository;
import dao.tron.rdist.ring.RingLedgerMirror;
import dao.tron.rdist.ring.SlotStatus;
import dao.tron.rdist.ring.SlotView;
import dao.tron.rdist.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether an identity may claim (epoch, channel) and produces the proof.
 * <p>
 * Checks run in a fixed order so a request always gets the most fundamental rejection first:
 * input, sealed, published, still in the ring, participant, not yet claimed. A proof that does not
 * reduce to the sealed root is never served.
 */
@Slf4j
@Service
public class ClaimValidator {

    static final Pattern IDENTITY = Pattern.compile("[A-Za-z0-9_.:@-]{1,128}");

    private final SealedEpochRepository sealedRepository;
    private final ClaimRecordRepository claimRepository;
    private final RingLedgerMirror mirror;
    private final EpochTreeCache treeCache;
    private final MerkleTreeService merkleTreeService;
    private final AlertService alertService;

    public ClaimValidator(SealedEpochRepository sealedRepository,
                          ClaimRecordRepository claimRepository,
                          RingLedgerMirror mirror,
                          EpochTreeCache treeCache,
                          MerkleTreeService merkleTreeService,
                          AlertService alertService) {
        this.sealedRepository = sealedRepository;
        this.claimRepository = claimRepository;
        this.mirror = mirror;
        this.treeCache = treeCache;
        this.merkleTreeService = merkleTreeService;
        this.alertService = alertService;
    }

    public ValidatedClaim validate(String identity, long epoch, String channel) {
        validateInput(identity, epoch, channel);

        SealedEpoch sealed = sealedRepository.find(new EpochKey(epoch, channel))
                .orElseThrow(() -> new ClaimRejectedException(DistributorErrorCode.NOT_SEALED, identity, epoch, channel));
        if (!sealed.isPublished()) {
            throw new ClaimRejectedException(DistributorErrorCode.NOT_PUBLISHED, identity, epoch, channel);
        }
        checkSlot(sealed, identity);

        SealedParticipant participant = findParticipant(sealed, identity);

        Optional<ClaimRecord> record = claimRepository.find(identity, epoch, channel);
        if (record.isPresent() && record.get().getStatus() == ClaimStatus.CONFIRMED) {
            throw new ClaimRejectedException(DistributorErrorCode.ALREADY_CLAIMED, identity, epoch, channel);
        }
        if (mirror.isClaimed(channel, epoch, participant.index())) {
            throw new ClaimRejectedException(DistributorErrorCode.ALREADY_CLAIMED, identity, epoch, channel);
        }
        Optional<ClaimRecord> pending = record.filter(r -> r.getStatus() == ClaimStatus.PENDING);

        ClaimProof proof = prove(sealed, participant, pending.isPresent());
        return new ValidatedClaim(sealed, participant, proof, pending);
    }

    private void validateInput(String identity, long epoch, String channel) {
        if (identity == null || !IDENTITY.matcher(identity).matches()) {
            throw new InvalidInputException("identity must match " + IDENTITY.pattern());
        }
        if (epoch < 0) {
            throw new InvalidInputException("epoch must be >= 0, got " + epoch);
        }
        if (channel == null || channel.isBlank()) {
            throw new InvalidInputException("channel is required");
        }
    }

    private void checkSlot(SealedEpoch sealed, String identity) {
        SlotStatus status = mirror.statusOf(sealed.getChannel(), sealed.getEpoch());
        if (status == SlotStatus.EVICTED) {
            throw new ClaimRejectedException(DistributorErrorCode.SLOT_EVICTED, identity, sealed.getEpoch(), sealed.getChannel());
        }
        if (status == SlotStatus.EMPTY) {
            // published locally but not yet mirrored; the keeper re-occupies it on its next pass
            throw new ClaimRejectedException(DistributorErrorCode.NOT_PUBLISHED, identity, sealed.getEpoch(), sealed.getChannel());
        }
        SlotView slot = mirror.find(sealed.getChannel(), sealed.getEpoch()).orElseThrow();
        if (!slot.rootHex().equalsIgnoreCase(sealed.getRootHex())) {
            IntegrityException e = new IntegrityException(DistributorErrorCode.SLOT_CONFLICT,
                    "ring slot " + slot.slotIndex() + " root " + slot.rootHex() + " != sealed root "
                            + sealed.getRootHex() + " for " + sealed.key());
            alertService.raise("claim validation", e);
            throw e;
        }
    }

    private SealedParticipant findParticipant(SealedEpoch sealed, String identity) {
        List<SealedParticipant> matches = new ArrayList<>();
        for (SealedParticipant p : sealedRepository.findParticipants(sealed.key())) {
            if (p.participantId().equals(identity)) matches.add(p);
        }
        if (matches.isEmpty()) {
            throw new ClaimRejectedException(DistributorErrorCode.NOT_PARTICIPANT, identity, sealed.getEpoch(), sealed.getChannel());
        }
        if (matches.size() > 1) {
            IntegrityException e = new IntegrityException(DistributorErrorCode.ROOT_MISMATCH,
                    identity + " appears " + matches.size() + " times in " + sealed.key());
            alertService.raise("claim validation", e);
            throw e;
        }
        return matches.get(0);
    }

    private ClaimProof prove(SealedEpoch sealed, SealedParticipant participant, boolean reissued) {
        CachedTree tree;
        try {
            tree = treeCache.get(sealed);
        } catch (IntegrityException e) {
            alertService.raise("tree rebuild", e);
            throw e;
        }

        byte[] leaf = merkleTreeService.leafHash(participant);
        List<byte[]> siblings = merkleTreeService.buildProofFromLevels(tree.levels(), participant.index());
        List<String> proofHex = new ArrayList<>(siblings.size());
        for (byte[] s : siblings) {
            if (s.length != CryptoUtil.HASH_BYTES) {
                throw proofMismatch(sealed, participant, "proof element of " + s.length + " bytes");
            }
            proofHex.add(CryptoUtil.toHex0x(s));
        }

        byte[] root = CryptoUtil.fromHex32(sealed.getRootHex());
        if (!merkleTreeService.verify(leaf, siblings, root)) {
            throw proofMismatch(sealed, participant, "proof does not reduce to sealed root");
        }

        return new ClaimProof(sealed.getEpoch(), sealed.getChannel(), sealed.getRootHex(),
                participant.index(), participant.amount(), List.copyOf(proofHex), reissued);
    }

    private IntegrityException proofMismatch(SealedEpoch sealed, SealedParticipant participant, String detail) {
        treeCache.evict(sealed.key());
        IntegrityException e = new IntegrityException(DistributorErrorCode.PROOF_MISMATCH,
                detail + ": epoch=" + sealed.key() + ", index=" + participant.index());
        alertService.raise("proof self-check", e);
        return e;
    }
}
