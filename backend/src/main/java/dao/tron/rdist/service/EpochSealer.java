package dao.tron.rdist.service;

import dao.tron.rdist.config.EpochProperties;
import dao.tron.rdist.config.RingProperties;
import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.InvalidInputException;
import dao.tron.rdist.exception.PolicyException;
import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.ParticipationRecord;
import dao.tron.rdist.model.RejectedEpoch;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.model.SealedParticipant;
import dao.tron.rdist.repository.ParticipationStore;
import dao.tron.rdist.repository.SealedEpochRepository;
import dao.tron.rdist.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Freezes an epoch's participants into an ordered, immutable snapshot and computes its root.
 * Only the keeper calls this.
 */
@Slf4j
@Service
public class EpochSealer {

    /** ascending first_seen, then participant id */
    static final Comparator<ParticipationRecord> SEAL_ORDER =
            Comparator.comparingLong(ParticipationRecord::firstSeen)
                    .thenComparing(ParticipationRecord::participantId);

    private final ParticipationStore store;
    private final SealedEpochRepository repository;
    private final MerkleTreeService merkleTreeService;
    private final EpochProperties epochProps;
    private final int maxClaims;
    private final Clock clock;

    public EpochSealer(ParticipationStore store,
                       SealedEpochRepository repository,
                       MerkleTreeService merkleTreeService,
                       EpochProperties epochProps,
                       RingProperties ringProps,
                       Clock clock) {
        this.store = store;
        this.repository = repository;
        this.merkleTreeService = merkleTreeService;
        this.epochProps = epochProps;
        this.maxClaims = ringProps.getMaxClaims();
        this.clock = clock;
    }

    /**
     * Seal (epoch, channel). Returns the existing snapshot unchanged if it was sealed before.
     *
     * @throws InvalidInputException when the epoch window is still open
     * @throws PolicyException       when the epoch has more participants than a ring slot can hold,
     *                               or was rejected for that before
     */
    public SealedEpoch sealEpoch(long epoch, String channel) {
        if (epoch < 0) {
            throw new InvalidInputException("epoch must be >= 0, got " + epoch);
        }
        if (channel == null || channel.isBlank()) {
            throw new InvalidInputException("channel is required");
        }

        EpochKey key = new EpochKey(epoch, channel);
        var existing = repository.find(key);
        if (existing.isPresent()) {
            log.debug("Epoch {} already sealed, returning stored snapshot", key);
            return existing.get();
        }
        var rejected = repository.findRejected(key);
        if (rejected.isPresent()) {
            throw new PolicyException(rejected.get().errorCode(), rejected.get().reason());
        }

        long now = clock.instant().getEpochSecond();
        if (!epochProps.isSealable(epoch, now)) {
            throw new InvalidInputException(DistributorErrorCode.EPOCH_NOT_CLOSED,
                    "epoch " + key + " closes at " + (epochProps.windowEnd(epoch) + epochProps.getSealDelaySeconds())
                            + ", now " + now);
        }

        List<SealedParticipant> participants = orderParticipants(
                store.findByEpochAndChannel(epoch, channel), epoch, channel, epochProps.amountPerParticipantValue());
        if (participants.size() > maxClaims) {
            String reason = "epoch " + key + " has " + participants.size()
                    + " participants, ring slot capacity is " + maxClaims;
            repository.saveRejected(new RejectedEpoch(epoch, channel, DistributorErrorCode.CAPACITY_EXCEEDED, reason, now));
            throw new PolicyException(DistributorErrorCode.CAPACITY_EXCEEDED, reason);
        }

        byte[] root = merkleTreeService.computeRootForParticipants(participants);

        SealedEpoch sealed = new SealedEpoch();
        sealed.setEpoch(epoch);
        sealed.setChannel(channel);
        sealed.setRootHex(CryptoUtil.toHex0x(root));
        sealed.setParticipantCount(participants.size());
        sealed.setSealedAt(now);
        sealed.setPublished(false);

        SealedEpoch stored = repository.saveSealed(sealed, participants);
        if (stored.getSealedAt() != now || !stored.getRootHex().equals(sealed.getRootHex())) {
            log.warn("Epoch {} was sealed concurrently; keeping stored root {}", key, stored.getRootHex());
        } else {
            log.info("Sealed epoch {}: participants={}, root={}", key, participants.size(), stored.getRootHex());
        }
        return stored;
    }

    /**
     * Closed epochs of {@code channel} that are neither sealed nor rejected. With
     * {@code includeLatest} the most recent sealable epoch is included even if nobody participated.
     */
    public List<Long> findDueEpochs(String channel, boolean includeLatest) {
        long now = clock.instant().getEpochSecond();
        TreeSet<Long> due = new TreeSet<>();
        for (EpochKey key : store.findEpochKeys()) {
            if (key.channel().equals(channel) && epochProps.isSealable(key.epoch(), now)) {
                due.add(key.epoch());
            }
        }
        long latest = epochProps.latestSealableEpoch(now);
        if (includeLatest && latest >= 0) {
            due.add(latest);
        }
        due.removeIf(e -> {
            EpochKey key = new EpochKey(e, channel);
            return repository.find(key).isPresent() || repository.findRejected(key).isPresent();
        });
        return new ArrayList<>(due);
    }

    /**
     * One row per participant (earliest sighting wins), indexed by {@link #SEAL_ORDER}.
     */
    static List<SealedParticipant> orderParticipants(List<ParticipationRecord> rows, long epoch, String channel,
                                                      BigInteger amount) {
        Map<String, ParticipationRecord> earliest = new LinkedHashMap<>();
        for (ParticipationRecord r : rows) {
            if (r.epoch() != epoch || !r.channel().equals(channel)) {
                throw new IllegalArgumentException("row " + r + " does not belong to " + channel + "#" + epoch);
            }
            earliest.merge(r.participantId(), r, (a, b) -> SEAL_ORDER.compare(a, b) <= 0 ? a : b);
        }

        List<ParticipationRecord> ordered = new ArrayList<>(earliest.values());
        ordered.sort(SEAL_ORDER);

        List<SealedParticipant> out = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            out.add(new SealedParticipant(epoch, channel, i, ordered.get(i).participantId(), amount));
        }
        return out;
    }
}
