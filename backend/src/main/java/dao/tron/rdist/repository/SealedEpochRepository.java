package dao.tron.rdist.repository;

import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.RejectedEpoch;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.model.SealedParticipant;

import java.util.List;
import java.util.Optional;

public interface SealedEpochRepository {

    /**
     * Stores the epoch row and its participants as one unit. If the pair is already sealed the
     * existing row is returned and nothing is written.
     */
    SealedEpoch saveSealed(SealedEpoch epoch, List<SealedParticipant> participants);

    Optional<SealedEpoch> find(EpochKey key);

    List<SealedParticipant> findParticipants(EpochKey key);

    /**
     * The participant's rows across all sealed epochs.
     */
    List<SealedParticipant> findByParticipant(String participantId);

    List<SealedEpoch> findAll();

    List<SealedEpoch> findUnpublished(String channel);

    Optional<Long> findLatestSealedEpoch(String channel);

    /**
     * Flips {@code published}. Returns false when it was already true.
     */
    boolean markPublished(EpochKey key, String publishTxId, long publishedAt);

    /**
     * Records a terminal seal rejection. Returns false when the pair was already rejected.
     */
    boolean saveRejected(RejectedEpoch rejected);

    Optional<RejectedEpoch> findRejected(EpochKey key);

    List<RejectedEpoch> findAllRejected();
}
