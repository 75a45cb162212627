package dao.tron.rdist.repository;

import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.ParticipationRecord;

import java.util.List;
import java.util.Set;

/**
 * Read side of the participation feed. Rows are append-only.
 */
public interface ParticipationStore {

    /**
     * Rows for one channel's epoch ordered by {@code firstSeen} ascending.
     */
    List<ParticipationRecord> findByEpochAndChannel(long epoch, String channel);

    Set<EpochKey> findEpochKeys();

    Set<String> findChannels();
}
