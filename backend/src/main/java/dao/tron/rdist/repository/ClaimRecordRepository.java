package dao.tron.rdist.repository;

import dao.tron.rdist.model.ClaimRecord;
import dao.tron.rdist.model.ClaimStatus;

import java.util.List;
import java.util.Optional;

public interface ClaimRecordRepository {

    Optional<ClaimRecord> find(String identity, long epoch, String channel);

    /**
     * Inserts {@code record} unless a row already exists for its (identity, epoch, channel);
     * returns whichever row is stored afterwards.
     */
    ClaimRecord insertIfAbsent(ClaimRecord record);

    /**
     * Compare-and-set on status. Returns the updated row, or empty when the stored status was not
     * {@code expected}.
     */
    Optional<ClaimRecord> transition(String identity, long epoch, String channel,
                                     ClaimStatus expected, ClaimStatus next, String txRef, long now);

    List<ClaimRecord> findByStatus(ClaimStatus status);

    List<ClaimRecord> findByIdentity(String identity);
}
