package dao.tron.rdist.model;

/**
 * One participant's first appearance in a channel's epoch. Owned by ingestion, never modified.
 *
 * @param firstSeen unix seconds
 */
public record ParticipationRecord(
        long epoch,
        String channel,
        String participantId,
        long firstSeen
) {
    public EpochKey key() {
        return new EpochKey(epoch, channel);
    }
}
