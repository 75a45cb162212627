package dao.tron.rdist.model;

import dao.tron.rdist.exception.DistributorErrorCode;

/**
 * An (epoch, channel) pair the sealer refused for good. It is never sealed and never due again.
 */
public record RejectedEpoch(long epoch, String channel, DistributorErrorCode errorCode, String reason,
                            long rejectedAt) {

    public EpochKey key() {
        return new EpochKey(epoch, channel);
    }
}
