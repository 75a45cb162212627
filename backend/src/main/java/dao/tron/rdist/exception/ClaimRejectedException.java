package dao.tron.rdist.exception;

import lombok.Getter;

/**
 * A claim that cannot be served for a terminal business reason
 * ({@code NOT_SEALED}, {@code NOT_PARTICIPANT}, {@code ALREADY_CLAIMED}, {@code SLOT_EVICTED}...).
 */
@Getter
public class ClaimRejectedException extends PolicyException {

    private final String identity;
    private final long epoch;
    private final String channel;

    public ClaimRejectedException(DistributorErrorCode reason, String identity, long epoch, String channel) {
        super(reason, reason.getDefaultMessage() + ": identity=" + identity + ", epoch=" + epoch + ", channel=" + channel);
        this.identity = identity;
        this.epoch = epoch;
        this.channel = channel;
    }
}
