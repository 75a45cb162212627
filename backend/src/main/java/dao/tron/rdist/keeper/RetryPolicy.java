package dao.tron.rdist.keeper;

import dao.tron.rdist.config.KeeperProperties;
import dao.tron.rdist.exception.ErrorClass;
import dao.tron.rdist.exception.DistributorException;

/**
 * Bounded exponential backoff for transient ledger failures. Pure: no clock, no sleeping.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public static RetryPolicy from(KeeperProperties props) {
        return new RetryPolicy(props.getMaxRetries(), props.getRetryBaseMs(), props.getRetryMaxMs());
    }

    /**
     * @param failedAttempts attempts made so far, all failed (>= 1)
     */
    public RetryDecision decide(int failedAttempts, Throwable failure) {
        if (!isTransient(failure)) return RetryDecision.STOP;
        if (failedAttempts >= maxAttempts) return RetryDecision.STOP;
        return RetryDecision.after(backoffDelay(failedAttempts));
    }

    /**
     * base * 2^(n-1), capped.
     */
    public long backoffDelay(int failedAttempts) {
        int shift = Math.min(Math.max(failedAttempts - 1, 0), 30);
        long delay = baseDelayMs << shift;
        if (delay < 0 || delay > maxDelayMs) return maxDelayMs;
        return delay;
    }

    public static boolean isTransient(Throwable failure) {
        return failure instanceof DistributorException de && de.getErrorClass() == ErrorClass.TRANSIENT;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
