package dao.tron.rdist.keeper;

/**
 * Observes backoff around transient failures.
 */
public interface RetryListener {

    RetryListener NONE = (operation, attempt, delayMs, cause) -> {};

    /** Called before sleeping {@code delayMs}. */
    void onRetry(String operation, int failedAttempts, long delayMs, Throwable cause);

    /** Called after the backoff elapsed, just before the next attempt. */
    default void afterBackoff(String operation, int failedAttempts) {
    }
}
