package dao.tron.rdist.keeper;

import dao.tron.rdist.exception.RetriesExhaustedException;
import dao.tron.rdist.exception.TransientLedgerException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Runs an action under a {@link RetryPolicy}. Only transient failures are retried; everything
 * else propagates on the first occurrence.
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, Supplier<T> action, RetryListener listener) {
        int attempts = 0;
        while (true) {
            try {
                return action.get();
            } catch (TransientLedgerException e) {
                attempts++;
                RetryDecision decision = policy.decide(attempts, e);
                if (!decision.retry()) {
                    throw new RetriesExhaustedException(operation, attempts, e);
                }
                log.warn("{} failed (attempt {}/{}): {}; retrying in {}ms",
                        operation, attempts, policy.getMaxAttempts(), e.getMessage(), decision.delayMs());
                listener.onRetry(operation, attempts, decision.delayMs(), e);
                try {
                    sleeper.sleep(decision.delayMs());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetriesExhaustedException(operation, attempts, ie);
                }
                listener.afterBackoff(operation, attempts);
            }
        }
    }
}
