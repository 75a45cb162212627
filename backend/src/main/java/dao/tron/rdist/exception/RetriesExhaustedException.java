package dao.tron.rdist.exception;

import lombok.Getter;

/**
 * Thrown once the keeper gave up retrying a transient failure within a tick.
 */
@Getter
public class RetriesExhaustedException extends DistributorException {

    private final String operation;
    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(DistributorErrorCode.RETRIES_EXHAUSTED,
                operation + " failed after " + attempts + " attempts: " + lastFailure.getMessage(),
                lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }
}
