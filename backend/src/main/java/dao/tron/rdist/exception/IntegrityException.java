package dao.tron.rdist.exception;

/**
 * Logic or data corruption: a rebuilt root or a proof does not match what was sealed.
 * Never retried.
 */
public class IntegrityException extends DistributorException {

    public IntegrityException(DistributorErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
