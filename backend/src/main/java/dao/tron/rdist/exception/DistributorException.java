package dao.tron.rdist.exception;

/**
 * Base class for every predictable failure raised by the distributor.
 */
public class DistributorException extends RuntimeException {

    private final DistributorErrorCode errorCode;

    public DistributorException(DistributorErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public DistributorException(DistributorErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DistributorException(DistributorErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public DistributorErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorClass getErrorClass() {
        return errorCode.getErrorClass();
    }
}
