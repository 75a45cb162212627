package dao.tron.rdist.exception;

public class PolicyException extends DistributorException {

    public PolicyException(DistributorErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public PolicyException(DistributorErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
