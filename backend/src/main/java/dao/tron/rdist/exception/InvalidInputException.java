package dao.tron.rdist.exception;

public class InvalidInputException extends DistributorException {

    public InvalidInputException(String message) {
        super(DistributorErrorCode.INVALID_INPUT, message);
    }

    public InvalidInputException(DistributorErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
