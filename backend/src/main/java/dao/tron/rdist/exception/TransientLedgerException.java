package dao.tron.rdist.exception;

/**
 * Network or RPC failure talking to the ledger. Safe to retry.
 */
public class TransientLedgerException extends DistributorException {

    public TransientLedgerException(DistributorErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TransientLedgerException(DistributorErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
