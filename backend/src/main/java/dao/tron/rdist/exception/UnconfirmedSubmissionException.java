package dao.tron.rdist.exception;

import lombok.Getter;

/**
 * A transaction was handed to the ledger but its outcome is unknown. It may still land, so a
 * retry has to look the transaction up before sending another one.
 */
@Getter
public class UnconfirmedSubmissionException extends TransientLedgerException {

    private final String txId;

    public UnconfirmedSubmissionException(DistributorErrorCode errorCode, String message, String txId) {
        super(errorCode, message);
        this.txId = txId;
    }

    public UnconfirmedSubmissionException(DistributorErrorCode errorCode, String message, String txId, Throwable cause) {
        super(errorCode, message, cause);
        this.txId = txId;
    }
}
