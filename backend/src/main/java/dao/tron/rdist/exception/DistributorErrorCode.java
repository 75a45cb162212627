package dao.tron.rdist.exception;

/**
 * Error codes raised by the distributor. Codes are grouped by their {@link ErrorClass}.
 */
public enum DistributorErrorCode {

    // --- 1xxx: input ---
    INVALID_INPUT(1001, ErrorClass.INPUT, "Invalid argument provided"),
    EPOCH_NOT_CLOSED(1002, ErrorClass.INPUT, "Epoch window has not closed yet"),

    // --- 2xxx: transient infrastructure ---
    LEDGER_TIMEOUT(2001, ErrorClass.TRANSIENT, "Ledger call timed out"),
    LEDGER_UNAVAILABLE(2002, ErrorClass.TRANSIENT, "Ledger endpoint unavailable"),
    RETRIES_EXHAUSTED(2003, ErrorClass.TRANSIENT, "Retries exhausted"),

    // --- 3xxx: integrity ---
    ROOT_MISMATCH(3001, ErrorClass.INTEGRITY, "Rebuilt Merkle root does not match sealed root"),
    PROOF_MISMATCH(3002, ErrorClass.INTEGRITY, "Proof failed self-verification"),
    SLOT_CONFLICT(3003, ErrorClass.INTEGRITY, "Ring slot holds a different root for the same epoch"),

    // --- 4xxx: policy ---
    NOT_SEALED(4001, ErrorClass.POLICY, "Epoch is not sealed"),
    NOT_PUBLISHED(4002, ErrorClass.POLICY, "Epoch root is not published yet"),
    NOT_PARTICIPANT(4003, ErrorClass.POLICY, "Identity did not participate in epoch"),
    ALREADY_CLAIMED(4004, ErrorClass.POLICY, "Reward already claimed"),
    SLOT_EVICTED(4005, ErrorClass.POLICY, "Epoch was evicted from the ring buffer"),
    CAPACITY_EXCEEDED(4006, ErrorClass.POLICY, "Epoch exceeds ring slot claim capacity"),
    LEDGER_REJECTED(4007, ErrorClass.POLICY, "Ledger rejected the transaction"),

    ;

    private final int code;
    private final ErrorClass errorClass;
    private final String defaultMessage;

    DistributorErrorCode(int code, ErrorClass errorClass, String defaultMessage) {
        this.code = code;
        this.errorClass = errorClass;
        this.defaultMessage = defaultMessage;
    }

    public int getCode() {
        return code;
    }

    public ErrorClass getErrorClass() {
        return errorClass;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
