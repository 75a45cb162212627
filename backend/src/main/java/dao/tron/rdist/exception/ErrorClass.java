package dao.tron.rdist.exception;

/**
 * How a failure is handled: whether it is retried, alerted or reported back to the caller.
 */
public enum ErrorClass {
    /** Malformed request data. Rejected immediately, never retried. */
    INPUT,
    /** Network/RPC trouble. Retried with bounded backoff inside the keeper. */
    TRANSIENT,
    /** Root or proof mismatch. Never retried; halts the operation and raises an alert. */
    INTEGRITY,
    /** A terminal business rule (already claimed, evicted...). Never retried. */
    POLICY
}
