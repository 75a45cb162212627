package dao.tron.rdist.keeper;

public enum KeeperEvent {
    /** a channel pass begins */
    START,
    /** the current phase finished */
    PHASE_COMPLETE,
    /** a ledger call failed transiently */
    TRANSIENT_FAILURE,
    /** backoff elapsed, retry the interrupted phase */
    RETRY,
    /** retries exhausted, the tick ends */
    GIVE_UP,
    /** the channel pass stopped on a non-retryable error */
    ABORT
}
