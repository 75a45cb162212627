package dao.tron.rdist.ingest;

/**
 * Handling of participation that arrives after its epoch was sealed.
 */
public enum LateEventPolicy {
    /** Discard the event. */
    DROP,
    /** Count the participant in the currently open epoch instead. */
    NEXT_EPOCH,
    /** Keep the event aside for operators; it is not counted anywhere. */
    FLAG
}
