package dao.tron.rdist.ingest;

public enum IngestionOutcome {
    ACCEPTED,
    REASSIGNED,
    DROPPED,
    FLAGGED
}
