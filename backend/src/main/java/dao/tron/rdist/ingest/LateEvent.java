package dao.tron.rdist.ingest;

import dao.tron.rdist.model.ParticipationRecord;

/**
 * A participation row that missed its sealed epoch.
 *
 * @param receivedAt unix seconds
 */
public record LateEvent(ParticipationRecord record, long receivedAt) {}
