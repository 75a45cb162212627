package dao.tron.rdist.service;

public enum PublishOutcome {
    /** publishRoot broadcast and confirmed */
    PUBLISHED,
    /** already published locally, nothing sent */
    ALREADY_PUBLISHED,
    /** the ledger already carried the root; adopted without a second transaction */
    ADOPTED,
    /** zero participants, marked published without a ledger call */
    SKIPPED_EMPTY,
    /** dry-run: simulation succeeded */
    SIMULATED,
    /** dry-run: simulation reverted */
    SIMULATION_FAILED
}
