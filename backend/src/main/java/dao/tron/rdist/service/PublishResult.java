package dao.tron.rdist.service;

import dao.tron.rdist.model.EpochKey;

/**
 * @param txId           publish transaction, null unless {@link PublishOutcome#PUBLISHED}
 * @param energyEstimate energy used or estimated, 0 when no ledger call was made
 */
public record PublishResult(
        EpochKey key,
        PublishOutcome outcome,
        String txId,
        long energyEstimate,
        String message
) {}
