package dao.tron.rdist.ledger;

import dao.tron.rdist.event.RootPublishedEvent;

/**
 * @param event decoded RootPublished log, null when the receipt carried none
 */
public record PublishReceipt(LedgerSubmission submission, RootPublishedEvent event) {}
