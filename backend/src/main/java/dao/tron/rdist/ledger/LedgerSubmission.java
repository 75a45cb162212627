package dao.tron.rdist.ledger;

/**
 * A mutation that reached the ledger and succeeded.
 */
public record LedgerSubmission(String txId, long blockNumber, long energyUsed) {}
