package dao.tron.rdist.ledger;

import java.util.Optional;

/**
 * Calls into the reward ring contract. Implementations bound every call with a timeout and raise
 * {@link dao.tron.rdist.exception.TransientLedgerException} for network failures and
 * {@link dao.tron.rdist.exception.PolicyException} ({@code LEDGER_REJECTED}) for reverts.
 * A mutation that was broadcast but not confirmed raises
 * {@link dao.tron.rdist.exception.UnconfirmedSubmissionException} carrying its txId.
 */
public interface RingLedgerClient {

    /**
     * Slot of (channel, epoch) as the full node sees it, including unsolidified blocks.
     */
    OnChainSlot readSlot(String channel, long epoch);

    PublishReceipt publishRoot(String channel, long epoch, String rootHex, int claimCount);

    /**
     * Receipt of an earlier {@code publishRoot} transaction, empty while the ledger does not know it.
     *
     * @throws dao.tron.rdist.exception.PolicyException when the transaction failed on-chain
     */
    Optional<PublishReceipt> findPublishReceipt(String txId);

    LedgerSimulation simulatePublishRoot(String channel, long epoch, String rootHex, int claimCount);

    boolean isClaimed(String channel, long epoch, int index);

    PositionState readPosition(String channel);

    LedgerSubmission compound(String channel);

    LedgerSimulation simulateCompound(String channel);

    String getContractAddress();

    String getPublisherAddress();
}
