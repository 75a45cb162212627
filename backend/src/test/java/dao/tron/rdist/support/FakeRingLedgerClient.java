package dao.tron.rdist.support;

import dao.tron.rdist.event.RootPublishedEvent;
import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.TransientLedgerException;
import dao.tron.rdist.exception.UnconfirmedSubmissionException;
import dao.tron.rdist.ledger.LedgerSimulation;
import dao.tron.rdist.ledger.LedgerSubmission;
import dao.tron.rdist.ledger.OnChainSlot;
import dao.tron.rdist.ledger.PositionState;
import dao.tron.rdist.ledger.PublishReceipt;
import dao.tron.rdist.ledger.RingLedgerClient;
import dao.tron.rdist.service.MerkleTreeService;
import dao.tron.rdist.util.CryptoUtil;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory contract with call counters. {@link #failNext(int)} makes the next calls time out.
 * {@link #loseNextConfirmation()} lets the next publish land without the caller learning about it
 * and without the slot showing up in reads yet, like a lagging node.
 */
public class FakeRingLedgerClient implements RingLedgerClient {

    public final AtomicInteger readSlotCalls = new AtomicInteger();
    public final AtomicInteger publishCalls = new AtomicInteger();
    public final AtomicInteger simulatePublishCalls = new AtomicInteger();
    public final AtomicInteger receiptLookups = new AtomicInteger();
    public final AtomicInteger compoundCalls = new AtomicInteger();
    public final AtomicInteger simulateCompoundCalls = new AtomicInteger();

    private final Map<String, OnChainSlot> slots = new ConcurrentHashMap<>();
    private final Map<String, PublishReceipt> receipts = new ConcurrentHashMap<>();
    private final Set<String> claimed = new HashSet<>();
    private final AtomicInteger failures = new AtomicInteger();
    private PositionState position = new PositionState(false, BigInteger.ZERO, BigInteger.ZERO, false, 0L);
    private String simulationFailure;
    private int nextSlot;
    private boolean confirmationLost;
    private boolean receiptsHidden;

    public void loseNextConfirmation() {
        this.confirmationLost = true;
    }

    public void hideReceipts(boolean hidden) {
        this.receiptsHidden = hidden;
    }

    public void failNext(int calls) {
        failures.set(calls);
    }

    public void setPosition(PositionState position) {
        this.position = position;
    }

    public void failSimulationsWith(String message) {
        this.simulationFailure = message;
    }

    public void putSlot(String channel, long epoch, String rootHex, int claimCount) {
        slots.put(channel + "#" + epoch, new OnChainSlot(true, rootHex, claimCount, nextSlot++));
    }

    public void setClaimed(String channel, long epoch, int index) {
        claimed.add(channel + "#" + epoch + "#" + index);
    }

    @Override
    public OnChainSlot readSlot(String channel, long epoch) {
        maybeFail("slotOf");
        readSlotCalls.incrementAndGet();
        return slots.getOrDefault(channel + "#" + epoch, OnChainSlot.absent());
    }

    @Override
    public PublishReceipt publishRoot(String channel, long epoch, String rootHex, int claimCount) {
        maybeFail("publishRoot");
        int n = publishCalls.incrementAndGet();
        String txId = "tx-" + n;
        int slotIndex = nextSlot;
        RootPublishedEvent event = new RootPublishedEvent(
                CryptoUtil.toHex0x(MerkleTreeService.channelId(channel)), epoch, rootHex, claimCount, slotIndex);
        PublishReceipt receipt = new PublishReceipt(new LedgerSubmission(txId, 1000L + n, 50_000L), event);
        receipts.put(txId, receipt);
        if (confirmationLost) {
            confirmationLost = false;
            nextSlot++;
            throw new UnconfirmedSubmissionException(DistributorErrorCode.LEDGER_TIMEOUT,
                    "publishRoot: no TransactionInfo yet", txId);
        }
        putSlot(channel, epoch, rootHex, claimCount);
        return receipt;
    }

    @Override
    public Optional<PublishReceipt> findPublishReceipt(String txId) {
        maybeFail("getTransactionInfoById");
        receiptLookups.incrementAndGet();
        return receiptsHidden ? Optional.empty() : Optional.ofNullable(receipts.get(txId));
    }

    @Override
    public LedgerSimulation simulatePublishRoot(String channel, long epoch, String rootHex, int claimCount) {
        maybeFail("publishRoot (simulate)");
        simulatePublishCalls.incrementAndGet();
        return simulationFailure == null ? LedgerSimulation.ok(48_000L) : LedgerSimulation.failed(simulationFailure);
    }

    @Override
    public boolean isClaimed(String channel, long epoch, int index) {
        maybeFail("isClaimed");
        return claimed.contains(channel + "#" + epoch + "#" + index);
    }

    @Override
    public PositionState readPosition(String channel) {
        maybeFail("positionOf");
        return position;
    }

    @Override
    public LedgerSubmission compound(String channel) {
        maybeFail("compound");
        int n = compoundCalls.incrementAndGet();
        return new LedgerSubmission("compound-" + n, 2000L + n, 30_000L);
    }

    @Override
    public LedgerSimulation simulateCompound(String channel) {
        maybeFail("compound (simulate)");
        simulateCompoundCalls.incrementAndGet();
        return simulationFailure == null ? LedgerSimulation.ok(28_000L) : LedgerSimulation.failed(simulationFailure);
    }

    @Override
    public String getContractAddress() {
        return "TXYZopYRdj2D9XRtbG411XZZ3kM5VkAeBf";
    }

    @Override
    public String getPublisherAddress() {
        return "TKWvD71EMFTpFVGZyqqX9fC6MQgcR9H76M";
    }

    private void maybeFail(String operation) {
        if (failures.getAndUpdate(f -> f > 0 ? f - 1 : 0) > 0) {
            throw new TransientLedgerException(DistributorErrorCode.LEDGER_TIMEOUT, operation + " timed out");
        }
    }
}
