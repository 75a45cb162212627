package dao.tron.rdist.ledger;

import dao.tron.rdist.config.LedgerProperties;
import dao.tron.rdist.event.RootPublishedEvent;
import dao.tron.rdist.event.RootPublishedEventReader;
import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.DistributorException;
import dao.tron.rdist.exception.PolicyException;
import dao.tron.rdist.exception.TransientLedgerException;
import dao.tron.rdist.exception.UnconfirmedSubmissionException;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.tron.trident.abi.FunctionEncoder;
import org.tron.trident.abi.FunctionReturnDecoder;
import org.tron.trident.abi.datatypes.Bool;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.Type;
import org.tron.trident.abi.datatypes.generated.Bytes32;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.abi.datatypes.generated.Uint32;
import org.tron.trident.abi.datatypes.generated.Uint64;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.core.NodeType;
import org.tron.trident.core.exceptions.IllegalException;
import org.tron.trident.proto.Chain;
import org.tron.trident.proto.Response;
import org.tron.trident.utils.Numeric;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Service
public class RingLedgerClientTrident implements RingLedgerClient {

    @FunctionalInterface
    interface LedgerCall<R> {
        R apply(ApiWrapper wrapper) throws Exception;
    }

    private final EndpointPool<ApiWrapper> pool;
    @Getter
    private final String publisherAddress;
    @Getter
    private final String contractAddress;
    private final RootPublishedEventReader eventReader;
    private final LedgerProperties.Polling polling;
    private final long callTimeoutMs;
    private final long feeLimit;
    private final Clock clock;
    private final ExecutorService callExecutor;
    /**
     * Guard signing/broadcasting so concurrent callers don't trip over non-thread-safe internals.
     * Receipt polling is done outside this lock.
     */
    private final Object broadcastLock = new Object();

    public RingLedgerClientTrident(LedgerProperties props, RootPublishedEventReader eventReader, Clock clock) {
        this.contractAddress = props.getContractAddress();
        this.eventReader = eventReader;
        this.polling = props.getPolling();
        this.callTimeoutMs = props.getCallTimeoutMs();
        this.feeLimit = props.getFeeLimit();
        this.clock = clock;

        AtomicInteger threadIds = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ledger-call-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        String privateKey = props.getPrivateKey();
        if (privateKey == null || privateKey.isBlank() || privateKey.equals("YOUR_PRIVATE_KEY_HERE")) {
            log.warn("No valid publisher key configured. Set PUBLISHER_PRIVATE_KEY to enable ledger operations.");
            this.pool = null;
            this.publisherAddress = "NOT_CONFIGURED";
            return;
        }
        if (privateKey.length() % 2 != 0) {
            log.error("Invalid private key format: odd-length hex string");
            this.pool = null;
            this.publisherAddress = "INVALID_KEY_FORMAT";
            return;
        }

        List<EndpointPool.Member<ApiWrapper>> members = new ArrayList<>();
        if (props.getEndpoints().isEmpty()) {
            members.add(new EndpointPool.Member<>("nile", ApiWrapper.ofNile(privateKey)));
        } else {
            for (LedgerProperties.Endpoint e : props.getEndpoints()) {
                members.add(new EndpointPool.Member<>(e.getGrpc(),
                        new ApiWrapper(e.getGrpc(), e.getSolidityGrpc(), privateKey)));
            }
        }
        this.pool = new EndpointPool<>(members, props.getEndpointCooldownMs(), clock);
        this.publisherAddress = members.get(0).getClient().keyPair.toBase58CheckAddress();
        log.info("RingLedgerClientTrident initialized: publisher={}, contract={}, endpoints={}",
                publisherAddress, contractAddress, members.size());
    }

    @Override
    public OnChainSlot readSlot(String channel, long epoch) {
        Function fn = RingContractAbi.slotOf(channel, epoch);
        List<Type> out = constantCall("slotOf", fn, NodeType.FULL_NODE);
        boolean present = ((Bool) out.get(0)).getValue();
        if (!present) return OnChainSlot.absent();
        Bytes32 root = (Bytes32) out.get(1);
        return new OnChainSlot(true,
                "0x" + Numeric.toHexStringNoPrefix(root.getValue()),
                ((Uint32) out.get(2)).getValue().intValueExact(),
                ((Uint32) out.get(3)).getValue().intValueExact());
    }

    @Override
    public PublishReceipt publishRoot(String channel, long epoch, String rootHex, int claimCount) {
        Function fn = RingContractAbi.publishRoot(channel, epoch, rootHex, claimCount);
        Response.TransactionInfo info = submit("publishRoot", fn);
        return toPublishReceipt(info, channel, epoch, rootHex);
    }

    @Override
    public Optional<PublishReceipt> findPublishReceipt(String txId) {
        Response.TransactionInfo info = call("getTransactionInfoById", w -> {
            try {
                return w.getTransactionInfoById(txId);
            } catch (IllegalException notFound) {
                log.debug("TransactionInfo not found for {}: {}", txId, notFound.getMessage());
                return null;
            }
        });
        if (info == null || info.getId().size() == 0) {
            return Optional.empty();
        }
        checkSucceeded("publishRoot", info, txId);
        RootPublishedEvent event = eventReader.findEvent(info).orElse(null);
        return Optional.of(new PublishReceipt(toSubmission(info), event));
    }

    @Override
    public LedgerSimulation simulatePublishRoot(String channel, long epoch, String rootHex, int claimCount) {
        return simulate("publishRoot", RingContractAbi.publishRoot(channel, epoch, rootHex, claimCount));
    }

    @Override
    public boolean isClaimed(String channel, long epoch, int index) {
        List<Type> out = constantCall("isClaimed", RingContractAbi.isClaimed(channel, epoch, index), NodeType.SOLIDITY_NODE);
        return ((Bool) out.get(0)).getValue();
    }

    @Override
    public PositionState readPosition(String channel) {
        List<Type> out = constantCall("positionOf", RingContractAbi.positionOf(channel), NodeType.SOLIDITY_NODE);
        return new PositionState(
                ((Bool) out.get(0)).getValue(),
                ((Uint256) out.get(1)).getValue(),
                ((Uint256) out.get(2)).getValue(),
                ((Bool) out.get(3)).getValue(),
                ((Uint64) out.get(4)).getValue().longValueExact());
    }

    @Override
    public LedgerSubmission compound(String channel) {
        return toSubmission(submit("compound", RingContractAbi.compound(channel)));
    }

    @Override
    public LedgerSimulation simulateCompound(String channel) {
        return simulate("compound", RingContractAbi.compound(channel));
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
        if (pool != null) {
            for (EndpointPool.Member<ApiWrapper> m : pool.members()) {
                m.getClient().close();
            }
        }
    }

    @SuppressWarnings("rawtypes")
    private List<Type> constantCall(String operation, Function fn, NodeType nodeType) {
        String encodedHex = FunctionEncoder.encode(fn);
        Response.TransactionExtention txn = call(operation, w -> w.triggerConstantContract(
                publisherAddress, contractAddress, encodedHex, nodeType));

        if (!txn.getResult().getResult() || txn.getConstantResultCount() == 0) {
            throw new PolicyException(DistributorErrorCode.LEDGER_REJECTED,
                    operation + " query failed: " + txn.getResult().getMessage().toStringUtf8());
        }
        String resultHex = Numeric.toHexString(txn.getConstantResult(0).toByteArray());
        List<Type> decoded = FunctionReturnDecoder.decode(resultHex, fn.getOutputParameters());
        if (decoded.size() != fn.getOutputParameters().size()) {
            throw new PolicyException(DistributorErrorCode.LEDGER_REJECTED,
                    "Unexpected " + operation + " outputs=" + decoded.size());
        }
        return decoded;
    }

    private LedgerSimulation simulate(String operation, Function fn) {
        String encodedHex = FunctionEncoder.encode(fn);
        Response.TransactionExtention txn = call(operation + " (simulate)", w -> w.triggerConstantContract(
                publisherAddress, contractAddress, encodedHex, NodeType.FULL_NODE));
        if (!txn.getResult().getResult()) {
            return LedgerSimulation.failed(txn.getResult().getMessage().toStringUtf8());
        }
        return LedgerSimulation.ok(txn.getEnergyUsed());
    }

    private Response.TransactionInfo submit(String operation, Function fn) {
        String encodedHex = FunctionEncoder.encode(fn);

        Response.TransactionExtention txnExt = call(operation, w -> w.triggerContract(
                publisherAddress, contractAddress, encodedHex, 0L, 0L, null, feeLimit));
        if (!txnExt.getResult().getResult()) {
            throw new PolicyException(DistributorErrorCode.LEDGER_REJECTED,
                    operation + " trigger failed: " + txnExt.getResult().getMessage().toStringUtf8());
        }

        // The id covers raw_data only, so it is known before signing and broadcasting
        String txId = Numeric.toHexStringNoPrefix(txnExt.getTxid().toByteArray());
        try {
            call(operation + " (broadcast)", w -> {
                synchronized (broadcastLock) {
                    Chain.Transaction signed = w.signTransaction(txnExt);
                    return w.broadcastTransaction(signed);
                }
            });
        } catch (TransientLedgerException e) {
            throw new UnconfirmedSubmissionException(e.getErrorCode(),
                    operation + " broadcast outcome unknown: " + e.getMessage(), txId, e);
        }
        log.info("{} broadcast: txId={}", operation, txId);

        Response.TransactionInfo info = waitForTxInfo(txId);
        if (info == null) {
            throw new UnconfirmedSubmissionException(DistributorErrorCode.LEDGER_TIMEOUT,
                    operation + ": no TransactionInfo after " + polling.getTxInfoTimeoutSeconds() + "s. txId=" + txId,
                    txId);
        }
        checkSucceeded(operation, info, txId);
        return info;
    }

    private static void checkSucceeded(String operation, Response.TransactionInfo info, String txId) {
        if (info.getResult() != Response.TransactionInfo.code.SUCESS) {
            String errorMsg = info.getResMessage() != null ? info.getResMessage().toStringUtf8() : "Unknown error";
            throw new PolicyException(DistributorErrorCode.LEDGER_REJECTED,
                    operation + " failed on-chain: " + errorMsg + ". txId=" + txId);
        }
    }

    private Response.TransactionInfo waitForTxInfo(String txId) {
        long deadline = clock.millis() + Duration.ofSeconds(polling.getTxInfoTimeoutSeconds()).toMillis();
        long sleepMs = Math.max(100, polling.getTxInfoPollInitialMs());
        long maxSleepMs = Math.max(sleepMs, polling.getTxInfoPollMaxMs());
        while (clock.millis() < deadline) {
            try {
                Response.TransactionInfo info = call("getTransactionInfoById", w -> w.getTransactionInfoById(txId));
                if (info != null && info.getId().size() > 0) return info;
            } catch (TransientLedgerException | PolicyException e) {
                log.debug("TransactionInfo not available yet for {}: {}", txId, e.getMessage());
            }
            try {
                long jitter = ThreadLocalRandom.current().nextLong(0, 150);
                Thread.sleep(sleepMs + jitter);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return null;
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
        return null;
    }

    private PublishReceipt toPublishReceipt(Response.TransactionInfo info, String channel, long epoch, String rootHex) {
        RootPublishedEvent event = eventReader.findEvent(info).orElse(null);
        if (event == null) {
            log.warn("publishRoot receipt had no RootPublished event: channel={}, epoch={}", channel, epoch);
        } else if (!event.rootHex().equalsIgnoreCase(rootHex) || event.epoch() != epoch) {
            log.warn("RootPublished mismatch: expected epoch={} root={}, got epoch={} root={}",
                    epoch, rootHex, event.epoch(), event.rootHex());
        }
        return new PublishReceipt(toSubmission(info), event);
    }

    private static LedgerSubmission toSubmission(Response.TransactionInfo info) {
        return new LedgerSubmission(
                Numeric.toHexStringNoPrefix(info.getId().toByteArray()),
                info.getBlockNumber(),
                info.getReceipt().getEnergyUsageTotal());
    }

    /**
     * Runs one RPC on the next endpoint with a hard timeout. Network failures cool the endpoint
     * down and surface as {@link TransientLedgerException}.
     */
    private <R> R call(String operation, LedgerCall<R> body) {
        if (pool == null) {
            throw new IllegalStateException("ledger client is not configured (publisher key missing)");
        }
        EndpointPool.Member<ApiWrapper> endpoint = pool.next();
        Future<R> future = callExecutor.submit(() -> body.apply(endpoint.getClient()));
        try {
            return future.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            pool.reportFailure(endpoint, e);
            throw new TransientLedgerException(DistributorErrorCode.LEDGER_TIMEOUT,
                    operation + " timed out after " + callTimeoutMs + "ms on " + endpoint.getName(), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientLedgerException(DistributorErrorCode.LEDGER_UNAVAILABLE,
                    operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DistributorException de) {
                throw de;
            }
            pool.reportFailure(endpoint, cause);
            throw new TransientLedgerException(DistributorErrorCode.LEDGER_UNAVAILABLE,
                    operation + " failed on " + endpoint.getName() + ": " + cause.getMessage(), cause);
        }
    }
}
