package dao.tron.rdist.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "ledger")
@Data
public class LedgerProperties {

    /**
     * gRPC endpoints of TRON full nodes. Calls are load-balanced across them.
     * When empty the public Nile endpoints are used.
     */
    private List<Endpoint> endpoints = new ArrayList<>();

    /**
     * Reward ring contract address (base58 format)
     */
    private String contractAddress;

    /**
     * Publisher private key (hex format, 64 characters)
     */
    private String privateKey;

    /**
     * Upper bound for any single ledger call.
     */
    private long callTimeoutMs = 10_000;

    /**
     * How long a failing endpoint is skipped.
     */
    private long endpointCooldownMs = 60_000;

    /**
     * Fee limit (sun) attached to publish, claim and compound transactions.
     */
    private long feeLimit = 100_000_000L;

    /**
     * Transaction polling settings (to reduce RPC load).
     */
    private Polling polling = new Polling();

    @Data
    public static class Endpoint {
        /**
         * Full node, e.g. grpc.nile.trongrid.io:50051
         */
        private String grpc;
        /**
         * Solidity node, e.g. grpc.nile.trongrid.io:50061
         */
        private String solidityGrpc;
    }

    @Data
    public static class Polling {
        /**
         * Timeout for getting TransactionInfo after broadcasting a tx.
         */
        private long txInfoTimeoutSeconds = 60;
        /**
         * Initial poll interval for TransactionInfo.
         */
        private long txInfoPollInitialMs = 250;
        /**
         * Maximum poll interval for TransactionInfo (backoff cap).
         */
        private long txInfoPollMaxMs = 2000;
        /**
         * How long an unconfirmed publish is looked up before it counts as dropped and is sent
         * again. Must exceed the transaction expiration window.
         */
        private long pendingTxExpirySeconds = 120;
    }
}
