package dao.tron.rdist.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "keeper")
public class KeeperProperties {

    /**
     * Enable/disable the scheduled keeper tick
     * Default: true
     */
    private boolean enabled = true;

    /**
     * Delay between the end of one tick and the start of the next (in milliseconds).
     * A tick that exhausts its retries waits this full interval before the next attempt.
     * Default: 60000ms
     */
    @Min(1000)
    private long intervalMs = 60_000;

    /**
     * Simulate every ledger mutation instead of broadcasting it.
     */
    private boolean dryRun = false;

    /**
     * Attempts per ledger operation within one tick (first try included).
     */
    @Min(1)
    private int maxRetries = 3;

    /**
     * First backoff delay; doubles on every further attempt.
     */
    @Min(0)
    private long retryBaseMs = 2000;

    /**
     * Backoff cap.
     */
    @Min(0)
    private long retryMaxMs = 60_000;

    /**
     * Channels sealed every tick even when nobody participated in the latest closed epoch.
     */
    private List<String> channels = new ArrayList<>();

    /**
     * Publish zero-participant epochs to the ledger. When false they are marked published locally
     * without consuming a ring slot.
     */
    private boolean publishEmptyEpochs = false;

    /**
     * Owner token used for the per-channel keeper lock.
     */
    private String instanceId = "keeper-1";

    /**
     * The keeper is reported unhealthy when no tick succeeded for this long.
     */
    private long healthStaleAfterSeconds = 900;

    /**
     * Number of tick reports kept for the monitoring endpoint.
     */
    private int historySize = 50;

    private Maintenance maintenance = new Maintenance();

    @Data
    public static class Maintenance {
        /**
         * Compound the channel's staking position once it matured on-ledger.
         */
        private boolean compoundEnabled = true;

        /**
         * Confirm pending claims whose claimed bit is already set on-ledger.
         */
        private boolean reconcileClaims = true;
    }
}
