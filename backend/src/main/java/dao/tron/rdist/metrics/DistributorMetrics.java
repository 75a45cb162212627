package dao.tron.rdist.metrics;

import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.keeper.TickReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Keeper and alert meters, exported through Micrometer (Prometheus at {@code /actuator/prometheus}).
 */
@Component
public class DistributorMetrics {

    public static final String PREFIX = "rdist.";

    public static final String METRIC_TICKS = PREFIX + "keeper.ticks";
    public static final String METRIC_RETRIES = PREFIX + "keeper.retries";
    public static final String METRIC_LAST_SUCCESS = PREFIX + "keeper.last.success.seconds";
    public static final String METRIC_SEALED = PREFIX + "epochs.sealed";
    public static final String METRIC_REJECTED = PREFIX + "epochs.rejected";
    public static final String METRIC_PUBLISHED = PREFIX + "epochs.published";
    public static final String METRIC_LAST_SEALED_EPOCH = PREFIX + "epochs.last.sealed";
    public static final String METRIC_LAST_SEALED_AT = PREFIX + "epochs.last.sealed.seconds";
    public static final String METRIC_ALERTS = PREFIX + "alerts";
    public static final String METRIC_SLOTS_NEAR_EVICTION = PREFIX + "ring.slots.near.eviction";

    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_CHANNEL = "channel";
    public static final String TAG_CODE = "code";

    private final MeterRegistry registry;

    private final Counter ticksSucceeded;
    private final Counter ticksFailed;
    private final Counter retries;
    private final Counter sealed;
    private final Counter rejected;
    private final Counter published;
    private final Counter adopted;
    private final Counter skippedEmpty;
    private final Counter simulated;

    private final AtomicLong lastSuccessAt = new AtomicLong(-1);
    private final AtomicLong lastSealedAt = new AtomicLong(-1);
    private final Map<String, AtomicLong> lastSealedEpoch = new ConcurrentHashMap<>();

    public DistributorMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.ticksSucceeded = registry.counter(METRIC_TICKS, TAG_OUTCOME, "success");
        this.ticksFailed = registry.counter(METRIC_TICKS, TAG_OUTCOME, "failure");
        this.retries = registry.counter(METRIC_RETRIES);
        this.sealed = registry.counter(METRIC_SEALED);
        this.rejected = registry.counter(METRIC_REJECTED);
        this.published = registry.counter(METRIC_PUBLISHED, TAG_OUTCOME, "published");
        this.adopted = registry.counter(METRIC_PUBLISHED, TAG_OUTCOME, "adopted");
        this.skippedEmpty = registry.counter(METRIC_PUBLISHED, TAG_OUTCOME, "skipped_empty");
        this.simulated = registry.counter(METRIC_PUBLISHED, TAG_OUTCOME, "simulated");
        registry.gauge(METRIC_LAST_SUCCESS, Tags.empty(), lastSuccessAt);
        registry.gauge(METRIC_LAST_SEALED_AT, Tags.empty(), lastSealedAt);
    }

    public void tickFinished(TickReport report) {
        (report.isSuccess() ? ticksSucceeded : ticksFailed).increment();
        retries.increment(report.getRetries());
        rejected.increment(report.getRejected());
        published.increment(report.getPublished());
        adopted.increment(report.getAdopted());
        skippedEmpty.increment(report.getSkippedEmpty());
        simulated.increment(report.getSimulated());
        if (report.isSuccess()) {
            lastSuccessAt.set(report.getFinishedAt());
        }
    }

    public void epochSealed(String channel, long epoch, long sealedAt) {
        sealed.increment();
        lastSealedAt.set(sealedAt);
        lastSealedEpoch
                .computeIfAbsent(channel, c -> registry.gauge(METRIC_LAST_SEALED_EPOCH, Tags.of(TAG_CHANNEL, c), new AtomicLong(-1)))
                .accumulateAndGet(epoch, Math::max);
    }

    public void alertRaised(DistributorErrorCode code) {
        registry.counter(METRIC_ALERTS, TAG_CODE, code.name()).increment();
    }

    /**
     * Alerts raised so far, across all codes.
     */
    public long alertCount() {
        return (long) registry.find(METRIC_ALERTS).counters().stream().mapToDouble(Counter::count).sum();
    }

    public void bindSlotsNearEviction(Supplier<Number> slotsNearEviction) {
        Gauge.builder(METRIC_SLOTS_NEAR_EVICTION, slotsNearEviction).register(registry);
    }
}
