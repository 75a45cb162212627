package dao.tron.rdist.service;

import dao.tron.rdist.exception.DistributorException;
import dao.tron.rdist.metrics.DistributorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Raises operator alerts for integrity failures. Alerts go to the dedicated {@code ALERT} logger
 * so log routing can page on them, and are counted per error code in {@link DistributorMetrics}.
 */
@Service
public class AlertService {

    private static final Logger ALERT = LoggerFactory.getLogger("ALERT");

    private final DistributorMetrics metrics;
    private final Clock clock;
    private final AtomicReference<String> lastAlert = new AtomicReference<>();
    private volatile long lastAlertAt;

    public AlertService(DistributorMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    public void raise(String context, DistributorException e) {
        metrics.alertRaised(e.getErrorCode());
        String message = "[" + e.getErrorCode() + "] " + context + ": " + e.getMessage();
        lastAlert.set(message);
        lastAlertAt = clock.instant().getEpochSecond();
        ALERT.error("INTEGRITY ALERT code={} context={} message={}", e.getErrorCode(), context, e.getMessage());
    }

    public long getAlertCount() {
        return metrics.alertCount();
    }

    public String getLastAlert() {
        return lastAlert.get();
    }

    public long getLastAlertAt() {
        return lastAlertAt;
    }
}
