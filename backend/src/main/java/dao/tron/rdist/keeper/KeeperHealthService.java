package dao.tron.rdist.keeper;

import dao.tron.rdist.config.KeeperProperties;
import dao.tron.rdist.config.RingProperties;
import dao.tron.rdist.metrics.DistributorMetrics;
import dao.tron.rdist.ring.EvictionRisk;
import dao.tron.rdist.ring.RingLedgerMirror;
import dao.tron.rdist.service.AlertService;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.OptionalLong;

@Service
public class KeeperHealthService {

    private final TickHistory history;
    private final KeeperService keeperService;
    private final RingLedgerMirror mirror;
    private final AlertService alertService;
    private final KeeperProperties keeperProps;
    private final int evictionWarningDistance;
    private final Clock clock;

    public KeeperHealthService(TickHistory history,
                               KeeperService keeperService,
                               RingLedgerMirror mirror,
                               AlertService alertService,
                               KeeperProperties keeperProps,
                               RingProperties ringProps,
                               DistributorMetrics metrics,
                               Clock clock) {
        this.history = history;
        this.keeperService = keeperService;
        this.mirror = mirror;
        this.alertService = alertService;
        this.keeperProps = keeperProps;
        this.evictionWarningDistance = ringProps.getEvictionWarningDistance();
        this.clock = clock;
        metrics.bindSlotsNearEviction(() -> mirror.slotsNearEviction(evictionWarningDistance).size());
    }

    public KeeperHealth health() {
        long now = clock.instant().getEpochSecond();
        OptionalLong lastSuccess = history.lastSuccessAt();
        long since = lastSuccess.isPresent() ? now - lastSuccess.getAsLong() : -1;
        boolean healthy = lastSuccess.isPresent() && since <= keeperProps.getHealthStaleAfterSeconds();

        List<EvictionRisk> risks = mirror.slotsNearEviction(evictionWarningDistance);
        return new KeeperHealth(healthy, since, keeperService.getStatus().state(), risks.size(), risks,
                alertService.getAlertCount(), alertService.getLastAlert());
    }
}
