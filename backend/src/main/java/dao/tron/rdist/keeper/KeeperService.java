package dao.tron.rdist.keeper;

import dao.tron.rdist.config.KeeperProperties;
import dao.tron.rdist.exception.DistributorException;
import dao.tron.rdist.exception.ErrorClass;
import dao.tron.rdist.exception.IntegrityException;
import dao.tron.rdist.exception.RetriesExhaustedException;
import dao.tron.rdist.metrics.DistributorMetrics;
import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.repository.ParticipationStore;
import dao.tron.rdist.repository.SealedEpochRepository;
import dao.tron.rdist.service.AlertService;
import dao.tron.rdist.service.EpochSealer;
import dao.tron.rdist.service.MaintenanceResult;
import dao.tron.rdist.service.MaintenanceService;
import dao.tron.rdist.service.PublishResult;
import dao.tron.rdist.service.PublisherService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * One keeper tick: for every channel, seal closed epochs, publish sealed roots, then run
 * maintenance. The keeper is the only writer of sealed state.
 * <p>
 * Failure handling per tick:
 * - transient ledger errors are retried with backoff inside the tick
 * - exhausted retries end the tick; the scheduler waits the full interval
 * - integrity and policy errors are reported for their channel and the other channels continue
 */
@Slf4j
@Service
public class KeeperService {

    private final EpochSealer sealer;
    private final PublisherService publisher;
    private final MaintenanceService maintenance;
    private final ParticipationStore participationStore;
    private final SealedEpochRepository sealedRepository;
    private final ChannelLock channelLock;
    private final TickHistory history;
    private final AlertService alertService;
    private final DistributorMetrics metrics;
    private final KeeperProperties props;
    private final RetryExecutor retryExecutor;
    private final Clock clock;

    private final AtomicLong tickSeq = new AtomicLong();
    private volatile KeeperStatus status = KeeperStatus.IDLE;

    @Autowired
    public KeeperService(EpochSealer sealer,
                         PublisherService publisher,
                         MaintenanceService maintenance,
                         ParticipationStore participationStore,
                         SealedEpochRepository sealedRepository,
                         ChannelLock channelLock,
                         TickHistory history,
                         AlertService alertService,
                         DistributorMetrics metrics,
                         KeeperProperties props,
                         Clock clock) {
        this(sealer, publisher, maintenance, participationStore, sealedRepository, channelLock, history,
                alertService, metrics, props, new RetryExecutor(RetryPolicy.from(props), Sleeper.THREAD), clock);
    }

    KeeperService(EpochSealer sealer,
                  PublisherService publisher,
                  MaintenanceService maintenance,
                  ParticipationStore participationStore,
                  SealedEpochRepository sealedRepository,
                  ChannelLock channelLock,
                  TickHistory history,
                  AlertService alertService,
                  DistributorMetrics metrics,
                  KeeperProperties props,
                  RetryExecutor retryExecutor,
                  Clock clock) {
        this.sealer = sealer;
        this.publisher = publisher;
        this.maintenance = maintenance;
        this.participationStore = participationStore;
        this.sealedRepository = sealedRepository;
        this.channelLock = channelLock;
        this.history = history;
        this.alertService = alertService;
        this.metrics = metrics;
        this.props = props;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    public TickReport runTick() {
        TickReport report = new TickReport();
        report.setTickId(tickSeq.incrementAndGet());
        report.setStartedAt(now());
        report.setDryRun(props.isDryRun());

        try {
            for (String channel : resolveChannels()) {
                report.getChannels().add(channel);
                Optional<ChannelLock.Lease> lease = channelLock.tryAcquire(channel, props.getInstanceId());
                if (lease.isEmpty()) {
                    log.warn("Skipping channel {}: another keeper pass holds its lock", channel);
                    continue;
                }
                try (ChannelLock.Lease ignored = lease.get()) {
                    processChannel(channel, report);
                }
            }
            report.setSuccess(report.getErrors().isEmpty());
        } catch (RetriesExhaustedException e) {
            report.setRetriesExhausted(true);
            report.addError("*", e.getErrorCode().name(), e.getMessage());
            log.error("Tick {} ended early: {}. Next attempt after the full interval.", report.getTickId(), e.getMessage());
        } finally {
            status = KeeperStatus.IDLE;
            report.setFinishedAt(now());
            history.record(report);
            metrics.tickFinished(report);
            log.info(report.toLogLine());
        }
        return report;
    }

    public KeeperStatus getStatus() {
        return status;
    }

    private void processChannel(String channel, TickReport report) {
        boolean dryRun = props.isDryRun();
        transition(KeeperEvent.START);
        try {
            seal(channel, report);
            transition(KeeperEvent.PHASE_COMPLETE);

            publish(channel, report, dryRun);
            transition(KeeperEvent.PHASE_COMPLETE);

            maintain(channel, report, dryRun);
            transition(KeeperEvent.PHASE_COMPLETE);
        } catch (RetriesExhaustedException e) {
            transition(KeeperEvent.TRANSIENT_FAILURE);
            transition(KeeperEvent.GIVE_UP);
            throw e;
        } catch (IntegrityException e) {
            transition(KeeperEvent.ABORT);
            alertService.raise("keeper channel " + channel, e);
            report.addError(channel, e.getErrorCode().name(), e.getMessage());
        } catch (DistributorException e) {
            transition(KeeperEvent.ABORT);
            log.error("Channel {} pass stopped: [{}] {}", channel, e.getErrorCode(), e.getMessage());
            report.addError(channel, e.getErrorCode().name(), e.getMessage());
        } catch (RuntimeException e) {
            transition(KeeperEvent.ABORT);
            log.error("Channel {} pass failed", channel, e);
            report.addError(channel, e.getClass().getSimpleName(), e.getMessage());
        }
    }

    private void seal(String channel, TickReport report) {
        boolean includeLatest = props.getChannels().contains(channel);
        for (long epoch : sealer.findDueEpochs(channel, includeLatest)) {
            try {
                SealedEpoch sealed = sealer.sealEpoch(epoch, channel);
                report.setSealed(report.getSealed() + 1);
                metrics.epochSealed(channel, epoch, sealed.getSealedAt());
            } catch (DistributorException e) {
                if (e.getErrorClass() == ErrorClass.INTEGRITY) throw e;
                // Policy rejections are recorded by the sealer and drop out of the due list
                log.error("Sealing {}#{} rejected: [{}] {}", channel, epoch, e.getErrorCode(), e.getMessage());
                report.setRejected(report.getRejected() + 1);
                report.addError(channel, e.getErrorCode().name(), e.getMessage());
            }
        }
    }

    private void publish(String channel, TickReport report, boolean dryRun) {
        if (!dryRun) {
            publisher.restoreMirror(channel);
        }
        for (SealedEpoch sealed : sealedRepository.findUnpublished(channel)) {
            EpochKey key = sealed.key();
            PublishResult result = withRetry("publish " + key, report, () -> publisher.publish(key, dryRun));
            switch (result.outcome()) {
                case PUBLISHED -> report.setPublished(report.getPublished() + 1);
                case ADOPTED -> report.setAdopted(report.getAdopted() + 1);
                case SKIPPED_EMPTY -> report.setSkippedEmpty(report.getSkippedEmpty() + 1);
                case SIMULATED -> report.setSimulated(report.getSimulated() + 1);
                case SIMULATION_FAILED -> report.addError(channel, "SIMULATION_FAILED", key + ": " + result.message());
                case ALREADY_PUBLISHED -> { }
            }
        }
    }

    private void maintain(String channel, TickReport report, boolean dryRun) {
        KeeperProperties.Maintenance m = props.getMaintenance();
        if (m.isCompoundEnabled()) {
            MaintenanceResult r = withRetry("compound " + channel, report, () -> maintenance.compound(channel, dryRun));
            if ("DONE".equals(r.outcome()) || "SIMULATED".equals(r.outcome())) {
                report.setCompounded(report.getCompounded() + r.count());
            } else if ("FAILED".equals(r.outcome())) {
                report.addError(channel, "COMPOUND_FAILED", r.detail());
            }
        }
        if (m.isReconcileClaims()) {
            MaintenanceResult r = withRetry("reconcile " + channel, report, () -> maintenance.reconcileClaims(channel, dryRun));
            report.setReconciled(report.getReconciled() + r.count());
        }
    }

    private <T> T withRetry(String operation, TickReport report, Supplier<T> action) {
        return retryExecutor.execute(operation, action, new RetryListener() {
            @Override
            public void onRetry(String op, int failedAttempts, long delayMs, Throwable cause) {
                report.setRetries(report.getRetries() + 1);
                transition(KeeperEvent.TRANSIENT_FAILURE);
            }

            @Override
            public void afterBackoff(String op, int failedAttempts) {
                transition(KeeperEvent.RETRY);
            }
        });
    }

    /**
     * Configured channels, channels seen in participation data, and channels with sealed epochs.
     */
    List<String> resolveChannels() {
        TreeSet<String> channels = new TreeSet<>(props.getChannels());
        channels.addAll(participationStore.findChannels());
        for (SealedEpoch e : sealedRepository.findAll()) {
            channels.add(e.getChannel());
        }
        return new ArrayList<>(channels);
    }

    private void transition(KeeperEvent event) {
        status = status.next(event);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
