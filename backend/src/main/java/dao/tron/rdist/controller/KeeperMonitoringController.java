package dao.tron.rdist.controller;

import dao.tron.rdist.config.KeeperProperties;
import dao.tron.rdist.ingest.IngestionService;
import dao.tron.rdist.keeper.KeeperHealth;
import dao.tron.rdist.keeper.KeeperHealthService;
import dao.tron.rdist.keeper.TickHistory;
import dao.tron.rdist.keeper.TickReport;
import dao.tron.rdist.model.RejectedEpoch;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.repository.SealedEpochRepository;
import dao.tron.rdist.ring.RingLedgerMirror;
import dao.tron.rdist.ring.SlotView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Monitoring endpoints for the keeper, sealed epochs and the ring mirror.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
public class KeeperMonitoringController {

    private final KeeperHealthService healthService;
    private final TickHistory tickHistory;
    private final SealedEpochRepository sealedRepository;
    private final RingLedgerMirror mirror;
    private final IngestionService ingestionService;
    private final KeeperProperties keeperProps;

    public KeeperMonitoringController(KeeperHealthService healthService,
                                      TickHistory tickHistory,
                                      SealedEpochRepository sealedRepository,
                                      RingLedgerMirror mirror,
                                      IngestionService ingestionService,
                                      KeeperProperties keeperProps) {
        this.healthService = healthService;
        this.tickHistory = tickHistory;
        this.sealedRepository = sealedRepository;
        this.mirror = mirror;
        this.ingestionService = ingestionService;
        this.keeperProps = keeperProps;
    }

    /**
     * GET /api/monitor/health
     * Time since the last successful tick and ring slots close to eviction. 503 when stale.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> getHealth() {
        KeeperHealth health = healthService.health();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", health.healthy() ? "UP" : "STALE");
        response.put("keeperState", health.state());
        response.put("secondsSinceLastSuccess", health.secondsSinceLastSuccess());
        response.put("staleAfterSeconds", keeperProps.getHealthStaleAfterSeconds());
        response.put("dryRun", keeperProps.isDryRun());
        response.put("slotsAtRisk", health.slotsAtRisk());
        response.put("evictionRisks", health.evictionRisks());
        response.put("alerts", Map.of(
                "count", health.alertCount(),
                "last", health.lastAlert() != null ? health.lastAlert() : "none"
        ));
        response.put("ingestion", Map.of(
                "dropped", ingestionService.getDroppedCount(),
                "flagged", ingestionService.getFlagged().size()
        ));

        return health.healthy() ? ResponseEntity.ok(response) : ResponseEntity.status(503).body(response);
    }

    /**
     * GET /api/monitor/ticks
     * Recent tick reports, newest first.
     */
    @GetMapping("/ticks")
    public ResponseEntity<Map<String, Object>> getTicks() {
        List<TickReport> reports = tickHistory.recent();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("totalTicks", reports.size());
        response.put("ticks", reports);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/epochs?channel=...
     */
    @GetMapping("/epochs")
    public ResponseEntity<Map<String, Object>> getEpochs(@RequestParam(required = false) String channel) {
        Map<String, Object> response = new LinkedHashMap<>();

        List<Map<String, Object>> epochs = new ArrayList<>();
        int published = 0;
        for (SealedEpoch e : sealedRepository.findAll()) {
            if (channel != null && !channel.equals(e.getChannel())) continue;
            epochs.add(buildEpochInfo(e));
            if (e.isPublished()) published++;
        }

        List<RejectedEpoch> rejected = new ArrayList<>();
        for (RejectedEpoch r : sealedRepository.findAllRejected()) {
            if (channel == null || channel.equals(r.channel())) rejected.add(r);
        }

        response.put("status", "SUCCESS");
        response.put("totalEpochs", epochs.size());
        response.put("epochs", epochs);
        response.put("rejected", rejected);
        response.put("statistics", Map.of(
                "sealed", epochs.size(),
                "published", published,
                "unpublished", epochs.size() - published
        ));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/ring/{channel}
     */
    @GetMapping("/ring/{channel}")
    public ResponseEntity<Map<String, Object>> getRing(@PathVariable String channel) {
        List<SlotView> slots = mirror.slots(channel);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("channel", channel);
        response.put("slotCount", mirror.getSlotCount());
        response.put("maxClaims", mirror.getMaxClaims());
        response.put("occupied", slots.size());
        response.put("slots", slots);
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> buildEpochInfo(SealedEpoch e) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("epoch", e.getEpoch());
        info.put("channel", e.getChannel());
        info.put("root", e.getRootHex());
        info.put("participantCount", e.getParticipantCount());
        info.put("sealedAt", e.getSealedAt());
        info.put("sealedAtReadable", new Date(e.getSealedAt() * 1000).toString());
        info.put("published", e.isPublished());
        info.put("publishTxId", e.getPublishTxId());
        info.put("publishedAt", e.getPublishedAt());
        info.put("ringStatus", mirror.statusOf(e.getChannel(), e.getEpoch()));
        return info;
    }
}
