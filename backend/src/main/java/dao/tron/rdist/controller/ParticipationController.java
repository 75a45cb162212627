package dao.tron.rdist.controller;

import dao.tron.rdist.ingest.IngestionOutcome;
import dao.tron.rdist.ingest.IngestionService;
import dao.tron.rdist.model.ParticipationEvent;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/participation")
public class ParticipationController {

    private final IngestionService ingestionService;

    public ParticipationController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@RequestBody ParticipationEvent event) {
        IngestionOutcome outcome = ingestionService.accept(event);
        return ResponseEntity.accepted().body(Map.of("outcome", outcome));
    }
}
