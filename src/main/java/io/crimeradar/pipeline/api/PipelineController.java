package io.crimeradar.pipeline.api;

import io.crimeradar.pipeline.api.dto.AggregatedPoint;
import io.crimeradar.pipeline.api.dto.CrimeEvent;
import io.crimeradar.pipeline.api.dto.RunRequest;
import io.crimeradar.pipeline.api.dto.RunStatistics;
import io.crimeradar.pipeline.api.service.EventStore;
import io.crimeradar.pipeline.api.service.PipelineOrchestrator;
import io.crimeradar.pipeline.api.service.SpatialAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineOrchestrator orchestrator;
    private final SpatialAggregator spatialAggregator;
    private final EventStore eventStore;

    public PipelineController(PipelineOrchestrator orchestrator,
                              SpatialAggregator spatialAggregator,
                              EventStore eventStore) {
        this.orchestrator = orchestrator;
        this.spatialAggregator = spatialAggregator;
        this.eventStore = eventStore;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        try {
            return ResponseEntity.ok(Map.of(
                    "status", "UP",
                    "service", "Crime Radar News Pipeline",
                    "timestamp", Instant.now(),
                    "storedEvents", eventStore.count()
            ));
        } catch (Exception e) {
            logger.warn("Health check failed: {}", e.getMessage());
            return ResponseEntity.status(503).body(Map.of(
                    "status", "DOWN",
                    "service", "Crime Radar News Pipeline",
                    "timestamp", Instant.now()
            ));
        }
    }

    @PostMapping("/runs")
    public ResponseEntity<RunStatistics> triggerDefaultRun() {
        return ResponseEntity.ok(orchestrator.run(null));
    }

    @PostMapping(path = "/runs", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RunStatistics> triggerRun(@RequestBody RunRequest request) {
        return ResponseEntity.ok(orchestrator.run(request));
    }

    @GetMapping("/points")
    public List<AggregatedPoint> getPoints() {
        return spatialAggregator.aggregate();
    }

    @GetMapping("/events")
    public List<CrimeEvent> getEvents() {
        return eventStore.findAll();
    }
}
