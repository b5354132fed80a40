package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.RunStatistics;
import io.crimeradar.pipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class ScheduledPipelineService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledPipelineService.class);

    private final PipelineOrchestrator orchestrator;
    private final PipelineConfig pipelineConfig;

    public ScheduledPipelineService(PipelineOrchestrator orchestrator, PipelineConfig pipelineConfig) {
        this.orchestrator = orchestrator;
        this.pipelineConfig = pipelineConfig;
    }

    @Scheduled(
            fixedDelayString = "#{@pipelineProps.scheduleIntervalMs}",
            initialDelayString = "#{@pipelineProps.initialDelayMs}"
    )
    public void runScheduled() {
        if (!pipelineConfig.processing().enableScheduling()) {
            logger.debug("Scheduled runs disabled");
            return;
        }

        logger.info("Starting scheduled run for {} enabled sources", pipelineConfig.getEnabledSources().size());

        try {
            RunStatistics statistics = orchestrator.run(orchestrator.defaultRequest());
            logger.info("Scheduled run {} saved {} of {} items",
                    statistics.runId(), statistics.itemsSaved(), statistics.itemsProcessed());
        } catch (Exception e) {
            logger.error("Scheduled run failed: {}", e.getMessage(), e);
        }
    }
}
