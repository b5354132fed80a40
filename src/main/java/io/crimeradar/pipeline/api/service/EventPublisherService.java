package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.CrimeEvent;
import io.crimeradar.pipeline.api.dto.RunStatistics;
import io.crimeradar.pipeline.api.dto.kafka.CrimeEventSavedEvent;
import io.crimeradar.pipeline.api.dto.kafka.PipelineRunCompletedEvent;
import io.crimeradar.pipeline.config.KafkaProperties;
import io.crimeradar.pipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Announces saved events and finished runs on Kafka. Publishing is best
 * effort: failures are logged and never reach the pipeline.
 */
@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties kafkaProperties;
    private final boolean enabled;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate,
                                 KafkaProperties kafkaProperties,
                                 PipelineConfig pipelineConfig) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaProperties = kafkaProperties;
        this.enabled = pipelineConfig.publishing().enabled();
    }

    public void publishEventSaved(CrimeEvent event, Set<String> crimeKeywords) {
        if (!enabled) return;

        try {
            CrimeEventSavedEvent message = CrimeEventSavedEvent.create(event, crimeKeywords);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(kafkaProperties.eventSaved(), event.link(), message);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Sent event saved message: {} to partition: {}",
                            event.link(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send event saved message: {}", event.link(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing event saved message for link: {}", event.link(), e);
        }
    }

    public void publishRunCompleted(RunStatistics statistics) {
        if (!enabled) return;

        try {
            PipelineRunCompletedEvent message = PipelineRunCompletedEvent.create(statistics);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(kafkaProperties.runCompleted(), statistics.runId(), message);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent run completed message: {} ({} of {} items saved)",
                            statistics.runId(), statistics.itemsSaved(), statistics.itemsProcessed());
                } else {
                    logger.error("Failed to send run completed message: {}", statistics.runId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing run completed message for run: {}", statistics.runId(), e);
        }
    }
}
