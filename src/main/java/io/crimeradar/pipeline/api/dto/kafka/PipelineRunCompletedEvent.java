package io.crimeradar.pipeline.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.crimeradar.pipeline.api.dto.ItemOutcome;
import io.crimeradar.pipeline.api.dto.RunStatistics;

import java.time.Instant;
import java.util.Map;

public record PipelineRunCompletedEvent(
        @JsonProperty("runId") String runId,
        @JsonProperty("itemsProcessed") int itemsProcessed,
        @JsonProperty("itemsSaved") int itemsSaved,
        @JsonProperty("aggregatedPoints") int aggregatedPoints,
        @JsonProperty("outcomes") Map<ItemOutcome, Integer> outcomes,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("completedAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant completedAt
) {
    public static PipelineRunCompletedEvent create(RunStatistics statistics) {
        return new PipelineRunCompletedEvent(
                statistics.runId(),
                statistics.itemsProcessed(),
                statistics.itemsSaved(),
                statistics.aggregatedPoints(),
                statistics.outcomes(),
                statistics.durationMs(),
                statistics.completedAt()
        );
    }
}
