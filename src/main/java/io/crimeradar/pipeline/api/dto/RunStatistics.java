package io.crimeradar.pipeline.api.dto;

import java.time.Instant;
import java.util.Map;

public record RunStatistics(
        String runId,
        int itemsProcessed,
        int itemsSaved,
        int aggregatedPoints,
        String renderingArtifact,
        Map<ItemOutcome, Integer> outcomes,
        long durationMs,
        Instant completedAt
) {
    public int countOf(ItemOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }
}
