package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.ItemOutcome;
import io.crimeradar.pipeline.config.DedupConfig;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * State owned by a single pipeline run: the near-duplicate index and the
 * outcome tally. Created when a run starts and dropped when it ends.
 */
public class RunContext {

    private final String runId;
    private final Instant startedAt;
    private final NearDuplicateIndex duplicateIndex;
    private final Map<ItemOutcome, Integer> outcomes = new EnumMap<>(ItemOutcome.class);
    private int itemsProcessed;

    RunContext(String runId, Instant startedAt, NearDuplicateIndex duplicateIndex) {
        this.runId = runId;
        this.startedAt = startedAt;
        this.duplicateIndex = duplicateIndex;
    }

    public static RunContext start(DedupConfig dedup, Instant startedAt) {
        return new RunContext(
                "RUN-" + UUID.randomUUID().toString().substring(0, 8),
                startedAt,
                new NearDuplicateIndex(dedup.threshold(), dedup.numPermutations())
        );
    }

    public void record(ItemOutcome outcome) {
        itemsProcessed++;
        outcomes.merge(outcome, 1, Integer::sum);
    }

    public String runId() {
        return runId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public NearDuplicateIndex duplicateIndex() {
        return duplicateIndex;
    }

    public int itemsProcessed() {
        return itemsProcessed;
    }

    public int count(ItemOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public Map<ItemOutcome, Integer> outcomes() {
        return Collections.unmodifiableMap(new EnumMap<>(outcomes));
    }
}
