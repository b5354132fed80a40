package io.crimeradar.pipeline.config;

import java.time.Duration;
import java.time.Instant;

public record ProcessingConfig(
        Duration scheduleInterval,
        Duration initialDelay,
        boolean enableScheduling,
        double relevanceThreshold,
        Instant since,
        int maxItems,
        Duration itemDelay
) {
    public long getScheduleIntervalMs() {
        return scheduleInterval.toMillis();
    }

    public long getInitialDelayMs() {
        return initialDelay.toMillis();
    }
}
