package io.crimeradar.pipeline.api.dto;

import java.util.Objects;

/**
 * Outcome of one pipeline stage: either a value to hand to the next stage or
 * the terminal {@link ItemOutcome} that ends the item.
 */
public record StageResult<T>(T value, ItemOutcome outcome, String reason) {

    public static <T> StageResult<T> next(T value) {
        return new StageResult<>(Objects.requireNonNull(value), null, null);
    }

    public static <T> StageResult<T> stop(ItemOutcome outcome, String reason) {
        return new StageResult<>(null, Objects.requireNonNull(outcome), reason);
    }

    public boolean isStopped() {
        return outcome != null;
    }
}
