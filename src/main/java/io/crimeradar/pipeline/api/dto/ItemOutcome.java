package io.crimeradar.pipeline.api.dto;

/**
 * Terminal state of a candidate item within one run.
 */
public enum ItemOutcome {
    SAVED,
    REJECTED_LOW_SCORE,
    DUPLICATE_REJECTED,
    PLACE_UNRESOLVED,
    FAILED
}
