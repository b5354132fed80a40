package io.crimeradar.pipeline.api.dto;

public record AggregatedPoint(
        double latBucket,
        double lonBucket,
        long count
) {}
