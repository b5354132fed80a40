package io.crimeradar.pipeline.config;

import java.math.RoundingMode;

public record AggregationConfig(
        int scale,
        RoundingMode roundingMode
) {}
