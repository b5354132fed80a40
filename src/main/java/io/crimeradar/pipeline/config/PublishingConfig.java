package io.crimeradar.pipeline.config;

public record PublishingConfig(
        boolean enabled
) {}
