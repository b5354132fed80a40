package io.crimeradar.pipeline.config;

import java.time.Duration;

public record GeocodingConfig(
        String baseUrl,
        String userAgent,
        Duration timeout,
        String rateLimiterName
) {}
