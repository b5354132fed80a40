package io.crimeradar.pipeline.api.dto;

import java.time.Instant;

public record CandidateItem(
        String link,
        String title,
        Instant publishedAt
) {}
