package io.crimeradar.pipeline.api.dto;

import java.time.Instant;
import java.util.List;

public record RunRequest(
        List<String> feedUrls,
        Instant since,
        int maxItems
) {}
