package io.crimeradar.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "pipeline")
public record PipelineConfig(
        List<FeedSource> sources,
        ProcessingConfig processing,
        HttpConfig http,
        CrimeKeywords keywords,
        DedupConfig dedup,
        GeocodingConfig geocoding,
        PlacesConfig places,
        AggregationConfig aggregation,
        RenderingConfig rendering,
        PublishingConfig publishing
) {

    public List<FeedSource> getEnabledSources() {
        return sources.stream()
                .filter(FeedSource::enabled)
                .toList();
    }

    public List<String> getEnabledSourceUrls() {
        return getEnabledSources().stream()
                .map(FeedSource::url)
                .toList();
    }
}
