package io.crimeradar.pipeline.config;

public record FeedSource(
        String url,
        String name,
        boolean enabled
) {
    public String getSimpleName() {
        if (url.contains("globo")) return "G1";
        if (url.contains("nytimes")) return "NYT";
        if (url.contains("bbc")) return "BBC";
        return name;
    }
}
