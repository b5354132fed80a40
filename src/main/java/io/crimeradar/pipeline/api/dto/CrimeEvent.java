package io.crimeradar.pipeline.api.dto;

import java.time.Instant;

/**
 * A relevant, de-duplicated and geolocated article. {@code link} is unique
 * across the store.
 */
public record CrimeEvent(
        String link,
        String title,
        Instant publishedAt,
        String language,
        double score,
        double latitude,
        double longitude,
        String placeLabel,
        Instant ingestedAt
) {
    public static CrimeEvent create(CandidateItem item, ExtractedDocument document,
                                    double score, GeoLocation location, Instant ingestedAt) {
        return new CrimeEvent(
                item.link(),
                item.title(),
                item.publishedAt(),
                document.language(),
                score,
                location.latitude(),
                location.longitude(),
                location.label(),
                ingestedAt
        );
    }
}
