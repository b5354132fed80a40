package io.crimeradar.pipeline.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.crimeradar.pipeline.api.dto.CrimeEvent;

import java.time.Instant;
import java.util.Set;

public record CrimeEventSavedEvent(
        @JsonProperty("link") String link,
        @JsonProperty("title") String title,
        @JsonProperty("language") String language,
        @JsonProperty("score") double score,
        @JsonProperty("latitude") double latitude,
        @JsonProperty("longitude") double longitude,
        @JsonProperty("place") String place,
        @JsonProperty("crimeKeywords") Set<String> crimeKeywords,
        @JsonProperty("publishedAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant publishedAt,
        @JsonProperty("ingestedAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant ingestedAt
) {
    public static CrimeEventSavedEvent create(CrimeEvent event, Set<String> crimeKeywords) {
        return new CrimeEventSavedEvent(
                event.link(), event.title(), event.language(), event.score(),
                event.latitude(), event.longitude(), event.placeLabel(),
                crimeKeywords, event.publishedAt(), event.ingestedAt()
        );
    }
}
