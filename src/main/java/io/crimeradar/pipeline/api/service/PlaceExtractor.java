package io.crimeradar.pipeline.api.service;

import java.util.List;

/**
 * Capability: find location names in text written in {@link #language()}.
 */
public interface PlaceExtractor {

    String language();

    /**
     * @return location names in order of first appearance, de-duplicated
     *         case-insensitively and capped at {@code limit}
     */
    List<String> extractPlaces(String text, int limit);
}
