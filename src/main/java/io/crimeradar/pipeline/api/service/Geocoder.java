package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.GeoLocation;

import java.util.Optional;

public interface Geocoder {

    /**
     * Look up a coordinate for a place name. Transient failures are reported
     * as an empty result, never thrown.
     */
    Optional<GeoLocation> geocode(String placeName);
}
