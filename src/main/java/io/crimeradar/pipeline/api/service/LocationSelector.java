package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.GeoLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the first candidate name that geocodes. Candidates after the first
 * hit are never looked up.
 */
@Service
public class LocationSelector {

    private static final Logger logger = LoggerFactory.getLogger(LocationSelector.class);

    private final Geocoder geocoder;

    public LocationSelector(Geocoder geocoder) {
        this.geocoder = geocoder;
    }

    public Optional<GeoLocation> select(List<String> candidateNames) {
        for (String name : candidateNames) {
            if (name == null || name.isBlank()) continue;

            Optional<GeoLocation> location = geocoder.geocode(name);
            if (location.isPresent()) {
                logger.debug("Resolved '{}' to ({}, {})", name, location.get().latitude(), location.get().longitude());
                return location;
            }
        }
        return Optional.empty();
    }
}
