package io.crimeradar.pipeline.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.crimeradar.pipeline.api.dto.GeoLocation;
import io.crimeradar.pipeline.config.PipelineConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Geocoder backed by a Nominatim-compatible {@code /search} endpoint. Every
 * lookup takes a permit from the shared rate limiter first, so concurrent
 * callers together stay within the provider's request budget.
 */
@Service
public class NominatimGeocoder implements Geocoder {

    private static final Logger logger = LoggerFactory.getLogger(NominatimGeocoder.class);

    private static final String SEARCH_PATH = "/search?q={query}&format=json&limit=1";

    private final RestTemplate restTemplate;
    private final RateLimiter rateLimiter;

    @Autowired
    public NominatimGeocoder(@Qualifier("geocodingRestTemplate") RestTemplate restTemplate,
                             RateLimiterRegistry rateLimiterRegistry,
                             PipelineConfig pipelineConfig) {
        this(restTemplate, rateLimiterRegistry.rateLimiter(pipelineConfig.geocoding().rateLimiterName()));
    }

    public NominatimGeocoder(RestTemplate restTemplate, RateLimiter rateLimiter) {
        this.restTemplate = restTemplate;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Optional<GeoLocation> geocode(String placeName) {
        if (placeName == null || placeName.isBlank()) {
            return Optional.empty();
        }

        try {
            RateLimiter.waitForPermission(rateLimiter);
            JsonNode results = restTemplate.getForObject(SEARCH_PATH, JsonNode.class, placeName);
            return toLocation(results, placeName);

        } catch (RequestNotPermitted e) {
            logger.warn("Geocoding of '{}' skipped: rate limiter permit not granted in time", placeName);
            return Optional.empty();

        } catch (RestClientException e) {
            logger.warn("Geocoding of '{}' failed: {}", placeName, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<GeoLocation> toLocation(JsonNode results, String placeName) {
        if (results == null || !results.isArray() || results.isEmpty()) {
            logger.debug("No geocoding result for '{}'", placeName);
            return Optional.empty();
        }

        JsonNode first = results.get(0);
        Double latitude = parseCoordinate(first.get("lat"));
        Double longitude = parseCoordinate(first.get("lon"));

        if (latitude == null || longitude == null) {
            logger.debug("Geocoding result for '{}' has no usable coordinate: {}", placeName, first);
            return Optional.empty();
        }
        return Optional.of(new GeoLocation(latitude, longitude, placeName));
    }

    private static Double parseCoordinate(JsonNode node) {
        if (node == null || node.isNull()) return null;
        try {
            double value = node.isNumber() ? node.asDouble() : Double.parseDouble(node.asText().trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
