package io.crimeradar.pipeline.api.dto;

public record GeoLocation(
        double latitude,
        double longitude,
        String label
) {
    public GeoLocation withLabel(String newLabel) {
        return new GeoLocation(latitude, longitude, newLabel);
    }
}
