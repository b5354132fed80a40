package io.crimeradar.pipeline.config;

public record RenderingConfig(
        String outputFile,
        double centerLatitude,
        double centerLongitude,
        int zoomStart,
        int radius,
        int blur,
        int maxZoom
) {}
