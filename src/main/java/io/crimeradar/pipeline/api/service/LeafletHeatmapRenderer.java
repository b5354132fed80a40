package io.crimeradar.pipeline.api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crimeradar.pipeline.api.dto.AggregatedPoint;
import io.crimeradar.pipeline.config.PipelineConfig;
import io.crimeradar.pipeline.config.RenderingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Writes a standalone HTML page showing the points as a Leaflet heat layer,
 * each point weighted by its event count.
 */
@Service
public class LeafletHeatmapRenderer implements HeatmapRenderer {

    private static final Logger logger = LoggerFactory.getLogger(LeafletHeatmapRenderer.class);

    private static final String TEMPLATE = """
            <!DOCTYPE html>
            <html>
            <head>
              <meta charset="utf-8"/>
              <title>Crime news heat map</title>
              <link rel="stylesheet" href="https://unpkg.com/leaflet@1.9.4/dist/leaflet.css"/>
              <script src="https://unpkg.com/leaflet@1.9.4/dist/leaflet.js"></script>
              <script src="https://unpkg.com/leaflet.heat@0.2.0/dist/leaflet-heat.js"></script>
              <style>html, body, #map { height: 100%%; margin: 0; }</style>
            </head>
            <body>
              <div id="map"></div>
              <script>
                var map = L.map('map').setView([%s, %s], %d);
                L.tileLayer('https://{s}.tile.openstreetmap.org/{z}/{x}/{y}.png', {
                  attribution: '&copy; OpenStreetMap contributors'
                }).addTo(map);
                var points = %s;
                L.heatLayer(points, {radius: %d, blur: %d, maxZoom: %d}).addTo(map);
              </script>
            </body>
            </html>
            """;

    private final ObjectMapper objectMapper;
    private final RenderingConfig rendering;

    public LeafletHeatmapRenderer(ObjectMapper objectMapper, PipelineConfig pipelineConfig) {
        this.objectMapper = objectMapper;
        this.rendering = pipelineConfig.rendering();
    }

    @Override
    public String render(List<AggregatedPoint> points) throws IOException {
        List<double[]> data = points.stream()
                .map(point -> new double[]{point.latBucket(), point.lonBucket(), point.count()})
                .toList();

        String html = String.format(Locale.ROOT, TEMPLATE,
                rendering.centerLatitude(),
                rendering.centerLongitude(),
                rendering.zoomStart(),
                objectMapper.writeValueAsString(data),
                rendering.radius(),
                rendering.blur(),
                rendering.maxZoom());

        Path output = Path.of(rendering.outputFile()).toAbsolutePath();
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, html, StandardCharsets.UTF_8);

        logger.info("Heat map with {} points written to {}", points.size(), output);
        return output.toString();
    }
}
