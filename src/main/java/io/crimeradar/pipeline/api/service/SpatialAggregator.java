package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.AggregatedPoint;
import io.crimeradar.pipeline.api.dto.CrimeEvent;
import io.crimeradar.pipeline.config.AggregationConfig;
import io.crimeradar.pipeline.config.PipelineConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts stored events per grid cell, where a cell is the event's latitude
 * and longitude each rounded to {@code scale} decimal places. The result is
 * computed on every call and carries no ordering guarantee.
 */
@Service
public class SpatialAggregator {

    private final EventStore eventStore;
    private final int scale;
    private final RoundingMode roundingMode;

    @Autowired
    public SpatialAggregator(EventStore eventStore, PipelineConfig pipelineConfig) {
        this(eventStore, pipelineConfig.aggregation());
    }

    public SpatialAggregator(EventStore eventStore, AggregationConfig aggregation) {
        this.eventStore = eventStore;
        this.scale = aggregation.scale();
        this.roundingMode = aggregation.roundingMode();
    }

    public List<AggregatedPoint> aggregate() {
        Map<Bucket, Long> counts = new LinkedHashMap<>();

        for (CrimeEvent event : eventStore.findAll()) {
            Bucket bucket = new Bucket(bucketOf(event.latitude()), bucketOf(event.longitude()));
            counts.merge(bucket, 1L, Long::sum);
        }

        return counts.entrySet().stream()
                .map(entry -> new AggregatedPoint(entry.getKey().lat(), entry.getKey().lon(), entry.getValue()))
                .toList();
    }

    double bucketOf(double coordinate) {
        return BigDecimal.valueOf(coordinate).setScale(scale, roundingMode).doubleValue();
    }

    private record Bucket(double lat, double lon) {}
}
