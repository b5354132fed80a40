package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.AggregatedPoint;

import java.io.IOException;
import java.util.List;

public interface HeatmapRenderer {

    /**
     * @return a handle to the produced artifact, such as a file path
     */
    String render(List<AggregatedPoint> points) throws IOException;
}
