package io.crimeradar.pipeline.api.dto;

public record ExtractedDocument(
        String text,
        String language
) {}
