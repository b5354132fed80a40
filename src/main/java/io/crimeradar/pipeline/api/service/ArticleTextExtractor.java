package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.exception.TextExtractionException;

public interface ArticleTextExtractor {

    /**
     * Fetch the page behind {@code link} and return its readable text with
     * whitespace collapsed to single spaces.
     */
    String extractText(String link) throws TextExtractionException;
}
