package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.exception.PipelineInitializationException;
import io.crimeradar.pipeline.config.PipelineConfig;
import io.crimeradar.pipeline.config.PlacesConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolution table from language code to the {@link PlaceExtractor} serving it,
 * built once at startup. A language-specific gazetteer wins over the
 * multilingual one; a supported language served by neither aborts startup.
 */
@Component
public class PlaceExtractorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PlaceExtractorRegistry.class);

    private final Map<String, PlaceExtractor> extractors;
    private final int maxCandidates;

    @Autowired
    public PlaceExtractorRegistry(PipelineConfig pipelineConfig) {
        this(pipelineConfig.keywords().supportedLanguages(),
                gazetteerExtractors(pipelineConfig.places()),
                pipelineConfig.places().maxCandidates());
    }

    public PlaceExtractorRegistry(Collection<String> supportedLanguages,
                                  Map<String, PlaceExtractor> available,
                                  int maxCandidates) {
        this.maxCandidates = maxCandidates;
        this.extractors = new LinkedHashMap<>();

        for (String language : supportedLanguages) {
            PlaceExtractor extractor = available.containsKey(language)
                    ? available.get(language)
                    : available.get(PlacesConfig.MULTILINGUAL);
            if (extractor == null) {
                throw new PipelineInitializationException("No place extractor available for language: " + language);
            }
            extractors.put(language, extractor);
            logger.info("Place extraction for '{}' served by '{}' extractor", language, extractor.language());
        }
    }

    public List<String> extractPlaces(String text, String language) {
        return extractorFor(language).extractPlaces(text, maxCandidates);
    }

    public PlaceExtractor extractorFor(String language) {
        PlaceExtractor extractor = extractors.get(language);
        if (extractor == null) {
            throw new IllegalArgumentException("Unsupported language: " + language);
        }
        return extractor;
    }

    private static Map<String, PlaceExtractor> gazetteerExtractors(PlacesConfig places) {
        Map<String, PlaceExtractor> available = new LinkedHashMap<>();
        if (places.gazetteers() != null) {
            places.gazetteers().forEach((language, names) ->
                    available.put(language, new GazetteerPlaceExtractor(language, names)));
        }
        return available;
    }
}
