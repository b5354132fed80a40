package io.crimeradar.pipeline.config;

import java.util.List;
import java.util.Map;

/**
 * Place-name gazetteers keyed by language code. The {@link #MULTILINGUAL}
 * key holds the fallback list used for languages without their own.
 */
public record PlacesConfig(
        int maxCandidates,
        Map<String, List<String>> gazetteers
) {
    public static final String MULTILINGUAL = "xx";
}
