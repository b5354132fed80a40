package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.config.CrimeKeywords;
import io.crimeradar.pipeline.config.PipelineConfig;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Crime relevance in [0, 1]: {@code 0.6 * min(hits / 5, 1) + 0.4 * min(length / 2000, 1)},
 * where hits is the number of distinct crime keywords of the language found in the text.
 */
@Service
public class RelevanceScorer {

    static final double KEYWORD_WEIGHT = 0.6;
    static final double LENGTH_WEIGHT = 0.4;
    static final double KEYWORD_SATURATION = 5.0;
    static final double LENGTH_SATURATION = 2000.0;

    private final CrimeKeywords crimeKeywords;

    public RelevanceScorer(PipelineConfig pipelineConfig) {
        this.crimeKeywords = pipelineConfig.keywords();
    }

    public double score(String text, String language) {
        if (text == null || text.isEmpty()) return 0.0;

        int hitCount = matchedKeywords(text, language).size();
        int length = text.codePointCount(0, text.length());

        double keywordTerm = Math.min(hitCount / KEYWORD_SATURATION, 1.0);
        double lengthTerm = Math.min(length / LENGTH_SATURATION, 1.0);

        return KEYWORD_WEIGHT * keywordTerm + LENGTH_WEIGHT * lengthTerm;
    }

    public Set<String> matchedKeywords(String text, String language) {
        return crimeKeywords.findKeywords(text, language);
    }
}
