package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the supported language whose function words occur most often in the
 * first 2000 characters. Needs {@value #MIN_HITS} hits and a strict winner,
 * otherwise falls back to the default language.
 */
@Service
public class StopwordLanguageDetector implements LanguageDetector {

    private static final Logger logger = LoggerFactory.getLogger(StopwordLanguageDetector.class);

    static final int SAMPLE_LENGTH = 2000;
    static final int MIN_HITS = 3;

    private static final Pattern WORD = Pattern.compile("[\\p{L}']+");

    private static final Map<String, Set<String>> STOPWORDS = Map.of(
            "en", Set.of("the", "and", "of", "to", "in", "is", "was", "for", "that", "with",
                    "on", "by", "he", "she", "they", "were", "has", "have", "from", "at", "police", "after"),
            "pt", Set.of("o", "os", "de", "da", "dos", "das", "em", "na", "nos", "nas",
                    "que", "com", "para", "por", "um", "uma", "foi", "não", "ao", "pela", "pelo", "segundo")
    );

    private final String defaultLanguage;
    private final Set<String> supportedLanguages;

    public StopwordLanguageDetector(PipelineConfig pipelineConfig) {
        this.defaultLanguage = pipelineConfig.keywords().defaultLanguage();
        this.supportedLanguages = pipelineConfig.keywords().supportedLanguages();
    }

    @Override
    public String detect(String text) {
        if (text == null || text.isBlank()) {
            return defaultLanguage;
        }

        String sample = text.length() > SAMPLE_LENGTH ? text.substring(0, SAMPLE_LENGTH) : text;
        Map<String, Integer> hits = new HashMap<>();

        Matcher matcher = WORD.matcher(sample.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            STOPWORDS.forEach((language, words) -> {
                if (supportedLanguages.contains(language) && words.contains(word)) {
                    hits.merge(language, 1, Integer::sum);
                }
            });
        }

        String best = null;
        int bestHits = 0;
        boolean tie = false;
        for (Map.Entry<String, Integer> entry : hits.entrySet()) {
            if (entry.getValue() > bestHits) {
                best = entry.getKey();
                bestHits = entry.getValue();
                tie = false;
            } else if (entry.getValue() == bestHits) {
                tie = true;
            }
        }

        if (best == null || tie || bestHits < MIN_HITS) {
            logger.debug("Language undetermined ({}), using {}", hits, defaultLanguage);
            return defaultLanguage;
        }
        return best;
    }
}
