package io.crimeradar.pipeline.config;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Crime vocabulary per language code. Languages without an entry use the
 * default language's vocabulary.
 */
public record CrimeKeywords(
        String defaultLanguage,
        Map<String, Set<String>> byLanguage
) {
    public Set<String> supportedLanguages() {
        return byLanguage.keySet();
    }

    public boolean supports(String language) {
        return language != null && byLanguage.containsKey(language);
    }

    public Set<String> keywordsFor(String language) {
        Set<String> keywords = supports(language) ? byLanguage.get(language) : byLanguage.get(defaultLanguage);
        return keywords != null ? keywords : Set.of();
    }

    public Set<String> findKeywords(String text, String language) {
        if (text == null || text.isEmpty()) return Set.of();

        String lowerText = text.toLowerCase(Locale.ROOT);

        return keywordsFor(language).stream()
                .filter(keyword -> lowerText.contains(keyword.toLowerCase(Locale.ROOT)))
                .collect(Collectors.toSet());
    }
}
