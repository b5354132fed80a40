package io.crimeradar.pipeline.api.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds whole-word, case-insensitive occurrences of known place names. Where
 * names overlap the longest match starting first wins, so "Rio de Janeiro"
 * is not also reported as "Rio".
 */
public class GazetteerPlaceExtractor implements PlaceExtractor {

    private final String language;
    private final List<Pattern> patterns;

    public GazetteerPlaceExtractor(String language, List<String> placeNames) {
        this.language = language;
        this.patterns = placeNames.stream()
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .distinct()
                .map(name -> Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(name) + "(?![\\p{L}\\p{N}])",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    @Override
    public String language() {
        return language;
    }

    @Override
    public List<String> extractPlaces(String text, int limit) {
        if (text == null || text.isBlank() || limit <= 0) return List.of();

        List<Occurrence> occurrences = new ArrayList<>();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                occurrences.add(new Occurrence(matcher.start(), matcher.end(), matcher.group()));
            }
        }
        occurrences.sort(Comparator.comparingInt(Occurrence::start)
                .thenComparing(Comparator.comparingInt(Occurrence::length).reversed()));

        List<String> places = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int coveredUntil = -1;

        for (Occurrence occurrence : occurrences) {
            if (occurrence.start() < coveredUntil) continue;
            coveredUntil = occurrence.end();

            String name = occurrence.text().trim();
            if (!name.isEmpty() && seen.add(name.toLowerCase(Locale.ROOT))) {
                places.add(name);
                if (places.size() == limit) break;
            }
        }
        return places;
    }

    private record Occurrence(int start, int end, String text) {
        int length() {
            return end - start;
        }
    }
}
