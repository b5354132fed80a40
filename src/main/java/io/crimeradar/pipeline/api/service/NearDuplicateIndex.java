package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.MinHashSignature;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * MinHash LSH index answering whether a similar signature has already been
 * inserted. Signatures sharing a whole band are candidates; a candidate is a
 * match when its estimated Jaccard similarity reaches the threshold.
 * <p>
 * Not thread-safe. One instance lives for one pipeline run.
 */
public class NearDuplicateIndex {

    private final double threshold;
    private final int numPermutations;
    private final LshParameters parameters;
    private final List<Map<List<Long>, List<String>>> bandTables;
    private final Map<String, MinHashSignature> signatures = new LinkedHashMap<>();

    public NearDuplicateIndex(double threshold, int numPermutations) {
        this(threshold, numPermutations, LshParameters.optimal(threshold, numPermutations));
    }

    public NearDuplicateIndex(double threshold, int numPermutations, LshParameters parameters) {
        if (parameters.bands() * parameters.rows() > numPermutations) {
            throw new IllegalArgumentException("Banding " + parameters + " needs more than " + numPermutations + " slots");
        }
        this.threshold = threshold;
        this.numPermutations = numPermutations;
        this.parameters = parameters;
        this.bandTables = new ArrayList<>(parameters.bands());
        for (int i = 0; i < parameters.bands(); i++) {
            bandTables.add(new HashMap<>());
        }
    }

    public boolean query(MinHashSignature signature) {
        checkSize(signature);
        if (signature.isEmpty()) return false;

        Set<String> candidates = new HashSet<>();
        for (int band = 0; band < parameters.bands(); band++) {
            List<String> keys = bandTables.get(band).get(bandOf(signature, band));
            if (keys != null) {
                candidates.addAll(keys);
            }
        }

        return candidates.stream()
                .map(signatures::get)
                .anyMatch(candidate -> candidate.estimateJaccard(signature) >= threshold);
    }

    public void insert(String key, MinHashSignature signature) {
        checkSize(signature);
        if (signatures.containsKey(key)) {
            throw new IllegalArgumentException("Key already indexed: " + key);
        }

        signatures.put(key, signature);
        if (signature.isEmpty()) return;

        for (int band = 0; band < parameters.bands(); band++) {
            bandTables.get(band)
                    .computeIfAbsent(bandOf(signature, band), k -> new ArrayList<>())
                    .add(key);
        }
    }

    public boolean contains(String key) {
        return signatures.containsKey(key);
    }

    public int size() {
        return signatures.size();
    }

    public LshParameters parameters() {
        return parameters;
    }

    private List<Long> bandOf(MinHashSignature signature, int band) {
        return signature.band(band * parameters.rows(), parameters.rows());
    }

    private void checkSize(MinHashSignature signature) {
        if (signature.size() != numPermutations) {
            throw new IllegalArgumentException(
                    "Expected " + numPermutations + " slots, got " + signature.size());
        }
    }
}
