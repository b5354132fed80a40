package io.crimeradar.pipeline.config;

public record DedupConfig(
        int numPermutations,
        double threshold,
        long seed,
        int minTokenLength
) {}
