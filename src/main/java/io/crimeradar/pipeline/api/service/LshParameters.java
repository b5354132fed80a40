package io.crimeradar.pipeline.api.service;

import java.util.function.DoubleUnaryOperator;

/**
 * Banding layout for MinHash LSH: {@code bands} groups of {@code rows} slots.
 */
public record LshParameters(int bands, int rows) {

    private static final int INTEGRATION_STEPS = 200;
    static final double FALSE_POSITIVE_WEIGHT = 0.1;
    static final double FALSE_NEGATIVE_WEIGHT = 0.9;

    public LshParameters {
        if (bands < 1 || rows < 1) {
            throw new IllegalArgumentException("bands and rows must be positive: " + bands + "x" + rows);
        }
    }

    /**
     * Choose the layout that minimises the weighted false-positive area below
     * {@code threshold} plus the false-negative area above it, using at most
     * {@code numPermutations} slots. Candidates are verified against the full
     * signature afterwards, so missed pairs weigh more than spurious ones.
     */
    public static LshParameters optimal(double threshold, int numPermutations) {
        if (threshold <= 0.0 || threshold >= 1.0) {
            throw new IllegalArgumentException("threshold must be in (0, 1): " + threshold);
        }

        double minError = Double.POSITIVE_INFINITY;
        LshParameters best = null;

        for (int b = 1; b <= numPermutations; b++) {
            int maxRows = numPermutations / b;
            for (int r = 1; r <= maxRows; r++) {
                LshParameters candidate = new LshParameters(b, r);
                double falsePositive = integrate(candidate::probability, 0.0, threshold);
                double falseNegative = integrate(s -> 1.0 - candidate.probability(s), threshold, 1.0);
                double error = FALSE_POSITIVE_WEIGHT * falsePositive + FALSE_NEGATIVE_WEIGHT * falseNegative;
                if (error < minError) {
                    minError = error;
                    best = candidate;
                }
            }
        }
        return best;
    }

    /** Probability that two sets with Jaccard similarity {@code s} share at least one band. */
    public double probability(double s) {
        return candidateProbability(s, bands, rows);
    }

    static double candidateProbability(double s, int bands, int rows) {
        return 1.0 - Math.pow(1.0 - Math.pow(s, rows), bands);
    }

    private static double integrate(DoubleUnaryOperator f, double from, double to) {
        double h = (to - from) / INTEGRATION_STEPS;
        double sum = f.applyAsDouble(from) + f.applyAsDouble(to);
        for (int i = 1; i < INTEGRATION_STEPS; i++) {
            sum += f.applyAsDouble(from + i * h) * (i % 2 == 0 ? 2 : 4);
        }
        return sum * h / 3.0;
    }
}
