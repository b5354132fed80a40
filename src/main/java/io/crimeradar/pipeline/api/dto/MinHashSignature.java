package io.crimeradar.pipeline.api.dto;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed-size MinHash sketch of a token set. A signature built from an empty
 * token set is {@linkplain #isEmpty() empty} and is never similar to anything.
 */
public final class MinHashSignature {

    private final long[] values;
    private final boolean empty;

    public MinHashSignature(long[] values, boolean empty) {
        this.values = values.clone();
        this.empty = empty;
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return empty;
    }

    public long valueAt(int slot) {
        return values[slot];
    }

    public List<Long> band(int start, int rows) {
        return Arrays.stream(values, start, start + rows).boxed().toList();
    }

    /**
     * Fraction of slots holding the same minimum, the MinHash estimate of the
     * Jaccard similarity of the underlying sets.
     */
    public double estimateJaccard(MinHashSignature other) {
        if (other.size() != size()) {
            throw new IllegalArgumentException("Signatures differ in size: " + size() + " vs " + other.size());
        }
        if (empty || other.empty) return 0.0;

        int equal = 0;
        for (int i = 0; i < values.length; i++) {
            if (values[i] == other.values[i]) equal++;
        }
        return (double) equal / values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MinHashSignature that)) return false;
        return empty == that.empty && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Boolean.hashCode(empty);
    }

    @Override
    public String toString() {
        return "MinHashSignature{size=" + values.length + ", empty=" + empty + "}";
    }
}
