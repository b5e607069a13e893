package com.scholar.text;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sparse term weight vector. Immutable; terms are kept in sorted order so iteration is deterministic.
 */
public final class DocumentVector {
    public static final DocumentVector EMPTY = new DocumentVector(Map.of());

    private final Map<String, Double> weights;

    public DocumentVector(Map<String, Double> weights) {
        this.weights = Collections.unmodifiableMap(new TreeMap<>(weights));
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public double weight(String term) {
        Double value = weights.get(term);
        return value == null ? 0.0 : value;
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public int size() {
        return weights.size();
    }

    public double norm() {
        double sumSquares = 0.0;
        for (double value : weights.values()) {
            sumSquares += value * value;
        }
        return Math.sqrt(sumSquares);
    }

    public double dot(DocumentVector other) {
        if (other == null || isEmpty() || other.isEmpty()) {
            return 0.0;
        }
        DocumentVector smaller = size() <= other.size() ? this : other;
        DocumentVector larger = smaller == this ? other : this;
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : smaller.weights.entrySet()) {
            Double value = larger.weights.get(entry.getKey());
            if (value != null) {
                sum += entry.getValue() * value;
            }
        }
        return sum;
    }

    @Override
    public String toString() {
        return "DocumentVector" + weights;
    }
}
