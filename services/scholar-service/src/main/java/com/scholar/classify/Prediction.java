package com.scholar.classify;

import java.util.List;
import java.util.Map;

/**
 * @param probabilities in category order, summing to 1
 * @param topTerms terms that moved the score toward {@code category}, strongest first
 * @param processedTokenCount tokens left after preprocessing
 */
public record Prediction(
    AlgorithmKind algorithm,
    String category,
    double confidence,
    Map<String, Double> probabilities,
    List<TermContribution> topTerms,
    int processedTokenCount
) {
    public record TermContribution(String term, double weight) {}
}
