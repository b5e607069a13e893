package com.scholar.classify;

import java.util.List;
import java.util.Map;

public record ClassificationResult(
    String category,
    double confidence,
    Map<String, Double> probabilities,
    Explanation explanation,
    AlgorithmKind modelUsed,
    int textLength,
    int processedTextLength
) {
    public record Explanation(String summary, List<Prediction.TermContribution> topTerms) {}
}
