package com.scholar.classify;

/**
 * Algorithm-specific part of a {@link ClassifierModel}. Arrays are indexed by category position, then by the
 * vocabulary's term index.
 */
public sealed interface ModelParameters permits NaiveBayesParameters, LogisticParameters {
    AlgorithmKind kind();
}
