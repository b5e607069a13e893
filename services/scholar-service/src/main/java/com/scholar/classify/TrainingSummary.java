package com.scholar.classify;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * @param accuracy holdout accuracy, or {@code null} when the set was too small to hold anything out
 */
public record TrainingSummary(
    AlgorithmKind algorithm,
    Double accuracy,
    Map<String, CategoryMetrics> report,
    int trainingSize,
    int testSize,
    List<String> categories,
    Instant trainedAt
) {}
