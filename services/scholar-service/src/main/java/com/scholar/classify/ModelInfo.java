package com.scholar.classify;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ModelInfo(
    AlgorithmKind algorithm,
    boolean trained,
    int documentCount,
    List<String> categories,
    Map<String, Integer> trainingStats,
    Instant trainedAt
) {}
