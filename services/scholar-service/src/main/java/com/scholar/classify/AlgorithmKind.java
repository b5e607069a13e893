package com.scholar.classify;

import java.util.Locale;

public enum AlgorithmKind {
    NAIVE_BAYES("naive_bayes"),
    LOGISTIC_REGRESSION("logistic_regression");

    private final String id;

    AlgorithmKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a model type name. A missing name selects naive Bayes; an unrecognized one is rejected.
     */
    public static AlgorithmKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            return NAIVE_BAYES;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "naive_bayes", "nb", "multinomial_nb" -> NAIVE_BAYES;
            case "logistic_regression", "lr", "logistic" -> LOGISTIC_REGRESSION;
            default -> throw new UnknownAlgorithmException(raw);
        };
    }
}
