package com.scholar.classify;

public final class LogisticParameters implements ModelParameters {
    private final double[][] weights;
    private final double[] biases;

    public LogisticParameters(double[][] weights, double[] biases) {
        this.weights = new double[weights.length][];
        for (int c = 0; c < weights.length; c++) {
            this.weights[c] = weights[c].clone();
        }
        this.biases = biases.clone();
    }

    @Override
    public AlgorithmKind kind() {
        return AlgorithmKind.LOGISTIC_REGRESSION;
    }

    public double weight(int category, int term) {
        return weights[category][term];
    }

    public double bias(int category) {
        return biases[category];
    }
}
