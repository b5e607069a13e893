package com.scholar.classify;

public final class NaiveBayesParameters implements ModelParameters {
    private final double[] logPriors;
    private final double[][] logConditionals;

    public NaiveBayesParameters(double[] logPriors, double[][] logConditionals) {
        this.logPriors = logPriors.clone();
        this.logConditionals = new double[logConditionals.length][];
        for (int c = 0; c < logConditionals.length; c++) {
            this.logConditionals[c] = logConditionals[c].clone();
        }
    }

    @Override
    public AlgorithmKind kind() {
        return AlgorithmKind.NAIVE_BAYES;
    }

    public double logPrior(int category) {
        return logPriors[category];
    }

    public double logConditional(int category, int term) {
        return logConditionals[category][term];
    }
}
