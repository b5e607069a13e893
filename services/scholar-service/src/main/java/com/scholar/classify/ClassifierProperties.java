package com.scholar.classify;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scholar.classifier")
public class ClassifierProperties {
    private List<String> categories = new ArrayList<>(List.of("politics", "business", "health"));
    private String trainingLocation = "classpath:data/training_documents.json";
    private int minTokenLength = 3;
    private boolean stemming = false;
    private double holdoutRatio = 0.2;
    private boolean trainOnStartup = true;
    private int explanationTerms = 5;
    private Logistic logistic = new Logistic();

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories;
    }

    public String getTrainingLocation() {
        return trainingLocation;
    }

    public void setTrainingLocation(String trainingLocation) {
        this.trainingLocation = trainingLocation;
    }

    public int getMinTokenLength() {
        return minTokenLength;
    }

    public void setMinTokenLength(int minTokenLength) {
        this.minTokenLength = minTokenLength;
    }

    public boolean isStemming() {
        return stemming;
    }

    public void setStemming(boolean stemming) {
        this.stemming = stemming;
    }

    public double getHoldoutRatio() {
        return holdoutRatio;
    }

    public void setHoldoutRatio(double holdoutRatio) {
        this.holdoutRatio = holdoutRatio;
    }

    public boolean isTrainOnStartup() {
        return trainOnStartup;
    }

    public void setTrainOnStartup(boolean trainOnStartup) {
        this.trainOnStartup = trainOnStartup;
    }

    public int getExplanationTerms() {
        return explanationTerms;
    }

    public void setExplanationTerms(int explanationTerms) {
        this.explanationTerms = explanationTerms;
    }

    public Logistic getLogistic() {
        return logistic;
    }

    public void setLogistic(Logistic logistic) {
        this.logistic = logistic;
    }

    public static class Logistic {
        private double learningRate = 1.0;
        private int iterations = 500;
        private double l2Penalty = 0.0001;

        public double getLearningRate() {
            return learningRate;
        }

        public void setLearningRate(double learningRate) {
            this.learningRate = learningRate;
        }

        public int getIterations() {
            return iterations;
        }

        public void setIterations(int iterations) {
            this.iterations = iterations;
        }

        public double getL2Penalty() {
            return l2Penalty;
        }

        public void setL2Penalty(double l2Penalty) {
            this.l2Penalty = l2Penalty;
        }
    }
}
