package com.scholar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholar.classify.ClassificationResult;
import com.scholar.classify.Prediction;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ClassificationResponse {
    @JsonProperty("predicted_category")
    private String predictedCategory;

    private double confidence;
    private Map<String, Double> probabilities;
    private String explanation;

    @JsonProperty("top_terms")
    private List<TermView> topTerms;

    @JsonProperty("model_used")
    private String modelUsed;

    @JsonProperty("text_length")
    private int textLength;

    @JsonProperty("processed_text_length")
    private int processedTextLength;

    public static ClassificationResponse from(ClassificationResult result) {
        ClassificationResponse response = new ClassificationResponse();
        response.setPredictedCategory(result.category());
        response.setConfidence(result.confidence());
        response.setProbabilities(result.probabilities());
        response.setExplanation(result.explanation().summary());
        List<TermView> terms = new ArrayList<>();
        for (Prediction.TermContribution contribution : result.explanation().topTerms()) {
            terms.add(new TermView(contribution.term(), contribution.weight()));
        }
        response.setTopTerms(terms);
        response.setModelUsed(result.modelUsed().id());
        response.setTextLength(result.textLength());
        response.setProcessedTextLength(result.processedTextLength());
        return response;
    }

    public String getPredictedCategory() {
        return predictedCategory;
    }

    public void setPredictedCategory(String predictedCategory) {
        this.predictedCategory = predictedCategory;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public Map<String, Double> getProbabilities() {
        return probabilities;
    }

    public void setProbabilities(Map<String, Double> probabilities) {
        this.probabilities = probabilities;
    }

    public String getExplanation() {
        return explanation;
    }

    public void setExplanation(String explanation) {
        this.explanation = explanation;
    }

    public List<TermView> getTopTerms() {
        return topTerms;
    }

    public void setTopTerms(List<TermView> topTerms) {
        this.topTerms = topTerms;
    }

    public String getModelUsed() {
        return modelUsed;
    }

    public void setModelUsed(String modelUsed) {
        this.modelUsed = modelUsed;
    }

    public int getTextLength() {
        return textLength;
    }

    public void setTextLength(int textLength) {
        this.textLength = textLength;
    }

    public int getProcessedTextLength() {
        return processedTextLength;
    }

    public void setProcessedTextLength(int processedTextLength) {
        this.processedTextLength = processedTextLength;
    }

    public static class TermView {
        private String term;
        private double weight;

        public TermView() {
        }

        public TermView(String term, double weight) {
            this.term = term;
            this.weight = weight;
        }

        public String getTerm() {
            return term;
        }

        public void setTerm(String term) {
            this.term = term;
        }

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }
    }
}
