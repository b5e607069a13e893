package com.scholar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholar.classify.ModelInfo;
import java.util.List;
import java.util.Map;

public class ModelInfoResponse {
    @JsonProperty("model_type")
    private String modelType;

    @JsonProperty("is_trained")
    private boolean trained;

    @JsonProperty("total_documents")
    private int totalDocuments;

    private List<String> categories;

    @JsonProperty("training_stats")
    private Map<String, Integer> trainingStats;

    @JsonProperty("trained_at")
    private String trainedAt;

    public static ModelInfoResponse from(ModelInfo info) {
        ModelInfoResponse response = new ModelInfoResponse();
        response.setModelType(info.algorithm().id());
        response.setTrained(info.trained());
        response.setTotalDocuments(info.documentCount());
        response.setCategories(info.categories());
        response.setTrainingStats(info.trainingStats());
        response.setTrainedAt(info.trainedAt() == null ? null : info.trainedAt().toString());
        return response;
    }

    public String getModelType() {
        return modelType;
    }

    public void setModelType(String modelType) {
        this.modelType = modelType;
    }

    public boolean isTrained() {
        return trained;
    }

    public void setTrained(boolean trained) {
        this.trained = trained;
    }

    public int getTotalDocuments() {
        return totalDocuments;
    }

    public void setTotalDocuments(int totalDocuments) {
        this.totalDocuments = totalDocuments;
    }

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories;
    }

    public Map<String, Integer> getTrainingStats() {
        return trainingStats;
    }

    public void setTrainingStats(Map<String, Integer> trainingStats) {
        this.trainingStats = trainingStats;
    }

    public String getTrainedAt() {
        return trainedAt;
    }

    public void setTrainedAt(String trainedAt) {
        this.trainedAt = trainedAt;
    }
}
