package com.scholar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholar.classify.AlgorithmKind;
import com.scholar.classify.CategoryMetrics;
import com.scholar.classify.TrainingSummary;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TrainModelsResponse {
    private String message;
    private Map<String, Summary> results;

    public static TrainModelsResponse from(Map<AlgorithmKind, TrainingSummary> summaries) {
        TrainModelsResponse response = new TrainModelsResponse();
        response.setMessage("Models trained successfully");
        Map<String, Summary> results = new LinkedHashMap<>();
        for (Map.Entry<AlgorithmKind, TrainingSummary> entry : summaries.entrySet()) {
            results.put(entry.getKey().id(), Summary.from(entry.getValue()));
        }
        response.setResults(results);
        return response;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Map<String, Summary> getResults() {
        return results;
    }

    public void setResults(Map<String, Summary> results) {
        this.results = results;
    }

    public static class Summary {
        @JsonProperty("model_type")
        private String modelType;

        private Double accuracy;

        @JsonProperty("classification_report")
        private Map<String, Metrics> classificationReport;

        @JsonProperty("training_size")
        private int trainingSize;

        @JsonProperty("test_size")
        private int testSize;

        private List<String> categories;

        @JsonProperty("trained_at")
        private String trainedAt;

        static Summary from(TrainingSummary summary) {
            Summary view = new Summary();
            view.setModelType(summary.algorithm().id());
            view.setAccuracy(summary.accuracy());
            Map<String, Metrics> report = new LinkedHashMap<>();
            for (Map.Entry<String, CategoryMetrics> entry : summary.report().entrySet()) {
                CategoryMetrics metrics = entry.getValue();
                report.put(
                    entry.getKey(),
                    new Metrics(metrics.precision(), metrics.recall(), metrics.f1(), metrics.support())
                );
            }
            view.setClassificationReport(report);
            view.setTrainingSize(summary.trainingSize());
            view.setTestSize(summary.testSize());
            view.setCategories(summary.categories());
            view.setTrainedAt(summary.trainedAt() == null ? null : summary.trainedAt().toString());
            return view;
        }

        public String getModelType() {
            return modelType;
        }

        public void setModelType(String modelType) {
            this.modelType = modelType;
        }

        public Double getAccuracy() {
            return accuracy;
        }

        public void setAccuracy(Double accuracy) {
            this.accuracy = accuracy;
        }

        public Map<String, Metrics> getClassificationReport() {
            return classificationReport;
        }

        public void setClassificationReport(Map<String, Metrics> classificationReport) {
            this.classificationReport = classificationReport;
        }

        public int getTrainingSize() {
            return trainingSize;
        }

        public void setTrainingSize(int trainingSize) {
            this.trainingSize = trainingSize;
        }

        public int getTestSize() {
            return testSize;
        }

        public void setTestSize(int testSize) {
            this.testSize = testSize;
        }

        public List<String> getCategories() {
            return categories;
        }

        public void setCategories(List<String> categories) {
            this.categories = categories;
        }

        public String getTrainedAt() {
            return trainedAt;
        }

        public void setTrainedAt(String trainedAt) {
            this.trainedAt = trainedAt;
        }
    }

    public static class Metrics {
        private double precision;
        private double recall;

        @JsonProperty("f1-score")
        private double f1;

        private int support;

        public Metrics() {
        }

        public Metrics(double precision, double recall, double f1, int support) {
            this.precision = precision;
            this.recall = recall;
            this.f1 = f1;
            this.support = support;
        }

        public double getPrecision() {
            return precision;
        }

        public void setPrecision(double precision) {
            this.precision = precision;
        }

        public double getRecall() {
            return recall;
        }

        public void setRecall(double recall) {
            this.recall = recall;
        }

        public double getF1() {
            return f1;
        }

        public void setF1(double f1) {
            this.f1 = f1;
        }

        public int getSupport() {
            return support;
        }

        public void setSupport(int support) {
            this.support = support;
        }
    }
}
