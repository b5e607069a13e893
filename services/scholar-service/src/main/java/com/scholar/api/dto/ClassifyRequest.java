package com.scholar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ClassifyRequest {
    private String text;

    @JsonProperty("model_type")
    private String modelType;

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getModelType() {
        return modelType;
    }

    public void setModelType(String modelType) {
        this.modelType = modelType;
    }
}
