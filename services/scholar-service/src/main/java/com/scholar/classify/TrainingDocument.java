package com.scholar.classify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record TrainingDocument(String text, String category) {
    @JsonCreator
    public TrainingDocument(@JsonProperty("text") String text, @JsonProperty("category") String category) {
        this.text = text == null ? "" : text;
        this.category = category == null ? null : category.trim();
    }
}
