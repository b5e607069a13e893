package com.scholar.classify;

public class ModelNotTrainedException extends RuntimeException {
    public ModelNotTrainedException(String message) {
        super(message);
    }
}
