package com.scholar.classify;

public class InsufficientTrainingDataException extends RuntimeException {
    public InsufficientTrainingDataException(String message) {
        super(message);
    }
}
