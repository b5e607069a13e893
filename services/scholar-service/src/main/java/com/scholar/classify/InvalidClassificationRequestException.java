package com.scholar.classify;

public class InvalidClassificationRequestException extends RuntimeException {
    public InvalidClassificationRequestException(String message) {
        super(message);
    }
}
