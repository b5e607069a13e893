package com.scholar.classify;

public class UnknownAlgorithmException extends RuntimeException {
    public UnknownAlgorithmException(String algorithm) {
        super("unknown model type: " + algorithm);
    }
}
