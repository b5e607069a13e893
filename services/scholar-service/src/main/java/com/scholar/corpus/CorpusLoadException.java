package com.scholar.corpus;

public class CorpusLoadException extends RuntimeException {
    public CorpusLoadException(String message) {
        super(message);
    }

    public CorpusLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
