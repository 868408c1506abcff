package com.kitchenlab.search.retrieval;

public class RetrievalException extends RuntimeException {
    private final String path;

    public RetrievalException(String path, String message) {
        super(message);
        this.path = path;
    }

    public RetrievalException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
