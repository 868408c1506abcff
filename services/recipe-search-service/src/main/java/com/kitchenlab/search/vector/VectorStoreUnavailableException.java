package com.kitchenlab.search.vector;

public class VectorStoreUnavailableException extends RuntimeException {
    public VectorStoreUnavailableException(String message) {
        super(message);
    }

    public VectorStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
