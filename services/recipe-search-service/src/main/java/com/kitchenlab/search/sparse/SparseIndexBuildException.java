package com.kitchenlab.search.sparse;

public class SparseIndexBuildException extends RuntimeException {
    public SparseIndexBuildException(String message) {
        super(message);
    }

    public SparseIndexBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
