package com.kitchenlab.search.service;

/**
 * Every active retrieval path failed, so no ranking can be produced.
 */
public class TotalRetrievalFailureException extends RuntimeException {
    private final String sparseReason;
    private final String denseReason;

    public TotalRetrievalFailureException(String sparseReason, String denseReason) {
        super("all retrieval paths failed (sparse=" + sparseReason + ", dense=" + denseReason + ")");
        this.sparseReason = sparseReason;
        this.denseReason = denseReason;
    }

    public String getSparseReason() {
        return sparseReason;
    }

    public String getDenseReason() {
        return denseReason;
    }
}
