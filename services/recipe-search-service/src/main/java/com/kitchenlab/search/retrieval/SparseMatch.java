package com.kitchenlab.search.retrieval;

import com.kitchenlab.search.model.RecipeMetadata;

public final class SparseMatch {
    private final String docId;
    private final double score;
    private final RecipeMetadata metadata;

    public SparseMatch(String docId, double score, RecipeMetadata metadata) {
        this.docId = docId;
        this.score = score;
        this.metadata = metadata;
    }

    public String getDocId() {
        return docId;
    }

    public double getScore() {
        return score;
    }

    public RecipeMetadata getMetadata() {
        return metadata;
    }
}
