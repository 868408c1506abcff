package com.kitchenlab.search.retrieval;

import com.kitchenlab.search.model.RecipeMetadata;

public final class DenseMatch {
    private final String docId;
    private final double similarity;
    private final RecipeMetadata metadata;

    public DenseMatch(String docId, double similarity, RecipeMetadata metadata) {
        this.docId = docId;
        this.similarity = similarity;
        this.metadata = metadata;
    }

    public String getDocId() {
        return docId;
    }

    public double getSimilarity() {
        return similarity;
    }

    public RecipeMetadata getMetadata() {
        return metadata;
    }
}
