package com.kitchenlab.search.fusion;

import com.kitchenlab.search.model.RecipeMetadata;

/**
 * One recipe after fusion. Raw scores are 0 and ranks are {@code null} for a path that did not
 * return the recipe.
 */
public final class FusedResult {
    private final String docId;
    private final double sparseScore;
    private final double denseScore;
    private final Integer sparseRank;
    private final Integer denseRank;
    private final double rrfSparse;
    private final double rrfDense;
    private final RecipeMetadata metadata;

    public FusedResult(
        String docId,
        double sparseScore,
        double denseScore,
        Integer sparseRank,
        Integer denseRank,
        double rrfSparse,
        double rrfDense,
        RecipeMetadata metadata
    ) {
        this.docId = docId;
        this.sparseScore = sparseScore;
        this.denseScore = denseScore;
        this.sparseRank = sparseRank;
        this.denseRank = denseRank;
        this.rrfSparse = rrfSparse;
        this.rrfDense = rrfDense;
        this.metadata = metadata;
    }

    public FusedResult withMetadata(RecipeMetadata resolved) {
        return new FusedResult(docId, sparseScore, denseScore, sparseRank, denseRank, rrfSparse, rrfDense, resolved);
    }

    public String getDocId() {
        return docId;
    }

    public double getSparseScore() {
        return sparseScore;
    }

    public double getDenseScore() {
        return denseScore;
    }

    public Integer getSparseRank() {
        return sparseRank;
    }

    public Integer getDenseRank() {
        return denseRank;
    }

    public double getRrfSparse() {
        return rrfSparse;
    }

    public double getRrfDense() {
        return rrfDense;
    }

    public double getCombinedScore() {
        return rrfSparse + rrfDense;
    }

    public RecipeMetadata getMetadata() {
        return metadata;
    }
}
