package com.kitchenlab.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kitchenlab.search.model.RecipeMetadata;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchHit {
    @JsonProperty("doc_id")
    private String docId;

    private int rank;
    private double score;

    @JsonProperty("sparse_score")
    private Double sparseScore;

    @JsonProperty("dense_score")
    private Double denseScore;

    @JsonProperty("rrf_sparse")
    private Double rrfSparse;

    @JsonProperty("rrf_dense")
    private Double rrfDense;

    private RecipeMetadata recipe;

    public String getDocId() {
        return docId;
    }

    public void setDocId(String docId) {
        this.docId = docId;
    }

    public int getRank() {
        return rank;
    }

    public void setRank(int rank) {
        this.rank = rank;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public Double getSparseScore() {
        return sparseScore;
    }

    public void setSparseScore(Double sparseScore) {
        this.sparseScore = sparseScore;
    }

    public Double getDenseScore() {
        return denseScore;
    }

    public void setDenseScore(Double denseScore) {
        this.denseScore = denseScore;
    }

    public Double getRrfSparse() {
        return rrfSparse;
    }

    public void setRrfSparse(Double rrfSparse) {
        this.rrfSparse = rrfSparse;
    }

    public Double getRrfDense() {
        return rrfDense;
    }

    public void setRrfDense(Double rrfDense) {
        this.rrfDense = rrfDense;
    }

    public RecipeMetadata getRecipe() {
        return recipe;
    }

    public void setRecipe(RecipeMetadata recipe) {
        this.recipe = recipe;
    }
}
