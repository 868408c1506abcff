package com.kitchenlab.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SearchRequest {
    private String query;

    @JsonProperty("n_results")
    private Integer numResults;

    private FilterSpec filters;

    @JsonProperty("sparse_weight")
    private Double sparseWeight;

    @JsonProperty("dense_weight")
    private Double denseWeight;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Integer getNumResults() {
        return numResults;
    }

    public void setNumResults(Integer numResults) {
        this.numResults = numResults;
    }

    public FilterSpec getFilters() {
        return filters;
    }

    public void setFilters(FilterSpec filters) {
        this.filters = filters;
    }

    public Double getSparseWeight() {
        return sparseWeight;
    }

    public void setSparseWeight(Double sparseWeight) {
        this.sparseWeight = sparseWeight;
    }

    public Double getDenseWeight() {
        return denseWeight;
    }

    public void setDenseWeight(Double denseWeight) {
        this.denseWeight = denseWeight;
    }
}
