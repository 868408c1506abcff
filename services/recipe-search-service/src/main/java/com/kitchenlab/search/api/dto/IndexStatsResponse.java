package com.kitchenlab.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kitchenlab.search.catalog.IndexStats;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexStatsResponse {
    private boolean built;

    @JsonProperty("document_count")
    private int documentCount;

    @JsonProperty("vocabulary_size")
    private int vocabularySize;

    @JsonProperty("average_length")
    private double averageLength;

    @JsonProperty("built_at_ms")
    private Long builtAtMs;

    public static IndexStatsResponse from(IndexStats stats) {
        IndexStatsResponse response = new IndexStatsResponse();
        response.setBuilt(stats.isBuilt());
        response.setDocumentCount(stats.getDocumentCount());
        response.setVocabularySize(stats.getVocabularySize());
        response.setAverageLength(stats.getAverageLength());
        response.setBuiltAtMs(stats.getBuiltAtMs());
        return response;
    }

    public boolean isBuilt() {
        return built;
    }

    public void setBuilt(boolean built) {
        this.built = built;
    }

    public int getDocumentCount() {
        return documentCount;
    }

    public void setDocumentCount(int documentCount) {
        this.documentCount = documentCount;
    }

    public int getVocabularySize() {
        return vocabularySize;
    }

    public void setVocabularySize(int vocabularySize) {
        this.vocabularySize = vocabularySize;
    }

    public double getAverageLength() {
        return averageLength;
    }

    public void setAverageLength(double averageLength) {
        this.averageLength = averageLength;
    }

    public Long getBuiltAtMs() {
        return builtAtMs;
    }

    public void setBuiltAtMs(Long builtAtMs) {
        this.builtAtMs = builtAtMs;
    }
}
