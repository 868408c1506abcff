package com.kitchenlab.search.catalog;

public final class IndexStats {
    private final boolean built;
    private final int documentCount;
    private final int vocabularySize;
    private final double averageLength;
    private final Long builtAtMs;

    public IndexStats(boolean built, int documentCount, int vocabularySize, double averageLength, Long builtAtMs) {
        this.built = built;
        this.documentCount = documentCount;
        this.vocabularySize = vocabularySize;
        this.averageLength = averageLength;
        this.builtAtMs = builtAtMs;
    }

    public static IndexStats notBuilt() {
        return new IndexStats(false, 0, 0, 0.0, null);
    }

    public boolean isBuilt() {
        return built;
    }

    public int getDocumentCount() {
        return documentCount;
    }

    public int getVocabularySize() {
        return vocabularySize;
    }

    public double getAverageLength() {
        return averageLength;
    }

    public Long getBuiltAtMs() {
        return builtAtMs;
    }
}
