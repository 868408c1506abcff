package com.kitchenlab.search.vector;

import java.util.List;

public interface VectorStore {
    /**
     * Returns up to {@code topN} hits ordered by ascending distance.
     *
     * @throws VectorStoreUnavailableException when the store cannot answer
     */
    List<VectorHit> query(List<Double> vector, int topN, Integer timeBudgetMs);
}
