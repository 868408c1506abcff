package com.kitchenlab.search.dense;

import com.kitchenlab.search.retrieval.DenseMatch;
import java.util.List;

/**
 * Embeds a query and returns the nearest recipes with a similarity in {@code [0, 1]}.
 * Implementations throw on any upstream failure instead of returning an empty list.
 */
public interface DenseSearchClient {
    List<DenseMatch> embedAndSearch(String queryText, int topN, double minSimilarity);
}
