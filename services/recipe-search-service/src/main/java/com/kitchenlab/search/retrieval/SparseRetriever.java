package com.kitchenlab.search.retrieval;

import com.kitchenlab.search.sparse.SparseIndex;
import com.kitchenlab.search.text.RecipeTokenizer;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class SparseRetriever {
    public static final String PATH = "sparse";

    private final SparseIndex sparseIndex;
    private final RecipeTokenizer tokenizer;

    public SparseRetriever(SparseIndex sparseIndex, RecipeTokenizer tokenizer) {
        this.sparseIndex = sparseIndex;
        this.tokenizer = tokenizer;
    }

    public RetrievalStageResult<SparseMatch> retrieve(String query, int topK) {
        if (query == null || query.isBlank() || topK <= 0) {
            return RetrievalStageResult.empty();
        }
        if (!sparseIndex.isBuilt()) {
            return RetrievalStageResult.skipped("sparse_index_unavailable");
        }
        long started = System.nanoTime();
        try {
            List<String> keywords = tokenizer.queryKeywords(query);
            if (keywords.isEmpty()) {
                return RetrievalStageResult.empty();
            }
            List<SparseMatch> matches = sparseIndex.search(keywords, topK);
            long tookMs = (System.nanoTime() - started) / 1_000_000L;
            return RetrievalStageResult.success(matches, tookMs);
        } catch (RuntimeException e) {
            return RetrievalStageResult.error(e.getMessage());
        }
    }
}
