package com.kitchenlab.search.dense;

import com.kitchenlab.search.resilience.CircuitBreaker;
import com.kitchenlab.search.resilience.SearchResilienceRegistry;
import com.kitchenlab.search.retrieval.DenseMatch;
import com.kitchenlab.search.retrieval.RetrievalException;
import com.kitchenlab.search.retrieval.RetrievalStageResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.springframework.stereotype.Component;

/**
 * Semantic retrieval path. Results are re-checked against the similarity threshold, ordered by
 * descending similarity and cut to size regardless of what the client returned.
 */
@Component
public class DenseRetriever {
    public static final String PATH = "dense";

    private final DenseSearchClient client;
    private final DenseSearchProperties properties;
    private final SearchResilienceRegistry resilienceRegistry;

    public DenseRetriever(
        DenseSearchClient client,
        DenseSearchProperties properties,
        SearchResilienceRegistry resilienceRegistry
    ) {
        this.client = client;
        this.properties = properties;
        this.resilienceRegistry = resilienceRegistry;
    }

    public List<DenseMatch> search(String query, int topN) {
        return search(query, topN, properties.getMinSimilarity());
    }

    public List<DenseMatch> search(String query, int topN, double minSimilarity) {
        return search(query, topN, minSimilarity, () -> false);
    }

    private List<DenseMatch> search(String query, int topN, double minSimilarity, BooleanSupplier abandoned) {
        if (query == null || query.isBlank() || topN <= 0) {
            return List.of();
        }
        CircuitBreaker breaker = resilienceRegistry.getDenseBreaker();
        if (!breaker.allowRequest()) {
            throw new RetrievalException(PATH, "dense_circuit_open");
        }
        List<DenseMatch> raw;
        try {
            raw = client.embedAndSearch(query, topN, minSimilarity);
        } catch (RuntimeException e) {
            if (!abandoned.getAsBoolean()) {
                breaker.recordFailure();
            }
            throw new RetrievalException(PATH, "dense search failed: " + e.getMessage(), e);
        }
        // a call the caller already timed out was counted by recordTimeout
        if (!abandoned.getAsBoolean()) {
            breaker.recordSuccess();
        }
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<DenseMatch> matches = new ArrayList<>(raw.size());
        for (DenseMatch match : raw) {
            if (match != null && match.getDocId() != null && match.getSimilarity() >= minSimilarity) {
                matches.add(match);
            }
        }
        // List.sort is stable, equal similarities keep the client's order
        matches.sort(Comparator.comparingDouble(DenseMatch::getSimilarity).reversed());
        if (matches.size() > topN) {
            return new ArrayList<>(matches.subList(0, topN));
        }
        return matches;
    }

    public RetrievalStageResult<DenseMatch> retrieve(String query, int topK) {
        return retrieve(query, topK, () -> false);
    }

    /**
     * @param abandoned becomes true once the caller stopped waiting; the breaker then ignores the
     *     outcome of this call
     */
    public RetrievalStageResult<DenseMatch> retrieve(String query, int topK, BooleanSupplier abandoned) {
        if (query == null || query.isBlank() || topK <= 0) {
            return RetrievalStageResult.empty();
        }
        long started = System.nanoTime();
        try {
            List<DenseMatch> matches = search(query, topK, properties.getMinSimilarity(), abandoned);
            long tookMs = (System.nanoTime() - started) / 1_000_000L;
            return RetrievalStageResult.success(matches, tookMs);
        } catch (RetrievalException e) {
            return RetrievalStageResult.error(e.getMessage());
        }
    }

    public void recordTimeout() {
        resilienceRegistry.getDenseBreaker().recordFailure();
    }
}
