package com.kitchenlab.search.dense;

import com.kitchenlab.search.embed.EmbeddingProvider;
import com.kitchenlab.search.retrieval.DenseMatch;
import com.kitchenlab.search.vector.VectorHit;
import com.kitchenlab.search.vector.VectorStore;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingDenseSearchClient implements DenseSearchClient {
    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;

    public EmbeddingDenseSearchClient(EmbeddingProvider embeddingProvider, VectorStore vectorStore) {
        this.embeddingProvider = embeddingProvider;
        this.vectorStore = vectorStore;
    }

    @Override
    public List<DenseMatch> embedAndSearch(String queryText, int topN, double minSimilarity) {
        List<Double> vector = embeddingProvider.embed(queryText, null);
        List<VectorHit> hits = vectorStore.query(vector, topN, null);
        List<DenseMatch> matches = new ArrayList<>(hits.size());
        for (VectorHit hit : hits) {
            double similarity = toSimilarity(hit.getDistance());
            if (similarity >= minSimilarity) {
                matches.add(new DenseMatch(hit.getId(), similarity, hit.getMetadata()));
            }
        }
        return matches;
    }

    static double toSimilarity(double distance) {
        double similarity = 1.0 - distance;
        if (Double.isNaN(similarity) || similarity < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, similarity);
    }
}
