package com.kitchenlab.search.embed;

import com.kitchenlab.search.text.RecipeTokenizer;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Deterministic feature-hashing embedder for local runs. Texts that share keywords land close to
 * each other, which is enough to exercise the dense path without an embedding service.
 */
@Component
public class ToyEmbedder {
    public static final int DIMENSION = 384;

    private final RecipeTokenizer tokenizer;

    public ToyEmbedder(RecipeTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public List<Double> embed(String text) {
        double[] values = new double[DIMENSION];
        for (String keyword : tokenizer.queryKeywords(text)) {
            int hash = keyword.hashCode();
            int bucket = Math.floorMod(hash, DIMENSION);
            values[bucket] += ((hash >>> 16) & 1) == 0 ? 1.0 : -1.0;
        }
        double sumSquares = 0.0;
        for (double value : values) {
            sumSquares += value * value;
        }
        double norm = sumSquares == 0.0 ? 1.0 : Math.sqrt(sumSquares);
        List<Double> vector = new ArrayList<>(DIMENSION);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }
}
