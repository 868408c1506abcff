package com.kitchenlab.search.sparse;

import com.kitchenlab.search.model.RecipeDocument;
import com.kitchenlab.search.retrieval.SparseMatch;
import com.kitchenlab.search.text.RecipeTokenizer;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the current BM25 snapshot. Queries read the published reference without locking; a
 * rebuild swaps in a fully built snapshot or leaves the previous one in place.
 */
@Component
public class SparseIndex {
    private static final Logger log = LoggerFactory.getLogger(SparseIndex.class);

    private final RecipeTokenizer tokenizer;
    private final double k1;
    private final double b;
    private final AtomicReference<Bm25Index> current = new AtomicReference<>();

    public SparseIndex(RecipeTokenizer tokenizer, SparseIndexProperties properties) {
        if (properties.getK1() < 0.0 || Double.isNaN(properties.getK1())) {
            throw new IllegalArgumentException("search.sparse.k1 must be >= 0");
        }
        if (properties.getB() < 0.0 || properties.getB() > 1.0 || Double.isNaN(properties.getB())) {
            throw new IllegalArgumentException("search.sparse.b must be within [0, 1]");
        }
        this.tokenizer = tokenizer;
        this.k1 = properties.getK1();
        this.b = properties.getB();
    }

    public synchronized Bm25Index build(Collection<RecipeDocument> documents) {
        if (documents == null) {
            throw new SparseIndexBuildException("document set is required");
        }
        long started = System.nanoTime();
        Bm25Index index;
        try {
            index = Bm25Index.build(documents, tokenizer::documentKeywords, k1, b);
        } catch (SparseIndexBuildException e) {
            log.error("sparse index build failed; keeping previous index: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("sparse index build failed; keeping previous index", e);
            throw new SparseIndexBuildException("sparse index build failed", e);
        }
        current.set(index);
        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        log.info(
            "sparse index built: documents={} vocabulary={} took_ms={}",
            index.size(),
            index.vocabularySize(),
            tookMs
        );
        return index;
    }

    public List<SparseMatch> search(List<String> queryTokens, int topN) {
        Bm25Index snapshot = current.get();
        if (snapshot == null) {
            return List.of();
        }
        return snapshot.search(queryTokens, topN);
    }

    public Optional<Bm25Index> snapshot() {
        return Optional.ofNullable(current.get());
    }

    public boolean isBuilt() {
        return current.get() != null;
    }
}
