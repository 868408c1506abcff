package com.kitchenlab.search.catalog;

import com.kitchenlab.search.model.RecipeDocument;
import com.kitchenlab.search.sparse.Bm25Index;
import com.kitchenlab.search.sparse.SparseIndex;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class RecipeIndexingService {
    private final DocumentStore documentStore;
    private final SparseIndex sparseIndex;

    public RecipeIndexingService(DocumentStore documentStore, SparseIndex sparseIndex) {
        this.documentStore = documentStore;
        this.sparseIndex = sparseIndex;
    }

    /**
     * Rebuilds the sparse index from the current document store contents.
     *
     * @throws com.kitchenlab.search.sparse.SparseIndexBuildException when the build fails; the
     *     previous index keeps serving
     */
    public IndexStats rebuild() {
        List<RecipeDocument> documents = documentStore.getAllDocuments();
        return toStats(sparseIndex.build(documents));
    }

    public IndexStats stats() {
        return sparseIndex.snapshot().map(RecipeIndexingService::toStats).orElseGet(IndexStats::notBuilt);
    }

    private static IndexStats toStats(Bm25Index index) {
        return new IndexStats(
            true,
            index.size(),
            index.vocabularySize(),
            index.getAverageLength(),
            index.getBuiltAtMs()
        );
    }
}
