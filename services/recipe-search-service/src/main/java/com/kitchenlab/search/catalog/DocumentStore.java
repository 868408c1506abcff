package com.kitchenlab.search.catalog;

import com.kitchenlab.search.model.RecipeDocument;
import com.kitchenlab.search.model.RecipeMetadata;
import java.util.List;
import java.util.Optional;

public interface DocumentStore {
    List<RecipeDocument> getAllDocuments();

    Optional<RecipeMetadata> getDocumentMetadata(String id);
}
