package com.kitchenlab.search.catalog;

import com.kitchenlab.search.model.RecipeDocument;
import com.kitchenlab.search.model.RecipeMetadata;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Insertion-ordered recipe store. A document whose id is already present replaces the stored one
 * in place.
 */
@Component
public class InMemoryDocumentStore implements DocumentStore {
    private volatile Map<String, RecipeDocument> documents = Map.of();

    public synchronized void replaceAll(Collection<RecipeDocument> replacement) {
        Map<String, RecipeDocument> next = new LinkedHashMap<>();
        if (replacement != null) {
            for (RecipeDocument document : replacement) {
                if (document != null && document.getId() != null) {
                    next.put(document.getId(), document);
                }
            }
        }
        documents = next;
    }

    public synchronized void put(RecipeDocument document) {
        if (document == null || document.getId() == null) {
            throw new IllegalArgumentException("document id is required");
        }
        Map<String, RecipeDocument> next = new LinkedHashMap<>(documents);
        next.put(document.getId(), document);
        documents = next;
    }

    @Override
    public List<RecipeDocument> getAllDocuments() {
        return new ArrayList<>(documents.values());
    }

    @Override
    public Optional<RecipeMetadata> getDocumentMetadata(String id) {
        if (id == null) {
            return Optional.empty();
        }
        RecipeDocument document = documents.get(id);
        return document == null ? Optional.empty() : Optional.ofNullable(document.getMetadata());
    }

    public int size() {
        return documents.size();
    }
}
