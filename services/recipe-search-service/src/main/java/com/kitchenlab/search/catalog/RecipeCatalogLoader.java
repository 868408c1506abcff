package com.kitchenlab.search.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kitchenlab.search.embed.EmbeddingProvider;
import com.kitchenlab.search.model.RecipeDocument;
import com.kitchenlab.search.model.RecipeMetadata;
import com.kitchenlab.search.vector.InMemoryVectorStore;
import com.kitchenlab.search.vector.VectorStore;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Loads the recipe catalog from a JSON array, fills the document store and builds the sparse
 * index. In memory vector mode every recipe is embedded and upserted as well.
 */
@Component
public class RecipeCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(RecipeCatalogLoader.class);

    private final CatalogProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final InMemoryDocumentStore documentStore;
    private final RecipeIndexingService indexingService;
    private final VectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;

    public RecipeCatalogLoader(
        CatalogProperties properties,
        ResourceLoader resourceLoader,
        ObjectMapper objectMapper,
        InMemoryDocumentStore documentStore,
        RecipeIndexingService indexingService,
        VectorStore vectorStore,
        EmbeddingProvider embeddingProvider
    ) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.documentStore = documentStore;
        this.indexingService = indexingService;
        this.vectorStore = vectorStore;
        this.embeddingProvider = embeddingProvider;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isLoadOnStartup()) {
            log.info("catalog load on startup disabled");
            return;
        }
        load();
    }

    public int load() {
        List<RecipeDocument> documents = readCatalog(properties.getLocation());
        documentStore.replaceAll(documents);
        IndexStats stats = indexingService.rebuild();
        int embedded = 0;
        if (vectorStore instanceof InMemoryVectorStore) {
            embedded = embedAll((InMemoryVectorStore) vectorStore, documentStore.getAllDocuments());
        }
        log.info(
            "catalog loaded: location={} documents={} vocabulary={} embedded={}",
            properties.getLocation(),
            stats.getDocumentCount(),
            stats.getVocabularySize(),
            embedded
        );
        return stats.getDocumentCount();
    }

    List<RecipeDocument> readCatalog(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("recipe catalog not found: " + location);
        }
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read recipe catalog " + location, e);
        }
        JsonNode recipes = root != null && root.isObject() ? root.path("recipes") : root;
        if (recipes == null || !recipes.isArray()) {
            throw new IllegalStateException("recipe catalog must be a JSON array: " + location);
        }
        List<RecipeDocument> documents = new ArrayList<>(recipes.size());
        for (JsonNode node : recipes) {
            RecipeMetadata metadata = RecipeMetadata.fromJson(node);
            if (metadata == null || metadata.getTitle().isBlank()) {
                log.warn("skipping catalog entry without a title");
                continue;
            }
            String id = node.path("id").asText(null);
            if (id == null || id.isBlank()) {
                id = recipeId(metadata.getTitle());
            }
            documents.add(new RecipeDocument(id, metadata));
        }
        return documents;
    }

    private int embedAll(InMemoryVectorStore store, List<RecipeDocument> documents) {
        store.clear();
        int embedded = 0;
        for (RecipeDocument document : documents) {
            try {
                List<Double> vector = embeddingProvider.embed(document.embeddingText(), null);
                store.upsert(document.getId(), vector, document.getMetadata());
                embedded++;
            } catch (RuntimeException e) {
                log.warn("embedding failed for recipe {}: {}", document.getId(), e.getMessage());
            }
        }
        return embedded;
    }

    /**
     * {@code "Chicken Fried-Rice!"} becomes {@code recipe_chicken_fried_rice}.
     */
    public static String recipeId(String title) {
        String lowered = title == null ? "" : title.trim().toLowerCase(Locale.ROOT);
        StringBuilder builder = new StringBuilder("recipe_");
        for (int i = 0; i < lowered.length(); i++) {
            char ch = lowered.charAt(i);
            if (ch == ' ' || ch == '-') {
                builder.append('_');
            } else if (Character.isLetterOrDigit(ch) || ch == '_') {
                builder.append(ch);
            }
        }
        return builder.toString();
    }
}
