package com.kitchenlab.search.model;

import java.util.ArrayList;
import java.util.List;

public final class RecipeDocument {
    private final String id;
    private final RecipeMetadata metadata;

    public RecipeDocument(String id, RecipeMetadata metadata) {
        this.id = id;
        this.metadata = metadata;
    }

    public String getId() {
        return id;
    }

    public RecipeMetadata getMetadata() {
        return metadata;
    }

    public String searchableText() {
        if (metadata == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        parts.add(metadata.getTitle());
        parts.addAll(metadata.getIngredients());
        parts.addAll(metadata.getInstructions());
        return String.join(" ", parts);
    }

    /**
     * Labelled multi-line description used as embedding input.
     */
    public String embeddingText() {
        if (metadata == null) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        lines.add("Recipe: " + metadata.getTitle());
        if (metadata.getDifficulty() != null) {
            lines.add("Difficulty: " + metadata.getDifficulty().getLabel());
        }
        if (metadata.getPrepTime() != null && metadata.getCookTime() != null) {
            lines.add(
                "Cooking time: " + metadata.getPrepTime() + " minutes prep, " + metadata.getCookTime() + " minutes cook"
            );
        }
        if (metadata.getServings() != null) {
            lines.add("Serves " + metadata.getServings() + " people");
        }
        lines.add("Ingredients: " + String.join(" | ", metadata.getIngredients()));
        lines.add("Instructions: " + String.join(" ", metadata.getInstructions()));
        return String.join("\n", lines);
    }
}
