package com.kitchenlab.search.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recipe fields that search results carry and filters inspect.
 *
 * <p>Numeric fields are nullable: a value that is missing or not numeric in the source payload is
 * kept as {@code null} so range checks can fail closed on it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RecipeMetadata {
    private final String title;
    private final Difficulty difficulty;
    private final Integer prepTime;
    private final Integer cookTime;
    private final Integer servings;
    private final List<String> ingredients;
    private final List<String> instructions;

    public RecipeMetadata(
        String title,
        Difficulty difficulty,
        Integer prepTime,
        Integer cookTime,
        Integer servings,
        List<String> ingredients,
        List<String> instructions
    ) {
        this.title = title == null ? "" : title;
        this.difficulty = difficulty;
        this.prepTime = nonNegative(prepTime);
        this.cookTime = nonNegative(cookTime);
        this.servings = nonNegative(servings);
        this.ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        this.instructions = instructions == null ? List.of() : List.copyOf(instructions);
    }

    public static RecipeMetadata fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || !node.isObject()) {
            return null;
        }
        return new RecipeMetadata(
            node.path("title").asText(""),
            Difficulty.fromString(node.path("difficulty").asText(null)),
            readInt(node.get("prep_time")),
            readInt(node.get("cook_time")),
            readInt(node.get("servings")),
            readStrings(node.get("ingredients")),
            readStrings(node.get("instructions"))
        );
    }

    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @JsonProperty("difficulty")
    public Difficulty getDifficulty() {
        return difficulty;
    }

    @JsonProperty("prep_time")
    public Integer getPrepTime() {
        return prepTime;
    }

    @JsonProperty("cook_time")
    public Integer getCookTime() {
        return cookTime;
    }

    @JsonProperty("total_time")
    public Integer getTotalTime() {
        if (prepTime == null || cookTime == null) {
            return null;
        }
        try {
            return Math.addExact(prepTime, cookTime);
        } catch (ArithmeticException e) {
            return null;
        }
    }

    @JsonProperty("servings")
    public Integer getServings() {
        return servings;
    }

    @JsonProperty("ingredients")
    public List<String> getIngredients() {
        return ingredients;
    }

    @JsonProperty("instructions")
    public List<String> getInstructions() {
        return instructions;
    }

    /**
     * Lower-cased title and ingredients, the text dietary checks run against.
     */
    @JsonIgnore
    public String dietaryText() {
        StringBuilder builder = new StringBuilder(title.toLowerCase(Locale.ROOT));
        builder.append(' ');
        builder.append(String.join(" ", ingredients).toLowerCase(Locale.ROOT));
        return builder.toString();
    }

    private static Integer nonNegative(Integer value) {
        return value == null || value < 0 ? null : value;
    }

    private static Integer readInt(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static List<String> readStrings(JsonNode value) {
        if (value == null || !value.isArray()) {
            return List.of();
        }
        List<String> items = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (item != null && item.isTextual()) {
                items.add(item.asText());
            }
        }
        return items;
    }
}
