package com.kitchenlab.search.filter;

import java.util.List;
import java.util.Map;

/**
 * Keyword heuristics for dietary restrictions. Matching is plain substring search on lower-cased
 * title and ingredient text, so "egg" also matches "eggplant".
 */
public final class DietaryRules {
    public static final List<String> DEFAULT_SUPPORTED = List.of(
        "vegetarian",
        "vegan",
        "gluten-free",
        "dairy-free",
        "nut-free",
        "low-carb",
        "keto",
        "paleo"
    );

    private static final List<String> MEAT = List.of("meat", "chicken", "beef");
    private static final List<String> DAIRY = List.of("milk", "butter", "cheese", "cream", "yogurt");
    private static final List<String> ANIMAL_PRODUCTS = List.of(
        "meat", "chicken", "beef", "milk", "butter", "cheese", "cream", "yogurt", "egg", "honey"
    );

    private static final Map<String, List<String>> EXCLUDED_KEYWORDS = Map.of(
        "vegetarian", MEAT,
        "vegan", ANIMAL_PRODUCTS,
        "dairy-free", DAIRY
    );

    private DietaryRules() {
    }

    /**
     * @param restriction lower-cased restriction name
     * @param dietaryText lower-cased title and ingredients
     */
    public static boolean satisfies(String restriction, String dietaryText) {
        if (restriction == null || dietaryText == null) {
            return false;
        }
        if (dietaryText.contains(restriction)) {
            return true;
        }
        List<String> excluded = EXCLUDED_KEYWORDS.get(restriction);
        if (excluded == null) {
            return false;
        }
        for (String keyword : excluded) {
            if (dietaryText.contains(keyword)) {
                return false;
            }
        }
        return true;
    }
}
