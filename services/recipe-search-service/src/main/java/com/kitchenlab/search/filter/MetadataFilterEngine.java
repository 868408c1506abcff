package com.kitchenlab.search.filter;

import com.kitchenlab.search.model.RecipeMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Evaluates a {@link RecipeFilter} against recipe metadata. Dimensions combine with AND; the
 * requested dietary restrictions combine with OR.
 */
@Component
public class MetadataFilterEngine {

    public boolean passes(RecipeMetadata metadata, RecipeFilter filter) {
        if (filter == null || !filter.hasFilters()) {
            return true;
        }
        if (metadata == null) {
            return false;
        }
        if (filter.getDifficulty() != null && filter.getDifficulty() != metadata.getDifficulty()) {
            return false;
        }
        if (!inRange(metadata.getPrepTime(), filter.getPrepTimeMin(), filter.getPrepTimeMax())) {
            return false;
        }
        if (!inRange(metadata.getCookTime(), filter.getCookTimeMin(), filter.getCookTimeMax())) {
            return false;
        }
        if (!inRange(metadata.getServings(), filter.getServingsMin(), filter.getServingsMax())) {
            return false;
        }
        if (filter.getMaxTotalTime() != null) {
            Integer total = metadata.getTotalTime();
            if (total == null || total > filter.getMaxTotalTime()) {
                return false;
            }
        }
        if (!filter.getDietaryRestrictions().isEmpty()) {
            String text = metadata.dietaryText();
            boolean any = false;
            for (String restriction : filter.getDietaryRestrictions()) {
                if (DietaryRules.satisfies(restriction, text)) {
                    any = true;
                    break;
                }
            }
            return any;
        }
        return true;
    }

    public <T> List<T> apply(List<T> candidates, RecipeFilter filter, Function<T, RecipeMetadata> metadataOf) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        if (filter == null || !filter.hasFilters()) {
            return new ArrayList<>(candidates);
        }
        List<T> kept = new ArrayList<>(candidates.size());
        for (T candidate : candidates) {
            if (passes(metadataOf.apply(candidate), filter)) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private static boolean inRange(Integer value, Integer min, Integer max) {
        if (min == null && max == null) {
            return true;
        }
        if (value == null) {
            return false;
        }
        if (min != null && value < min) {
            return false;
        }
        return max == null || value <= max;
    }
}
