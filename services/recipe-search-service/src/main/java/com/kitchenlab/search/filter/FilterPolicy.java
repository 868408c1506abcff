package com.kitchenlab.search.filter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Absolute bounds and the dietary vocabulary a {@link RecipeFilter} is validated against.
 */
public final class FilterPolicy {
    private final int maxMinutes;
    private final int servingsMin;
    private final int servingsMax;
    private final Set<String> supportedDietaryRestrictions;

    public FilterPolicy(int maxMinutes, int servingsMin, int servingsMax, Collection<String> supportedDietaryRestrictions) {
        if (maxMinutes < 0) {
            throw new IllegalArgumentException("search.filter.max-minutes must be >= 0");
        }
        if (servingsMin < 1 || servingsMax < servingsMin) {
            throw new IllegalArgumentException("search.filter servings range is invalid");
        }
        this.maxMinutes = maxMinutes;
        this.servingsMin = servingsMin;
        this.servingsMax = servingsMax;
        Set<String> supported = new LinkedHashSet<>();
        if (supportedDietaryRestrictions != null) {
            for (String restriction : supportedDietaryRestrictions) {
                String normalized = normalize(restriction);
                if (normalized != null) {
                    supported.add(normalized);
                }
            }
        }
        this.supportedDietaryRestrictions = Collections.unmodifiableSet(supported);
    }

    public static FilterPolicy from(FilterProperties properties) {
        return new FilterPolicy(
            properties.getMaxMinutes(),
            properties.getServingsMin(),
            properties.getServingsMax(),
            properties.getSupportedDietaryRestrictions()
        );
    }

    public static FilterPolicy defaults() {
        return from(new FilterProperties());
    }

    public int getMaxMinutes() {
        return maxMinutes;
    }

    public int getServingsMin() {
        return servingsMin;
    }

    public int getServingsMax() {
        return servingsMax;
    }

    public Set<String> getSupportedDietaryRestrictions() {
        return supportedDietaryRestrictions;
    }

    public boolean isSupportedDietaryRestriction(String restriction) {
        String normalized = normalize(restriction);
        return normalized != null && supportedDietaryRestrictions.contains(normalized);
    }

    static String normalize(String restriction) {
        if (restriction == null) {
            return null;
        }
        String trimmed = restriction.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }
}
