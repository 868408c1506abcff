package com.kitchenlab.search.filter;

import com.kitchenlab.search.model.Difficulty;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structured constraints on recipe metadata. Instances only come out of a successful
 * {@link Builder#build()}, so every instance is internally consistent.
 */
public final class RecipeFilter {
    private static final RecipeFilter NONE = new RecipeFilter(new Builder(FilterPolicy.defaults()));

    private final Difficulty difficulty;
    private final Integer prepTimeMin;
    private final Integer prepTimeMax;
    private final Integer cookTimeMin;
    private final Integer cookTimeMax;
    private final Integer servingsMin;
    private final Integer servingsMax;
    private final Integer maxTotalTime;
    private final Set<String> dietaryRestrictions;

    private RecipeFilter(Builder builder) {
        this.difficulty = builder.difficulty;
        this.prepTimeMin = builder.prepTimeMin;
        this.prepTimeMax = builder.prepTimeMax;
        this.cookTimeMin = builder.cookTimeMin;
        this.cookTimeMax = builder.cookTimeMax;
        this.servingsMin = builder.servingsMin;
        this.servingsMax = builder.servingsMax;
        this.maxTotalTime = builder.maxTotalTime;
        this.dietaryRestrictions = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dietaryRestrictions));
    }

    public static RecipeFilter none() {
        return NONE;
    }

    public static Builder builder(FilterPolicy policy) {
        return new Builder(policy);
    }

    public boolean hasFilters() {
        return difficulty != null
            || prepTimeMin != null
            || prepTimeMax != null
            || cookTimeMin != null
            || cookTimeMax != null
            || servingsMin != null
            || servingsMax != null
            || maxTotalTime != null
            || !dietaryRestrictions.isEmpty();
    }

    public Difficulty getDifficulty() {
        return difficulty;
    }

    public Integer getPrepTimeMin() {
        return prepTimeMin;
    }

    public Integer getPrepTimeMax() {
        return prepTimeMax;
    }

    public Integer getCookTimeMin() {
        return cookTimeMin;
    }

    public Integer getCookTimeMax() {
        return cookTimeMax;
    }

    public Integer getServingsMin() {
        return servingsMin;
    }

    public Integer getServingsMax() {
        return servingsMax;
    }

    public Integer getMaxTotalTime() {
        return maxTotalTime;
    }

    public Set<String> getDietaryRestrictions() {
        return dietaryRestrictions;
    }

    public static final class Builder {
        private final FilterPolicy policy;
        private final List<String> errors = new ArrayList<>();
        private Difficulty difficulty;
        private Integer prepTimeMin;
        private Integer prepTimeMax;
        private Integer cookTimeMin;
        private Integer cookTimeMax;
        private Integer servingsMin;
        private Integer servingsMax;
        private Integer maxTotalTime;
        private final Set<String> dietaryRestrictions = new LinkedHashSet<>();

        private Builder(FilterPolicy policy) {
            this.policy = policy == null ? FilterPolicy.defaults() : policy;
        }

        public Builder difficulty(Difficulty difficulty) {
            this.difficulty = difficulty;
            return this;
        }

        public Builder difficulty(String difficulty) {
            if (difficulty == null || difficulty.isBlank()) {
                this.difficulty = null;
                return this;
            }
            Difficulty parsed = Difficulty.fromString(difficulty);
            if (parsed == null) {
                errors.add("unknown difficulty: " + difficulty);
            }
            this.difficulty = parsed;
            return this;
        }

        public Builder prepTime(Integer min, Integer max) {
            this.prepTimeMin = min;
            this.prepTimeMax = max;
            return this;
        }

        public Builder cookTime(Integer min, Integer max) {
            this.cookTimeMin = min;
            this.cookTimeMax = max;
            return this;
        }

        public Builder servings(Integer min, Integer max) {
            this.servingsMin = min;
            this.servingsMax = max;
            return this;
        }

        public Builder maxTotalTime(Integer maxTotalTime) {
            this.maxTotalTime = maxTotalTime;
            return this;
        }

        public Builder dietaryRestrictions(Collection<String> restrictions) {
            if (restrictions != null) {
                restrictions.forEach(this::dietaryRestriction);
            }
            return this;
        }

        public Builder dietaryRestriction(String restriction) {
            String normalized = FilterPolicy.normalize(restriction);
            if (normalized == null) {
                return this;
            }
            if (!policy.isSupportedDietaryRestriction(normalized)) {
                errors.add("unsupported dietary restriction: " + restriction);
                return this;
            }
            dietaryRestrictions.add(normalized);
            return this;
        }

        public FilterValidation build() {
            List<String> violations = new ArrayList<>(errors);
            int maxMinutes = policy.getMaxMinutes();
            checkRange(violations, "prep_time", prepTimeMin, prepTimeMax, 0, maxMinutes);
            checkRange(violations, "cook_time", cookTimeMin, cookTimeMax, 0, maxMinutes);
            checkRange(violations, "servings", servingsMin, servingsMax, policy.getServingsMin(), policy.getServingsMax());
            checkBound(violations, "max_total_time", maxTotalTime, 0, maxMinutes);
            if (!violations.isEmpty()) {
                return FilterValidation.invalid(violations);
            }
            return FilterValidation.valid(new RecipeFilter(this));
        }

        private static void checkRange(List<String> violations, String field, Integer min, Integer max, int lower, int upper) {
            checkBound(violations, field + "_min", min, lower, upper);
            checkBound(violations, field + "_max", max, lower, upper);
            if (min != null && max != null && min > max) {
                violations.add(field + "_min (" + min + ") must not exceed " + field + "_max (" + max + ")");
            }
        }

        private static void checkBound(List<String> violations, String field, Integer value, int lower, int upper) {
            if (value != null && (value < lower || value > upper)) {
                violations.add(field + " must be within [" + lower + ", " + upper + "]");
            }
        }
    }
}
