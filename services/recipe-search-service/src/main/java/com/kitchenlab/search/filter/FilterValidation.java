package com.kitchenlab.search.filter;

import java.util.List;
import java.util.Optional;

/**
 * Result of building a {@link RecipeFilter}: either the filter or every violation found.
 */
public final class FilterValidation {
    private final RecipeFilter filter;
    private final List<String> errors;

    private FilterValidation(RecipeFilter filter, List<String> errors) {
        this.filter = filter;
        this.errors = errors;
    }

    static FilterValidation valid(RecipeFilter filter) {
        return new FilterValidation(filter, List.of());
    }

    static FilterValidation invalid(List<String> errors) {
        return new FilterValidation(null, List.copyOf(errors));
    }

    public boolean isValid() {
        return filter != null;
    }

    public Optional<RecipeFilter> getFilter() {
        return Optional.ofNullable(filter);
    }

    public List<String> getErrors() {
        return errors;
    }

    public RecipeFilter orElseThrow() {
        if (filter == null) {
            throw new FilterValidationException(errors);
        }
        return filter;
    }
}
