package com.kitchenlab.search.filter;

import java.util.List;

public class FilterValidationException extends RuntimeException {
    private final List<String> errors;

    public FilterValidationException(List<String> errors) {
        super("invalid filter: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
