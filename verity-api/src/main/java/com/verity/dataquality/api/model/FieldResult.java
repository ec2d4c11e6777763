package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Errors and warnings produced by checking one value against one rule.
 */
public record FieldResult(List<FieldError> fieldErrors, List<String> warnings) {

    private static final FieldResult OK = new FieldResult(List.of(), List.of());

    public FieldResult {
        fieldErrors = fieldErrors == null ? List.of() : List.copyOf(fieldErrors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static FieldResult ok() {
        return OK;
    }

    public static FieldResult error(FieldError error) {
        return new FieldResult(List.of(error), List.of());
    }

    /**
     * Error messages in check order.
     */
    public List<String> errors() {
        return fieldErrors.stream().map(FieldError::message).toList();
    }

    @JsonIgnore
    public boolean isValid() {
        return fieldErrors.isEmpty();
    }
}
