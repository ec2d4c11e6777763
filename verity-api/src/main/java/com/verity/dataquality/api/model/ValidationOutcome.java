/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Result of validating one record against a rule set.
 *
 * <p>{@code valid} is derived: it is false iff {@code errors} is non-empty.
 * Warnings never affect validity. {@code fieldErrors} attributes each message
 * of {@code errors}, in the same order, to its field and constraint.
 */
@JsonIgnoreProperties(value = "is_valid", allowGetters = true)
public record ValidationOutcome(
    @JsonProperty("row_index") int rowIndex,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("field_errors") List<FieldError> fieldErrors
) implements Serializable {

    public ValidationOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        fieldErrors = fieldErrors == null ? List.of() : List.copyOf(fieldErrors);
    }

    /**
     * Builds an outcome from attributed errors; {@code errors} is derived from their messages.
     */
    public static ValidationOutcome of(int rowIndex, List<FieldError> fieldErrors, List<String> warnings) {
        List<String> messages = fieldErrors.stream().map(FieldError::message).toList();
        return new ValidationOutcome(rowIndex, messages, warnings, fieldErrors);
    }

    @JsonProperty("is_valid")
    public boolean isValid() {
        return errors.isEmpty();
    }
}
