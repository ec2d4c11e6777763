/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Declarative constraints for a single column.
 *
 * <p>{@code originalTypeSpec} keeps the raw declaration because decimal
 * precision and scale are parsed from it, not from {@code dataType}.
 * {@code allowedValues} is stored already split and trimmed; an empty list
 * means the field has no enumeration constraint.
 *
 * <h2>Usage</h2>
 * <pre>
 * FieldRule amount = FieldRule.of("Amount", "DECIMAL(10,2)", false);
 * FieldRule status = FieldRule.of("Status", "string", true)
 *     .withAllowedValues(FieldRule.splitAllowedValues("Active, Inactive"));
 * </pre>
 */
public record FieldRule(
    @JsonProperty("field_name") String fieldName,
    @JsonProperty("data_type") DataType dataType,
    @JsonProperty("original_type_spec") String originalTypeSpec,
    @JsonProperty("required") boolean required,
    @JsonProperty("min_length") Integer minLength,
    @JsonProperty("max_length") Integer maxLength,
    @JsonProperty("pattern") String pattern,
    @JsonProperty("allowed_values") List<String> allowedValues,
    @JsonProperty("description") String description
) implements Serializable {

    public FieldRule {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        if (dataType == null) dataType = DataType.fromTypeSpec(originalTypeSpec);
        if (originalTypeSpec == null) originalTypeSpec = dataType.name().toLowerCase(Locale.ROOT);
        if (pattern != null && pattern.isEmpty()) pattern = null;
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    /**
     * Creates a rule with only a name, a raw type declaration and requiredness.
     */
    public static FieldRule of(String fieldName, String typeSpec, boolean required) {
        return new FieldRule(fieldName, DataType.fromTypeSpec(typeSpec), typeSpec, required,
            null, null, null, null, null);
    }

    /**
     * Splits a comma separated enumeration, trimming each entry and dropping blanks.
     */
    public static List<String> splitAllowedValues(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    public FieldRule withLength(Integer min, Integer max) {
        return new FieldRule(fieldName, dataType, originalTypeSpec, required,
            min, max, pattern, allowedValues, description);
    }

    public FieldRule withPattern(String regex) {
        return new FieldRule(fieldName, dataType, originalTypeSpec, required,
            minLength, maxLength, regex, allowedValues, description);
    }

    public FieldRule withAllowedValues(List<String> values) {
        return new FieldRule(fieldName, dataType, originalTypeSpec, required,
            minLength, maxLength, pattern, values, description);
    }

    public FieldRule withDescription(String text) {
        return new FieldRule(fieldName, dataType, originalTypeSpec, required,
            minLength, maxLength, pattern, allowedValues, text);
    }

    public boolean hasAllowedValues() {
        return !allowedValues.isEmpty();
    }
}
