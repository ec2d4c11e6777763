/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.api.model;

import java.util.Locale;

/**
 * Normalized data type of a field rule.
 *
 * <p>Raw declarations coming from mapping sheets are heterogeneous
 * ({@code "DECIMAL(18,2)"}, {@code "Picklist"}, {@code "datetime"}, ...).
 * {@link #fromTypeSpec(String)} folds them into one of the five types the
 * engine knows how to check. Anything unrecognized becomes {@link #STRING}.
 */
public enum DataType {
    STRING,
    INTEGER,
    DECIMAL,
    DATE,
    BOOLEAN;

    /**
     * Normalizes a raw type declaration.
     *
     * <p>Substring checks run in a fixed order, so {@code "decimal"} wins over
     * {@code "int"} and {@code "datetime"} resolves to {@link #DATE}.
     *
     * @param typeSpec raw declaration, may be null
     * @return the normalized type, never null
     */
    public static DataType fromTypeSpec(String typeSpec) {
        if (typeSpec == null || typeSpec.isBlank()) {
            return STRING;
        }
        String normalized = typeSpec.trim().toLowerCase(Locale.ROOT);

        if (containsAny(normalized, "decimal", "number", "double", "float", "currency", "percent")) {
            return DECIMAL;
        }
        if (normalized.contains("bool")) {
            return BOOLEAN;
        }
        if (containsAny(normalized, "timestamp", "datetime", "date", "time")) {
            return DATE;
        }
        if (containsAny(normalized, "string", "text", "picklist")) {
            return STRING;
        }
        if (normalized.contains("int")) {
            return INTEGER;
        }
        return STRING;
    }

    private static boolean containsAny(String value, String... needles) {
        for (String needle : needles) {
            if (value.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
