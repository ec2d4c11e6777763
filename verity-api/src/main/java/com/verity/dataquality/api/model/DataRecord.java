/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One input row: an ordered mapping from column name to raw string value.
 *
 * <p>Values are never pre-typed; all coercion happens at validation time.
 * A {@code null} value means the column was absent for this row.
 *
 * @param rowIndex 1-based position of the row in its dataset
 * @param values   column values in header order
 */
public record DataRecord(
    @JsonProperty("row_index") int rowIndex,
    @JsonProperty("values") Map<String, String> values
) implements Serializable {

    public DataRecord {
        values = values == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Numbers a list of raw rows from 1, in order.
     */
    public static List<DataRecord> fromRows(List<? extends Map<String, String>> rows) {
        List<DataRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            records.add(new DataRecord(i + 1, rows.get(i)));
        }
        return records;
    }

    public String value(String field) {
        return values.get(field);
    }

    public Set<String> fieldNames() {
        return values.keySet();
    }
}
