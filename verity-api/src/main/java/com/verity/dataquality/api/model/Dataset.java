package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A fully materialized tabular input: the header row plus its records.
 */
public record Dataset(
    @JsonProperty("headers") List<String> headers,
    @JsonProperty("records") List<DataRecord> records
) implements Serializable {

    public Dataset {
        headers = headers == null ? List.of() : List.copyOf(headers);
        records = records == null ? List.of() : List.copyOf(records);
    }

    /**
     * Builds a dataset from raw rows, taking the headers from the first row.
     */
    public static Dataset fromRows(List<? extends Map<String, String>> rows) {
        List<String> headers = rows.isEmpty() ? List.of() : List.copyOf(rows.get(0).keySet());
        return new Dataset(headers, DataRecord.fromRows(rows));
    }

    public int size() {
        return records.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }
}
