package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One non-key field whose trimmed values differ between source and destination.
 * The values are reported raw, absent values as the empty string.
 */
public record FieldDiff(
    @JsonProperty("field") String field,
    @JsonProperty("source_value") String sourceValue,
    @JsonProperty("dest_value") String destValue
) implements Serializable {}
