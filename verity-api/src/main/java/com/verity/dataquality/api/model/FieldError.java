package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One validation error, attributed to the field and constraint that produced it.
 *
 * @param message the same text that appears in {@link ValidationOutcome#errors()}
 */
public record FieldError(
    @JsonProperty("field") String field,
    @JsonProperty("category") ErrorCategory category,
    @JsonProperty("message") String message
) implements Serializable {

    public static FieldError of(String field, ErrorCategory category, String message) {
        return new FieldError(field, category, message);
    }
}
