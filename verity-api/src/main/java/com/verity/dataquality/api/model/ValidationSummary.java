package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate counts over a validation run.
 *
 * @param successRate      percentage of valid records, 0 when there are no records
 * @param errorsByField    error count per field, fields in order of first error
 * @param errorsByCategory error count per constraint kind, only kinds that occurred
 */
public record ValidationSummary(
    @JsonProperty("total_records") int totalRecords,
    @JsonProperty("valid_records") int validRecords,
    @JsonProperty("invalid_records") int invalidRecords,
    @JsonProperty("total_errors") int totalErrors,
    @JsonProperty("total_warnings") int totalWarnings,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("errors_by_field") Map<String, Integer> errorsByField,
    @JsonProperty("errors_by_category") Map<ErrorCategory, Integer> errorsByCategory
) implements Serializable {

    public ValidationSummary {
        errorsByField = errorsByField == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(errorsByField));
        errorsByCategory = errorsByCategory == null || errorsByCategory.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(errorsByCategory));
    }

    public static ValidationSummary of(List<ValidationOutcome> outcomes) {
        int total = outcomes.size();
        int valid = 0;
        int errors = 0;
        int warnings = 0;
        Map<String, Integer> byField = new LinkedHashMap<>();
        Map<ErrorCategory, Integer> byCategory = new EnumMap<>(ErrorCategory.class);
        for (ValidationOutcome outcome : outcomes) {
            if (outcome.isValid()) valid++;
            errors += outcome.errors().size();
            warnings += outcome.warnings().size();
            for (FieldError error : outcome.fieldErrors()) {
                byField.merge(error.field(), 1, Integer::sum);
                byCategory.merge(error.category(), 1, Integer::sum);
            }
        }
        double rate = total == 0 ? 0.0 : (valid * 100.0) / total;
        return new ValidationSummary(total, valid, total - valid, errors, warnings, rate, byField, byCategory);
    }

    /**
     * Number of distinct fields with at least one error.
     */
    public int fieldsWithErrors() {
        return errorsByField.size();
    }
}
