package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Counts and classification of a reconciliation run.
 *
 * <p>{@code matchingRecords} is {@code sourceRecordCount - missingCount}.
 */
public record ReconciliationSummary(
    @JsonProperty("source_record_count") int sourceRecordCount,
    @JsonProperty("destination_record_count") int destinationRecordCount,
    @JsonProperty("matching_records") int matchingRecords,
    @JsonProperty("missing_count") int missingCount,
    @JsonProperty("extra_count") int extraCount,
    @JsonProperty("mismatch_count") int mismatchCount,
    @JsonProperty("key_fields") List<String> keyFields,
    @JsonProperty("strict") boolean strict,
    @JsonProperty("status") ReconciliationStatus status,
    @JsonProperty("priority") PriorityLevel priority,
    @JsonProperty("recommendations") List<String> recommendations
) implements Serializable {

    public ReconciliationSummary {
        keyFields = List.copyOf(keyFields);
        recommendations = List.copyOf(recommendations);
    }

    public int totalDifferences() {
        return missingCount + extraCount + mismatchCount;
    }
}
