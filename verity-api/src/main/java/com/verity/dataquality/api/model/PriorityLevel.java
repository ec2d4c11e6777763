package com.verity.dataquality.api.model;

/**
 * Recommended follow-up priority for a reconciliation, based on the total
 * number of differences.
 */
public enum PriorityLevel {
    LOW,
    MEDIUM,
    HIGH
}
