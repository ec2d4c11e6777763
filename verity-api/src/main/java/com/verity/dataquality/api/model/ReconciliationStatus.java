package com.verity.dataquality.api.model;

/**
 * Coarse classification of how far two datasets are apart.
 */
public enum ReconciliationStatus {
    PERFECT_MATCH("Perfect Match"),
    MINOR_DIFFERENCES("Minor Differences"),
    MODERATE_DIFFERENCES("Moderate Differences"),
    MAJOR_DIFFERENCES("Major Differences");

    private final String label;

    ReconciliationStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
