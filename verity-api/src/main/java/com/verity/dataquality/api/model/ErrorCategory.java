package com.verity.dataquality.api.model;

/**
 * Kind of constraint a validation error reports on, one per field check.
 */
public enum ErrorCategory {
    REQUIRED,
    DATA_TYPE,
    LENGTH,
    PATTERN,
    ALLOWED_VALUES
}
