/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.runtime.evaluation;

import com.verity.dataquality.api.model.ErrorCategory;
import com.verity.dataquality.api.model.FieldError;
import com.verity.dataquality.api.model.FieldResult;
import com.verity.dataquality.api.model.FieldRule;
import com.verity.dataquality.runtime.operators.PatternMatcher;
import com.verity.dataquality.runtime.operators.TypeChecker;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks one raw value against one rule.
 *
 * <p>An empty value (null, or blank after trimming) is settled by requiredness
 * alone: a required field yields a single "required" error and nothing else
 * runs; an optional field passes. A non-empty value goes through the type,
 * length, pattern and allowed-values checks in that order, and every failing
 * check contributes its own message.
 *
 * <p>Rule artifacts that cannot be applied, an invalid regex or a regex that
 * exhausts its step budget, produce warnings and never errors.
 */
public final class FieldValidator {

    private final PatternMatcher patternMatcher;

    public FieldValidator() {
        this(new PatternMatcher());
    }

    public FieldValidator(PatternMatcher patternMatcher) {
        this.patternMatcher = patternMatcher;
    }

    public FieldResult validateField(String value, FieldRule rule) {
        String field = rule.fieldName();

        if (isEmpty(value)) {
            return rule.required()
                ? FieldResult.error(FieldError.of(field, ErrorCategory.REQUIRED,
                    "Field '" + field + "' is required but missing"))
                : FieldResult.ok();
        }

        List<FieldError> errors = new ArrayList<>(2);
        List<String> warnings = new ArrayList<>(1);

        Optional<String> typeFailure = TypeChecker.check(value, rule);
        typeFailure.ifPresent(detail -> errors.add(FieldError.of(field, ErrorCategory.DATA_TYPE,
            "Field '" + field + "' has invalid data type. Expected: " + rule.originalTypeSpec()
                + ", Got: " + value + (detail.isEmpty() ? "" : " (" + detail + ")"))));

        int length = value.codePointCount(0, value.length());
        if (rule.minLength() != null && length < rule.minLength()) {
            errors.add(FieldError.of(field, ErrorCategory.LENGTH,
                "Field '" + field + "' is too short. Minimum length: " + rule.minLength()
                    + ", Actual: " + length + ", Value: '" + value + "'"));
        }
        if (rule.maxLength() != null && length > rule.maxLength()) {
            errors.add(FieldError.of(field, ErrorCategory.LENGTH,
                "Field '" + field + "' is too long. Maximum length: " + rule.maxLength()
                    + ", Actual: " + length + ", Value: '" + value + "'"));
        }

        if (rule.pattern() != null) {
            PatternMatcher.Outcome outcome = patternMatcher.match(rule.pattern(), value);
            switch (outcome.status()) {
                case NOT_MATCHED -> errors.add(FieldError.of(field, ErrorCategory.PATTERN,
                    "Field '" + field + "' does not match required pattern: " + rule.pattern()
                        + ", Value: '" + value + "'"));
                case INVALID_PATTERN -> warnings.add(
                    "Invalid regex pattern for field '" + field + "': " + rule.pattern());
                case STEP_LIMIT_EXCEEDED -> warnings.add(
                    "Pattern check skipped for field '" + field + "': evaluation of " + rule.pattern()
                        + " was abandoned (" + outcome.detail() + ")");
                case MATCHED -> {
                }
            }
        }

        if (rule.hasAllowedValues() && !rule.allowedValues().contains(value)) {
            errors.add(FieldError.of(field, ErrorCategory.ALLOWED_VALUES,
                "Field '" + field + "' has invalid value '" + value + "'. Allowed values: "
                    + String.join(", ", rule.allowedValues())));
        }

        if (errors.isEmpty() && warnings.isEmpty()) {
            return FieldResult.ok();
        }
        return new FieldResult(errors, warnings);
    }

    static boolean isEmpty(String value) {
        return value == null || value.isBlank();
    }
}
