/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.runtime.detection;

import com.verity.dataquality.api.exceptions.PreconditionViolationException;
import com.verity.dataquality.api.model.DataRecord;
import com.verity.dataquality.api.model.DataType;
import com.verity.dataquality.api.model.FieldRule;
import com.verity.dataquality.api.model.FormattingIssue;
import com.verity.dataquality.api.model.RuleSet;
import com.verity.dataquality.runtime.operators.DecimalPrecisionChecker;
import com.verity.dataquality.runtime.operators.DecimalSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Flags representational inconsistencies that do not make a value wrong:
 * stray whitespace, mixed-case email addresses, malformed phone numbers,
 * unusual date layouts and decimals written with the wrong number of places.
 *
 * <p>Name-based checks apply to every column; type-based checks apply to
 * columns that have a rule. Findings never affect record validity.
 */
public final class FormattingConsistencyChecker {

    private static final Pattern PHONE = Pattern.compile("^\\+?[1-9]\\d{0,15}$");
    private static final Pattern PHONE_PUNCTUATION = Pattern.compile("[\\s\\-().]");

    public List<FormattingIssue> detectFormattingIssues(List<DataRecord> records, RuleSet rules) {
        if (records == null) {
            throw new PreconditionViolationException("Cannot check formatting of a dataset that was not loaded");
        }
        Map<String, FieldRule> byField = rules == null ? Map.of() : rules.byFieldName();

        List<FormattingIssue> issues = new ArrayList<>();
        for (DataRecord record : records) {
            List<String> found = new ArrayList<>();
            record.values().forEach((field, value) -> inspect(field, value, byField.get(field), found));
            if (!found.isEmpty()) {
                issues.add(new FormattingIssue(record.rowIndex(), found));
            }
        }
        return issues;
    }

    private static void inspect(String field, String value, FieldRule rule, List<String> found) {
        if (value == null || value.isBlank()) {
            return;
        }
        String trimmed = value.trim();
        String lowerName = field.toLowerCase(Locale.ROOT);

        if (!trimmed.equals(value)) {
            found.add("Field '" + field + "' has leading or trailing whitespace: '" + value + "'");
        }
        if (lowerName.contains("email") && !value.equals(value.toLowerCase(Locale.ROOT))) {
            found.add("Field '" + field + "' contains uppercase characters: '" + value + "'");
        }
        if ((lowerName.contains("phone") || lowerName.contains("mobile"))
                && !PHONE.matcher(PHONE_PUNCTUATION.matcher(value).replaceAll("")).matches()) {
            found.add("Field '" + field + "' is not a well-formed phone number: '" + value + "'");
        }
        if (rule == null) {
            return;
        }
        if (rule.dataType() == DataType.DATE && !DateShapeMatcher.hasKnownShape(trimmed)) {
            found.add("Field '" + field + "' uses a non-standard date format: '" + value + "'");
        }
        if (rule.dataType() == DataType.DECIMAL) {
            checkDecimalPlaces(field, value, trimmed, DecimalSpec.parse(rule.originalTypeSpec()), found);
        }
    }

    private static void checkDecimalPlaces(String field, String value, String trimmed,
                                           Optional<DecimalSpec> spec, List<String> found) {
        if (spec.isEmpty() || !DecimalPrecisionChecker.isPlainDecimal(trimmed)) {
            return;
        }
        int point = trimmed.indexOf('.');
        int places = point < 0 ? 0 : trimmed.length() - point - 1;
        if (places != spec.get().scale()) {
            found.add("Field '" + field + "' has " + places + " decimal places, expected "
                + spec.get().scale() + ": '" + value + "'");
        }
    }
}
