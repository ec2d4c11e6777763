/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.api;

import com.verity.dataquality.api.model.DataRecord;
import com.verity.dataquality.api.model.RuleSet;
import com.verity.dataquality.api.model.ValidationOutcome;

import java.util.List;

/**
 * Contract for checking records against field rules.
 *
 * <p>Implementations are pure with respect to their inputs: the same record and
 * rules always yield an equal outcome, and evaluating one record never depends
 * on another.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RuleSet rules = loader.load(Path.of("mapping.csv"));
 * ValidationOutcome outcome = validator.validate(record, rules);
 * if (!outcome.isValid()) {
 *     outcome.errors().forEach(System.out::println);
 * }
 * }</pre>
 */
public interface IRecordValidator {

    /**
     * Validates one record against every rule of the set.
     *
     * @param record the record to validate
     * @param rules  the rules, must not be empty
     * @return the outcome for the record
     * @throws com.verity.dataquality.api.exceptions.PreconditionViolationException
     *         if the rule set is empty
     */
    ValidationOutcome validate(DataRecord record, RuleSet rules);

    /**
     * Validates records in input order.
     */
    default List<ValidationOutcome> validateAll(List<DataRecord> records, RuleSet rules) {
        return records.stream()
            .map(record -> validate(record, rules))
            .toList();
    }
}
