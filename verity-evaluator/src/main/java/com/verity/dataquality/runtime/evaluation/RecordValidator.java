package com.verity.dataquality.runtime.evaluation;

import com.verity.dataquality.api.IRecordValidator;
import com.verity.dataquality.api.exceptions.PreconditionViolationException;
import com.verity.dataquality.api.model.DataRecord;
import com.verity.dataquality.api.model.FieldError;
import com.verity.dataquality.api.model.FieldResult;
import com.verity.dataquality.api.model.FieldRule;
import com.verity.dataquality.api.model.RuleSet;
import com.verity.dataquality.api.model.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies every rule of a set to a record and unions the findings in rule order.
 * A column the record does not carry is validated as an empty value.
 */
public class RecordValidator implements IRecordValidator {
    private static final Logger logger = LoggerFactory.getLogger(RecordValidator.class);

    private final FieldValidator fieldValidator;

    public RecordValidator() {
        this(new FieldValidator());
    }

    public RecordValidator(FieldValidator fieldValidator) {
        this.fieldValidator = fieldValidator;
    }

    @Override
    public ValidationOutcome validate(DataRecord record, RuleSet rules) {
        requireRules(rules);
        if (record == null) {
            throw new PreconditionViolationException("Cannot validate a null record");
        }

        List<FieldError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (FieldRule rule : rules.rules()) {
            FieldResult result = fieldValidator.validateField(record.value(rule.fieldName()), rule);
            errors.addAll(result.fieldErrors());
            warnings.addAll(result.warnings());
        }

        if (!errors.isEmpty() && logger.isDebugEnabled()) {
            logger.debug("Row {} failed {} check(s)", record.rowIndex(), errors.size());
        }
        return ValidationOutcome.of(record.rowIndex(), errors, warnings);
    }

    @Override
    public List<ValidationOutcome> validateAll(List<DataRecord> records, RuleSet rules) {
        requireRules(rules);
        if (records == null) {
            throw new PreconditionViolationException("Cannot validate a dataset that was not loaded");
        }
        List<ValidationOutcome> outcomes = new ArrayList<>(records.size());
        for (DataRecord record : records) {
            outcomes.add(validate(record, rules));
        }
        return outcomes;
    }

    static void requireRules(RuleSet rules) {
        if (rules == null || rules.isEmpty()) {
            throw new PreconditionViolationException("Validation requires at least one field rule");
        }
    }
}
