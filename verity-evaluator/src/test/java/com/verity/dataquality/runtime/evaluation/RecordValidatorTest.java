package com.verity.dataquality.runtime.evaluation;

import com.verity.dataquality.api.exceptions.PreconditionViolationException;
import com.verity.dataquality.api.model.DataRecord;
import com.verity.dataquality.api.model.ErrorCategory;
import com.verity.dataquality.api.model.FieldError;
import com.verity.dataquality.api.model.FieldRule;
import com.verity.dataquality.api.model.RuleSet;
import com.verity.dataquality.api.model.ValidationOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordValidatorTest {

    private final RecordValidator validator = new RecordValidator();

    private final RuleSet rules = RuleSet.of(
            FieldRule.of("id", "int", true),
            FieldRule.of("email", "string", true).withPattern("@"),
            FieldRule.of("score", "DECIMAL(5,2)", false)
    );

    @Test
    @DisplayName("Valid record should have no errors")
    void validRecord() {
        DataRecord record = new DataRecord(1, Map.of("id", "1", "email", "a@b.com", "score", "99.50"));

        ValidationOutcome outcome = validator.validate(record, rules);

        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.rowIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("Missing columns are validated as empty values, errors follow rule order")
    void missingColumnsAreEmpty() {
        DataRecord record = new DataRecord(7, Map.of("score", "1.5"));

        ValidationOutcome outcome = validator.validate(record, rules);

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.errors()).hasSize(3);
        assertThat(outcome.errors().get(0)).isEqualTo("Field 'id' is required but missing");
        assertThat(outcome.errors().get(1)).isEqualTo("Field 'email' is required but missing");
        assertThat(outcome.errors().get(2)).contains("Field 'score'");
    }

    @Test
    @DisplayName("Warnings alone should not invalidate a record")
    void warningsDoNotInvalidate() {
        RuleSet withBadPattern = RuleSet.of(FieldRule.of("id", "string", true).withPattern("(unclosed"));

        ValidationOutcome outcome = validator.validate(new DataRecord(1, Map.of("id", "x")), withBadPattern);

        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.warnings()).hasSize(1);
    }

    @Test
    @DisplayName("Validating without rules is a precondition failure")
    void emptyRulesShouldThrow() {
        DataRecord record = new DataRecord(1, Map.of("id", "1"));

        assertThatThrownBy(() -> validator.validate(record, RuleSet.of(List.of())))
                .isInstanceOf(PreconditionViolationException.class)
                .hasMessageContaining("at least one field rule");
        assertThatThrownBy(() -> validator.validateAll(List.of(record), null))
                .isInstanceOf(PreconditionViolationException.class);
    }

    @Test
    @DisplayName("Batch validation keeps input order and is repeatable")
    void validateAllShouldKeepOrder() {
        List<DataRecord> records = DataRecord.fromRows(List.of(
                Map.of("id", "x", "email", "a@b"),
                Map.of("id", "2", "email", "c@d"),
                Map.of("id", "3", "email", "nope")));

        List<ValidationOutcome> first = validator.validateAll(records, rules);
        List<ValidationOutcome> second = validator.validateAll(records, rules);

        assertThat(first).extracting(ValidationOutcome::rowIndex).containsExactly(1, 2, 3);
        assertThat(first).extracting(ValidationOutcome::isValid).containsExactly(false, true, false);
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("A pattern that cannot be evaluated on one record should not stop the batch")
    void unevaluablePatternShouldNotStopBatch() {
        RuleSet codes = RuleSet.of(FieldRule.of("code", "string", false).withPattern("^(a|b)*$"));
        List<DataRecord> records = DataRecord.fromRows(List.of(
                Map.of("code", "a".repeat(100_000)),
                Map.of("code", "ab"),
                Map.of("code", "abc")));

        List<ValidationOutcome> outcomes = validator.validateAll(records, codes);

        assertThat(outcomes).extracting(ValidationOutcome::isValid).containsExactly(true, true, false);
        assertThat(outcomes.get(0).warnings()).singleElement().asString().contains("Pattern check skipped");
        assertThat(outcomes.get(1).warnings()).isEmpty();
    }

    @Test
    @DisplayName("Outcome errors should be attributed in the same order as the messages")
    void outcomeShouldCarryFieldErrors() {
        DataRecord record = new DataRecord(7, Map.of("id", "x", "score", "1.5"));

        ValidationOutcome outcome = validator.validate(record, rules);

        assertThat(outcome.fieldErrors()).extracting(FieldError::field).containsExactly("id", "email", "score");
        assertThat(outcome.fieldErrors()).extracting(FieldError::category)
                .containsExactly(ErrorCategory.DATA_TYPE, ErrorCategory.REQUIRED, ErrorCategory.DATA_TYPE);
        assertThat(outcome.fieldErrors()).extracting(FieldError::message).isEqualTo(outcome.errors());
    }
}
