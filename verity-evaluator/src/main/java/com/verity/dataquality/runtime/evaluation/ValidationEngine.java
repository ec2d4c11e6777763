/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.runtime.evaluation;

import com.verity.dataquality.api.exceptions.PreconditionViolationException;
import com.verity.dataquality.api.model.Dataset;
import com.verity.dataquality.api.model.DuplicateEntry;
import com.verity.dataquality.api.model.FormattingIssue;
import com.verity.dataquality.api.model.HeaderMatchResult;
import com.verity.dataquality.api.model.RuleSet;
import com.verity.dataquality.api.model.ValidationOutcome;
import com.verity.dataquality.api.model.ValidationReport;
import com.verity.dataquality.api.model.ValidationSummary;
import com.verity.dataquality.runtime.detection.DuplicateDetector;
import com.verity.dataquality.runtime.detection.FormattingConsistencyChecker;
import com.verity.dataquality.runtime.detection.HeaderMatcher;
import com.verity.dataquality.runtime.operators.PatternMatcher;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a complete validation pass over one dataset.
 *
 * <p>Record validation, duplicate detection, formatting checks and header
 * matching each read the same immutable inputs and contribute one section of
 * the returned {@link ValidationReport}. Nothing is retained between calls,
 * so one engine can serve any number of runs.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ValidationEngine engine = new ValidationEngine(tracer, ValidationConfig.defaults());
 * ValidationReport report = engine.validate(dataset, rules, List.of("customer_id"));
 * }</pre>
 */
public class ValidationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ValidationEngine.class);

    private final Tracer tracer;
    private final ValidationConfig config;
    private final RecordValidator recordValidator;
    private final DuplicateDetector duplicateDetector = new DuplicateDetector();
    private final FormattingConsistencyChecker formattingChecker = new FormattingConsistencyChecker();
    private final HeaderMatcher headerMatcher = new HeaderMatcher();

    public ValidationEngine() {
        this(OpenTelemetry.noop().getTracer("verity-evaluator"), ValidationConfig.defaults());
    }

    public ValidationEngine(Tracer tracer, ValidationConfig config) {
        this.tracer = tracer;
        this.config = config;
        PatternMatcher patternMatcher = new PatternMatcher(config.patternCacheSize(), config.patternStepLimit());
        this.recordValidator = new RecordValidator(new FieldValidator(patternMatcher));
    }

    public ValidationReport validate(Dataset dataset, RuleSet rules) {
        return validate(dataset, rules, null);
    }

    /**
     * @param duplicateKeyFields key for duplicate detection, or null/empty for whole-row equality
     * @throws PreconditionViolationException if the dataset is null or the rule set is empty
     */
    public ValidationReport validate(Dataset dataset, RuleSet rules, List<String> duplicateKeyFields) {
        if (dataset == null) {
            throw new PreconditionViolationException("Cannot validate a dataset that was not loaded");
        }
        RecordValidator.requireRules(rules);

        Span span = tracer.spanBuilder("validate-dataset").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            span.setAttribute("recordCount", dataset.size());
            span.setAttribute("ruleCount", rules.size());

            List<ValidationOutcome> outcomes = recordValidator.validateAll(dataset.records(), rules);
            List<DuplicateEntry> duplicates = config.detectDuplicates()
                ? duplicateDetector.detectDuplicates(dataset.records(), duplicateKeyFields)
                : List.of();
            List<FormattingIssue> formattingIssues = config.detectFormatting()
                ? formattingChecker.detectFormattingIssues(dataset.records(), rules)
                : List.of();
            HeaderMatchResult headerMatch = headerMatcher.match(rules.fieldNames(), dataset.headers());
            ValidationSummary summary = ValidationSummary.of(outcomes);

            span.setAttribute("invalidRecordCount", summary.invalidRecords());
            span.setAttribute("duplicateCount", duplicates.size());
            span.setAttribute("formattingIssueCount", formattingIssues.size());
            span.setAttribute("validationTimeMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));

            logger.info("Validated {} records: {} valid, {} invalid, {} duplicates, {} formatting issues",
                summary.totalRecords(), summary.validRecords(), summary.invalidRecords(),
                duplicates.size(), formattingIssues.size());
            if (!headerMatch.isExactMatch()) {
                logger.warn("Header mismatch: missing {} unexpected {}", headerMatch.missing(), headerMatch.unexpected());
            }

            return new ValidationReport(outcomes, duplicates, formattingIssues, headerMatch, summary);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
