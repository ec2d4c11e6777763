/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.runtime.reconciliation;

import com.verity.dataquality.api.IReconciliationEngine;
import com.verity.dataquality.api.exceptions.PreconditionViolationException;
import com.verity.dataquality.api.model.CompositeKey;
import com.verity.dataquality.api.model.DataRecord;
import com.verity.dataquality.api.model.FieldDiff;
import com.verity.dataquality.api.model.MatchEntry;
import com.verity.dataquality.api.model.MismatchEntry;
import com.verity.dataquality.api.model.ReconciliationResult;
import com.verity.dataquality.api.model.ReconciliationStatus;
import com.verity.dataquality.api.model.ReconciliationSummary;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matches a source dataset against a destination dataset by composite key.
 *
 * <p>Each side is indexed by key in first-appearance order. A key repeated on
 * one side keeps its first position but resolves to its last record:
 * reconciliation only asserts cross-side presence, intra-side uniqueness is
 * the duplicate detector's concern.
 *
 * <p>In strict mode every matched pair is also compared on the union of both
 * records' non-key fields. Values are compared trimmed, with an absent value
 * equal to an empty one; reported diffs keep the raw values.
 */
public class ReconciliationEngine implements IReconciliationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final Tracer tracer;
    private final ReconciliationConfig config;

    public ReconciliationEngine() {
        this(OpenTelemetry.noop().getTracer("verity-evaluator"), ReconciliationConfig.defaults());
    }

    public ReconciliationEngine(Tracer tracer, ReconciliationConfig config) {
        this.tracer = tracer;
        this.config = config;
    }

    @Override
    public ReconciliationResult reconcile(List<DataRecord> source,
                                          List<DataRecord> destination,
                                          List<String> keyFields,
                                          boolean strict) {
        if (source == null || destination == null) {
            throw new PreconditionViolationException(
                "Both source and destination datasets must be loaded before reconciling");
        }

        Span span = tracer.spanBuilder("reconcile-datasets").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<String> keys = resolveKeyFields(source, destination, keyFields);
            span.setAttribute("sourceRecordCount", source.size());
            span.setAttribute("destinationRecordCount", destination.size());
            span.setAttribute("keyFields", String.join(",", keys));
            span.setAttribute("strict", strict);

            Map<CompositeKey, DataRecord> sourceIndex = index(source, keys, "source");
            Map<CompositeKey, DataRecord> destinationIndex = index(destination, keys, "destination");

            List<MatchEntry> missing = new ArrayList<>();
            List<MismatchEntry> mismatches = new ArrayList<>();
            Set<String> keySet = new HashSet<>(keys);

            for (Map.Entry<CompositeKey, DataRecord> entry : sourceIndex.entrySet()) {
                CompositeKey key = entry.getKey();
                DataRecord sourceRecord = entry.getValue();
                DataRecord destinationRecord = destinationIndex.get(key);
                if (destinationRecord == null) {
                    missing.add(new MatchEntry(key.display(), sourceRecord.rowIndex(), key.values()));
                } else if (strict) {
                    List<FieldDiff> diffs = compareFields(sourceRecord, destinationRecord, keySet);
                    if (!diffs.isEmpty()) {
                        mismatches.add(new MismatchEntry(key.display(), sourceRecord.rowIndex(),
                            destinationRecord.rowIndex(), key.values(), diffs));
                    }
                }
            }

            List<MatchEntry> extra = new ArrayList<>();
            for (Map.Entry<CompositeKey, DataRecord> entry : destinationIndex.entrySet()) {
                if (!sourceIndex.containsKey(entry.getKey())) {
                    extra.add(new MatchEntry(entry.getKey().display(), entry.getValue().rowIndex(),
                        entry.getKey().values()));
                }
            }

            ReconciliationSummary summary = summarize(source.size(), destination.size(),
                missing.size(), extra.size(), mismatches.size(), keys, strict);

            span.setAttribute("missingCount", missing.size());
            span.setAttribute("extraCount", extra.size());
            span.setAttribute("mismatchCount", mismatches.size());
            span.setAttribute("status", summary.status().name());

            logger.info("Reconciled {} source against {} destination records: {} missing, {} extra, {} mismatched ({})",
                source.size(), destination.size(), missing.size(), extra.size(), mismatches.size(),
                summary.status().label());

            return new ReconciliationResult(missing, extra, mismatches, summary);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static List<String> resolveKeyFields(List<DataRecord> source,
                                                 List<DataRecord> destination,
                                                 List<String> keyFields) {
        if (keyFields != null && !keyFields.isEmpty()) {
            return List.copyOf(keyFields);
        }
        if (!source.isEmpty()) {
            return List.copyOf(source.get(0).fieldNames());
        }
        if (!destination.isEmpty()) {
            return List.copyOf(destination.get(0).fieldNames());
        }
        return List.of();
    }

    private static Map<CompositeKey, DataRecord> index(List<DataRecord> records, List<String> keys, String side) {
        Map<CompositeKey, DataRecord> index = new LinkedHashMap<>();
        int overwritten = 0;
        for (DataRecord record : records) {
            if (index.put(CompositeKey.of(record, keys), record) != null) {
                overwritten++;
            }
        }
        if (overwritten > 0) {
            logger.debug("{} {} records share a key with an earlier record; the later one is kept",
                overwritten, side);
        }
        return index;
    }

    private static List<FieldDiff> compareFields(DataRecord sourceRecord, DataRecord destinationRecord,
                                                 Set<String> keys) {
        Set<String> fields = new LinkedHashSet<>(sourceRecord.fieldNames());
        fields.addAll(destinationRecord.fieldNames());

        List<FieldDiff> diffs = new ArrayList<>();
        for (String field : fields) {
            if (keys.contains(field)) {
                continue;
            }
            String sourceValue = sourceRecord.value(field);
            String destinationValue = destinationRecord.value(field);
            if (!normalize(sourceValue).equals(normalize(destinationValue))) {
                diffs.add(new FieldDiff(field, sourceValue, destinationValue));
            }
        }
        return diffs;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }

    private ReconciliationSummary summarize(int sourceCount, int destinationCount,
                                            int missing, int extra, int mismatches,
                                            List<String> keys, boolean strict) {
        ReconciliationStatus status = config.classify(missing, extra, mismatches);
        return new ReconciliationSummary(
            sourceCount,
            destinationCount,
            sourceCount - missing,
            missing,
            extra,
            mismatches,
            keys,
            strict,
            status,
            config.priority(missing + extra + mismatches),
            config.recommendations(missing, extra, mismatches)
        );
    }
}
