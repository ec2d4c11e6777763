/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.compiler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.verity.dataquality.api.IRuleSetLoader;
import com.verity.dataquality.api.exceptions.RuleSetLoadException;
import com.verity.dataquality.api.model.FieldRule;
import com.verity.dataquality.api.model.RuleSet;
import com.verity.dataquality.compiler.dataset.DelimiterDetector;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads field rules from a rule definition sheet.
 *
 * <p>Files ending in {@code .json} are read as an array of objects; anything
 * else is read as delimited text with the delimiter detected from the header
 * line. Header spellings are resolved through a {@link ColumnAliasTable}, so
 * spreadsheets exported from different mapping templates load to the same rules.
 *
 * <p>Loading degrades rather than aborts: a row without a field name, or a
 * repeated field name, is skipped with a warning and listed in
 * {@link RuleSet#skippedRows()}. Only an unreadable source, or one that yields
 * no rules at all, fails the load.
 *
 * <h2>Usage</h2>
 * <pre>
 * IRuleSetLoader loader = new RuleSetLoader(tracer);
 * RuleSet rules = loader.load(Path.of("mapping.csv"));
 * </pre>
 */
public class RuleSetLoader implements IRuleSetLoader {
    private static final Logger logger = LoggerFactory.getLogger(RuleSetLoader.class);

    private static final TypeReference<List<Map<String, Object>>> JSON_ROWS = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CsvMapper csvMapper = CsvMapper.builder()
        .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .build();
    private final Tracer tracer;
    private final RuleRowParser rowParser;

    public RuleSetLoader() {
        this(OpenTelemetry.noop().getTracer("verity-compiler"));
    }

    public RuleSetLoader(Tracer tracer) {
        this(tracer, ColumnAliasTable.defaults());
    }

    public RuleSetLoader(Tracer tracer, ColumnAliasTable aliases) {
        this.tracer = tracer;
        this.rowParser = new RuleRowParser(aliases);
    }

    @Override
    public RuleSet load(Path rulesPath) {
        Span span = tracer.spanBuilder("load-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleFilePath", rulesPath.toString());

            List<Map<String, String>> rows = isJson(rulesPath) ? readJson(rulesPath) : readDelimited(rulesPath);
            span.setAttribute("definitionRowCount", rows.size());

            RuleSet ruleSet = fromRows(rows);
            if (ruleSet.isEmpty()) {
                throw new RuleSetLoadException("Rule definitions yielded no rules: " + rulesPath);
            }

            span.setAttribute("ruleCount", ruleSet.size());
            span.setAttribute("skippedRowCount", ruleSet.skippedRows().size());
            logger.info("Loaded {} field rules from {} ({} rows skipped)",
                ruleSet.size(), rulesPath, ruleSet.skippedRows().size());
            return ruleSet;
        } catch (RuleSetLoadException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Builds a rule set from rows already read from some tabular source.
     * Rows are numbered from 1 in diagnostics. The result may be empty.
     */
    public RuleSet fromRows(List<Map<String, String>> rows) {
        List<FieldRule> rules = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            RuleRowParser.ParsedRow parsed = rowParser.parse(rows.get(i), rowNumber);
            if (!parsed.isAccepted()) {
                logger.warn("Skipping rule definition: {}", parsed.rejection());
                skipped.add(parsed.rejection());
                continue;
            }
            FieldRule rule = parsed.rule();
            if (!seen.add(rule.fieldName())) {
                String reason = "Rule row " + rowNumber + " repeats field '" + rule.fieldName() + "'";
                logger.warn("Skipping rule definition: {}", reason);
                skipped.add(reason);
                continue;
            }
            rules.add(rule);
        }
        return new RuleSet(rules, skipped);
    }

    private static boolean isJson(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private List<Map<String, String>> readJson(Path path) {
        try {
            List<Map<String, Object>> raw = objectMapper.readValue(Files.readString(path), JSON_ROWS);
            List<Map<String, String>> rows = new ArrayList<>(raw.size());
            for (Map<String, Object> object : raw) {
                rows.add(stringify(object));
            }
            return rows;
        } catch (IOException e) {
            throw new RuleSetLoadException("Failed to read rule definitions from " + path, e);
        }
    }

    private List<Map<String, String>> readDelimited(Path path) {
        char delimiter = DelimiterDetector.detect(path);
        CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(delimiter);
        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(path.toFile())) {
            return it.readAll();
        } catch (IOException e) {
            throw new RuleSetLoadException("Failed to read rule definitions from " + path, e);
        }
    }

    /**
     * JSON definitions may carry numbers, booleans or arrays; the row parser
     * only deals in text, the same as for a spreadsheet cell.
     */
    private static Map<String, String> stringify(Map<String, Object> object) {
        Map<String, String> row = new LinkedHashMap<>();
        object.forEach((key, value) -> {
            if (value == null) {
                row.put(key, null);
            } else if (value instanceof Collection<?> items) {
                row.put(key, items.stream().map(String::valueOf).collect(Collectors.joining(",")));
            } else {
                row.put(key, String.valueOf(value));
            }
        });
        return row;
    }
}
