package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered collection of field rules produced by a loader.
 *
 * <p>{@code skippedRows} carries one diagnostic per definition row the loader
 * could not turn into a rule. A non-empty list never invalidates the set.
 */
public record RuleSet(
    @JsonProperty("rules") List<FieldRule> rules,
    @JsonProperty("skipped_rows") List<String> skippedRows
) implements Serializable {

    public RuleSet {
        rules = rules == null ? List.of() : List.copyOf(rules);
        skippedRows = skippedRows == null ? List.of() : List.copyOf(skippedRows);
    }

    public static RuleSet of(List<FieldRule> rules) {
        return new RuleSet(rules, List.of());
    }

    public static RuleSet of(FieldRule... rules) {
        return new RuleSet(List.of(rules), List.of());
    }

    public int size() {
        return rules.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * Field names in declaration order. These are the headers an input file is
     * expected to carry.
     */
    public List<String> fieldNames() {
        return rules.stream().map(FieldRule::fieldName).toList();
    }

    public Optional<FieldRule> rule(String fieldName) {
        return rules.stream().filter(r -> r.fieldName().equals(fieldName)).findFirst();
    }

    /**
     * Index by field name. When a field is declared twice the first declaration wins.
     */
    public Map<String, FieldRule> byFieldName() {
        Map<String, FieldRule> index = new LinkedHashMap<>();
        for (FieldRule rule : rules) {
            index.putIfAbsent(rule.fieldName(), rule);
        }
        return index;
    }
}
