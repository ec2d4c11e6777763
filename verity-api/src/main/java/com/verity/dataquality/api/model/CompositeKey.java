package com.verity.dataquality.api.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Identity of a record built from one or more key field values.
 *
 * <p>Equality is list equality over the values, so two keys can never collide
 * through separator characters embedded in field content. Absent values are
 * coerced to the empty string, which makes {@code null} and {@code ""}
 * indistinguishable as key parts.
 */
public record CompositeKey(List<String> values) implements Serializable {

    /** ASCII unit separator, used by {@link #encoded()}. */
    public static final char SEPARATOR = '\u001F';

    public CompositeKey {
        values = List.copyOf(values);
    }

    public static CompositeKey of(DataRecord record, List<String> keyFields) {
        List<String> parts = new ArrayList<>(keyFields.size());
        for (String field : keyFields) {
            String value = record.value(field);
            parts.add(value == null ? "" : value);
        }
        return new CompositeKey(parts);
    }

    /**
     * Machine form: values joined with the unit separator.
     */
    public String encoded() {
        return String.join(String.valueOf(SEPARATOR), values);
    }

    /**
     * Human-readable form used in reports: values joined with {@code |}.
     */
    public String display() {
        return String.join("|", values);
    }

    @Override
    public String toString() {
        return display();
    }
}
