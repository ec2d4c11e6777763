package com.verity.dataquality.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the header spellings found in rule definition sheets onto canonical
 * {@link RuleColumn}s.
 *
 * <p>The table is consulted once per definition row at load time; nothing past
 * the loader ever sees raw header names. Lookups are exact after trimming
 * surrounding whitespace and a leading byte order mark from the header.
 *
 * <h2>Usage</h2>
 * <pre>
 * ColumnAliasTable aliases = ColumnAliasTable.defaults()
 *     .withAlias(RuleColumn.FIELD_NAME, "Column");
 * Map&lt;RuleColumn, String&gt; resolved = aliases.resolve(row);
 * </pre>
 */
public final class ColumnAliasTable {

    private final Map<RuleColumn, List<String>> aliases;

    private ColumnAliasTable(Map<RuleColumn, List<String>> aliases) {
        this.aliases = aliases;
    }

    public static ColumnAliasTable defaults() {
        Map<RuleColumn, List<String>> table = new EnumMap<>(RuleColumn.class);
        for (RuleColumn column : RuleColumn.values()) {
            table.put(column, column.defaultAliases());
        }
        return new ColumnAliasTable(table);
    }

    /**
     * Returns a copy of this table that also accepts {@code header} for {@code column}.
     * The new alias is tried after the existing ones.
     */
    public ColumnAliasTable withAlias(RuleColumn column, String header) {
        Map<RuleColumn, List<String>> copy = new EnumMap<>(aliases);
        List<String> extended = new ArrayList<>(copy.get(column));
        extended.add(header);
        copy.put(column, List.copyOf(extended));
        return new ColumnAliasTable(copy);
    }

    public List<String> aliasesFor(RuleColumn column) {
        return aliases.get(column);
    }

    /**
     * Resolves one raw definition row. For each canonical column the first alias
     * carrying a non-blank value wins; columns with no such alias are absent
     * from the returned map.
     */
    public Map<RuleColumn, String> resolve(Map<String, String> row) {
        Map<String, String> normalized = new LinkedHashMap<>();
        row.forEach((header, value) -> {
            if (header != null) {
                normalized.putIfAbsent(normalizeHeader(header), value);
            }
        });

        Map<RuleColumn, String> resolved = new EnumMap<>(RuleColumn.class);
        for (Map.Entry<RuleColumn, List<String>> entry : aliases.entrySet()) {
            for (String alias : entry.getValue()) {
                String value = normalized.get(alias);
                if (value != null && !value.isBlank()) {
                    resolved.put(entry.getKey(), value);
                    break;
                }
            }
        }
        return Collections.unmodifiableMap(resolved);
    }

    private static String normalizeHeader(String header) {
        String trimmed = header.trim();
        if (!trimmed.isEmpty() && trimmed.charAt(0) == '\uFEFF') {
            trimmed = trimmed.substring(1).trim();
        }
        return trimmed;
    }
}
