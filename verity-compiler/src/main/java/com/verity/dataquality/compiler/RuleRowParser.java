package com.verity.dataquality.compiler;

import com.verity.dataquality.api.model.DataType;
import com.verity.dataquality.api.model.FieldRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns one alias-resolved definition row into a {@link FieldRule}.
 *
 * <p>Requiredness: an explicit {@code required} column wins and is truthy for
 * {@code true/yes/y/1}. Otherwise a {@code Null Allowed} column decides, where
 * anything but a truthy value means the field is required. With neither column
 * the field is optional.
 */
final class RuleRowParser {
    private static final Logger logger = LoggerFactory.getLogger(RuleRowParser.class);

    private static final Set<String> TRUTHY = Set.of("true", "yes", "y", "1");

    private final ColumnAliasTable aliases;

    RuleRowParser(ColumnAliasTable aliases) {
        this.aliases = aliases;
    }

    /**
     * Parses a raw row.
     *
     * @param row       raw header-to-value mapping
     * @param rowNumber 1-based position in the definition source, for diagnostics
     */
    ParsedRow parse(Map<String, String> row, int rowNumber) {
        Map<RuleColumn, String> columns = aliases.resolve(row);

        String fieldName = columns.get(RuleColumn.FIELD_NAME);
        if (fieldName == null) {
            return ParsedRow.rejected("Rule row " + rowNumber + " has no field name");
        }
        fieldName = fieldName.trim();

        String typeSpec = trimToNull(columns.get(RuleColumn.DATA_TYPE));
        DataType dataType = DataType.fromTypeSpec(typeSpec);

        String pattern = columns.get(RuleColumn.PATTERN);
        if (pattern != null) {
            checkPattern(fieldName, pattern);
        }

        FieldRule rule = new FieldRule(
            fieldName,
            dataType,
            typeSpec,
            isRequired(columns),
            parseLength(fieldName, "minLength", columns.get(RuleColumn.MIN_LENGTH)),
            parseLength(fieldName, "maxLength", columns.get(RuleColumn.MAX_LENGTH)),
            pattern,
            FieldRule.splitAllowedValues(columns.get(RuleColumn.ALLOWED_VALUES)),
            trimToNull(columns.get(RuleColumn.DESCRIPTION))
        );
        return ParsedRow.accepted(rule);
    }

    private static boolean isRequired(Map<RuleColumn, String> columns) {
        String required = columns.get(RuleColumn.REQUIRED);
        if (required != null) {
            return isTruthy(required);
        }
        String nullAllowed = columns.get(RuleColumn.NULL_ALLOWED);
        if (nullAllowed != null) {
            return !isTruthy(nullAllowed);
        }
        return false;
    }

    private static boolean isTruthy(String value) {
        return TRUTHY.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private static Integer parseLength(String fieldName, String column, String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            logger.warn("Ignoring non-numeric {} '{}' for field '{}'", column, raw, fieldName);
            return null;
        }
    }

    private static void checkPattern(String fieldName, String pattern) {
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            // Kept on the rule: the validator reports it as a warning per record.
            logger.warn("Field '{}' declares an invalid regex pattern: {}", fieldName, e.getDescription());
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Either a rule or the reason the row was rejected.
     */
    record ParsedRow(FieldRule rule, String rejection) {

        static ParsedRow accepted(FieldRule rule) {
            return new ParsedRow(rule, null);
        }

        static ParsedRow rejected(String reason) {
            return new ParsedRow(null, reason);
        }

        boolean isAccepted() {
            return rule != null;
        }
    }
}
