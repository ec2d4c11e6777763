package com.verity.dataquality.runtime.operators;

import com.verity.dataquality.api.model.FieldRule;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Type check for a non-empty raw value, dispatched on the rule's normalized type.
 */
public final class TypeChecker {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Set<String> BOOLEANS = Set.of("true", "false", "yes", "no", "1", "0");

    private TypeChecker() {
    }

    /**
     * @return empty when the value conforms, otherwise a detail describing the
     *         failure; the detail is blank when there is nothing to add
     */
    public static Optional<String> check(String value, FieldRule rule) {
        String trimmed = value.trim();
        return switch (rule.dataType()) {
            case INTEGER -> INTEGER.matcher(trimmed).matches() ? Optional.empty() : Optional.of("");
            case DECIMAL -> {
                DecimalCheckResult decimal = DecimalPrecisionChecker.check(trimmed, rule.originalTypeSpec());
                yield decimal.isValid() ? Optional.empty() : Optional.of(decimal.detail());
            }
            case DATE -> PermissiveDateParser.isParseable(trimmed) ? Optional.empty() : Optional.of("");
            case BOOLEAN -> BOOLEANS.contains(trimmed.toLowerCase(Locale.ROOT)) ? Optional.empty() : Optional.of("");
            case STRING -> Optional.empty();
        };
    }
}
