package com.verity.dataquality.runtime.detection;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Purely lexical check that a value looks like one of the accepted date
 * layouts. {@code 13/45/2024} has an accepted shape; calendar validity is the
 * concern of {@link com.verity.dataquality.runtime.operators.PermissiveDateParser}.
 */
public final class DateShapeMatcher {

    private static final List<Pattern> SHAPES = List.of(
        Pattern.compile("\\d{4}-\\d{1,2}-\\d{1,2}"),
        Pattern.compile("\\d{1,2}/\\d{1,2}/\\d{4}"),
        Pattern.compile("\\d{1,2}-\\d{1,2}-\\d{4}"),
        Pattern.compile("\\d{4}/\\d{1,2}/\\d{1,2}"),
        Pattern.compile("\\d{1,2}\\.\\d{1,2}\\.\\d{4}"),
        // ISO timestamp
        Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?(Z|[+-]\\d{2}:?\\d{2})?")
    );

    private DateShapeMatcher() {
    }

    public static boolean hasKnownShape(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        for (Pattern shape : SHAPES) {
            if (shape.matcher(trimmed).matches()) {
                return true;
            }
        }
        return false;
    }
}
