package com.verity.dataquality.runtime.operators;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a string is a calendar date or timestamp in any of the
 * layouts commonly found in exported spreadsheets.
 *
 * <p>Resolution is strict, so impossible dates such as {@code 2024-02-30} are
 * rejected. Shape-only matching lives in
 * {@link com.verity.dataquality.runtime.detection.DateShapeMatcher}.
 */
public final class PermissiveDateParser {

    private static final List<DateTimeFormatter> FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        DateTimeFormatter.ISO_ZONED_DATE_TIME,
        DateTimeFormatter.ISO_INSTANT,
        pattern("uuuu-MM-dd HH:mm[:ss]"),
        pattern("M/d/uuuu"),
        pattern("M-d-uuuu"),
        pattern("uuuu/M/d"),
        pattern("M.d.uuuu"),
        pattern("M/d/uuuu H:mm[:ss]"),
        pattern("M/d/uuuu h:mm[:ss] a"),
        pattern("MMM d, uuuu"),
        pattern("d MMM uuuu"),
        DateTimeFormatter.RFC_1123_DATE_TIME
    );

    private PermissiveDateParser() {
    }

    public static boolean isParseable(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        for (DateTimeFormatter format : FORMATS) {
            try {
                format.parse(trimmed);
                return true;
            } catch (DateTimeParseException e) {
                // try the next layout
            }
        }
        return false;
    }

    private static DateTimeFormatter pattern(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.US)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
