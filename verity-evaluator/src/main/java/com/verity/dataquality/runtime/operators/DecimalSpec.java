package com.verity.dataquality.runtime.operators;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Precision and scale declared in a raw type such as {@code DECIMAL(18,2)}.
 *
 * @param precision total number of digits allowed
 * @param scale     exact number of fractional digits required
 */
public record DecimalSpec(int precision, int scale) {

    private static final Pattern DECLARATION =
        Pattern.compile("decimal\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)", Pattern.CASE_INSENSITIVE);

    public DecimalSpec {
        if (precision <= 0 || scale < 0 || scale > precision) {
            throw new IllegalArgumentException("Invalid decimal spec: precision=" + precision + ", scale=" + scale);
        }
    }

    /**
     * Extracts precision and scale from a raw type declaration. Declarations
     * without them, or with an inconsistent pair, yield empty, which callers
     * treat as "numeric only".
     */
    public static Optional<DecimalSpec> parse(String typeSpec) {
        if (typeSpec == null) {
            return Optional.empty();
        }
        Matcher m = DECLARATION.matcher(typeSpec);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            int precision = Integer.parseInt(m.group(1));
            int scale = Integer.parseInt(m.group(2));
            if (precision <= 0 || scale > precision) {
                return Optional.empty();
            }
            return Optional.of(new DecimalSpec(precision, scale));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public int integerDigits() {
        return precision - scale;
    }

    @Override
    public String toString() {
        return "DECIMAL(" + precision + "," + scale + ")";
    }
}
