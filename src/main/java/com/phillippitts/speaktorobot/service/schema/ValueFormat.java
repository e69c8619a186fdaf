package com.phillippitts.speaktorobot.service.schema;

import java.math.BigDecimal;

/**
 * Renders raw and coerced values for validation reasons. Output is stable for equal inputs so
 * retry feedback stays reproducible.
 */
final class ValueFormat {

    private ValueFormat() {}

    /**
     * Formats numbers without trailing zeros ({@code 400.0 -> 400}), quotes strings, and prints
     * {@code null} literally.
     */
    static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double d) {
            return number(d);
        }
        if (value instanceof Float f) {
            return number(f.doubleValue());
        }
        if (value instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof CharSequence cs) {
            return "'" + cs + "'";
        }
        return String.valueOf(value);
    }

    static String number(double d) {
        if (!Double.isFinite(d)) {
            return Double.toString(d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
