package com.phillippitts.speaktorobot.service.schema;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Declared type of a command parameter and the coercion accepted for it.
 *
 * <p>Coercion only converts representation (numeric strings to numbers, enum spellings to a
 * canonical form). It never interprets natural language: {@code "five"} is not a number here.
 */
public enum ParameterType {

    /** Finite floating point. Accepts JSON numbers and numeric strings. */
    NUMBER {
        @Override
        Coercion coerce(String field, Object raw) {
            Double d = toDouble(raw);
            if (d == null) {
                return Coercion.failed(field + " must be a number, got " + ValueFormat.describe(raw));
            }
            if (!Double.isFinite(d)) {
                return Coercion.failed(field + " must be a finite number, got " + ValueFormat.describe(raw));
            }
            return Coercion.ok(d);
        }
    },

    /** Whole number in int range. Accepts integral JSON numbers ({@code 3}, {@code 3.0}) and strings. */
    INTEGER {
        @Override
        Coercion coerce(String field, Object raw) {
            BigDecimal bd = toBigDecimal(raw);
            if (bd == null) {
                return Coercion.failed(field + " must be an integer, got " + ValueFormat.describe(raw));
            }
            try {
                return Coercion.ok(bd.intValueExact());
            } catch (ArithmeticException e) {
                return Coercion.failed(field + " must be an integer, got " + ValueFormat.describe(raw));
            }
        }
    },

    /** Free text. Only strings are accepted; the value is trimmed. */
    STRING {
        @Override
        Coercion coerce(String field, Object raw) {
            if (raw instanceof CharSequence cs) {
                return Coercion.ok(cs.toString().trim());
            }
            return Coercion.failed(field + " must be a string, got " + ValueFormat.describe(raw));
        }
    },

    /**
     * Symbolic value. Strings are lower-cased and hyphen/space runs become underscores
     * ({@code "Counter-Clockwise" -> "counter_clockwise"}); membership is a constraint.
     */
    ENUM {
        @Override
        Coercion coerce(String field, Object raw) {
            if (raw instanceof CharSequence cs) {
                String normalized = cs.toString().trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
                return Coercion.ok(normalized);
            }
            return Coercion.failed(field + " must be a string, got " + ValueFormat.describe(raw));
        }
    };

    /**
     * Converts a raw value (already present and non-null) to this type.
     *
     * @param field parameter name used in the failure reason
     * @param raw   raw value from the candidate
     * @return coercion outcome
     */
    abstract Coercion coerce(String field, Object raw);

    public boolean isNumeric() {
        return this == NUMBER || this == INTEGER;
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof Boolean) {
            return null;
        }
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof CharSequence cs) {
            String s = cs.toString().trim();
            if (s.isEmpty()) {
                return null;
            }
            try {
                // plain decimal text only; rejects "90d", "0x1p3", "NaN"
                return new BigDecimal(s).doubleValue();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static BigDecimal toBigDecimal(Object raw) {
        if (raw instanceof Boolean) {
            return null;
        }
        try {
            if (raw instanceof BigDecimal bd) {
                return bd;
            }
            if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
                return BigDecimal.valueOf(((Number) raw).longValue());
            }
            if (raw instanceof Number n) {
                double d = n.doubleValue();
                return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
            }
            if (raw instanceof CharSequence cs) {
                String s = cs.toString().trim();
                return s.isEmpty() ? null : new BigDecimal(s);
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return null;
    }
}
