package com.phillippitts.speaktorobot.service.schema;

/**
 * Outcome of coercing a raw parameter value to its declared type.
 *
 * @param value coerced value (null when coercion failed)
 * @param error reason naming the field and expected type (null on success)
 */
public record Coercion(Object value, String error) {

    static Coercion ok(Object value) {
        return new Coercion(value, null);
    }

    static Coercion failed(String error) {
        return new Coercion(null, error);
    }

    public boolean isOk() {
        return error == null;
    }
}
