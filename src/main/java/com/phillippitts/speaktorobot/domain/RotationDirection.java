package com.phillippitts.speaktorobot.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Rotation direction as exchanged with the language model and the robot.
 */
public enum RotationDirection {
    CLOCKWISE("clockwise"),
    COUNTER_CLOCKWISE("counter_clockwise");

    private final String wireName;

    RotationDirection(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire value, tolerating case and hyphen/space separators
     * ({@code counter-clockwise}, {@code Counter Clockwise}).
     *
     * @param value raw value (nullable)
     * @return matching direction, or empty if unknown
     */
    public static Optional<RotationDirection> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = normalize(value);
        for (RotationDirection d : values()) {
            if (d.wireName.equals(normalized)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
    }
}
