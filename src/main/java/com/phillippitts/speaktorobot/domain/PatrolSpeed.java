package com.phillippitts.speaktorobot.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Patrol speed. Defaults to {@link #MEDIUM} when the utterance does not name one.
 */
public enum PatrolSpeed {
    SLOW,
    MEDIUM,
    FAST;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PatrolSpeed> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PatrolSpeed s : values()) {
            if (s.wireName().equals(normalized)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
