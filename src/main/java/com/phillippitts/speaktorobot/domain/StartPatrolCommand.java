package com.phillippitts.speaktorobot.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Patrol a named route.
 *
 * @param route       non-blank route or location name
 * @param repeatCount number of loops ({@code >= 1}), or {@link #CONTINUOUS} to repeat indefinitely
 * @param speed       patrol speed
 */
public record StartPatrolCommand(String route, int repeatCount, PatrolSpeed speed) implements Command {

    public static final String NAME = "start_patrol";

    /** Sentinel repeat count meaning "patrol until told otherwise". */
    public static final int CONTINUOUS = -1;

    public StartPatrolCommand {
        Objects.requireNonNull(route, "route must not be null");
        Objects.requireNonNull(speed, "speed must not be null");
        if (route.isBlank()) {
            throw new IllegalArgumentException("Route must not be blank");
        }
        if (repeatCount < 1 && repeatCount != CONTINUOUS) {
            throw new IllegalArgumentException("Repeat count must be positive or " + CONTINUOUS
                    + ", got " + repeatCount);
        }
    }

    public boolean isContinuous() {
        return repeatCount == CONTINUOUS;
    }

    @Override
    public String commandName() {
        return NAME;
    }

    @Override
    public Map<String, Object> commandParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("route", route);
        params.put("repeat_count", repeatCount);
        params.put("speed", speed.wireName());
        return Collections.unmodifiableMap(params);
    }
}
