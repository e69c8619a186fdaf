package com.phillippitts.speaktorobot.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rotate in place.
 *
 * @param angle     rotation in degrees, in (0, 360]
 * @param direction rotation direction
 */
public record RotateCommand(double angle, RotationDirection direction) implements Command {

    public static final String NAME = "rotate";

    public RotateCommand {
        Objects.requireNonNull(direction, "direction must not be null");
        if (!(angle > 0.0 && angle <= 360.0)) {
            throw new IllegalArgumentException("Angle must be in (0, 360], got " + angle);
        }
    }

    @Override
    public String commandName() {
        return NAME;
    }

    @Override
    public Map<String, Object> commandParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("angle", angle);
        params.put("direction", direction.wireName());
        return Collections.unmodifiableMap(params);
    }
}
