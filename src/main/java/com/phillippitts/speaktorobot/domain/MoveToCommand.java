package com.phillippitts.speaktorobot.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Navigate to an absolute coordinate.
 *
 * @param x target x coordinate (finite)
 * @param y target y coordinate (finite)
 */
public record MoveToCommand(double x, double y) implements Command {

    public static final String NAME = "move_to";

    public MoveToCommand {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Coordinates must be finite, got (" + x + ", " + y + ")");
        }
    }

    @Override
    public String commandName() {
        return NAME;
    }

    @Override
    public Map<String, Object> commandParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("x", x);
        params.put("y", y);
        return Collections.unmodifiableMap(params);
    }
}
