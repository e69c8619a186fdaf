package com.phillippitts.speaktorobot.config.properties;

import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the command schema: coordinate bounds and patrol locations.
 */
@ConfigurationProperties(prefix = "robot.schema")
@Validated
public class CommandSchemaProperties {

    /** Lower bound (inclusive) for move_to x and y. */
    private double coordinateMin = -100.0;

    /** Upper bound (inclusive) for move_to x and y. */
    private double coordinateMax = 100.0;

    /** Named patrol locations known to the robot. */
    @NotEmpty(message = "At least one known route is required")
    private List<String> knownRoutes = new ArrayList<>(List.of("first_floor", "second_floor", "bedrooms"));

    /** If true, start_patrol routes outside {@link #knownRoutes} are rejected. */
    private boolean restrictRoutes = false;

    public double getCoordinateMin() {
        return coordinateMin;
    }

    public void setCoordinateMin(double coordinateMin) {
        this.coordinateMin = coordinateMin;
    }

    public double getCoordinateMax() {
        return coordinateMax;
    }

    public void setCoordinateMax(double coordinateMax) {
        this.coordinateMax = coordinateMax;
    }

    public List<String> getKnownRoutes() {
        return knownRoutes;
    }

    public void setKnownRoutes(List<String> knownRoutes) {
        this.knownRoutes = knownRoutes;
    }

    public boolean isRestrictRoutes() {
        return restrictRoutes;
    }

    public void setRestrictRoutes(boolean restrictRoutes) {
        this.restrictRoutes = restrictRoutes;
    }
}
