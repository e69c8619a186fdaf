package com.phillippitts.speaktorobot.service.schema;

import com.phillippitts.speaktorobot.domain.MoveToCommand;
import com.phillippitts.speaktorobot.domain.PatrolSpeed;
import com.phillippitts.speaktorobot.domain.RotateCommand;
import com.phillippitts.speaktorobot.domain.RotationDirection;
import com.phillippitts.speaktorobot.domain.StartPatrolCommand;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Single source of truth for what constitutes a structurally valid robot command.
 *
 * <p>The schema is a declarative table of {@link CommandSpec}s. Adding a command kind means
 * adding an entry to the table; the validator and the extraction loop are driven by it and need
 * no change.
 *
 * <p>Instances are immutable and safe to share across threads.
 */
public final class CommandSchema {

    /** Claimed names that mean "no command" rather than an unknown one. */
    private static final Set<String> NO_COMMAND_NAMES = Set.of("none", "null", "no_command");

    private final Map<String, CommandSpec> specs;

    public CommandSchema(List<CommandSpec> specs) {
        Map<String, CommandSpec> byName = new LinkedHashMap<>();
        for (CommandSpec spec : specs) {
            if (byName.put(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate command kind: " + spec.name());
            }
        }
        this.specs = Collections.unmodifiableMap(byName);
    }

    /**
     * Builds the standard robot command table.
     *
     * @param coordinateMin  lower bound (inclusive) for move_to coordinates
     * @param coordinateMax  upper bound (inclusive) for move_to coordinates
     * @param knownRoutes    known patrol locations
     * @param restrictRoutes if true, start_patrol routes must be one of {@code knownRoutes}
     * @return the schema
     */
    public static CommandSchema standard(double coordinateMin, double coordinateMax,
                                         Collection<String> knownRoutes, boolean restrictRoutes) {
        if (!(coordinateMin < coordinateMax)) {
            throw new IllegalArgumentException("coordinateMin must be below coordinateMax");
        }

        CommandSpec moveTo = new CommandSpec(MoveToCommand.NAME,
                "Navigate to absolute coordinates (x, y)",
                List.of(
                        ParameterSpec.builder("x", ParameterType.NUMBER)
                                .constraint(ValueConstraint.range(coordinateMin, true, coordinateMax, true))
                                .build(),
                        ParameterSpec.builder("y", ParameterType.NUMBER)
                                .constraint(ValueConstraint.range(coordinateMin, true, coordinateMax, true))
                                .build()),
                v -> new MoveToCommand((Double) v.get("x"), (Double) v.get("y")));

        CommandSpec rotate = new CommandSpec(RotateCommand.NAME,
                "Rotate in place by an angle in degrees",
                List.of(
                        ParameterSpec.builder("angle", ParameterType.NUMBER)
                                .constraint(ValueConstraint.range(0, false, 360, true))
                                .build(),
                        ParameterSpec.builder("direction", ParameterType.ENUM)
                                .constraint(ValueConstraint.oneOf(wireNames(RotationDirection.values())))
                                .build()),
                v -> new RotateCommand((Double) v.get("angle"), direction((String) v.get("direction"))));

        ParameterSpec.Builder route = ParameterSpec.builder("route", ParameterType.STRING)
                .alias("route_id")
                .constraint(ValueConstraint.nonBlank());
        if (restrictRoutes) {
            route.constraint(knownLocation(knownRoutes));
        }
        CommandSpec startPatrol = new CommandSpec(StartPatrolCommand.NAME,
                "Patrol a route a number of times, or continuously",
                List.of(
                        route.build(),
                        ParameterSpec.builder("repeat_count", ParameterType.INTEGER)
                                .defaultValue(1)
                                .constraint(ValueConstraint.positiveOrAllowed(
                                        Set.of(StartPatrolCommand.CONTINUOUS), "repeat indefinitely"))
                                .build(),
                        ParameterSpec.builder("speed", ParameterType.ENUM)
                                .defaultValue(PatrolSpeed.MEDIUM.wireName())
                                .constraint(ValueConstraint.oneOf(wireNames(PatrolSpeed.values())))
                                .build()),
                v -> new StartPatrolCommand((String) v.get("route"), (Integer) v.get("repeat_count"),
                        speed((String) v.get("speed"))));

        return new CommandSchema(List.of(moveTo, rotate, startPatrol));
    }

    /**
     * @return recognized command names in declaration order
     */
    public List<String> commandNames() {
        return List.copyOf(specs.keySet());
    }

    public Collection<CommandSpec> specs() {
        return specs.values();
    }

    /**
     * Finds a command kind by claimed name. Matching ignores case, surrounding whitespace and
     * hyphen/space separators ({@code "Move-To"} matches {@code move_to}).
     */
    public Optional<CommandSpec> find(String claimedName) {
        if (claimedName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(specs.get(normalizeName(claimedName)));
    }

    public boolean isRecognized(String claimedName) {
        return find(claimedName).isPresent();
    }

    /**
     * @return true if the claimed name is absent or explicitly says "no command"
     */
    public boolean isNoCommand(String claimedName) {
        return claimedName == null
                || claimedName.isBlank()
                || NO_COMMAND_NAMES.contains(normalizeName(claimedName));
    }

    /**
     * Checks name recognition, parameter presence and type coercibility.
     *
     * <p>Violations are ordered: unexpected or duplicated keys in input order, then missing or
     * wrongly typed parameters in declaration order. Absent optional parameters receive their
     * default.
     *
     * @param claimedName command name claimed by the candidate
     * @param params      raw parameters (nullable; null values count as absent)
     * @return structural check result
     */
    public StructuralCheck lookup(String claimedName, Map<String, Object> params) {
        Optional<CommandSpec> found = find(claimedName);
        if (found.isEmpty()) {
            return new StructuralCheck(null, Map.of(), List.of("unknown command " + ValueFormat.describe(claimedName)
                    + "; valid commands are " + String.join(", ", specs.keySet())));
        }
        CommandSpec spec = found.get();
        List<String> violations = new ArrayList<>();

        Map<String, Object> rawByName = new LinkedHashMap<>();
        if (params != null) {
            for (Map.Entry<String, Object> entry : params.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().trim();
                Optional<ParameterSpec> param = spec.parameter(key);
                if (param.isEmpty()) {
                    violations.add("unexpected parameter '" + key + "' for " + spec.name()
                            + "; expected " + parameterNames(spec));
                } else if (rawByName.containsKey(param.get().name())) {
                    violations.add(param.get().name() + " was given more than once");
                } else {
                    rawByName.put(param.get().name(), entry.getValue());
                }
            }
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (ParameterSpec param : spec.parameters()) {
            Object raw = rawByName.get(param.name());
            if (raw == null) {
                if (param.isRequired()) {
                    violations.add(param.name() + " is required for " + spec.name());
                } else {
                    values.put(param.name(), param.defaultValue());
                }
                continue;
            }
            Coercion coercion = param.type().coerce(param.name(), raw);
            if (coercion.isOk()) {
                values.put(param.name(), coercion.value());
            } else {
                violations.add(coercion.error());
            }
        }
        return new StructuralCheck(spec, values, violations);
    }

    private static String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
    }

    private static String parameterNames(CommandSpec spec) {
        return spec.parameters().stream().map(ParameterSpec::name).collect(Collectors.joining(", ", "[", "]"));
    }

    private static List<String> wireNames(RotationDirection[] values) {
        List<String> names = new ArrayList<>();
        for (RotationDirection d : values) {
            names.add(d.wireName());
        }
        return names;
    }

    private static List<String> wireNames(PatrolSpeed[] values) {
        List<String> names = new ArrayList<>();
        for (PatrolSpeed s : values) {
            names.add(s.wireName());
        }
        return names;
    }

    private static RotationDirection direction(String value) {
        return RotationDirection.fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown direction: " + value));
    }

    private static PatrolSpeed speed(String value) {
        return PatrolSpeed.fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown speed: " + value));
    }

    /**
     * Route must name a known location; comparison ignores case and treats spaces, hyphens and
     * underscores alike ({@code "second floor"} matches {@code second_floor}).
     */
    private static ValueConstraint knownLocation(Collection<String> knownRoutes) {
        Objects.requireNonNull(knownRoutes, "knownRoutes");
        List<String> ordered = List.copyOf(knownRoutes);
        Set<String> normalized = ordered.stream().map(CommandSchema::normalizeName).collect(Collectors.toSet());
        return (field, value) -> normalized.contains(normalizeName(value.toString()))
                ? Optional.empty()
                : Optional.of(field + " must be a known location " + ordered + ", got "
                        + ValueFormat.describe(value));
    }
}
