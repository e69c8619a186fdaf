package com.phillippitts.speaktorobot.service.schema;

import com.phillippitts.speaktorobot.domain.Command;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Declaration of one command kind.
 *
 * @param name        wire name (e.g. {@code rotate})
 * @param description short description used in prompts and error details
 * @param parameters  parameters in declaration order
 * @param factory     builds the typed command from fully coerced and constraint-checked values
 */
public record CommandSpec(
        String name,
        String description,
        List<ParameterSpec> parameters,
        Function<Map<String, Object>, Command> factory
) {

    public CommandSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(factory, "factory");
        parameters = List.copyOf(parameters);
    }

    /**
     * Resolves a raw key (canonical name or alias) to its parameter.
     */
    public Optional<ParameterSpec> parameter(String key) {
        for (ParameterSpec p : parameters) {
            if (p.matches(key)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
