package com.phillippitts.speaktorobot.service.schema;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link CommandSchema#lookup(String, Map)}: name recognition, presence and type checks.
 * Range and enum-membership constraints are not evaluated here.
 *
 * @param spec       matched command kind, or {@code null} if the name is not recognized
 * @param values     coerced values keyed by canonical parameter name, in declaration order;
 *                   includes defaults for absent optional parameters, excludes failed coercions
 * @param violations ordered structural problems (unexpected, missing, wrongly typed parameters)
 */
public record StructuralCheck(CommandSpec spec, Map<String, Object> values, List<String> violations) {

    public StructuralCheck {
        values = values == null ? Map.of() : Collections.unmodifiableMap(values);
        violations = List.copyOf(violations);
    }

    public boolean isRecognized() {
        return spec != null;
    }

    public boolean isStructurallyValid() {
        return isRecognized() && violations.isEmpty();
    }
}
