package com.phillippitts.speaktorobot.service.schema;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Value-level rule applied to an already-coerced parameter value.
 */
@FunctionalInterface
public interface ValueConstraint {

    /**
     * @param field parameter name
     * @param value coerced value (never null)
     * @return the violation reason, or empty if the value satisfies the rule
     */
    Optional<String> check(String field, Object value);

    /**
     * Numeric interval. Reason format: {@code angle must be in (0, 360], got 400}.
     */
    static ValueConstraint range(double min, boolean minInclusive, double max, boolean maxInclusive) {
        String interval = (minInclusive ? "[" : "(") + ValueFormat.number(min) + ", "
                + ValueFormat.number(max) + (maxInclusive ? "]" : ")");
        return (field, value) -> {
            double d = ((Number) value).doubleValue();
            boolean aboveMin = minInclusive ? d >= min : d > min;
            boolean belowMax = maxInclusive ? d <= max : d < max;
            if (aboveMin && belowMax) {
                return Optional.empty();
            }
            return Optional.of(field + " must be in " + interval + ", got " + ValueFormat.describe(value));
        };
    }

    /**
     * Membership in a fixed, ordered set of values.
     */
    static ValueConstraint oneOf(List<String> allowed) {
        List<String> copy = List.copyOf(allowed);
        Set<String> lookup = Set.copyOf(copy);
        return (field, value) -> lookup.contains(value)
                ? Optional.empty()
                : Optional.of(field + " must be one of " + copy + ", got " + ValueFormat.describe(value));
    }

    /**
     * String must not be empty after trimming.
     */
    static ValueConstraint nonBlank() {
        return (field, value) -> value.toString().isBlank()
                ? Optional.of(field + " must be a non-empty string")
                : Optional.empty();
    }

    /**
     * Positive integer, or one of an explicit set of sentinel values (e.g. {@code -1} for
     * "repeat indefinitely"). Sentinels are part of the declaration, not a validator special case.
     */
    static ValueConstraint positiveOrAllowed(Set<Integer> sentinels, String sentinelMeaning) {
        String allowedText = sentinels.stream().sorted().map(String::valueOf).collect(Collectors.joining(", "));
        return (field, value) -> {
            int i = ((Number) value).intValue();
            if (i > 0 || sentinels.contains(i)) {
                return Optional.empty();
            }
            return Optional.of(field + " must be a positive integer or " + allowedText
                    + " (" + sentinelMeaning + "), got " + i);
        };
    }
}
