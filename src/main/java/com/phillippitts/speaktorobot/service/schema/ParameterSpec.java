package com.phillippitts.speaktorobot.service.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declaration of one command parameter: name, type, whether it is required (or its default),
 * accepted aliases and the constraints its value must meet.
 */
public final class ParameterSpec {

    private final String name;
    private final ParameterType type;
    private final boolean required;
    private final Object defaultValue;
    private final List<String> aliases;
    private final List<ValueConstraint> constraints;

    private ParameterSpec(Builder b) {
        this.name = b.name;
        this.type = b.type;
        this.required = b.defaultValue == null;
        this.defaultValue = b.defaultValue;
        this.aliases = List.copyOf(b.aliases);
        this.constraints = List.copyOf(b.constraints);
    }

    public static Builder builder(String name, ParameterType type) {
        return new Builder(name, type);
    }

    public String name() {
        return name;
    }

    public ParameterType type() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * @return already-coerced default used when the parameter is absent (null if required)
     */
    public Object defaultValue() {
        return defaultValue;
    }

    public List<String> aliases() {
        return aliases;
    }

    public List<ValueConstraint> constraints() {
        return constraints;
    }

    /**
     * @return true if {@code key} is the canonical name or one of the aliases
     */
    public boolean matches(String key) {
        return name.equals(key) || aliases.contains(key);
    }

    @Override
    public String toString() {
        return name + ":" + type + (required ? "" : "=" + defaultValue);
    }

    public static final class Builder {
        private final String name;
        private final ParameterType type;
        private Object defaultValue;
        private final List<String> aliases = new ArrayList<>();
        private final List<ValueConstraint> constraints = new ArrayList<>();

        private Builder(String name, ParameterType type) {
            this.name = Objects.requireNonNull(name, "name");
            this.type = Objects.requireNonNull(type, "type");
        }

        /**
         * Makes the parameter optional with the given default (in coerced form).
         */
        public Builder defaultValue(Object value) {
            this.defaultValue = Objects.requireNonNull(value, "default value");
            return this;
        }

        public Builder alias(String alias) {
            this.aliases.add(alias);
            return this;
        }

        public Builder constraint(ValueConstraint constraint) {
            this.constraints.add(Objects.requireNonNull(constraint, "constraint"));
            return this;
        }

        public ParameterSpec build() {
            return new ParameterSpec(this);
        }
    }
}
