package com.phillippitts.speaktorobot.domain;

import java.util.Map;

/**
 * A structured, schema-valid instruction destined for robot hardware.
 *
 * <p>Instances are only produced by the command schema after every structural and range
 * constraint of their kind has passed, so downstream consumers may rely on them without
 * re-checking. {@link NoCommand} represents an utterance that carried no actionable instruction.
 *
 * @see com.phillippitts.speaktorobot.service.validation.CommandValidator
 */
public sealed interface Command permits MoveToCommand, RotateCommand, StartPatrolCommand, NoCommand {

    /**
     * Wire name of the command kind (e.g. {@code move_to}).
     *
     * @return command name, or {@code null} for {@link NoCommand}
     */
    String commandName();

    /**
     * Parameters in wire form, keyed by parameter name in declaration order.
     *
     * @return immutable parameter map, or {@code null} for {@link NoCommand}
     */
    Map<String, Object> commandParams();

    /**
     * @return true if this value carries an executable instruction
     */
    default boolean isActionable() {
        return !(this instanceof NoCommand);
    }
}
