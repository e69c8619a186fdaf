/**
 * Declarative command schema.
 *
 * <p>{@link com.phillippitts.speaktorobot.service.schema.CommandSchema} holds one
 * {@link com.phillippitts.speaktorobot.service.schema.CommandSpec} per command kind. Each
 * parameter declares a {@link com.phillippitts.speaktorobot.service.schema.ParameterType}
 * (coercion only) and a list of
 * {@link com.phillippitts.speaktorobot.service.schema.ValueConstraint}s (ranges, enum
 * membership, sentinel values). Structural checks live here; the validator layers the
 * constraints on top.
 */
package com.phillippitts.speaktorobot.service.schema;
