package com.phillippitts.speaktorobot.domain;

import java.util.List;
import java.util.Objects;

/**
 * Classification of a {@link CommandCandidate} by the validator.
 */
public sealed interface Verdict permits Verdict.Valid, Verdict.Invalid, Verdict.NotACommand {

    /** Every structural and range constraint is satisfied. */
    record Valid(Command command) implements Verdict {
        public Valid {
            Objects.requireNonNull(command, "command must not be null");
        }
    }

    /**
     * One or more field-level failures, each naming the field and the violated constraint.
     * Reasons keep the order they were detected in so retry feedback is reproducible.
     */
    record Invalid(List<String> reasons) implements Verdict {
        public Invalid {
            Objects.requireNonNull(reasons, "reasons must not be null");
            if (reasons.isEmpty()) {
                throw new IllegalArgumentException("Invalid verdict requires at least one reason");
            }
            reasons = List.copyOf(reasons);
        }
    }

    /** The candidate has no recognizable command name; treated as conversation. */
    record NotACommand() implements Verdict {
    }

    NotACommand NOT_A_COMMAND = new NotACommand();

    static Valid valid(Command command) {
        return new Valid(command);
    }

    static Invalid invalid(List<String> reasons) {
        return new Invalid(reasons);
    }

    static Invalid invalid(String reason) {
        return new Invalid(List.of(reason));
    }

    static NotACommand notACommand() {
        return NOT_A_COMMAND;
    }
}
