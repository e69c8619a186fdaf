package com.phillippitts.speaktorobot.service.validation;

import com.phillippitts.speaktorobot.domain.Command;
import com.phillippitts.speaktorobot.domain.CommandCandidate;
import com.phillippitts.speaktorobot.domain.Verdict;
import com.phillippitts.speaktorobot.service.schema.CommandSchema;
import com.phillippitts.speaktorobot.service.schema.CommandSpec;
import com.phillippitts.speaktorobot.service.schema.ParameterSpec;
import com.phillippitts.speaktorobot.service.schema.StructuralCheck;
import com.phillippitts.speaktorobot.service.schema.ValueConstraint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies a {@link CommandCandidate} against the {@link CommandSchema}.
 *
 * <p>All violations are accumulated rather than failing on the first one, so a single retry can
 * correct every problem at once. Reason order is stable: unexpected parameters in input order,
 * then missing, wrongly typed and out-of-range parameters in declaration order.
 *
 * <p>Pure and stateless; safe to call concurrently.
 */
@Component
public class CommandValidator {

    private final CommandSchema schema;

    public CommandValidator(CommandSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    /**
     * Validate a parsed candidate.
     *
     * @param candidate candidate parsed from model output (must not be null)
     * @return {@code Valid}, {@code Invalid} with ordered reasons, or {@code NotACommand}
     */
    public Verdict validate(CommandCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        return validate(candidate.commandName(), candidate.params());
    }

    /**
     * Validate a command name and raw parameters, e.g. from a direct command submission.
     */
    public Verdict validate(String commandName, Map<String, Object> params) {
        if (schema.isNoCommand(commandName)) {
            return Verdict.notACommand();
        }

        StructuralCheck check = schema.lookup(commandName, params);
        if (!check.isRecognized()) {
            return Verdict.invalid(check.violations());
        }

        List<String> reasons = new ArrayList<>(check.violations());
        CommandSpec spec = check.spec();
        for (ParameterSpec param : spec.parameters()) {
            Object value = check.values().get(param.name());
            if (value == null) {
                continue; // missing or failed coercion, already reported
            }
            for (ValueConstraint constraint : param.constraints()) {
                Optional<String> violation = constraint.check(param.name(), value);
                if (violation.isPresent()) {
                    reasons.add(violation.get());
                    break;
                }
            }
        }
        if (!reasons.isEmpty()) {
            return Verdict.invalid(reasons);
        }

        try {
            Command command = spec.factory().apply(check.values());
            return Verdict.valid(command);
        } catch (IllegalArgumentException e) {
            return Verdict.invalid(spec.name() + " could not be built: " + e.getMessage());
        }
    }

    public CommandSchema schema() {
        return schema;
    }
}
