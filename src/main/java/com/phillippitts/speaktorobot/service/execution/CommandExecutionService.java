package com.phillippitts.speaktorobot.service.execution;

import com.phillippitts.speaktorobot.domain.ExecuteCommandRequest;
import com.phillippitts.speaktorobot.domain.ExecutionResponse;
import com.phillippitts.speaktorobot.domain.Verdict;
import com.phillippitts.speaktorobot.service.schema.CommandSchema;
import com.phillippitts.speaktorobot.service.schema.ParameterSpec;
import com.phillippitts.speaktorobot.service.validation.CommandValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.stream.Collectors;

/**
 * Validates a directly submitted structured command with the same {@link CommandValidator} the
 * extraction loop uses, and dispatches it when valid. Invalid submissions are reported in the
 * response body, never dispatched.
 */
@Service
public class CommandExecutionService {

    private static final Logger LOG = LogManager.getLogger(CommandExecutionService.class);

    private final CommandValidator validator;
    private final CommandDispatcher dispatcher;

    public CommandExecutionService(CommandValidator validator, CommandDispatcher dispatcher) {
        this.validator = validator;
        this.dispatcher = dispatcher;
    }

    public ExecutionResponse execute(ExecuteCommandRequest request) {
        String name = request.command();
        CommandSchema schema = validator.schema();
        String validCommands = "Valid commands are: " + String.join(", ", schema.commandNames());

        Verdict verdict = validator.validate(name, request.commandParams());
        if (verdict instanceof Verdict.Valid valid) {
            String canonical = valid.command().commandName();
            String summary = dispatcher.dispatch(valid.command(), null);
            String message = "Received and validated command: '" + canonical + "' with params "
                    + valid.command().commandParams() + ". " + summary;
            LOG.info("[ROBOT-VALIDATOR-SUCCESS] command={}", canonical);
            return ExecutionResponse.success(message, valid.command());
        }
        if (verdict instanceof Verdict.NotACommand || !schema.isRecognized(name)) {
            String error = "Invalid command. Reason: Unknown command name '" + name + "'";
            LOG.warn("[ROBOT-VALIDATOR-ERROR] {}", error);
            return ExecutionResponse.failure(error, validCommands);
        }

        Verdict.Invalid invalid = (Verdict.Invalid) verdict;
        String canonical = schema.find(name).orElseThrow().name();
        String error = "Invalid params for '" + canonical + "': " + String.join("; ", invalid.reasons());
        String expected = schema.find(name).orElseThrow().parameters().stream()
                .map(ParameterSpec::toString)
                .collect(Collectors.joining(", ", "Expected parameters: ", ""));
        LOG.warn("[ROBOT-VALIDATOR-ERROR] {}", error);
        return ExecutionResponse.failure(error, expected);
    }
}
