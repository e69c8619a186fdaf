package com.phillippitts.speaktorobot.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response for one processed utterance.
 *
 * <p>{@code command} and {@code command_params} are always serialized (as {@code null} when no
 * command was produced). {@code diagnostic} is set only when extraction was exhausted, which
 * lets callers tell a failed extraction apart from ordinary conversation.
 *
 * @param response        human-readable reply
 * @param command         command name, or {@code null}
 * @param commandParams   command parameters, or {@code null}
 * @param correlationId   correlation ID of this interaction
 * @param executionResult summary from the downstream dispatcher (nullable)
 * @param diagnostic      internal diagnostic marker (nullable)
 */
public record CommandResponse(
        @JsonProperty("response") String response,
        @JsonProperty("command") String command,
        @JsonProperty("command_params") Map<String, Object> commandParams,
        @JsonProperty("correlation_id") @JsonInclude(JsonInclude.Include.NON_NULL) String correlationId,
        @JsonProperty("execution_result") @JsonInclude(JsonInclude.Include.NON_NULL) String executionResult,
        @JsonProperty("diagnostic") @JsonInclude(JsonInclude.Include.NON_NULL) String diagnostic
) {

    /** Diagnostic marker for responses produced after the retry budget ran out. */
    public static final String EXTRACTION_EXHAUSTED = "EXTRACTION_EXHAUSTED";

    public static CommandResponse forCommand(String response, Command command, String correlationId,
                                             String executionResult) {
        return new CommandResponse(response, command.commandName(), command.commandParams(),
                correlationId, executionResult, null);
    }

    public static CommandResponse conversational(String response, String correlationId) {
        return new CommandResponse(response, null, null, correlationId, null, null);
    }

    public static CommandResponse exhausted(String response, String correlationId) {
        return new CommandResponse(response, null, null, correlationId, null, EXTRACTION_EXHAUSTED);
    }

    @JsonIgnore
    public boolean hasCommand() {
        return command != null;
    }

    @JsonIgnore
    public boolean isExhausted() {
        return EXTRACTION_EXHAUSTED.equals(diagnostic);
    }
}
