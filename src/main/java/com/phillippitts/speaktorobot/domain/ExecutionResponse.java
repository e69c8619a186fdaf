package com.phillippitts.speaktorobot.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Outcome of a direct command submission: either
 * {@code {success: true, message, command, command_params}} or
 * {@code {success: false, error, details}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("command") String command,
        @JsonProperty("command_params") Map<String, Object> commandParams,
        @JsonProperty("error") String error,
        @JsonProperty("details") String details
) {

    public static ExecutionResponse success(String message, Command command) {
        return new ExecutionResponse(true, message, command.commandName(), command.commandParams(), null, null);
    }

    public static ExecutionResponse failure(String error, String details) {
        return new ExecutionResponse(false, null, null, null, error, details);
    }
}
