package com.phillippitts.speaktorobot.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Structured command submitted directly, bypassing language-model extraction.
 *
 * @param command       command name
 * @param commandParams raw parameters (nullable)
 */
public record ExecuteCommandRequest(
        @JsonProperty("command") String command,
        @JsonProperty("command_params") Map<String, Object> commandParams
) {}
