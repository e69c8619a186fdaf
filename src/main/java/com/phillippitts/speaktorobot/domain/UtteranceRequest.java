package com.phillippitts.speaktorobot.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound utterance.
 *
 * @param userInput    the text to interpret (required, non-blank after trimming)
 * @param retryContext optional corrective context supplied by the caller for the first attempt
 */
public record UtteranceRequest(
        @JsonProperty("user_input") String userInput,
        @JsonProperty("retry_context") String retryContext
) {

    public static UtteranceRequest of(String userInput) {
        return new UtteranceRequest(userInput, null);
    }
}
