package com.phillippitts.speaktorobot.service.llm;

import java.util.Objects;

/**
 * One call to the language-model service.
 *
 * @param userInput     the user's utterance (non-blank)
 * @param retryContext  corrective feedback from the previous attempt, or null on a first attempt
 * @param correlationId request correlation ID, forwarded for tracing
 * @param attempt       1-based attempt number
 */
public record ExtractionRequest(String userInput, String retryContext, String correlationId, int attempt) {

    public ExtractionRequest {
        Objects.requireNonNull(userInput, "userInput");
        if (retryContext != null && retryContext.isBlank()) {
            retryContext = null;
        }
    }

    public boolean isRetry() {
        return retryContext != null;
    }
}
