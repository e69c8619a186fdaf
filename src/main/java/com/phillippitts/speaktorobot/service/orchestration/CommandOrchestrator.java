package com.phillippitts.speaktorobot.service.orchestration;

import com.phillippitts.speaktorobot.domain.CommandResponse;
import com.phillippitts.speaktorobot.domain.UtteranceRequest;

/**
 * Entry point of the command pipeline: turns one utterance into a {@link CommandResponse}.
 *
 * <p><b>Pipeline:</b>
 * <ol>
 *   <li>Rejects empty input with a
 *       {@link com.phillippitts.speaktorobot.exception.ClientInputException} (no model call)</li>
 *   <li>Assigns a correlation ID and puts it into the logging context</li>
 *   <li>Runs the extraction-retry loop</li>
 *   <li>Hands a valid command to the downstream dispatcher</li>
 *   <li>Maps the terminal state to a response, records metrics, publishes events</li>
 * </ol>
 *
 * <p><b>Error Handling:</b> Language-model failures propagate as
 * {@link com.phillippitts.speaktorobot.exception.UpstreamServiceException} after being recorded;
 * exhausted extraction is a normal response carrying the
 * {@link CommandResponse#EXTRACTION_EXHAUSTED} diagnostic.
 *
 * @see com.phillippitts.speaktorobot.service.extraction.ExtractionRetryLoop
 */
public interface CommandOrchestrator {

    /**
     * Process an utterance under a newly generated correlation ID.
     */
    default CommandResponse process(UtteranceRequest request) {
        return process(request, null);
    }

    /**
     * @param request       utterance and optional caller-supplied retry context
     * @param correlationId correlation ID supplied by the caller, or null to generate one
     * @return response for the caller
     */
    CommandResponse process(UtteranceRequest request, String correlationId);
}
