package com.phillippitts.speaktorobot.service.llm;

/**
 * Boundary to the language model that turns an utterance into a (hopefully) structured reply.
 *
 * <p>Implementations perform blocking I/O and must be thread-safe. Transport failures,
 * timeouts, non-success statuses and malformed envelopes are reported as
 * {@link com.phillippitts.speaktorobot.exception.UpstreamServiceException}; the content of a
 * successful reply is returned as-is, even when it is not the JSON the prompt asked for.
 */
public interface LanguageModelService {

    /**
     * @param request utterance plus optional retry context
     * @return raw reply text (may be empty, never null)
     */
    String generate(ExtractionRequest request);

    /**
     * Lightweight reachability probe used by the health endpoint.
     *
     * @return true if the model endpoint answered
     */
    boolean isAvailable();
}
