package com.phillippitts.speaktorobot.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when the language-model service failed a request.
 *
 * @param correlationId request correlation ID
 * @param serviceName failing upstream service
 * @param statusCode HTTP status, or -1 if no response was received
 * @param timeout whether the call timed out
 * @param message failure description
 * @param timestamp when the failure surfaced
 */
public record UpstreamFailureEvent(
        String correlationId,
        String serviceName,
        int statusCode,
        boolean timeout,
        String message,
        Instant timestamp
) {}
