package com.phillippitts.speaktorobot.service.orchestration.event;

import java.time.Instant;
import java.util.List;

/**
 * Emitted when the retry budget ran out without a valid command.
 *
 * @param correlationId request correlation ID
 * @param attempts model calls made
 * @param lastReasons validation reasons of the final attempt
 * @param timestamp when the loop gave up
 */
public record ExtractionExhaustedEvent(
        String correlationId,
        int attempts,
        List<String> lastReasons,
        Instant timestamp
) {
    public ExtractionExhaustedEvent {
        lastReasons = List.copyOf(lastReasons);
    }
}
