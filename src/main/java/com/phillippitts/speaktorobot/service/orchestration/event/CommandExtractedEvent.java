package com.phillippitts.speaktorobot.service.orchestration.event;

import com.phillippitts.speaktorobot.domain.Command;

import java.time.Instant;

/**
 * Emitted when an utterance produced a valid command.
 *
 * @param correlationId request correlation ID
 * @param command the validated command
 * @param attempts model calls it took
 * @param timestamp when extraction completed
 */
public record CommandExtractedEvent(
        String correlationId,
        Command command,
        int attempts,
        Instant timestamp
) {}
