package com.phillippitts.speaktorobot.service.execution.event;

import com.phillippitts.speaktorobot.domain.Command;

import java.time.Instant;

/**
 * Emitted after a validated command was handed to the robot (or its simulation).
 *
 * @param correlationId request correlation ID (nullable for direct submissions)
 * @param command the dispatched command
 * @param summary human-readable execution summary
 * @param timestamp when the command was dispatched
 */
public record CommandDispatchedEvent(
        String correlationId,
        Command command,
        String summary,
        Instant timestamp
) {}
