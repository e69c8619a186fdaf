package com.phillippitts.speaktorobot.service.execution;

import com.phillippitts.speaktorobot.domain.Command;

/**
 * Downstream collaborator that carries out validated commands.
 *
 * <p>Only commands that passed validation are dispatched; implementations may rely on every
 * constraint of the command kind holding.
 */
public interface CommandDispatcher {

    /**
     * @param command       validated, actionable command
     * @param correlationId correlation ID for tracing (nullable for direct submissions)
     * @return human-readable execution summary
     */
    String dispatch(Command command, String correlationId);
}
