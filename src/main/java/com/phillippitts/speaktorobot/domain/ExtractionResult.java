package com.phillippitts.speaktorobot.domain;

import java.util.List;
import java.util.Objects;

/**
 * Terminal state of the extraction-retry loop.
 *
 * <p>Infrastructure failures of the language-model service are not represented here; they
 * propagate as {@link com.phillippitts.speaktorobot.exception.UpstreamServiceException}.
 *
 * @param status       terminal status
 * @param command      the validated command ({@link NoCommand} unless status is {@link Status#COMMAND})
 * @param responseText the model's human-readable reply from the final attempt (nullable)
 * @param attempts     the attempts that led here, in order
 */
public record ExtractionResult(
        Status status,
        Command command,
        String responseText,
        List<ExtractionAttempt> attempts
) {

    public enum Status {
        /** A valid, actionable command was extracted. */
        COMMAND,
        /** The utterance was classified as conversational; no command. */
        NO_COMMAND,
        /** The retry budget was consumed without a valid command. */
        EXHAUSTED
    }

    public ExtractionResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(command, "command must not be null");
        attempts = List.copyOf(attempts);
        if (status == Status.COMMAND && !command.isActionable()) {
            throw new IllegalArgumentException("COMMAND result requires an actionable command");
        }
        if (status != Status.COMMAND && command.isActionable()) {
            throw new IllegalArgumentException(status + " result must not carry a command");
        }
    }

    public static ExtractionResult command(Command command, String responseText, List<ExtractionAttempt> attempts) {
        return new ExtractionResult(Status.COMMAND, command, responseText, attempts);
    }

    public static ExtractionResult noCommand(String responseText, List<ExtractionAttempt> attempts) {
        return new ExtractionResult(Status.NO_COMMAND, NoCommand.INSTANCE, responseText, attempts);
    }

    public static ExtractionResult exhausted(String responseText, List<ExtractionAttempt> attempts) {
        return new ExtractionResult(Status.EXHAUSTED, NoCommand.INSTANCE, responseText, attempts);
    }

    public int attemptCount() {
        return attempts.size();
    }

    /**
     * Reasons from the final attempt when it was rejected.
     *
     * @return ordered reasons, or an empty list if the last attempt was not {@code Invalid}
     */
    public List<String> lastReasons() {
        if (attempts.isEmpty()) {
            return List.of();
        }
        Verdict last = attempts.get(attempts.size() - 1).verdict();
        return last instanceof Verdict.Invalid invalid ? invalid.reasons() : List.of();
    }
}
