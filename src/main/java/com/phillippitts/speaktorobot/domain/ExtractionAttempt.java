package com.phillippitts.speaktorobot.domain;

import java.util.Objects;

/**
 * One round of the extraction-retry loop.
 *
 * @param number    1-based attempt number
 * @param rawOutput raw model output (nullable if the model returned nothing)
 * @param candidate parsed candidate, or {@code null} when the output could not be parsed
 * @param verdict   validation verdict for this round
 * @param feedback  corrective text handed to the next attempt, or {@code null} if none follows
 */
public record ExtractionAttempt(
        int number,
        String rawOutput,
        CommandCandidate candidate,
        Verdict verdict,
        String feedback
) {

    public ExtractionAttempt {
        if (number < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1, got " + number);
        }
        Objects.requireNonNull(verdict, "verdict must not be null");
    }

    public boolean isParsed() {
        return candidate != null;
    }
}
