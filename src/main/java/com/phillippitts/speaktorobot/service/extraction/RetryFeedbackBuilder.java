package com.phillippitts.speaktorobot.service.extraction;

import java.util.List;

/**
 * Builds the corrective text handed to the model on a retry. Output depends only on the ordered
 * reasons, so the same failures always produce the same feedback.
 */
public final class RetryFeedbackBuilder {

    static final String PREFIX = "Previous attempt failed because: ";
    static final String SUFFIX = ". Correct and respond again.";

    private RetryFeedbackBuilder() {
    }

    /**
     * @param reasons ordered, non-empty validation reasons
     * @return {@code Previous attempt failed because: r1; r2. Correct and respond again.}
     */
    public static String build(List<String> reasons) {
        if (reasons == null || reasons.isEmpty()) {
            throw new IllegalArgumentException("reasons must not be empty");
        }
        return PREFIX + String.join("; ", reasons) + SUFFIX;
    }
}
