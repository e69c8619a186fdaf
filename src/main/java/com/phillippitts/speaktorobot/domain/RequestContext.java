package com.phillippitts.speaktorobot.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-request state for one end-to-end user interaction.
 *
 * <p>Confined to the request that created it and never shared between threads. The
 * extraction-retry loop is the only component that appends attempts; everything else reads.
 */
public final class RequestContext {

    private final String correlationId;
    private final String userInput;
    private final String initialRetryContext;
    private final long startNanos;
    private final List<ExtractionAttempt> attempts = new ArrayList<>();
    private ExtractionResult result;

    /**
     * @param correlationId       unique identifier of this interaction
     * @param userInput           the caller's utterance (non-blank)
     * @param initialRetryContext caller-supplied corrective context for the first attempt (nullable)
     */
    public RequestContext(String correlationId, String userInput, String initialRetryContext) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId must not be null");
        this.userInput = Objects.requireNonNull(userInput, "userInput must not be null");
        this.initialRetryContext = initialRetryContext == null || initialRetryContext.isBlank()
                ? null : initialRetryContext;
        this.startNanos = System.nanoTime();
    }

    public String correlationId() {
        return correlationId;
    }

    public String userInput() {
        return userInput;
    }

    public String initialRetryContext() {
        return initialRetryContext;
    }

    public long startNanos() {
        return startNanos;
    }

    /**
     * Appends the next attempt. Attempt numbers must be consecutive starting at 1.
     */
    public void recordAttempt(ExtractionAttempt attempt) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        if (result != null) {
            throw new IllegalStateException("Request " + correlationId + " already completed");
        }
        int expected = attempts.size() + 1;
        if (attempt.number() != expected) {
            throw new IllegalStateException("Expected attempt " + expected + " but got " + attempt.number());
        }
        attempts.add(attempt);
    }

    public List<ExtractionAttempt> attempts() {
        return Collections.unmodifiableList(attempts);
    }

    public int attemptCount() {
        return attempts.size();
    }

    public void complete(ExtractionResult result) {
        if (this.result != null) {
            throw new IllegalStateException("Request " + correlationId + " already completed");
        }
        this.result = Objects.requireNonNull(result, "result must not be null");
    }

    public boolean isComplete() {
        return result != null;
    }

    /**
     * @return the final result, or {@code null} while the request is in flight
     */
    public ExtractionResult result() {
        return result;
    }
}
