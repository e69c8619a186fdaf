package com.phillippitts.speaktorobot.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the extraction-retry loop.
 */
@Validated
@ConfigurationProperties(prefix = "robot.extraction")
public class ExtractionProperties {

    public static final int DEFAULT_MAX_ATTEMPTS = 2;
    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Total language-model calls allowed per utterance, including the first one.
     */
    @Min(1)
    @Max(5)
    private final int maxAttempts;

    /**
     * Upper bound on a single language-model call. Exceeding it cancels the call and fails the
     * request as an upstream error.
     */
    @NotNull
    private final Duration attemptTimeout;

    @ConstructorBinding
    public ExtractionProperties(Integer maxAttempts, Duration attemptTimeout) {
        this.maxAttempts = maxAttempts == null ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
        this.attemptTimeout = attemptTimeout == null ? DEFAULT_ATTEMPT_TIMEOUT : attemptTimeout;
    }

    /**
     * Defaults: two attempts, 30 second timeout.
     */
    public ExtractionProperties() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_ATTEMPT_TIMEOUT);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }
}
