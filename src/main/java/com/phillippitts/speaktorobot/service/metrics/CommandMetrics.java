package com.phillippitts.speaktorobot.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for command extraction.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>End-to-end extraction latency per outcome (command, no_command, exhausted)</li>
 *   <li>Outcome counts per command kind</li>
 *   <li>Attempts needed per utterance</li>
 *   <li>Language-model failures by reason</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class CommandMetrics {

    private static final String METRIC_PREFIX = "speaktorobot.extraction";

    private final MeterRegistry registry;

    public CommandMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records end-to-end extraction latency.
     *
     * @param outcome terminal outcome (command, no_command, exhausted, upstream_error)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to turn an utterance into a command")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the outcome counter.
     *
     * @param outcome terminal outcome
     * @param command command kind, or "none"
     */
    public void incrementOutcome(String outcome, String command) {
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of utterances by extraction outcome")
                .tag("outcome", outcome)
                .tag("command", command)
                .register(registry)
                .increment();
    }

    /**
     * Records how many model calls an utterance needed.
     */
    public void recordAttempts(int attempts) {
        DistributionSummary.builder(METRIC_PREFIX + ".attempts")
                .description("Language-model attempts per utterance")
                .register(registry)
                .record(attempts);
    }

    /**
     * Increments the language-model failure counter.
     *
     * @param reason failure category (timeout, status, transport)
     */
    public void incrementUpstreamFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".upstream.failure")
                .description("Number of failed language-model calls")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
