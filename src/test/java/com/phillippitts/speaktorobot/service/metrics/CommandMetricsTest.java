package com.phillippitts.speaktorobot.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CommandMetricsTest {

    private SimpleMeterRegistry registry;
    private CommandMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CommandMetrics(registry);
    }

    @Test
    void recordsLatencyPerOutcome() {
        metrics.recordLatency("command", TimeUnit.MILLISECONDS.toNanos(120));
        metrics.recordLatency("command", TimeUnit.MILLISECONDS.toNanos(80));
        metrics.recordLatency("no_command", TimeUnit.MILLISECONDS.toNanos(50));

        assertThat(registry.get("speaktorobot.extraction.latency").tag("outcome", "command").timer().count())
                .isEqualTo(2);
        assertThat(registry.get("speaktorobot.extraction.latency").tag("outcome", "command").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
    }

    @Test
    void countsOutcomesByCommand() {
        metrics.incrementOutcome("command", "rotate");
        metrics.incrementOutcome("command", "rotate");
        metrics.incrementOutcome("command", "move_to");

        assertThat(registry.get("speaktorobot.extraction.outcome").tags("command", "rotate").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("speaktorobot.extraction.outcome").tags("command", "move_to").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void summarizesAttempts() {
        metrics.recordAttempts(1);
        metrics.recordAttempts(2);

        assertThat(registry.get("speaktorobot.extraction.attempts").summary().count()).isEqualTo(2);
        assertThat(registry.get("speaktorobot.extraction.attempts").summary().totalAmount()).isEqualTo(3.0);
    }

    @Test
    void countsUpstreamFailuresByReason() {
        metrics.incrementUpstreamFailure("timeout");

        assertThat(registry.get("speaktorobot.extraction.upstream.failure").tag("reason", "timeout")
                .counter().count()).isEqualTo(1.0);
    }
}
