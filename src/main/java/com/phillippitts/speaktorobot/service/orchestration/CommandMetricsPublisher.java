package com.phillippitts.speaktorobot.service.orchestration;

import com.phillippitts.speaktorobot.domain.ExtractionResult;
import com.phillippitts.speaktorobot.exception.UpstreamServiceException;
import com.phillippitts.speaktorobot.service.metrics.CommandMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Translates orchestration outcomes into {@link CommandMetrics} calls.
 *
 * <p><b>Null Safety:</b> All methods handle a null {@link CommandMetrics} gracefully, allowing
 * the orchestrator to run without metrics in unit tests.
 */
@Component
public final class CommandMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(CommandMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and defaults.
     */
    public static final CommandMetricsPublisher NOOP = new CommandMetricsPublisher(null);

    static final String OUTCOME_UPSTREAM_ERROR = "upstream_error";

    private final CommandMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public CommandMetricsPublisher(CommandMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("CommandMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records a terminal extraction result.
     *
     * @param result terminal result
     * @param durationNanos time since request entry
     */
    public void recordResult(ExtractionResult result, long durationNanos) {
        if (metrics == null) {
            return;
        }
        String outcome = result.status().name().toLowerCase(Locale.ROOT);
        String command = result.command().isActionable() ? result.command().commandName() : "none";
        metrics.recordLatency(outcome, durationNanos);
        metrics.incrementOutcome(outcome, command);
        metrics.recordAttempts(result.attemptCount());
    }

    /**
     * Records a language-model failure.
     */
    public void recordUpstreamFailure(UpstreamServiceException e, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(OUTCOME_UPSTREAM_ERROR, durationNanos);
        metrics.incrementOutcome(OUTCOME_UPSTREAM_ERROR, "none");
        metrics.incrementUpstreamFailure(failureReason(e));
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    static String failureReason(UpstreamServiceException e) {
        if (e.isTimeout()) {
            return "timeout";
        }
        return e.getStatusCode() > 0 ? "status" : "transport";
    }
}
