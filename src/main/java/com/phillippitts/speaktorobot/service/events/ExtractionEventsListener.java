package com.phillippitts.speaktorobot.service.events;

import com.phillippitts.speaktorobot.service.execution.event.CommandDispatchedEvent;
import com.phillippitts.speaktorobot.service.orchestration.event.CommandExtractedEvent;
import com.phillippitts.speaktorobot.service.orchestration.event.ExtractionExhaustedEvent;
import com.phillippitts.speaktorobot.service.orchestration.event.UpstreamFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for pipeline events. Privacy-safe (no utterance text) and throttled per
 * failure kind to avoid log spam while the model is down.
 */
@Component
class ExtractionEventsListener {
    private static final Logger LOG = LogManager.getLogger(ExtractionEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCommandExtracted(CommandExtractedEvent e) {
        LOG.debug("Command extracted: correlationId={}, command={}, attempts={}",
                e.correlationId(), e.command().commandName(), e.attempts());
    }

    @EventListener
    void onCommandDispatched(CommandDispatchedEvent e) {
        LOG.info("Command dispatched: correlationId={}, command={}", e.correlationId(), e.command().commandName());
    }

    @EventListener
    void onExtractionExhausted(ExtractionExhaustedEvent e) {
        if (shouldLog("exhausted")) {
            LOG.warn("Model repeatedly produced invalid commands (correlationId={}, attempts={}). "
                    + "Check the system prompt and model. Last reasons: {}",
                    e.correlationId(), e.attempts(), e.lastReasons());
        }
    }

    @EventListener
    void onUpstreamFailure(UpstreamFailureEvent e) {
        String key = "upstream-" + e.serviceName() + '-' + (e.timeout() ? "timeout" : e.statusCode());
        if (shouldLog(key)) {
            LOG.error("Language model unavailable: service={}, status={}, timeout={}. Check robot.llm.base-url "
                    + "and that the model runner is up.", e.serviceName(), e.statusCode(), e.timeout());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
