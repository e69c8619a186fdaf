package com.phillippitts.speaktorobot.service.orchestration;

import com.phillippitts.speaktorobot.domain.Command;
import com.phillippitts.speaktorobot.domain.CommandResponse;
import com.phillippitts.speaktorobot.domain.ExtractionResult;
import com.phillippitts.speaktorobot.domain.RequestContext;
import com.phillippitts.speaktorobot.domain.UtteranceRequest;
import com.phillippitts.speaktorobot.exception.ClientInputException;
import com.phillippitts.speaktorobot.exception.UpstreamServiceException;
import com.phillippitts.speaktorobot.service.execution.CommandDispatcher;
import com.phillippitts.speaktorobot.service.extraction.ExtractionRetryLoop;
import com.phillippitts.speaktorobot.service.orchestration.event.CommandExtractedEvent;
import com.phillippitts.speaktorobot.service.orchestration.event.ExtractionExhaustedEvent;
import com.phillippitts.speaktorobot.service.orchestration.event.UpstreamFailureEvent;
import com.phillippitts.speaktorobot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Default implementation of {@link CommandOrchestrator}.
 *
 * <p>Each call owns a fresh {@link RequestContext}; nothing is shared between requests, so the
 * orchestrator is safe to call concurrently.
 */
public class DefaultCommandOrchestrator implements CommandOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultCommandOrchestrator.class);

    static final String USER_INPUT_FIELD = "user_input";
    static final String MDC_CORRELATION_ID = "correlationId";
    static final String DEFAULT_CONVERSATIONAL_REPLY =
            "I didn't hear a robot command. Try asking me to move somewhere, rotate, or start a patrol.";

    private final ExtractionRetryLoop loop;
    private final CommandDispatcher dispatcher;
    private final CorrelationIdGenerator idGenerator;
    private final ApplicationEventPublisher publisher;
    private final CommandMetricsPublisher metricsPublisher;

    public DefaultCommandOrchestrator(ExtractionRetryLoop loop,
                                      CommandDispatcher dispatcher,
                                      CorrelationIdGenerator idGenerator,
                                      ApplicationEventPublisher publisher,
                                      CommandMetricsPublisher metricsPublisher) {
        this.loop = Objects.requireNonNull(loop, "loop must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metricsPublisher = Objects.requireNonNull(metricsPublisher, "metricsPublisher must not be null");
    }

    @Override
    public CommandResponse process(UtteranceRequest request, String correlationId) {
        if (request == null || request.userInput() == null || request.userInput().isBlank()) {
            throw ClientInputException.missing(USER_INPUT_FIELD);
        }
        String cid = correlationId == null || correlationId.isBlank() ? idGenerator.next() : correlationId;

        String previousCid = ThreadContext.get(MDC_CORRELATION_ID);
        ThreadContext.put(MDC_CORRELATION_ID, cid);
        try {
            RequestContext context = new RequestContext(cid, request.userInput().trim(), request.retryContext());
            LOG.info("Processing utterance '{}'{}", LogSanitizer.preview(context.userInput()),
                    context.initialRetryContext() != null ? " (with caller retry context)" : "");

            ExtractionResult result;
            try {
                result = loop.run(context);
            } catch (UpstreamServiceException e) {
                onUpstreamFailure(context, e);
                throw e;
            }
            metricsPublisher.recordResult(result, System.nanoTime() - context.startNanos());
            return toResponse(context, result);
        } finally {
            if (previousCid != null) {
                ThreadContext.put(MDC_CORRELATION_ID, previousCid);
            } else {
                ThreadContext.remove(MDC_CORRELATION_ID);
            }
        }
    }

    private CommandResponse toResponse(RequestContext context, ExtractionResult result) {
        String cid = context.correlationId();
        switch (result.status()) {
            case COMMAND: {
                Command command = result.command();
                String executionResult = dispatcher.dispatch(command, cid);
                publisher.publishEvent(new CommandExtractedEvent(cid, command, result.attemptCount(), Instant.now()));
                String reply = hasText(result.responseText()) ? result.responseText() : confirmation(command);
                return CommandResponse.forCommand(reply, command, cid, executionResult);
            }
            case NO_COMMAND: {
                String reply = hasText(result.responseText()) ? result.responseText() : DEFAULT_CONVERSATIONAL_REPLY;
                return CommandResponse.conversational(reply, cid);
            }
            case EXHAUSTED:
            default: {
                List<String> reasons = result.lastReasons();
                publisher.publishEvent(new ExtractionExhaustedEvent(cid, result.attemptCount(), reasons, Instant.now()));
                return CommandResponse.exhausted(apology(reasons), cid);
            }
        }
    }

    private void onUpstreamFailure(RequestContext context, UpstreamServiceException e) {
        metricsPublisher.recordUpstreamFailure(e, System.nanoTime() - context.startNanos());
        publisher.publishEvent(new UpstreamFailureEvent(context.correlationId(), e.getServiceName(),
                e.getStatusCode(), e.isTimeout(), e.getMessage(), Instant.now()));
        LOG.error("Language model failed after {} completed attempt(s): {}", context.attemptCount(), e.getMessage());
    }

    static String confirmation(Command command) {
        Map<String, Object> params = command.commandParams();
        String args = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        return "Executing " + command.commandName() + " (" + args + ").";
    }

    static String apology(List<String> reasons) {
        String base = "Sorry, I couldn't turn that into a valid robot command";
        if (reasons.isEmpty()) {
            return base + ". Please rephrase.";
        }
        return base + " (" + reasons.get(0) + "). Please rephrase.";
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
