package com.phillippitts.speaktorobot.service.extraction;

import com.phillippitts.speaktorobot.config.properties.ExtractionProperties;
import com.phillippitts.speaktorobot.domain.CommandCandidate;
import com.phillippitts.speaktorobot.domain.ExtractionAttempt;
import com.phillippitts.speaktorobot.domain.ExtractionResult;
import com.phillippitts.speaktorobot.domain.RequestContext;
import com.phillippitts.speaktorobot.domain.Verdict;
import com.phillippitts.speaktorobot.exception.RequestCancelledException;
import com.phillippitts.speaktorobot.exception.SpeakToRobotException;
import com.phillippitts.speaktorobot.exception.UpstreamServiceExceptionBuilder;
import com.phillippitts.speaktorobot.service.llm.CandidateParser;
import com.phillippitts.speaktorobot.service.llm.ExtractionRequest;
import com.phillippitts.speaktorobot.service.llm.LanguageModelService;
import com.phillippitts.speaktorobot.service.llm.ParsedOutput;
import com.phillippitts.speaktorobot.service.validation.CommandValidator;
import com.phillippitts.speaktorobot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link ExtractionRetryLoop}.
 *
 * <p>Per attempt: call the model on {@code llmExecutor} (bounded by the attempt timeout), parse
 * the reply, validate the candidate, then
 * <ul>
 *   <li>{@code Valid}: done with the command</li>
 *   <li>{@code NotACommand}: done without a command; never retried</li>
 *   <li>{@code Invalid} with attempts left: retry with feedback built from the reasons</li>
 *   <li>{@code Invalid} on the last attempt: exhausted</li>
 * </ul>
 *
 * <p>Thread-safe: all per-request state lives in the {@link RequestContext}.
 */
public class DefaultExtractionRetryLoop implements ExtractionRetryLoop {

    private static final Logger LOG = LogManager.getLogger(DefaultExtractionRetryLoop.class);

    static final String UNPARSEABLE_PREFIX = "response could not be parsed as a command: ";

    private final LanguageModelService modelService;
    private final CandidateParser parser;
    private final CommandValidator validator;
    private final Executor llmExecutor;
    private final int maxAttempts;
    private final long attemptTimeoutMs;

    public DefaultExtractionRetryLoop(LanguageModelService modelService,
                                      CandidateParser parser,
                                      CommandValidator validator,
                                      Executor llmExecutor,
                                      ExtractionProperties props) {
        this.modelService = Objects.requireNonNull(modelService, "modelService");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.llmExecutor = Objects.requireNonNull(llmExecutor, "llmExecutor");
        Objects.requireNonNull(props, "props");
        if (props.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + props.getMaxAttempts());
        }
        this.maxAttempts = props.getMaxAttempts();
        this.attemptTimeoutMs = props.getAttemptTimeout().toMillis();
    }

    @Override
    public ExtractionResult run(RequestContext context) {
        Objects.requireNonNull(context, "context");
        String retryContext = context.initialRetryContext();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ExtractionRequest request = new ExtractionRequest(
                    context.userInput(), retryContext, context.correlationId(), attempt);
            String raw = callModel(request);

            ParsedOutput parsed = parser.parse(raw);
            CommandCandidate candidate = parsed.candidate();
            Verdict verdict = parsed.isParsed()
                    ? validator.validate(candidate)
                    : Verdict.invalid(UNPARSEABLE_PREFIX + parsed.error());
            String responseText = candidate != null ? candidate.responseText() : null;

            if (verdict instanceof Verdict.Valid valid) {
                context.recordAttempt(new ExtractionAttempt(attempt, raw, candidate, verdict, null));
                LOG.info("Extracted {} on attempt {}", valid.command().commandName(), attempt);
                return complete(context, ExtractionResult.command(valid.command(), responseText, context.attempts()));
            }
            if (verdict instanceof Verdict.NotACommand) {
                context.recordAttempt(new ExtractionAttempt(attempt, raw, candidate, verdict, null));
                LOG.info("No command in utterance (attempt {})", attempt);
                return complete(context, ExtractionResult.noCommand(responseText, context.attempts()));
            }

            Verdict.Invalid invalid = (Verdict.Invalid) verdict;
            if (attempt < maxAttempts) {
                String feedback = RetryFeedbackBuilder.build(invalid.reasons());
                context.recordAttempt(new ExtractionAttempt(attempt, raw, candidate, verdict, feedback));
                LOG.info("Attempt {}/{} rejected, retrying: {}", attempt, maxAttempts, invalid.reasons());
                retryContext = feedback;
            } else {
                context.recordAttempt(new ExtractionAttempt(attempt, raw, candidate, verdict, null));
                LOG.warn("Extraction exhausted after {} attempt(s): {} (input='{}')",
                        attempt, invalid.reasons(), LogSanitizer.preview(context.userInput()));
                return complete(context, ExtractionResult.exhausted(responseText, context.attempts()));
            }
        }
        // unreachable: the last iteration always returns
        throw new IllegalStateException("Extraction loop ended without a result");
    }

    private static ExtractionResult complete(RequestContext context, ExtractionResult result) {
        context.complete(result);
        return result;
    }

    /**
     * Runs one model call on the executor and waits at most the attempt timeout.
     */
    private String callModel(ExtractionRequest request) {
        FutureTask<String> task = new FutureTask<>(() -> {
            ThreadContext.put("attempt", String.valueOf(request.attempt()));
            try {
                return modelService.generate(request);
            } finally {
                ThreadContext.remove("attempt");
            }
        });
        long start = System.nanoTime();
        try {
            llmExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            throw UpstreamServiceExceptionBuilder.create("Language model executor rejected the call")
                    .cause(e)
                    .metadata("attempt", request.attempt())
                    .build();
        }

        try {
            String raw = task.get(attemptTimeoutMs, TimeUnit.MILLISECONDS);
            return raw == null ? "" : raw;
        } catch (TimeoutException e) {
            task.cancel(true);
            throw UpstreamServiceExceptionBuilder.create("Language model call timed out")
                    .cause(e)
                    .durationMs((System.nanoTime() - start) / 1_000_000L)
                    .metadata("attempt", request.attempt())
                    .metadata("timeoutMs", attemptTimeoutMs)
                    .build();
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(request.correlationId(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SpeakToRobotException ste) {
                throw ste;
            }
            throw UpstreamServiceExceptionBuilder.create("Language model call failed")
                    .cause(cause)
                    .durationMs((System.nanoTime() - start) / 1_000_000L)
                    .metadata("attempt", request.attempt())
                    .build();
        }
    }
}
