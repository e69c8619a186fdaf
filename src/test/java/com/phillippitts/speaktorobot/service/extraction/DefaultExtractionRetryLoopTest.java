package com.phillippitts.speaktorobot.service.extraction;

import com.phillippitts.speaktorobot.config.ThreadPoolConfig;
import com.phillippitts.speaktorobot.config.properties.ExtractionProperties;
import com.phillippitts.speaktorobot.config.properties.ThreadPoolProperties;
import com.phillippitts.speaktorobot.domain.ExtractionResult;
import com.phillippitts.speaktorobot.domain.MoveToCommand;
import com.phillippitts.speaktorobot.domain.RequestContext;
import com.phillippitts.speaktorobot.domain.RotateCommand;
import com.phillippitts.speaktorobot.domain.RotationDirection;
import com.phillippitts.speaktorobot.domain.Verdict;
import com.phillippitts.speaktorobot.exception.RequestCancelledException;
import com.phillippitts.speaktorobot.exception.UpstreamServiceException;
import com.phillippitts.speaktorobot.service.llm.CandidateParser;
import com.phillippitts.speaktorobot.service.llm.ExtractionRequest;
import com.phillippitts.speaktorobot.service.schema.CommandSchema;
import com.phillippitts.speaktorobot.service.validation.CommandValidator;
import com.phillippitts.speaktorobot.testutil.ScriptedLanguageModelService;
import com.phillippitts.speaktorobot.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.phillippitts.speaktorobot.testutil.Replies.command;
import static com.phillippitts.speaktorobot.testutil.Replies.conversation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class DefaultExtractionRetryLoopTest {

    private static final String ROTATE_400 = command("Rotating.", "rotate", "{\"angle\": 400, \"direction\": \"clockwise\"}");
    private static final String ROTATE_90 = command("Rotating.", "rotate", "{\"angle\": 90, \"direction\": \"clockwise\"}");

    private final CommandSchema schema = CommandSchema.standard(-100, 100, List.of(), false);
    private ExecutorService pool;
    private ThreadPoolTaskExecutor llmPool;

    @AfterEach
    void shutdown() {
        if (pool != null) {
            pool.shutdownNow();
        }
        if (llmPool != null) {
            llmPool.shutdown();
        }
    }

    private DefaultExtractionRetryLoop loop(ScriptedLanguageModelService model, int maxAttempts) {
        return new DefaultExtractionRetryLoop(model, new CandidateParser(schema), new CommandValidator(schema),
                new SyncExecutor(), new ExtractionProperties(maxAttempts, Duration.ofSeconds(5)));
    }

    private static RequestContext context(String input) {
        return new RequestContext("cid-1", input, null);
    }

    @Test
    void validFirstAttemptCompletesWithoutRetry() {
        ScriptedLanguageModelService model = ScriptedLanguageModelService.replying(
                command("Heading there.", "move_to", "{\"x\": 5, \"y\": 7}"));
        RequestContext ctx = context("Go to coordinates 5, 7");

        ExtractionResult result = loop(model, 2).run(ctx);

        assertThat(result.status()).isEqualTo(ExtractionResult.Status.COMMAND);
        assertThat(result.command()).isEqualTo(new MoveToCommand(5, 7));
        assertThat(result.responseText()).isEqualTo("Heading there.");
        assertThat(result.attemptCount()).isEqualTo(1);
        assertThat(model.callCount()).isEqualTo(1);
        assertThat(model.requests().get(0).retryContext()).isNull();
        assertThat(ctx.isComplete()).isTrue();
    }

    @Test
    void invalidAttemptIsRetriedWithFeedback() {
        ScriptedLanguageModelService model = ScriptedLanguageModelService.replying(ROTATE_400, ROTATE_90);
        RequestContext ctx = context("Rotate 90 degrees clockwise");

        ExtractionResult result = loop(model, 2).run(ctx);

        assertThat(result.status()).isEqualTo(ExtractionResult.Status.COMMAND);
        assertThat(result.command()).isEqualTo(new RotateCommand(90, RotationDirection.CLOCKWISE));
        assertThat(result.attemptCount()).isEqualTo(2);

        ExtractionRequest retry = model.requests().get(1);
        assertThat(retry.attempt()).isEqualTo(2);
        assertThat(retry.userInput()).isEqualTo("Rotate 90 degrees clockwise");
        assertThat(retry.retryContext()).isEqualTo(
                "Previous attempt failed because: angle must be in (0, 360], got 400. Correct and respond again.");
        assertThat(result.attempts().get(0).feedback()).isEqualTo(retry.retryContext());
    }

    @Test
    void exhaustsAfterMaxAttempts() {
        ScriptedLanguageModelService model = ScriptedLanguageModelService.replying(ROTATE_400, ROTATE_400);

        ExtractionResult result = loop(model, 2).run(context("Rotate 400 degrees"));

        assertThat(result.status()).isEqualTo(ExtractionResult.Status.EXHAUSTED);
        assertThat(result.command().isActionable()).isFalse();
        assertThat(result.attemptCount()).isEqualTo(2);
        assertThat(result.lastReasons()).containsExactly("angle must be in (0, 360], got 400");
        assertThat(result.attempts().get(1).feedback()).isNull();
        assertThat(model.callCount()).isEqualTo(2);
    }

    @Test
    void singleAttemptBudgetNeverRetries() {
        ScriptedLanguageModelService model = ScriptedLanguageModelService.replying(ROTATE_400);

        ExtractionResult result = loop(model, 1).run(context("Rotate 400 degrees"));

        assertThat(result.status()).isEqualTo(ExtractionResult.Status.EXHAUSTED);
        assertThat(model.callCount()).isEqualTo(1);
    }

    @Test
    void conversationalReplyIsNotRetried() {
        ScriptedLanguageModelService model = ScriptedLanguageModelService.replying(
                conversation("I can't fly, but I can patrol!"));

        ExtractionResult result = loop(model, 3).run(context("Fly to the moon"));

        assertThat(result.status()).isEqualTo(ExtractionResult.Status.NO_COMMAND);
        assertThat(result.responseText()).isEqualTo("I can't fly, but I can patrol!");
        assertThat(result.attempts().get(0).verdict()).isInstanceOf(Verdict.NotACommand.class);
        assertThat(model.callCount()).isEqualTo(1);
    }

    @Test
    void unparseableReplyCountsAsInvalidAttempt() {
        ScriptedLanguageModelService model = ScriptedLanguageModelService.replying(
                "Sure, moving now!", command("Heading there.", "move_to", "{\"x\": 1, \"y\": 2}"));

        ExtractionResult result = loop(model, 2).run(context("Go to 1, 2"));

        assertThat(result.status()).isEqualTo(ExtractionResult.Status.COMMAND);
        assertThat(result.attempts().get(0).isParsed()).isFalse();
        assertThat(model.requests().get(1).retryContext())
                .contains("response could not be parsed as a command: no JSON object found");
    }

    @Test
    void callerRetryContextIsSentOnFirstAttempt() {
        ScriptedLanguageModelService model = ScriptedLanguageModelService.replying(ROTATE_90);
        RequestContext ctx = new RequestContext("cid-2", "Rotate", "angle was missing last time");

        loop(model, 2).run(ctx);

        assertThat(model.requests().get(0).retryContext()).isEqualTo("angle was missing last time");
    }

    @Test
    void forwardsCorrelationIdToModel() {
        ScriptedLanguageModelService model = ScriptedLanguageModelService.replying(ROTATE_90);

        loop(model, 2).run(context("Rotate"));

        assertThat(model.requests()).extracting(ExtractionRequest::correlationId).containsExactly("cid-1");
    }

    @Test
    void upstreamFailureIsPropagatedWithoutRetry() {
        ScriptedLanguageModelService model = new ScriptedLanguageModelService()
                .thenThrow(new UpstreamServiceException("connection refused", UpstreamServiceException.LANGUAGE_MODEL));

        assertThatThrownBy(() -> loop(model, 2).run(context("Go to 5, 7")))
                .isInstanceOf(UpstreamServiceException.class)
                .hasMessageContaining("connection refused");
        assertThat(model.callCount()).isEqualTo(1);
    }

    @Test
    void unexpectedModelErrorIsWrappedAsUpstreamFailure() {
        ScriptedLanguageModelService model = new ScriptedLanguageModelService()
                .thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> loop(model, 2).run(context("Go to 5, 7")))
                .isInstanceOf(UpstreamServiceException.class)
                .hasMessageContaining("Language model call failed")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void slowModelCallTimesOut() {
        pool = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        ScriptedLanguageModelService model = new ScriptedLanguageModelService().then(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ROTATE_90;
        });
        DefaultExtractionRetryLoop loop = new DefaultExtractionRetryLoop(model, new CandidateParser(schema),
                new CommandValidator(schema), pool, new ExtractionProperties(2, Duration.ofMillis(100)));

        try {
            assertThatThrownBy(() -> loop.run(context("Rotate")))
                    .isInstanceOf(UpstreamServiceException.class)
                    .hasMessageContaining("timed out")
                    .satisfies(e -> assertThat(((UpstreamServiceException) e).isTimeout()).isTrue());
        } finally {
            release.countDown();
        }
        assertThat(model.callCount()).isEqualTo(1);
    }

    @Test
    void interruptedCallerCancelsRequest() throws InterruptedException {
        pool = Executors.newSingleThreadExecutor();
        CountDownLatch started = new CountDownLatch(1);
        ScriptedLanguageModelService model = new ScriptedLanguageModelService().then(() -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ROTATE_90;
        });
        DefaultExtractionRetryLoop loop = new DefaultExtractionRetryLoop(model, new CandidateParser(schema),
                new CommandValidator(schema), pool, new ExtractionProperties(2, Duration.ofSeconds(30)));
        AtomicReference<Throwable> thrown = new AtomicReference<>();

        Thread caller = new Thread(() -> {
            try {
                loop.run(context("Rotate"));
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        caller.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();

        await().atMost(Duration.ofSeconds(5)).until(() -> thrown.get() != null);
        assertThat(thrown.get()).isInstanceOf(RequestCancelledException.class);
        assertThat(((RequestCancelledException) thrown.get()).getCorrelationId()).isEqualTo("cid-1");
    }

    @Test
    void rejectedExecutionBecomesUpstreamFailure() {
        ScriptedLanguageModelService model = ScriptedLanguageModelService.replying(ROTATE_90);
        DefaultExtractionRetryLoop loop = new DefaultExtractionRetryLoop(model, new CandidateParser(schema),
                new CommandValidator(schema), task -> {
                    throw new RejectedExecutionException("queue full");
                }, new ExtractionProperties());

        assertThatThrownBy(() -> loop.run(context("Rotate")))
                .isInstanceOf(UpstreamServiceException.class)
                .hasMessageContaining("rejected");
        assertThat(model.callCount()).isZero();
    }

    @Test
    void saturatedPoolFailsFastInsteadOfRunningOnCaller() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getLlm().setCorePoolSize(1);
        properties.getLlm().setMaxPoolSize(1);
        properties.getLlm().setQueueCapacity(0);
        llmPool = (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).llmExecutor();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch occupied = new CountDownLatch(1);
        llmPool.execute(() -> {
            occupied.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        ScriptedLanguageModelService model = new ScriptedLanguageModelService().then(() -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ROTATE_90;
        });
        DefaultExtractionRetryLoop loop = new DefaultExtractionRetryLoop(model, new CandidateParser(schema),
                new CommandValidator(schema), llmPool, new ExtractionProperties(2, Duration.ofMillis(100)));

        assertThat(occupied.await(5, TimeUnit.SECONDS)).isTrue();
        long start = System.nanoTime();
        try {
            assertThatThrownBy(() -> loop.run(context("Rotate 90 degrees")))
                    .isInstanceOf(UpstreamServiceException.class)
                    .hasMessageContaining("rejected");
        } finally {
            release.countDown();
        }
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
        assertThat(model.callCount()).isZero();
    }

    @Test
    void rejectsZeroAttemptBudget() {
        assertThatThrownBy(() -> loop(new ScriptedLanguageModelService(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
