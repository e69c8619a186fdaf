package com.phillippitts.speaktorobot.config;

import com.phillippitts.speaktorobot.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs language-model calls.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded pool on which each extraction attempt calls the language model, so the
     * request thread can enforce a per-attempt timeout and cancel the call.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.llm.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - handles typical load</li>
     *   <li>Max pool: default 8 - handles burst traffic</li>
     *   <li>Queue: default 50 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}
     * When the pool and queue are full the call is rejected and the attempt fails as an upstream
     * error. The task must never run on the request thread, where the attempt timeout cannot
     * interrupt it.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread to preserve request and correlation IDs in async logs.
     *
     * @return Configured executor for language-model calls
     */
    @Bean(name = "llmExecutor")
    public Executor llmExecutor() {
        ThreadPoolProperties.LlmPoolProperties llmProps = threadPoolProperties.getLlm();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(llmProps.getCorePoolSize());
        executor.setMaxPoolSize(llmProps.getMaxPoolSize());
        executor.setQueueCapacity(llmProps.getQueueCapacity());
        executor.setThreadNamePrefix(llmProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(llmProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitter's ThreadContext into the worker for the task's duration and restores
     * the worker's previous context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
