/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Request-level values are put into Log4j2's {@code ThreadContext} by
 * {@link com.phillippitts.speaktorobot.config.logging.MdcFilter}; the orchestrator adds the
 * command correlation ID, and the {@code llmExecutor} task decorator copies the context into
 * language-model worker threads.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request (UUID unless supplied in {@code X-Request-ID})</li>
 *   <li>{@code correlationId} - per utterance, shared by every extraction attempt</li>
 *   <li>{@code attempt} - extraction attempt number while a model call is in flight</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [thread-name] [requestId] [correlationId] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.speaktorobot.config.logging;
