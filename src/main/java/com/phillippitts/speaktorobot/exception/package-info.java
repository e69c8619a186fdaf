/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.speaktorobot.exception.SpeakToRobotException} - Base exception</li>
 *   <li>{@link com.phillippitts.speaktorobot.exception.ClientInputException} - Missing or blank
 *       request field; rejected before any model call</li>
 *   <li>{@link com.phillippitts.speaktorobot.exception.UpstreamServiceException} - Model service
 *       failed, timed out or returned an uninterpretable envelope</li>
 *   <li>{@link com.phillippitts.speaktorobot.exception.RequestCancelledException} - Request thread
 *       interrupted while an attempt was in flight</li>
 *   <li>{@link com.phillippitts.speaktorobot.exception.PromptNotFoundException} - System prompt
 *       missing at startup</li>
 * </ul>
 *
 * <p>Validation failures are not exceptions: they are
 * {@link com.phillippitts.speaktorobot.domain.Verdict.Invalid} verdicts consumed by the retry loop.
 *
 * @see com.phillippitts.speaktorobot.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.speaktorobot.exception;
