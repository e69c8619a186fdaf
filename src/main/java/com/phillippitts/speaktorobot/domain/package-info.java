/**
 * Domain model for command extraction.
 *
 * <p>Immutable records describe commands ({@link com.phillippitts.speaktorobot.domain.Command}),
 * unvalidated candidates, validation verdicts and loop attempts.
 * {@link com.phillippitts.speaktorobot.domain.RequestContext} is the only mutable type and is
 * confined to a single request.
 *
 * @since 1.0
 */
package com.phillippitts.speaktorobot.domain;
