package com.phillippitts.speaktorobot.service.orchestration;

/**
 * Source of correlation IDs for new interactions. Injectable so tests can use fixed IDs.
 */
@FunctionalInterface
public interface CorrelationIdGenerator {

    /**
     * @return a new, non-blank correlation ID
     */
    String next();
}
