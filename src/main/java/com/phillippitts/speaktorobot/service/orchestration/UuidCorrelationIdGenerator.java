package com.phillippitts.speaktorobot.service.orchestration;

import java.util.UUID;

/**
 * Random (type 4) UUID correlation IDs.
 */
public final class UuidCorrelationIdGenerator implements CorrelationIdGenerator {

    @Override
    public String next() {
        return UUID.randomUUID().toString();
    }
}
