package com.phillippitts.speaktorobot.domain;

import java.util.Map;

/**
 * Marker for utterances that carry no actionable command (conversation, questions,
 * out-of-capability requests).
 */
public record NoCommand() implements Command {

    public static final NoCommand INSTANCE = new NoCommand();

    @Override
    public String commandName() {
        return null;
    }

    @Override
    public Map<String, Object> commandParams() {
        return null;
    }
}
