package com.phillippitts.speaktorobot.exception;

/**
 * Thrown when the language-model system prompt cannot be loaded from its configured location.
 * Fatal at startup: the model cannot be prompted in the format it was tuned for without it.
 */
public class PromptNotFoundException extends SpeakToRobotException {

    private final String location;

    public PromptNotFoundException(String location) {
        super("System prompt not found at location: " + location);
        this.location = location;
    }

    public PromptNotFoundException(String location, Throwable cause) {
        super("System prompt not found at location: " + location, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
