package com.phillippitts.speaktorobot.exception;

/**
 * Thrown when a required request field is missing or blank.
 * Raised before any language-model call is made and never retried.
 */
public class ClientInputException extends SpeakToRobotException {

    private final String field;

    public ClientInputException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Convenience for the common "field is required" case.
     */
    public static ClientInputException missing(String field) {
        return new ClientInputException(field, "Missing required field '" + field + "': must be a non-empty string");
    }

    public String getField() {
        return field;
    }
}
