package com.phillippitts.speaktorobot.exception;

/**
 * Base exception for all speakToRobot application-specific errors.
 * All domain exceptions extend this class so the REST boundary can handle them centrally.
 */
public class SpeakToRobotException extends RuntimeException {

    public SpeakToRobotException(String message) {
        super(message);
    }

    public SpeakToRobotException(String message, Throwable cause) {
        super(message, cause);
    }
}
