package com.phillippitts.speaktorobot.exception;

/**
 * Thrown when the thread handling a request is interrupted (client gone, shutdown) while an
 * extraction attempt is in flight. The in-flight call is cancelled before this is raised.
 */
public class RequestCancelledException extends SpeakToRobotException {

    private final String correlationId;

    public RequestCancelledException(String correlationId, Throwable cause) {
        super("Request " + correlationId + " was cancelled", cause);
        this.correlationId = correlationId;
    }

    public String getCorrelationId() {
        return correlationId;
    }
}
