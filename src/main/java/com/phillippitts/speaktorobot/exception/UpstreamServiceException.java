package com.phillippitts.speaktorobot.exception;

import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Thrown when an external model service (language model, speech services) fails, times out,
 * or returns a response that cannot be interpreted at all.
 *
 * <p>This is an infrastructure failure, distinct from a command that merely failed validation.
 * The extraction-retry loop never retries it.
 */
public class UpstreamServiceException extends SpeakToRobotException {

    public static final String LANGUAGE_MODEL = "language-model";

    private final String serviceName;
    private final int statusCode;

    public UpstreamServiceException(String message, String serviceName) {
        this(message, serviceName, -1, null);
    }

    public UpstreamServiceException(String message, String serviceName, Throwable cause) {
        this(message, serviceName, -1, cause);
    }

    public UpstreamServiceException(String message, String serviceName, int statusCode, Throwable cause) {
        super(message + " (service: " + serviceName + ")", cause);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
    }

    public String getServiceName() {
        return serviceName;
    }

    /**
     * @return HTTP status returned by the service, or -1 if no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTimeout() {
        return getCause() instanceof TimeoutException
                || getCause() instanceof HttpTimeoutException;
    }
}
