package com.phillippitts.speaktorobot.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link UpstreamServiceException} with contextual metadata.
 *
 * <pre>
 * throw UpstreamServiceExceptionBuilder.create("Language model returned an error")
 *         .service(UpstreamServiceException.LANGUAGE_MODEL)
 *         .statusCode(502)
 *         .durationMs(1200)
 *         .metadata("attempt", 2)
 *         .build();
 * </pre>
 *
 * <p>Message format: {@code {message} (statusCode={code}, durationMs={ms}, {key}={value}, ...)}
 */
public final class UpstreamServiceExceptionBuilder {

    private final String message;
    private String serviceName = UpstreamServiceException.LANGUAGE_MODEL;
    private Throwable cause;
    private Integer statusCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private UpstreamServiceExceptionBuilder(String message) {
        this.message = message;
    }

    public static UpstreamServiceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new UpstreamServiceExceptionBuilder(message);
    }

    public UpstreamServiceExceptionBuilder service(String serviceName) {
        this.serviceName = serviceName;
        return this;
    }

    public UpstreamServiceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public UpstreamServiceExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public UpstreamServiceExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key/value pair to the message. Null keys or values are ignored.
     */
    public UpstreamServiceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public UpstreamServiceException build() {
        String service = serviceName != null ? serviceName : "unknown";
        int status = statusCode != null ? statusCode : -1;
        return new UpstreamServiceException(buildDetailedMessage(), service, status, cause);
    }

    private String buildDetailedMessage() {
        if (statusCode == null && durationMs == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (statusCode != null) {
            sb.append("statusCode=").append(statusCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
