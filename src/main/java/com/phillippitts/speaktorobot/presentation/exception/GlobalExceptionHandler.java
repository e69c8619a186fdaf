package com.phillippitts.speaktorobot.presentation.exception;

import com.phillippitts.speaktorobot.exception.ClientInputException;
import com.phillippitts.speaktorobot.exception.PromptNotFoundException;
import com.phillippitts.speaktorobot.exception.RequestCancelledException;
import com.phillippitts.speaktorobot.exception.UpstreamServiceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - missing or empty input (HTTP 400). Never reaches the language model.
     */
    @ExceptionHandler(ClientInputException.class)
    ResponseEntity<ApiError> handleClientInput(ClientInputException ex) {
        LOG.warn("Rejected request: field={}, reason={}", ex.getField(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                ex.getMessage(),
                "field: " + ex.getField(),
                Instant.now()
            ));
    }

    /**
     * Client error - body is not valid JSON for the endpoint (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "MalformedRequest",
                "Request body could not be read",
                "Send a JSON object such as {\"user_input\": \"...\"}",
                Instant.now()
            ));
    }

    /**
     * Transient error - language model unreachable, timed out or misbehaving (HTTP 503).
     */
    @ExceptionHandler(UpstreamServiceException.class)
    ResponseEntity<ApiError> handleUpstreamFailure(UpstreamServiceException ex) {
        LOG.error("Upstream failure: service={}, status={}, timeout={}",
                ex.getServiceName(), ex.getStatusCode(), ex.isTimeout());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Language model service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Request abandoned while a model call was in flight (HTTP 503).
     */
    @ExceptionHandler(RequestCancelledException.class)
    ResponseEntity<ApiError> handleCancelled(RequestCancelledException ex) {
        LOG.warn("Request cancelled: correlationId={}", ex.getCorrelationId());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Request was cancelled before completion",
                "Please retry",
                Instant.now()
            ));
    }

    /**
     * Configuration error - fails startup normally, but if encountered at runtime return 503.
     */
    @ExceptionHandler(PromptNotFoundException.class)
    ResponseEntity<ApiError> handlePromptNotFound(PromptNotFoundException ex) {
        LOG.error("System prompt not found at: {}", ex.getLocation());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Command service unavailable",
                "Prompt not loaded. Contact administrator.",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
