package com.phillippitts.slotwatch.presentation.exception;

import com.phillippitts.slotwatch.exception.InvalidConfigurationException;
import com.phillippitts.slotwatch.exception.SlotWatchException;
import com.phillippitts.slotwatch.exception.SubscriptionNotAllowedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed path variable such as a non-numeric subscriber id (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        LOG.warn("Invalid value for '{}': {}", ex.getName(), ex.getValue());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidArgument",
                "Invalid value for '" + ex.getName() + "'",
                "Expected a numeric id",
                Instant.now()
            ));
    }

    /**
     * Recipient outside the subscriber allowlist (HTTP 403).
     */
    @ExceptionHandler(SubscriptionNotAllowedException.class)
    ResponseEntity<ApiError> handleSubscriptionNotAllowed(SubscriptionNotAllowedException ex) {
        return ResponseEntity
            .status(HttpStatus.FORBIDDEN)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Not authorized",
                "Recipient " + ex.getRecipientId() + " is not allowed to subscribe",
                Instant.now()
            ));
    }

    /**
     * Misconfiguration reached at runtime (HTTP 500).
     */
    @ExceptionHandler(InvalidConfigurationException.class)
    ResponseEntity<ApiError> handleInvalidConfiguration(InvalidConfigurationException ex) {
        LOG.error("Invalid configuration: setting={}", ex.getSetting(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service misconfigured",
                "Setting '" + ex.getSetting() + "' is invalid. Contact administrator.",
                Instant.now()
            ));
    }

    /**
     * Transient error, e.g. the subscriber file could not be read (HTTP 503).
     */
    @ExceptionHandler(SlotWatchException.class)
    ResponseEntity<ApiError> handleSlotWatchFailure(SlotWatchException ex) {
        LOG.error("Request failed", ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service temporarily unavailable",
                "Please retry in a few seconds",
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
