package com.phillippitts.voxbank.presentation.exception;

import com.phillippitts.voxbank.exception.ArchiveException;
import com.phillippitts.voxbank.exception.ConcatenationException;
import com.phillippitts.voxbank.exception.FilterException;
import com.phillippitts.voxbank.exception.InvalidRequestException;
import com.phillippitts.voxbank.exception.NoContentException;
import com.phillippitts.voxbank.exception.SynthesisCancelledException;
import com.phillippitts.voxbank.exception.SynthesisProviderException;
import com.phillippitts.voxbank.exception.VoxBankException;
import com.phillippitts.voxbank.exception.WordBankStorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details (file paths, provider
 * responses) from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - request violates limits or identifiers are malformed (HTTP 400).
     */
    @ExceptionHandler(InvalidRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidRequestException ex) {
        LOG.warn("Invalid request: field={}, reason={}", ex.getField(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Request body validation failed: {}", details);
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getClass().getSimpleName());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", "Malformed request body");
    }

    /**
     * Client error - archive is malformed or from an incompatible format (HTTP 400).
     */
    @ExceptionHandler(ArchiveException.class)
    ResponseEntity<ApiError> handleArchive(ArchiveException ex) {
        LOG.warn("Archive rejected: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid word bank archive", ex.getMessage());
    }

    /**
     * No word of the request could be resolved (HTTP 422).
     */
    @ExceptionHandler(NoContentException.class)
    ResponseEntity<ApiError> handleNoContent(NoContentException ex) {
        LOG.info("No playable words: skipped={}", ex.getSkippedWords().size());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex, "No playable words",
                ex.getSkippedWords().size() + " word(s) could not be resolved");
    }

    /**
     * Upstream synthesis provider failed (HTTP 502).
     */
    @ExceptionHandler(SynthesisProviderException.class)
    ResponseEntity<ApiError> handleProvider(SynthesisProviderException ex) {
        LOG.error("Synthesis provider failed: voice={}, retryable={}", ex.getVoiceId(), ex.isRetryable(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex, "Synthesis provider unavailable",
                ex.isRetryable() ? "Please retry in a few seconds" : "Provider rejected the request");
    }

    @ExceptionHandler(SynthesisCancelledException.class)
    ResponseEntity<ApiError> handleCancelled(SynthesisCancelledException ex) {
        LOG.info("Synthesis cancelled: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Synthesis cancelled", "Please retry");
    }

    /**
     * Server-side pipeline failures (HTTP 500). Storage paths and clip details stay in the log.
     */
    @ExceptionHandler({ConcatenationException.class, FilterException.class, WordBankStorageException.class})
    ResponseEntity<ApiError> handlePipelineFailure(VoxBankException ex) {
        LOG.error("Pipeline failure", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Audio processing failed",
                "Please contact support with request ID");
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

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
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
