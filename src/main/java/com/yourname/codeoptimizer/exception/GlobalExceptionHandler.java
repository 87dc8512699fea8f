package com.yourname.codeoptimizer.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.Map;

/**
 * Centralizes exception handling so controllers stay clean and
 * stack traces never leak to the client.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /** Model server unreachable, timed out or answered with an error status */
    @ExceptionHandler(ModelCallException.class)
    public ResponseEntity<Map<String, Object>> handleModelCall(ModelCallException ex) {
        log.error("Model call failed", ex);
        return llmError(ex);
    }

    /** Completion did not contain a parseable JSON object */
    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<Map<String, Object>> handleExtraction(ExtractionException ex) {
        log.error("Model output could not be processed", ex);
        return llmError(ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(IllegalArgumentException ex) {
        // Client error, no stack trace
        String message = ex.getMessage() == null ? "Invalid request." : ex.getMessage();
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Rejected unreadable request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Request body must be a JSON object.");
    }

    /** Wrong method, content type or path keep their own 4xx status */
    @ExceptionHandler({
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class,
        NoResourceFoundException.class
    })
    public ResponseEntity<Map<String, Object>> handleFramework(Exception ex) {
        HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
        return error(HttpStatus.valueOf(status.value()), ex.getMessage());
    }

    /** Catch-all, never expose internal detail */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred.");
    }

    private ResponseEntity<Map<String, Object>> llmError(RuntimeException ex) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "LLM error: " + ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", message,
                "status", status.value(),
                "timestamp", Instant.now().toString()));
    }
}
