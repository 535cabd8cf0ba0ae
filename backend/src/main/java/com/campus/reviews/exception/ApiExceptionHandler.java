package com.campus.reviews.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException ex) {
        Map<String, Object> body = body("validation_error", ex.getMessage());
        if (!ex.getDetails().isEmpty()) body.put("details", ex.getDetails());
        return body;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBeanValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                errors.put(error.getField(), error.getDefaultMessage())
        );
        Map<String, Object> body = body("validation_error", "Request is invalid");
        body.put("details", errors);
        return body;
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(Exception ex) {
        log.debug("Unreadable request: {}", ex.getMessage());
        return body("validation_error", "Request could not be read");
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimited(RateLimitedException ex) {
        long seconds = Math.max(1, ex.getRetryAfter().toSeconds());
        Map<String, Object> body = body("rate_limited", ex.getMessage());
        body.put("retryAfterSeconds", seconds);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds))
                .body(body);
    }

    @ExceptionHandler(IngestionFailedException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleIngestionFailed(IngestionFailedException ex) {
        // cause already logged by the saga; never echo it
        return body("ingestion_failed", ex.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleInvalidTransition(InvalidTransitionException ex) {
        Map<String, Object> body = body("invalid_transition", ex.getMessage());
        body.put("currentStatus", ex.getCurrentStatus());
        body.put("attemptedAction", ex.getAttemptedAction());
        return body;
    }

    @ExceptionHandler(ReviewLockedException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleLocked(ReviewLockedException ex) {
        Map<String, Object> body = body("review_locked", ex.getMessage());
        body.put("currentStatus", ex.getCurrentStatus());
        return body;
    }

    @ExceptionHandler(ReviewNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(ReviewNotFoundException ex) {
        return body("not_found", ex.getMessage());
    }

    @ExceptionHandler(ElevationRequiredException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleElevation(ElevationRequiredException ex) {
        return body("elevation_required", ex.getMessage());
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Map<String, Object> handleInvalidCredentials(InvalidCredentialsException ex) {
        return body("invalid_credentials", ex.getMessage());
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
