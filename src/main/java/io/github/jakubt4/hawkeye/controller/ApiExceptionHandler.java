package io.github.jakubt4.hawkeye.controller;

import io.github.jakubt4.hawkeye.service.broadcast.UnknownClientException;
import io.github.jakubt4.hawkeye.service.simulation.StateLockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.Map;

/**
 * Maps REST failures to a stable JSON shape {@code {error, message, timestamp}}.
 * Command outcomes never pass through here; they are always a structured result.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(final BadRequestException ex) {
        return ResponseEntity.badRequest().body(error("bad_request", ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(final HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(error("bad_request", "malformed request body"));
    }

    @ExceptionHandler(UnknownClientException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownClient(final UnknownClientException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", ex.getMessage()));
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<Map<String, Object>> handleMissingRoute(final Exception ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", "resource not found"));
    }

    /** A deadlock in the simulator; already logged where it was detected. */
    @ExceptionHandler(StateLockTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleLockTimeout(final StateLockTimeoutException ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error("internal_error", "drone state unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(final Exception ex) {
        log.error("Unhandled request failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error("internal_error", "internal server error"));
    }

    private static Map<String, Object> error(final String code, final String message) {
        return Map.of(
                "error", code,
                "message", message,
                "timestamp", Instant.now().toString());
    }
}
