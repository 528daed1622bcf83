package io.github.jakubt4.hawkeye.controller;

/**
 * Invalid client request. Mapped to HTTP 400 by {@link ApiExceptionHandler}.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(final String message) {
        super(message);
    }
}
