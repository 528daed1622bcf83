package io.github.jakubt4.hawkeye.service.command;

/**
 * A command that is malformed or out of range. Raised before any state is touched.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(final String message) {
        super(message);
    }
}
