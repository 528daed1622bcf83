package io.github.jakubt4.hawkeye.service.simulation;

/**
 * A command that is well-formed but illegal in the current drone state,
 * e.g. takeoff while disarmed.
 */
public class PreconditionException extends RuntimeException {

    public PreconditionException(final String message) {
        super(message);
    }
}
