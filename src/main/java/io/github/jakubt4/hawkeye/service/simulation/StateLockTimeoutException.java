package io.github.jakubt4.hawkeye.service.simulation;

import java.time.Duration;

/**
 * Thrown when the drone state lock cannot be acquired within its bound.
 * Always a programming error (deadlock); never mapped to a command result.
 */
public class StateLockTimeoutException extends IllegalStateException {

    public StateLockTimeoutException(final Duration bound) {
        super("Drone state lock not acquired within " + bound + " (deadlock?)");
    }

    public StateLockTimeoutException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
