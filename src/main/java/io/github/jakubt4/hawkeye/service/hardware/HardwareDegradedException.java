package io.github.jakubt4.hawkeye.service.hardware;

/**
 * Signals that the device telemetry source is unusable and the adapter fell back to mock data.
 * Logged, never fatal.
 */
public class HardwareDegradedException extends RuntimeException {

    public HardwareDegradedException(final String message) {
        super(message);
    }

    public HardwareDegradedException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
