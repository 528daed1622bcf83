package io.github.jakubt4.hawkeye.service.hardware;

/**
 * Telemetry source (flight controller / GPS). Implementations are either backed by a real
 * device or by a mock generator; callers never know which.
 */
public interface HardwareAdapter extends AutoCloseable {

    /**
     * Latest known reading. Never blocks on I/O.
     *
     * @return the newest sample, or {@code null} before the first reading
     */
    TelemetrySample sample();

    boolean health();

    /** Invoked periodically by the runtime's polling task. */
    default void poll() {
    }

    /** {@code true} once the source has fallen back to synthetic data. */
    default boolean degraded() {
        return false;
    }

    @Override
    void close();
}
