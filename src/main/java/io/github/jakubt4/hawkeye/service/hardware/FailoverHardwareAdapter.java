package io.github.jakubt4.hawkeye.service.hardware;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The telemetry source the rest of the system sees. Starts on the device when the startup probe
 * succeeded and falls back to the mock generator the first time the device goes silent.
 *
 * <p>The fallback is one-way for the lifetime of the process: switching back to a device that
 * reappears would mix real and synthetic positions mid-flight. A restart is required.
 */
@Slf4j
public final class FailoverHardwareAdapter implements HardwareAdapter {

    private final HardwareAdapter device;
    private final HardwareAdapter fallback;
    private final AtomicReference<HardwareAdapter> active;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    private FailoverHardwareAdapter(final HardwareAdapter device, final HardwareAdapter fallback) {
        this.device = device;
        this.fallback = fallback;
        this.active = new AtomicReference<>(device != null ? device : fallback);
    }

    /** Device probe succeeded. */
    public static FailoverHardwareAdapter onDevice(final HardwareAdapter device, final HardwareAdapter fallback) {
        return new FailoverHardwareAdapter(device, fallback);
    }

    /** Device probe failed; starts degraded. */
    public static FailoverHardwareAdapter degradedAtStartup(final HardwareAdapter fallback,
                                                            final HardwareDegradedException cause) {
        final var adapter = new FailoverHardwareAdapter(null, fallback);
        adapter.degraded.set(true);
        log.warn("[HARDWARE] DEGRADED — running on mock telemetry until restart: {}", describe(cause));
        return adapter;
    }

    /** Mock telemetry by configuration; not a degradation. */
    public static FailoverHardwareAdapter mockOnly(final HardwareAdapter mock) {
        return new FailoverHardwareAdapter(null, mock);
    }

    @Override
    public void poll() {
        if (active.get() == device && !device.health()) {
            degrade(new HardwareDegradedException("GPS device went silent"));
        }
        active.get().poll();
    }

    void degrade(final HardwareDegradedException cause) {
        if (device == null || !degraded.compareAndSet(false, true)) {
            return;
        }
        active.set(fallback);
        log.warn("[HARDWARE] DEGRADED — falling back to mock telemetry until restart: {}", describe(cause));
        device.close();
    }

    private static String describe(final HardwareDegradedException cause) {
        return cause.getCause() == null
                ? cause.getMessage()
                : cause.getMessage() + " (" + cause.getCause().getMessage() + ")";
    }

    @Override
    public TelemetrySample sample() {
        return active.get().sample();
    }

    @Override
    public boolean health() {
        return active.get().health();
    }

    @Override
    public boolean degraded() {
        return degraded.get();
    }

    @Override
    public void close() {
        if (device != null) {
            device.close();
        }
        fallback.close();
    }
}
