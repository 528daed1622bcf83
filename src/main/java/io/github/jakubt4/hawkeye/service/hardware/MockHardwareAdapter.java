package io.github.jakubt4.hawkeye.service.hardware;

import io.github.jakubt4.hawkeye.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Synthetic GPS: every poll perturbs a fixed base position by a bounded random offset.
 * Deterministic for a seeded {@link Random}.
 */
@Slf4j
public class MockHardwareAdapter implements HardwareAdapter {

    private static final int MIN_SATELLITES = 6;
    private static final int MAX_SATELLITES = 12;
    private static final double ALT_JITTER_M = 1.0;

    private final GeoPoint base;
    private final double jitterDeg;
    private final Random random;
    private final Clock clock;
    private final AtomicReference<TelemetrySample> latest = new AtomicReference<>();

    public MockHardwareAdapter(final GeoPoint base, final double jitterDeg, final Random random, final Clock clock) {
        this.base = base;
        this.jitterDeg = jitterDeg;
        this.random = random;
        this.clock = clock;
        poll();
        log.info("[HARDWARE] Mock GPS active — base lat={}, lng={}, alt={}", base.lat(), base.lng(), base.alt());
    }

    @Override
    public void poll() {
        final var position = new GeoPoint(
                base.lat() + uniform(jitterDeg),
                base.lng() + uniform(jitterDeg),
                base.alt() + uniform(ALT_JITTER_M));
        final var satellites = MIN_SATELLITES + random.nextInt(MAX_SATELLITES - MIN_SATELLITES + 1);
        latest.set(new TelemetrySample(position, satellites, clock.instant(), false));
    }

    private double uniform(final double bound) {
        return (random.nextDouble() * 2 - 1) * bound;
    }

    @Override
    public TelemetrySample sample() {
        return latest.get();
    }

    @Override
    public boolean health() {
        return true;
    }

    @Override
    public void close() {
        // nothing to release
    }
}
