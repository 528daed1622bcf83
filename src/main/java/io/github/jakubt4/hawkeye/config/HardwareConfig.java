package io.github.jakubt4.hawkeye.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.hawkeye.model.GeoPoint;
import io.github.jakubt4.hawkeye.service.hardware.FailoverHardwareAdapter;
import io.github.jakubt4.hawkeye.service.hardware.GpsDeviceAdapter;
import io.github.jakubt4.hawkeye.service.hardware.HardwareAdapter;
import io.github.jakubt4.hawkeye.service.hardware.HardwareDegradedException;
import io.github.jakubt4.hawkeye.service.hardware.MockHardwareAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.io.IOException;
import java.time.Clock;
import java.util.Random;

/**
 * Selects the telemetry source with an explicit capability probe at startup.
 *
 * <p>In {@code DEVICE} mode the GPS link is opened with a bounded number of attempts; if none
 * produces a fix the system starts degraded on mock telemetry.
 */
@Slf4j
@Configuration
public class HardwareConfig {

    private static final long RETRY_BACKOFF_MS = 500L;

    @Bean(destroyMethod = "close")
    public HardwareAdapter hardwareAdapter(final HawkeyeProperties properties, final ObjectMapper objectMapper) {
        final var hardware = properties.hardware();
        final var mock = new MockHardwareAdapter(toGeoPoint(hardware.basePosition()), hardware.mockJitterDeg(),
                new Random(), Clock.systemUTC());

        if (hardware.mode() == HawkeyeProperties.HardwareMode.MOCK) {
            log.info("[HARDWARE] Mock telemetry selected by configuration");
            return FailoverHardwareAdapter.mockOnly(mock);
        }
        final var device = new GpsDeviceAdapter(hardware.devicePort(), hardware.staleAfter(), objectMapper, Clock.systemUTC());
        return probe(device, mock, hardware);
    }

    static FailoverHardwareAdapter probe(final GpsDeviceAdapter device,
                                         final HardwareAdapter fallback,
                                         final HawkeyeProperties.Hardware hardware) {
        final var attempts = Math.max(1, hardware.connectAttempts());
        final var retryTemplate = RetryTemplate.builder()
                .maxAttempts(attempts)
                .fixedBackoff(RETRY_BACKOFF_MS)
                .retryOn(IOException.class)
                .build();
        try {
            retryTemplate.<Void, IOException>execute(context -> {
                log.info("[HARDWARE] Probing GPS device on UDP port {} (attempt {}/{})",
                        hardware.devicePort(), context.getRetryCount() + 1, attempts);
                device.open(hardware.connectTimeout());
                return null;
            });
            return FailoverHardwareAdapter.onDevice(device, fallback);
        } catch (final IOException e) {
            device.close();
            return FailoverHardwareAdapter.degradedAtStartup(fallback,
                    new HardwareDegradedException("GPS device unavailable after " + attempts + " attempt(s)", e));
        }
    }

    private static GeoPoint toGeoPoint(final HawkeyeProperties.Position position) {
        return new GeoPoint(position.lat(), position.lng(), position.alt());
    }
}
