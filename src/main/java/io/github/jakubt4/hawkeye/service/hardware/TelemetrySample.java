package io.github.jakubt4.hawkeye.service.hardware;

import io.github.jakubt4.hawkeye.model.GeoPoint;

import java.time.Instant;

/**
 * Normalized reading from a telemetry source.
 *
 * @param position   reported position
 * @param satellites satellites in view
 * @param timestamp  time of the reading
 * @param live       {@code true} when the reading comes from a real device
 */
public record TelemetrySample(GeoPoint position, int satellites, Instant timestamp, boolean live) {
}
