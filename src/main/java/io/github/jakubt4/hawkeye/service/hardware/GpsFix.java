package io.github.jakubt4.hawkeye.service.hardware;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Normalized GPS fix as delivered by the GPS/MAVLink bridge over UDP.
 *
 * @param timestamp epoch milliseconds of the fix, optional
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GpsFix(Double lat, Double lng, Double altitude, Integer satellites, Long timestamp) {
}
