package io.github.jakubt4.hawkeye.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of the drone state at one instant. This is the only state object that is
 * ever handed to the broadcast queues.
 *
 * @param mission {@code null} when no mission is active
 * @param alerts  newest alerts, oldest first
 */
public record TelemetrySnapshot(Instant timestamp,
                                boolean armed,
                                boolean flying,
                                FlightMode mode,
                                GeoPoint position,
                                double heading,
                                double speed,
                                double batteryPct,
                                MissionProgress mission,
                                List<Alert> alerts,
                                long flightTimeSeconds,
                                int satellites,
                                boolean hardwareDegraded) {

    public TelemetrySnapshot {
        alerts = List.copyOf(alerts);
    }
}
