package io.github.jakubt4.hawkeye.service.simulation;

import io.github.jakubt4.hawkeye.model.FlightMode;
import io.github.jakubt4.hawkeye.model.GeoPoint;
import io.github.jakubt4.hawkeye.model.TelemetrySnapshot;

import java.time.Instant;

/**
 * The single mutable record of truth for the drone. Owned by {@link DroneStateSimulator};
 * every field is read and written under its lock and leaves only through {@link #snapshot}.
 */
final class DroneState {

    boolean armed;
    boolean flying;
    FlightMode mode = FlightMode.DISARMED;
    GeoPoint position;
    GeoPoint home;
    double heading;
    double speed;
    double batteryPct;
    Mission mission;
    long flightTimeSeconds;
    int satellites;
    boolean hardwareDegraded;
    boolean lowBatteryWarned;
    final AlertLog alerts;

    DroneState(final GeoPoint home, final double batteryPct, final AlertLog alerts) {
        this.home = home;
        this.position = home;
        this.batteryPct = batteryPct;
        this.alerts = alerts;
    }

    boolean missionActive() {
        return mission != null && mission.active();
    }

    TelemetrySnapshot snapshot(final Instant now, final int alertCount) {
        return new TelemetrySnapshot(
                now,
                armed,
                flying,
                mode,
                position,
                heading,
                speed,
                batteryPct,
                mission == null ? null : mission.progress(),
                alerts.newest(alertCount),
                flightTimeSeconds,
                satellites,
                hardwareDegraded);
    }
}
