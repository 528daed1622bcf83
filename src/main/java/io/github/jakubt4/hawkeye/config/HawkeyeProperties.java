package io.github.jakubt4.hawkeye.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed configuration bound from {@code hawkeye.*} in {@code application.yml}.
 *
 * <p>Step sizes and tolerances of the simulator are plain tuning knobs; they carry
 * no physical derivation.
 */
@ConfigurationProperties(prefix = "hawkeye")
public record HawkeyeProperties(Simulator simulator,
                                Commands commands,
                                Hardware hardware,
                                Broadcast broadcast,
                                Media media) {

    /**
     * @param tickPeriod             period of the simulation tick
     * @param lockTimeout            bound on state lock acquisition; exceeding it is a deadlock bug
     * @param initialBatteryPct      battery charge at process start
     * @param drainRatePerMinute     battery percent drained per minute of flight
     * @param lowBatteryPct          threshold of the one-shot low battery warning
     * @param minArmBatteryPct       arming is refused below this charge
     * @param waypointStepDeg        per-tick lat/lng step toward the active waypoint
     * @param altitudeStepM          per-tick altitude step toward the active waypoint
     * @param arrivalToleranceDeg    lat/lng tolerance for waypoint arrival
     * @param arrivalToleranceAltM   altitude tolerance for waypoint arrival
     * @param hoverJitterDeg         bound of the idle hover drift in lat/lng
     * @param hoverJitterAltM        bound of the idle hover drift in altitude
     * @param headingJitterDeg       bound of the per-tick heading change
     * @param alertCapacity          size of the alert ring buffer
     * @param snapshotAlerts         number of newest alerts carried in a snapshot
     * @param home                   launch position used until the first takeoff
     * @param returnAltitudeM        cruise altitude of the return-to-launch leg
     */
    public record Simulator(Duration tickPeriod,
                            Duration lockTimeout,
                            double initialBatteryPct,
                            double drainRatePerMinute,
                            double lowBatteryPct,
                            double minArmBatteryPct,
                            double waypointStepDeg,
                            double altitudeStepM,
                            double arrivalToleranceDeg,
                            double arrivalToleranceAltM,
                            double hoverJitterDeg,
                            double hoverJitterAltM,
                            double headingJitterDeg,
                            int alertCapacity,
                            int snapshotAlerts,
                            Position home,
                            double returnAltitudeM) {}

    public record Commands(double minAltitudeM, double maxAltitudeM, double defaultAltitudeM) {}

    public record Hardware(HardwareMode mode,
                           int devicePort,
                           Duration connectTimeout,
                           int connectAttempts,
                           Duration staleAfter,
                           Duration pollPeriod,
                           Position basePosition,
                           double mockJitterDeg) {}

    public record Broadcast(Duration alertPublishTimeout,
                            Duration alertPollTimeout,
                            Duration shutdownTimeout,
                            Duration clientSendTimeout) {}

    public record Media(boolean syntheticVideo, int frameWidth, int frameHeight) {}

    public record Position(double lat, double lng, double alt) {}

    /** How the telemetry source is selected at startup. */
    public enum HardwareMode {
        /** Probe the GPS device; degrade permanently to mock on failure. */
        DEVICE,
        /** Never touch the device. */
        MOCK
    }
}
