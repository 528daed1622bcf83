package io.github.jakubt4.hawkeye.service.simulation;

import io.github.jakubt4.hawkeye.config.HawkeyeProperties;
import io.github.jakubt4.hawkeye.model.Alert;
import io.github.jakubt4.hawkeye.model.AlertSeverity;
import io.github.jakubt4.hawkeye.model.FlightMode;
import io.github.jakubt4.hawkeye.model.GeoPoint;
import io.github.jakubt4.hawkeye.model.TelemetrySnapshot;
import io.github.jakubt4.hawkeye.service.broadcast.BroadcastHub;
import io.github.jakubt4.hawkeye.service.broadcast.Channel;
import io.github.jakubt4.hawkeye.service.hardware.HardwareAdapter;
import io.github.jakubt4.hawkeye.service.hardware.TelemetrySample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Core flight simulation engine. Owns the {@link DroneState} and is the only component that
 * mutates it, either from the periodic {@link #tick()} or from one of the command entry points.
 *
 * <p>Every read and write goes through one {@link ReentrantLock}. Nothing performs I/O while
 * holding it: snapshots and alerts are handed to the {@link BroadcastHub} after unlocking.
 * Each published snapshot carries a sequence number taken under the lock, and one that lost
 * the race to a newer snapshot is not published, so telemetry never goes backwards.
 */
@Slf4j
@Service
public class DroneStateSimulator {

    private static final double EARTH_RADIUS_M = 6_371_000.0;
    private static final double MISSION_SPEED_MIN = 5.0;
    private static final double MISSION_SPEED_MAX = 15.0;
    private static final double HOVER_SPEED_MAX = 3.0;

    private final HawkeyeProperties.Simulator config;
    private final HardwareAdapter hardware;
    private final BroadcastHub hub;
    private final Random random;
    private final Clock clock;
    private final ReentrantLock stateLock = new ReentrantLock();
    private final DroneState state;
    private final Object telemetryOrder = new Object();

    private long snapshotSequence;
    private long lastPublishedSequence = -1;

    @Autowired
    public DroneStateSimulator(final HawkeyeProperties properties,
                               final HardwareAdapter hardware,
                               final BroadcastHub hub) {
        this(properties.simulator(), hardware, hub, new Random(), Clock.systemUTC());
    }

    DroneStateSimulator(final HawkeyeProperties.Simulator config,
                        final HardwareAdapter hardware,
                        final BroadcastHub hub,
                        final Random random,
                        final Clock clock) {
        this.config = config;
        this.hardware = hardware;
        this.hub = hub;
        this.random = random;
        this.clock = clock;
        final var home = new GeoPoint(config.home().lat(), config.home().lng(), config.home().alt());
        this.state = new DroneState(home, config.initialBatteryPct(), new AlertLog(config.alertCapacity(), clock));
        log.info("Drone state initialized — home lat={}, lng={}, battery={}%",
                home.lat(), home.lng(), config.initialBatteryPct());
    }

    /**
     * Advances the simulation by one period and publishes the resulting snapshot.
     */
    public void tick() {
        final var sample = hardware.sample();
        final var degraded = hardware.degraded();

        final TelemetrySnapshot snapshot;
        final long sequence;
        final List<Alert> raised;
        acquire();
        try {
            advance(sample, degraded);
            snapshot = state.snapshot(clock.instant(), config.snapshotAlerts());
            sequence = ++snapshotSequence;
            raised = state.alerts.drainUnpublished();
        } finally {
            stateLock.unlock();
        }

        log.debug("[TICK] mode={}, pos=({}, {}, {}), battery={}",
                snapshot.mode(), snapshot.position().lat(), snapshot.position().lng(),
                snapshot.position().alt(), snapshot.batteryPct());
        publishTelemetry(sequence, snapshot);
        publishAlerts(raised);
    }

    private void advance(final TelemetrySample sample, final boolean degraded) {
        if (sample != null) {
            state.satellites = sample.satellites();
        }
        state.hardwareDegraded = degraded;

        if (state.flying && state.missionActive()) {
            flyMission();
        } else if (state.flying) {
            hover(sample);
        }

        state.heading = wrapHeading(state.heading + uniform(config.headingJitterDeg()));

        if (state.flying) {
            drainBattery();
            state.flightTimeSeconds++;
            state.speed = state.missionActive()
                    ? MISSION_SPEED_MIN + random.nextDouble() * (MISSION_SPEED_MAX - MISSION_SPEED_MIN)
                    : random.nextDouble() * HOVER_SPEED_MAX;
        } else {
            state.speed = 0;
        }
    }

    private void flyMission() {
        final var mission = state.mission;
        final var target = mission.target();
        final var current = state.position;

        final var next = new GeoPoint(
                stepToward(current.lat(), target.lat(), config.waypointStepDeg()),
                stepToward(current.lng(), target.lng(), config.waypointStepDeg()),
                stepToward(current.alt(), target.alt(), config.altitudeStepM()));
        state.position = next;

        if (!arrived(next, target)) {
            return;
        }
        mission.advance();
        log.info("[MISSION] Waypoint reached — {}/{}", mission.progress().cursor(), mission.progress().total());
        if (mission.active()) {
            return;
        }

        state.alerts.append("Mission completed successfully", AlertSeverity.INFO, Alert.GENERAL);
        if (mission.kind() == Mission.Kind.RETURN_HOME) {
            state.flying = false;
            state.mode = FlightMode.LAND;
            state.position = state.position.withAlt(0);
            state.speed = 0;
            state.alerts.append("Landed at launch position", AlertSeverity.INFO, Alert.GENERAL);
        }
    }

    private boolean arrived(final GeoPoint position, final GeoPoint target) {
        return Math.abs(target.lat() - position.lat()) < config.arrivalToleranceDeg()
                && Math.abs(target.lng() - position.lng()) < config.arrivalToleranceDeg()
                && Math.abs(target.alt() - position.alt()) < config.arrivalToleranceAltM();
    }

    static double stepToward(final double current, final double target, final double step) {
        final var delta = target - current;
        if (Math.abs(delta) <= step) {
            return target;
        }
        return current + Math.signum(delta) * step;
    }

    private void hover(final TelemetrySample sample) {
        if (sample != null && sample.live()) {
            // device altitude is MSL; keep the simulated height above launch
            final var fix = sample.position();
            state.position = new GeoPoint(fix.lat(), fix.lng(), state.position.alt());
            return;
        }
        final var p = state.position;
        state.position = new GeoPoint(
                p.lat() + uniform(config.hoverJitterDeg()),
                p.lng() + uniform(config.hoverJitterDeg()),
                Math.max(0, p.alt() + uniform(config.hoverJitterAltM())));
    }

    private void drainBattery() {
        state.batteryPct = Math.max(0, state.batteryPct - config.drainRatePerMinute() / 60.0);
        if (!state.lowBatteryWarned && state.batteryPct < config.lowBatteryPct()) {
            state.lowBatteryWarned = true;
            state.alerts.append("Low battery warning", AlertSeverity.WARNING, "low_battery");
            log.warn("[TICK] Battery below {}% — {}%", config.lowBatteryPct(), state.batteryPct);
        }
    }

    static double wrapHeading(final double heading) {
        final var wrapped = heading % 360.0;
        return wrapped < 0 ? wrapped + 360.0 : wrapped;
    }

    private double uniform(final double bound) {
        return (random.nextDouble() * 2 - 1) * bound;
    }

    // --- command entry points ---

    public String arm() {
        return mutate(s -> {
            if (s.mode == FlightMode.EMERGENCY) {
                throw new PreconditionException("Emergency stop active; disarm before arming");
            }
            if (s.armed) {
                throw new PreconditionException("Drone already armed");
            }
            if (s.batteryPct < config.minArmBatteryPct()) {
                throw new PreconditionException("Battery too low to arm");
            }
            s.armed = true;
            s.mode = FlightMode.ARMED;
            s.alerts.append("Drone armed successfully", AlertSeverity.INFO, Alert.GENERAL);
            return "Drone armed successfully";
        });
    }

    public String disarm() {
        return mutate(s -> {
            if (s.flying) {
                throw new PreconditionException("Cannot disarm while flying");
            }
            s.armed = false;
            s.mode = FlightMode.DISARMED;
            s.alerts.append("Drone disarmed", AlertSeverity.INFO, Alert.GENERAL);
            return "Drone disarmed successfully";
        });
    }

    public String takeoff(final double altitude) {
        return mutate(s -> {
            if (!s.armed) {
                throw new PreconditionException("Drone must be armed first");
            }
            if (s.flying) {
                throw new PreconditionException("Drone is already flying");
            }
            s.home = s.position.withAlt(0);
            s.flying = true;
            s.position = s.position.withAlt(altitude);
            s.mode = FlightMode.GUIDED;
            s.mission = null;
            s.alerts.append("Takeoff to " + meters(altitude) + " initiated", AlertSeverity.INFO, Alert.GENERAL);
            return "Taking off to " + meters(altitude);
        });
    }

    public String land() {
        return mutate(s -> {
            requireFlying(s, "Drone is not flying");
            s.flying = false;
            s.position = s.position.withAlt(0);
            s.speed = 0;
            s.mission = null;
            s.mode = FlightMode.LAND;
            s.alerts.append("Landing initiated", AlertSeverity.INFO, Alert.GENERAL);
            return "Landing initiated";
        });
    }

    public String gotoPosition(final double lat, final double lng, final double alt) {
        return mutate(s -> {
            requireFlying(s, "Drone must be flying");
            final var target = new GeoPoint(lat, lng, alt);
            final var distance = distanceMeters(s.position, target);
            s.mission = new Mission(Mission.Kind.GOTO, List.of(target));
            s.mode = FlightMode.GUIDED;
            return String.format(Locale.ROOT, "Navigating to position (distance: %.1fm)", distance);
        });
    }

    public String startMission(final List<GeoPoint> waypoints) {
        return mutate(s -> {
            requireFlying(s, "Drone must be flying to start mission");
            if (waypoints == null || waypoints.isEmpty()) {
                throw new PreconditionException("Mission requires at least one waypoint");
            }
            s.mission = new Mission(Mission.Kind.SURVEY, waypoints);
            s.mode = FlightMode.GUIDED;
            final var message = "Mission started with " + waypoints.size() + " waypoints";
            s.alerts.append(message, AlertSeverity.INFO, Alert.GENERAL);
            return message;
        });
    }

    public String returnHome() {
        return mutate(s -> {
            requireFlying(s, "Drone must be flying");
            final var target = s.home.withAlt(config.returnAltitudeM());
            s.mission = new Mission(Mission.Kind.RETURN_HOME, List.of(target));
            s.mode = FlightMode.RTL;
            s.alerts.append("Returning to launch position", AlertSeverity.INFO, Alert.GENERAL);
            return String.format(Locale.ROOT, "Returning to launch position (distance: %.1fm)",
                    distanceMeters(s.position, target));
        });
    }

    /** Always succeeds, from any state. */
    public String emergencyStop() {
        return mutate(s -> {
            s.mode = FlightMode.EMERGENCY;
            s.flying = false;
            s.armed = false;
            s.speed = 0;
            s.mission = null;
            s.alerts.append("Emergency stop activated", AlertSeverity.CRITICAL, Alert.GENERAL);
            return "Emergency stop activated, motors stopped";
        });
    }

    private static void requireFlying(final DroneState s, final String message) {
        if (!s.flying) {
            throw new PreconditionException(message);
        }
    }

    /**
     * Runs one mutation under the state lock. After unlocking, publishes the resulting snapshot
     * and the alerts the mutation raised.
     *
     * @throws PreconditionException if the mutation is illegal in the current state
     */
    private String mutate(final Function<DroneState, String> mutation) {
        final String message;
        final TelemetrySnapshot snapshot;
        final long sequence;
        final List<Alert> raised;
        acquire();
        try {
            message = mutation.apply(state);
            snapshot = state.snapshot(clock.instant(), config.snapshotAlerts());
            sequence = ++snapshotSequence;
            raised = state.alerts.drainUnpublished();
        } finally {
            stateLock.unlock();
        }
        publishTelemetry(sequence, snapshot);
        publishAlerts(raised);
        return message;
    }

    /** Publishes unless a newer snapshot already went out. Telemetry offers never block. */
    void publishTelemetry(final long sequence, final TelemetrySnapshot snapshot) {
        synchronized (telemetryOrder) {
            if (sequence <= lastPublishedSequence) {
                log.debug("[TICK] Snapshot #{} superseded by #{}, not published", sequence, lastPublishedSequence);
                return;
            }
            lastPublishedSequence = sequence;
            hub.publish(Channel.TELEMETRY, snapshot);
        }
    }

    private void publishAlerts(final List<Alert> raised) {
        for (final var alert : raised) {
            hub.publish(Channel.ALERTS, alert);
        }
    }

    /** Consistent copy of the current state. */
    public TelemetrySnapshot snapshot() {
        acquire();
        try {
            return state.snapshot(clock.instant(), config.snapshotAlerts());
        } finally {
            stateLock.unlock();
        }
    }

    /** Newest alerts, oldest first. */
    public List<Alert> recentAlerts() {
        acquire();
        try {
            return state.alerts.newest(config.snapshotAlerts());
        } finally {
            stateLock.unlock();
        }
    }

    int alertCount() {
        acquire();
        try {
            return state.alerts.size();
        } finally {
            stateLock.unlock();
        }
    }

    void setBatteryPct(final double batteryPct) {
        acquire();
        try {
            state.batteryPct = batteryPct;
        } finally {
            stateLock.unlock();
        }
    }

    void raiseAlert(final String message, final AlertSeverity severity) {
        mutate(s -> {
            s.alerts.append(message, severity, Alert.GENERAL);
            return message;
        });
    }

    private void acquire() {
        final var bound = config.lockTimeout();
        try {
            if (!stateLock.tryLock(bound.toMillis(), TimeUnit.MILLISECONDS)) {
                final var e = new StateLockTimeoutException(bound);
                log.error("[STATE] {}", e.getMessage());
                throw e;
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateLockTimeoutException("Interrupted while waiting for the drone state lock", e);
        }
    }

    /** Great-circle distance in meters (haversine). */
    static double distanceMeters(final GeoPoint from, final GeoPoint to) {
        final var dLat = Math.toRadians(to.lat() - from.lat());
        final var dLng = Math.toRadians(to.lng() - from.lng());
        final var a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(from.lat())) * Math.cos(Math.toRadians(to.lat()))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return 2 * EARTH_RADIUS_M * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    private static String meters(final double value) {
        return String.format(Locale.ROOT, "%.1fm", value);
    }
}
