package io.github.jakubt4.hawkeye.service.command;

import io.github.jakubt4.hawkeye.config.HawkeyeProperties;
import io.github.jakubt4.hawkeye.model.GeoPoint;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a loosely typed {@code {command, params}} request into a {@link DroneCommand}.
 *
 * <p>Accepted parameter aliases: {@code lat|latitude}, {@code lng|lon|longitude},
 * {@code alt|altitude}. Numbers may arrive as JSON numbers or numeric strings.
 */
@Component
public class CommandParser {

    private static final double MIN_LAT = -90.0;
    private static final double MAX_LAT = 90.0;
    private static final double MIN_LNG = -180.0;
    private static final double MAX_LNG = 180.0;

    private static final String[] LAT_KEYS = {"lat", "latitude"};
    private static final String[] LNG_KEYS = {"lng", "lon", "longitude"};
    private static final String[] ALT_KEYS = {"alt", "altitude"};

    private final HawkeyeProperties.Commands limits;

    @Autowired
    public CommandParser(final HawkeyeProperties properties) {
        this(properties.commands());
    }

    public CommandParser(final HawkeyeProperties.Commands limits) {
        this.limits = limits;
    }

    /**
     * @throws ValidationException on an unknown command or a missing, non-numeric or out-of-range parameter
     */
    public DroneCommand parse(final String command, final Map<String, ?> params) {
        if (command == null || command.isBlank()) {
            throw new ValidationException("Command is required");
        }
        final Map<String, ?> p = params == null ? Map.of() : params;
        final var normalized = command.trim().toLowerCase(Locale.ROOT).replace('-', '_');

        return switch (normalized) {
            case "arm" -> new DroneCommand.Arm();
            case "disarm" -> new DroneCommand.Disarm();
            case "takeoff" -> new DroneCommand.Takeoff(altitude(p));
            case "land" -> new DroneCommand.Land();
            case "goto" -> new DroneCommand.Goto(position(p));
            case "start_mission" -> new DroneCommand.StartMission(waypoints(p.get("waypoints")));
            case "return_home", "rtl" -> new DroneCommand.ReturnHome();
            case "emergency_stop" -> new DroneCommand.EmergencyStop();
            default -> throw new ValidationException("Unknown command: " + command);
        };
    }

    private GeoPoint position(final Map<String, ?> p) {
        final var lat = requireNumber(p, "lat", LAT_KEYS);
        final var lng = requireNumber(p, "lng", LNG_KEYS);
        if (lat < MIN_LAT || lat > MAX_LAT) {
            throw new ValidationException("Invalid latitude: " + lat);
        }
        if (lng < MIN_LNG || lng > MAX_LNG) {
            throw new ValidationException("Invalid longitude: " + lng);
        }
        return new GeoPoint(lat, lng, altitude(p));
    }

    private double altitude(final Map<String, ?> p) {
        final var raw = first(p, ALT_KEYS);
        final var alt = raw == null ? limits.defaultAltitudeM() : toNumber("altitude", raw);
        if (alt < limits.minAltitudeM() || alt > limits.maxAltitudeM()) {
            throw new ValidationException(String.format(Locale.ROOT,
                    "Altitude must be between %.0f and %.0f meters", limits.minAltitudeM(), limits.maxAltitudeM()));
        }
        return alt;
    }

    private List<GeoPoint> waypoints(final Object raw) {
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            throw new ValidationException("Mission requires a non-empty waypoints list");
        }
        final var waypoints = new ArrayList<GeoPoint>(list.size());
        for (var i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Map<?, ?> entry)) {
                throw new ValidationException("Waypoint " + i + " must be an object");
            }
            try {
                waypoints.add(position(stringKeys(entry)));
            } catch (final ValidationException e) {
                throw new ValidationException("Waypoint " + i + ": " + e.getMessage());
            }
        }
        return waypoints;
    }

    private static Map<String, Object> stringKeys(final Map<?, ?> raw) {
        final var copy = new HashMap<String, Object>();
        raw.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    private static double requireNumber(final Map<String, ?> p, final String name, final String[] keys) {
        final var raw = first(p, keys);
        if (raw == null) {
            throw new ValidationException("Missing parameter: " + name);
        }
        return toNumber(name, raw);
    }

    private static Object first(final Map<String, ?> p, final String[] keys) {
        for (final var key : keys) {
            final var value = p.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static double toNumber(final String name, final Object raw) {
        final double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text) {
            try {
                value = Double.parseDouble(text.trim());
            } catch (final NumberFormatException e) {
                throw new ValidationException(name + " must be a number");
            }
        } else {
            throw new ValidationException(name + " must be a number");
        }
        if (!Double.isFinite(value)) {
            throw new ValidationException(name + " must be a finite number");
        }
        return value;
    }
}
