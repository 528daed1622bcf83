package io.github.jakubt4.hawkeye.service.simulation;

import io.github.jakubt4.hawkeye.model.GeoPoint;
import io.github.jakubt4.hawkeye.model.MissionProgress;

import java.util.List;

/**
 * Waypoint route being flown. Mutated only under the simulator lock.
 */
final class Mission {

    enum Kind {
        GOTO,
        SURVEY,
        RETURN_HOME
    }

    private final Kind kind;
    private final List<GeoPoint> waypoints;
    private int cursor;
    private boolean active = true;

    Mission(final Kind kind, final List<GeoPoint> waypoints) {
        if (waypoints.isEmpty()) {
            throw new IllegalArgumentException("mission needs at least one waypoint");
        }
        this.kind = kind;
        this.waypoints = List.copyOf(waypoints);
    }

    Kind kind() {
        return kind;
    }

    boolean active() {
        return active;
    }

    GeoPoint target() {
        return waypoints.get(cursor);
    }

    /** Marks the current waypoint reached; deactivates the mission after the last one. */
    void advance() {
        cursor++;
        if (cursor >= waypoints.size()) {
            active = false;
        }
    }

    MissionProgress progress() {
        return new MissionProgress(cursor, waypoints.size(), active);
    }
}
