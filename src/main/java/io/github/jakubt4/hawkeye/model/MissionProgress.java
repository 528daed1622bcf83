package io.github.jakubt4.hawkeye.model;

/**
 * Progress of the current mission as seen by consumers.
 *
 * @param cursor index of the next unreached waypoint; equals {@code total} once completed
 * @param total  number of waypoints in the mission
 * @param active {@code false} once the last waypoint has been reached
 */
public record MissionProgress(int cursor, int total, boolean active) {
}
