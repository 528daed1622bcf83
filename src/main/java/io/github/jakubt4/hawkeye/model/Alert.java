package io.github.jakubt4.hawkeye.model;

import java.time.Instant;

/**
 * System alert raised by the simulator.
 *
 * @param id        monotonic identifier, unique for the process lifetime
 * @param message   human-readable text
 * @param severity  info, warning or critical
 * @param type      machine-readable category, {@code general} unless stated
 * @param timestamp time the alert was raised
 */
public record Alert(long id, String message, AlertSeverity severity, String type, Instant timestamp) {

    public static final String GENERAL = "general";
}
