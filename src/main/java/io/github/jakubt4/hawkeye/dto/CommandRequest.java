package io.github.jakubt4.hawkeye.dto;

import java.util.Map;

/**
 * Inbound control command.
 *
 * @param command command name, e.g. {@code takeoff} or {@code start_mission}
 * @param params  command parameters, may be {@code null} for parameterless commands
 */
public record CommandRequest(String command, Map<String, Object> params) {
}
