package io.github.jakubt4.hawkeye.service.command;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Outcome of one command, returned synchronously to the caller.
 *
 * @param error {@code null} on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResult(boolean success, String command, String message, Instant timestamp, CommandError error) {

    public static CommandResult ok(final String command, final String message, final Instant timestamp) {
        return new CommandResult(true, command, message, timestamp, null);
    }

    public static CommandResult failed(final String command, final String message, final Instant timestamp,
                                       final CommandError error) {
        return new CommandResult(false, command, message, timestamp, error);
    }
}
