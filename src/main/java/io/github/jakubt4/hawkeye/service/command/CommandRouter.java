package io.github.jakubt4.hawkeye.service.command;

import io.github.jakubt4.hawkeye.service.simulation.DroneStateSimulator;
import io.github.jakubt4.hawkeye.service.simulation.PreconditionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * Entry point for control commands: parse, dispatch to the simulator, report. The simulator
 * publishes the post-command snapshot itself.
 *
 * <p>User-visible failures always come back as a {@link CommandResult}; only a state lock
 * timeout propagates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandRouter {

    private final CommandParser parser;
    private final DroneStateSimulator simulator;

    private volatile boolean accepting = true;

    public CommandResult execute(final String command, final Map<String, ?> params) {
        if (!accepting) {
            log.info("[COMMAND] {} refused — shutting down", command);
            return CommandResult.failed(command, "Not accepting commands: shutting down",
                    Instant.now(), CommandError.PRECONDITION);
        }

        final DroneCommand parsed;
        try {
            parsed = parser.parse(command, params);
        } catch (final ValidationException e) {
            log.info("[COMMAND] {} rejected — {}", command, e.getMessage());
            return CommandResult.failed(command, e.getMessage(), Instant.now(), CommandError.VALIDATION);
        }

        final String message;
        try {
            message = parsed.applyTo(simulator);
        } catch (final PreconditionException e) {
            log.info("[COMMAND] {} refused — {}", parsed.name(), e.getMessage());
            return CommandResult.failed(parsed.name(), e.getMessage(), Instant.now(), CommandError.PRECONDITION);
        }

        log.info("[COMMAND] {} accepted — {}", parsed.name(), message);
        return CommandResult.ok(parsed.name(), message, Instant.now());
    }

    /** Refuses every later command. Called once at shutdown. */
    public void stopAccepting() {
        accepting = false;
        log.info("[COMMAND] Command intake closed");
    }

    public boolean accepting() {
        return accepting;
    }
}
