package io.github.jakubt4.hawkeye.controller;

import io.github.jakubt4.hawkeye.dto.CommandRequest;
import io.github.jakubt4.hawkeye.model.Alert;
import io.github.jakubt4.hawkeye.model.TelemetrySnapshot;
import io.github.jakubt4.hawkeye.service.command.CommandResult;
import io.github.jakubt4.hawkeye.service.command.CommandRouter;
import io.github.jakubt4.hawkeye.service.simulation.DroneStateSimulator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface for drone control and state.
 */
@RestController
@RequestMapping("/api/drone")
@RequiredArgsConstructor
public class DroneCommandController {

    private final CommandRouter commandRouter;
    private final DroneStateSimulator simulator;

    /**
     * Executes one control command.
     *
     * @return {@code 200 OK} on success, {@code 400 Bad Request} on a validation or precondition failure
     */
    @PostMapping("/command")
    public ResponseEntity<CommandResult> execute(@RequestBody final CommandRequest request) {
        final var result = commandRouter.execute(request.command(), request.params());
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }

    @GetMapping("/status")
    public TelemetrySnapshot status() {
        return simulator.snapshot();
    }

    @GetMapping("/alerts")
    public Map<String, List<Alert>> alerts() {
        return Map.of("alerts", simulator.recentAlerts());
    }
}
