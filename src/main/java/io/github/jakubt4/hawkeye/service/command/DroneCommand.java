package io.github.jakubt4.hawkeye.service.command;

import io.github.jakubt4.hawkeye.model.GeoPoint;
import io.github.jakubt4.hawkeye.service.simulation.DroneStateSimulator;

import java.util.List;

/**
 * Validated control command. Produced only by {@link CommandParser}; each variant knows which
 * simulator entry point it maps to.
 */
public sealed interface DroneCommand {

    /** Wire name, e.g. {@code start_mission}. */
    String name();

    /**
     * @return human-readable outcome
     * @throws io.github.jakubt4.hawkeye.service.simulation.PreconditionException if illegal in the current state
     */
    String applyTo(DroneStateSimulator simulator);

    record Arm() implements DroneCommand {
        public String name() {
            return "arm";
        }

        public String applyTo(final DroneStateSimulator simulator) {
            return simulator.arm();
        }
    }

    record Disarm() implements DroneCommand {
        public String name() {
            return "disarm";
        }

        public String applyTo(final DroneStateSimulator simulator) {
            return simulator.disarm();
        }
    }

    record Takeoff(double altitude) implements DroneCommand {
        public String name() {
            return "takeoff";
        }

        public String applyTo(final DroneStateSimulator simulator) {
            return simulator.takeoff(altitude);
        }
    }

    record Land() implements DroneCommand {
        public String name() {
            return "land";
        }

        public String applyTo(final DroneStateSimulator simulator) {
            return simulator.land();
        }
    }

    record Goto(GeoPoint target) implements DroneCommand {
        public String name() {
            return "goto";
        }

        public String applyTo(final DroneStateSimulator simulator) {
            return simulator.gotoPosition(target.lat(), target.lng(), target.alt());
        }
    }

    record StartMission(List<GeoPoint> waypoints) implements DroneCommand {
        public StartMission {
            waypoints = List.copyOf(waypoints);
        }

        public String name() {
            return "start_mission";
        }

        public String applyTo(final DroneStateSimulator simulator) {
            return simulator.startMission(waypoints);
        }
    }

    record ReturnHome() implements DroneCommand {
        public String name() {
            return "return_home";
        }

        public String applyTo(final DroneStateSimulator simulator) {
            return simulator.returnHome();
        }
    }

    record EmergencyStop() implements DroneCommand {
        public String name() {
            return "emergency_stop";
        }

        public String applyTo(final DroneStateSimulator simulator) {
            return simulator.emergencyStop();
        }
    }
}
