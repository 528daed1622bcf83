package io.github.jakubt4.hawkeye.service.command;

import io.github.jakubt4.hawkeye.TestProperties;
import io.github.jakubt4.hawkeye.model.GeoPoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandParserTest {

    private final CommandParser parser = new CommandParser(TestProperties.commands());

    @Test
    void parsesParameterlessCommands() {
        assertThat(parser.parse("arm", null)).isInstanceOf(DroneCommand.Arm.class);
        assertThat(parser.parse("DISARM", Map.of())).isInstanceOf(DroneCommand.Disarm.class);
        assertThat(parser.parse("land", Map.of())).isInstanceOf(DroneCommand.Land.class);
        assertThat(parser.parse("return-home", Map.of())).isInstanceOf(DroneCommand.ReturnHome.class);
        assertThat(parser.parse("emergency_stop", Map.of())).isInstanceOf(DroneCommand.EmergencyStop.class);
    }

    @Test
    void takeoffAltitudeDefaultsToTenMeters() {
        assertThat(parser.parse("takeoff", Map.of())).isEqualTo(new DroneCommand.Takeoff(10));
        assertThat(parser.parse("takeoff", Map.of("altitude", 25))).isEqualTo(new DroneCommand.Takeoff(25));
        assertThat(parser.parse("takeoff", Map.of("alt", "30.5"))).isEqualTo(new DroneCommand.Takeoff(30.5));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.99, 100.01, 150.0, -5.0})
    void takeoffRejectsAltitudeOutOfRange(final double altitude) {
        assertThatThrownBy(() -> parser.parse("takeoff", Map.of("altitude", altitude)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Altitude must be between 1 and 100 meters");
    }

    @Test
    void gotoAcceptsCoordinateAliases() {
        final var expected = new DroneCommand.Goto(new GeoPoint(33.69, 73.05, 15));

        assertThat(parser.parse("goto", Map.of("lat", 33.69, "lng", 73.05, "alt", 15))).isEqualTo(expected);
        assertThat(parser.parse("goto", Map.of("latitude", 33.69, "longitude", 73.05, "altitude", 15))).isEqualTo(expected);
        assertThat(parser.parse("goto", Map.of("lat", "33.69", "lon", "73.05", "alt", "15"))).isEqualTo(expected);
    }

    @Test
    void gotoAltitudeDefaultsToTenMeters() {
        final var command = (DroneCommand.Goto) parser.parse("goto", Map.of("lat", 33.69, "lng", 73.05));

        assertThat(command.target().alt()).isEqualTo(10.0);
    }

    @Test
    void gotoRejectsInvalidCoordinates() {
        assertThatThrownBy(() -> parser.parse("goto", Map.of("lat", 91, "lng", 73.05)))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Invalid latitude");
        assertThatThrownBy(() -> parser.parse("goto", Map.of("lat", 33.69, "lng", -180.5)))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Invalid longitude");
        assertThatThrownBy(() -> parser.parse("goto", Map.of("lng", 73.05)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Missing parameter: lat");
        assertThatThrownBy(() -> parser.parse("goto", Map.of("lat", "north", "lng", 73.05)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("lat must be a number");
        assertThatThrownBy(() -> parser.parse("goto", Map.of("lat", true, "lng", 73.05)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void startMissionParsesWaypoints() {
        final var command = parser.parse("start_mission", Map.of("waypoints", List.of(
                Map.of("lat", 33.69, "lng", 73.05, "alt", 20),
                Map.of("latitude", 33.70, "longitude", 73.06))));

        assertThat(command).isEqualTo(new DroneCommand.StartMission(List.of(
                new GeoPoint(33.69, 73.05, 20),
                new GeoPoint(33.70, 73.06, 10))));
    }

    @Test
    void startMissionRejectsEmptyOrMalformedWaypoints() {
        assertThatThrownBy(() -> parser.parse("start_mission", Map.of("waypoints", List.of())))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> parser.parse("start_mission", Map.of()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> parser.parse("start_mission", Map.of("waypoints", List.of("33.69,73.05"))))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Waypoint 0 must be an object");
        assertThatThrownBy(() -> parser.parse("start_mission", Map.of("waypoints", List.of(
                Map.of("lat", 33.69, "lng", 73.05),
                Map.of("lat", 33.69, "lng", 73.05, "alt", 500)))))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Waypoint 1: Altitude");
    }

    @Test
    void rejectsUnknownOrMissingCommand() {
        assertThatThrownBy(() -> parser.parse("barrel_roll", Map.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Unknown command: barrel_roll");
        assertThatThrownBy(() -> parser.parse(" ", Map.of()))
                .isInstanceOf(ValidationException.class);
    }
}
