package io.github.jakubt4.hawkeye;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Hawkeye: digital twin of a surveillance drone.
 *
 * <p>Simulates the drone's flight state at 1 Hz from a GPS source (real device or mock),
 * applies validated control commands against an explicit flight state machine,
 * and streams telemetry, video, detections and alerts to any number of connected clients.
 *
 * @see io.github.jakubt4.hawkeye.service.simulation.DroneStateSimulator
 * @see io.github.jakubt4.hawkeye.service.broadcast.BroadcastHub
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class HawkeyeApplication {

    public static void main(String[] args) {
        SpringApplication.run(HawkeyeApplication.class, args);
    }
}
