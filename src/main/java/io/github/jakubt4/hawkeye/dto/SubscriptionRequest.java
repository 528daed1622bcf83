package io.github.jakubt4.hawkeye.dto;

/**
 * @param channel one of {@code telemetry}, {@code video}, {@code detections}, {@code alerts}
 */
public record SubscriptionRequest(String channel) {
}
