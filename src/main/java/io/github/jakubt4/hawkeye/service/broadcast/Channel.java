package io.github.jakubt4.hawkeye.service.broadcast;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Broadcast channels with their queue capacity, delivery period and overflow policy.
 * {@link #ALERTS} is event-driven and has no period.
 */
public enum Channel {

    TELEMETRY("telemetry", "telemetry_update", 100, Duration.ofMillis(100), OverflowPolicy.DROP_NEWEST),
    VIDEO("video", "video_frame", 10, Duration.ofMillis(33), OverflowPolicy.DROP_NEWEST),
    DETECTIONS("detections", "detection_update", 50, Duration.ofMillis(100), OverflowPolicy.DROP_NEWEST),
    ALERTS("alerts", "system_alert", 20, null, OverflowPolicy.BLOCK);

    private final String wireName;
    private final String eventName;
    private final int capacity;
    private final Duration period;
    private final OverflowPolicy policy;

    Channel(final String wireName, final String eventName, final int capacity,
            final Duration period, final OverflowPolicy policy) {
        this.wireName = wireName;
        this.eventName = eventName;
        this.capacity = capacity;
        this.period = period;
        this.policy = policy;
    }

    public String wireName() {
        return wireName;
    }

    public String eventName() {
        return eventName;
    }

    public int capacity() {
        return capacity;
    }

    public Duration period() {
        return period;
    }

    public OverflowPolicy policy() {
        return policy;
    }

    public boolean periodic() {
        return period != null;
    }

    public static Optional<Channel> fromWireName(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        final var normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(c -> c.wireName.equals(normalized)).findFirst();
    }
}
