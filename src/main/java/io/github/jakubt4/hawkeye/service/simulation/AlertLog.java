package io.github.jakubt4.hawkeye.service.simulation;

import io.github.jakubt4.hawkeye.model.Alert;
import io.github.jakubt4.hawkeye.model.AlertSeverity;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only ring buffer of alerts, newest last. Not thread-safe; guarded by the simulator lock.
 */
final class AlertLog {

    private final int capacity;
    private final Clock clock;
    private final ArrayDeque<Alert> alerts;
    private final List<Alert> unpublished = new ArrayList<>();
    private long nextId = 1;

    AlertLog(final int capacity, final Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("alert capacity must be >= 1");
        }
        this.capacity = capacity;
        this.clock = clock;
        this.alerts = new ArrayDeque<>(capacity);
    }

    Alert append(final String message, final AlertSeverity severity, final String type) {
        final var alert = new Alert(nextId++, message, severity, type, clock.instant());
        if (alerts.size() == capacity) {
            alerts.removeFirst();
        }
        alerts.addLast(alert);
        unpublished.add(alert);
        return alert;
    }

    /** The newest {@code count} alerts, oldest first. */
    List<Alert> newest(final int count) {
        final var skip = Math.max(0, alerts.size() - count);
        return alerts.stream().skip(skip).toList();
    }

    /** Alerts appended since the previous call, for hand-off to the alert channel. */
    List<Alert> drainUnpublished() {
        if (unpublished.isEmpty()) {
            return List.of();
        }
        final var drained = List.copyOf(unpublished);
        unpublished.clear();
        return drained;
    }

    int size() {
        return alerts.size();
    }
}
