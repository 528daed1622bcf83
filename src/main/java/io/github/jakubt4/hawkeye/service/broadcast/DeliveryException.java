package io.github.jakubt4.hawkeye.service.broadcast;

import java.util.Locale;

/**
 * Delivery of one event to one client failed. Affects only that client.
 */
public class DeliveryException extends Exception {

    private final String clientId;

    public DeliveryException(final String clientId, final String eventName, final Throwable cause) {
        super("Delivery of " + eventName + " to client " + clientId + " failed", cause);
        this.clientId = clientId;
    }

    public String clientId() {
        return clientId;
    }

    /** {@code true} when the failure is an ordinary client disconnect (broken pipe, reset, ...). */
    public boolean expectedDisconnect() {
        return isExpectedClientDisconnect(getCause());
    }

    static boolean isExpectedClientDisconnect(final Throwable error) {
        var current = error;
        while (current != null) {
            final var className = current.getClass().getName();
            if (className.endsWith("ClientAbortException") || className.endsWith("EofException")
                    || className.endsWith("AsyncRequestNotUsableException")) {
                return true;
            }
            if (hasDisconnectMessage(current.getMessage())) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static boolean hasDisconnectMessage(final String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        final var normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("broken pipe")
                || normalized.contains("connection reset")
                || normalized.contains("socket closed")
                || normalized.contains("stream closed")
                || normalized.contains("connection abort")
                || normalized.contains("forcibly closed by the remote host");
    }

    /** Innermost cause as {@code Type: message}. */
    public String rootCauseSummary() {
        Throwable current = this;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        final var message = current.getMessage();
        if (message == null || message.isBlank()) {
            return current.getClass().getSimpleName();
        }
        return current.getClass().getSimpleName() + ": " + message;
    }
}
