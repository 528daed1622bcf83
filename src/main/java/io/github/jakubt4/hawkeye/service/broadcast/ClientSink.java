package io.github.jakubt4.hawkeye.service.broadcast;

import java.io.IOException;

/**
 * Transport-side endpoint of one connected client (SSE stream, test recorder, ...).
 */
public interface ClientSink {

    void send(String eventName, Object payload) throws IOException;

    /** Ends the underlying stream. Called at most once, after the last {@link #send} that finished in time. */
    default void close() {
    }
}
