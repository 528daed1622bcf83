package io.github.jakubt4.hawkeye.service.stream;

import io.github.jakubt4.hawkeye.service.broadcast.ClientSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * {@link ClientSink} over a Server-Sent Events stream. Payloads are written as JSON.
 */
@Slf4j
final class SseClientSink implements ClientSink {

    private final SseEmitter emitter;

    SseClientSink(final SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(final String eventName, final Object payload) throws IOException {
        emitter.send(SseEmitter.event().name(eventName).data(payload, MediaType.APPLICATION_JSON));
    }

    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (final RuntimeException e) {
            log.debug("SSE emitter already closed: {}", e.getMessage());
        }
    }
}
