package io.github.jakubt4.hawkeye.service.stream;

import io.github.jakubt4.hawkeye.controller.BadRequestException;
import io.github.jakubt4.hawkeye.service.broadcast.BroadcastHub;
import io.github.jakubt4.hawkeye.service.broadcast.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Collection;
import java.util.UUID;

/**
 * Opens Server-Sent Events streams and registers them as hub clients.
 *
 * <p>The emitter's completion, timeout and error callbacks all disconnect the client, so a
 * browser that goes away is removed from every channel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SseStreamService {

    private static final long STREAM_TIMEOUT_MS = 0L;

    private final BroadcastHub hub;

    /**
     * @param clientId requested id, generated when blank
     * @param channels initial subscriptions
     * @throws BadRequestException if the id is already connected
     */
    public SseEmitter open(final String clientId, final Collection<Channel> channels) {
        final var id = clientId == null || clientId.isBlank() ? UUID.randomUUID().toString() : clientId.trim();
        final var emitter = createEmitter();
        emitter.onCompletion(() -> hub.disconnect(id));
        emitter.onTimeout(() -> hub.disconnect(id));
        emitter.onError(ex -> {
            log.debug("SSE stream {} failed: {}", id, ex.getMessage());
            hub.disconnect(id);
        });

        if (!hub.connect(id, new SseClientSink(emitter))) {
            throw new BadRequestException("Client id already connected: " + id);
        }
        for (final var channel : channels) {
            if (hub.connected(id)) {
                hub.subscribe(id, channel);
            }
        }
        return emitter;
    }

    SseEmitter createEmitter() {
        return new SseEmitter(STREAM_TIMEOUT_MS);
    }
}
