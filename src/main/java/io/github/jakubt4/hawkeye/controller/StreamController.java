package io.github.jakubt4.hawkeye.controller;

import io.github.jakubt4.hawkeye.dto.SubscriptionRequest;
import io.github.jakubt4.hawkeye.dto.SubscriptionResponse;
import io.github.jakubt4.hawkeye.service.broadcast.BroadcastHub;
import io.github.jakubt4.hawkeye.service.broadcast.Channel;
import io.github.jakubt4.hawkeye.service.broadcast.HubStats;
import io.github.jakubt4.hawkeye.service.broadcast.UnknownClientException;
import io.github.jakubt4.hawkeye.service.stream.SseStreamService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Real-time streaming over Server-Sent Events.
 *
 * <p>{@code GET /api/stream} opens a stream; channels are joined and left through the
 * subscribe/unsubscribe endpoints using the client id announced in {@code connection_status}.
 */
@RestController
@RequestMapping("/api/stream")
@RequiredArgsConstructor
public class StreamController {

    private final SseStreamService streamService;
    private final BroadcastHub hub;

    /**
     * @param clientId optional client id; generated when absent
     * @param channels optional comma-separated initial channels
     */
    @GetMapping
    public SseEmitter open(@RequestParam(required = false) final String clientId,
                           @RequestParam(required = false) final String channels) {
        return streamService.open(clientId, parseChannels(channels));
    }

    @PostMapping("/{clientId}/subscribe")
    public SubscriptionResponse subscribe(@PathVariable final String clientId,
                                          @RequestBody final SubscriptionRequest request) {
        return response(clientId, hub.subscribe(clientId, channel(request)));
    }

    @PostMapping("/{clientId}/unsubscribe")
    public SubscriptionResponse unsubscribe(@PathVariable final String clientId,
                                            @RequestBody final SubscriptionRequest request) {
        return response(clientId, hub.unsubscribe(clientId, channel(request)));
    }

    @DeleteMapping("/{clientId}")
    public ResponseEntity<Void> disconnect(@PathVariable final String clientId) {
        if (!hub.disconnect(clientId)) {
            throw new UnknownClientException(clientId);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    public HubStats stats() {
        return hub.stats();
    }

    private static Channel channel(final SubscriptionRequest request) {
        final var name = request == null ? null : request.channel();
        return Channel.fromWireName(name)
                .orElseThrow(() -> new BadRequestException("Unknown channel: " + name));
    }

    private static List<Channel> parseChannels(final String channels) {
        if (channels == null || channels.isBlank()) {
            return List.of();
        }
        final var parsed = new ArrayList<Channel>();
        for (final var name : channels.split(",")) {
            if (name.isBlank()) {
                continue;
            }
            parsed.add(Channel.fromWireName(name)
                    .orElseThrow(() -> new BadRequestException("Unknown channel: " + name.trim())));
        }
        return parsed;
    }

    private static SubscriptionResponse response(final String clientId, final Set<Channel> channels) {
        return new SubscriptionResponse(clientId, channels.stream().map(Channel::wireName).toList());
    }
}
