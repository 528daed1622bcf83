package io.github.jakubt4.hawkeye.service.broadcast;

import io.github.jakubt4.hawkeye.config.HawkeyeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Multi-channel publish/subscribe hub.
 *
 * <p>Every channel has its own bounded {@link ChannelQueue} and its own delivery thread:
 * periodic channels are drained on a fixed-rate scheduler, alerts are delivered as soon as they
 * arrive. Within a channel items leave in FIFO order and each item reaches every current
 * subscriber before the next one is taken. A failing client is dropped from that channel only.
 */
@Slf4j
@Service
public class BroadcastHub {

    static final String CONNECTION_STATUS = "connection_status";
    static final String SUBSCRIPTION_STATUS = "subscription_status";

    private final HawkeyeProperties.Broadcast config;
    private final Map<Channel, ChannelQueue> queues = new EnumMap<>(Channel.class);
    private final Map<Channel, Set<ClientSubscription>> subscribers = new EnumMap<>(Channel.class);
    private final Map<String, ClientSubscription> clients = new ConcurrentHashMap<>();
    private final AtomicLong alertPublishFailures = new AtomicLong();
    private final List<ExecutorService> loops = new ArrayList<>();

    private volatile boolean running;

    @Autowired
    public BroadcastHub(final HawkeyeProperties properties) {
        this(properties.broadcast());
    }

    BroadcastHub(final HawkeyeProperties.Broadcast config) {
        this.config = config;
        for (final var channel : Channel.values()) {
            queues.put(channel, new ChannelQueue(channel));
            subscribers.put(channel, ConcurrentHashMap.newKeySet());
        }
    }

    // --- lifecycle ---

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        for (final var channel : Channel.values()) {
            if (channel.periodic()) {
                final var scheduler = Executors.newSingleThreadScheduledExecutor(daemon("hawkeye-hub-" + channel.wireName()));
                final var periodMs = channel.period().toMillis();
                scheduler.scheduleAtFixedRate(() -> drainOnce(channel), periodMs, periodMs, TimeUnit.MILLISECONDS);
                loops.add(scheduler);
            } else {
                final var executor = Executors.newSingleThreadExecutor(daemon("hawkeye-hub-" + channel.wireName()));
                executor.submit(() -> eventLoop(channel));
                loops.add(executor);
            }
        }
        log.info("[HUB] Broadcast loops started — {}", Arrays.toString(Channel.values()));
    }

    /**
     * Signals every loop, lets each finish its current iteration within the shutdown bound and
     * then closes all clients. In-flight deliveries are never interrupted.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        loops.forEach(ExecutorService::shutdown);
        final var deadline = System.nanoTime() + config.shutdownTimeout().toNanos();
        for (final var loop : loops) {
            try {
                final var remaining = Math.max(0, deadline - System.nanoTime());
                if (!loop.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("[HUB] Delivery loop still busy after {}", config.shutdownTimeout());
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        loops.clear();
        List.copyOf(clients.keySet()).forEach(this::disconnect);
        log.info("[HUB] Broadcast loops stopped");
    }

    public boolean running() {
        return running;
    }

    private static ThreadFactory daemon(final String name) {
        return runnable -> {
            final var thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    // --- clients ---

    /**
     * Registers a client and sends it a {@code connection_status} event.
     *
     * @return {@code false} if the id is already connected
     */
    public boolean connect(final String clientId, final ClientSink sink) {
        final var subscription = new ClientSubscription(clientId, sink, config.clientSendTimeout());
        if (clients.putIfAbsent(clientId, subscription) != null) {
            subscription.discard();
            return false;
        }
        log.info("[HUB] Client connected — {}", clientId);
        final var payload = status("connected");
        payload.put("clientId", clientId);
        payload.put("channels", Arrays.stream(Channel.values()).map(Channel::wireName).toList());
        sendDirect(subscription, CONNECTION_STATUS, payload);
        return true;
    }

    /**
     * Removes the client from every channel and closes it. Once this returns the client's sink
     * is never called again. A client stalled on a write holds this up for at most the client
     * send timeout.
     *
     * @return {@code false} if the client was not connected
     */
    public boolean disconnect(final String clientId) {
        final var subscription = clients.remove(clientId);
        if (subscription == null) {
            return false;
        }
        subscribers.values().forEach(set -> set.remove(subscription));
        subscription.close();
        log.info("[HUB] Client disconnected — {}", clientId);
        return true;
    }

    /**
     * @throws UnknownClientException if the client is not connected
     */
    public Set<Channel> subscribe(final String clientId, final Channel channel) {
        final var subscription = requireClient(clientId);
        subscription.join(channel);
        subscribers.get(channel).add(subscription);
        if (clients.get(clientId) != subscription) {
            // lost a race with disconnect
            subscribers.get(channel).remove(subscription);
            subscription.leave(channel);
            throw new UnknownClientException(clientId);
        }
        log.debug("[HUB] {} subscribed to {}", clientId, channel.wireName());
        final var payload = status("subscribed");
        payload.put("channel", channel.wireName());
        sendDirect(subscription, SUBSCRIPTION_STATUS, payload);
        return subscription.channels();
    }

    /**
     * @throws UnknownClientException if the client is not connected
     */
    public Set<Channel> unsubscribe(final String clientId, final Channel channel) {
        final var subscription = requireClient(clientId);
        subscribers.get(channel).remove(subscription);
        subscription.leave(channel);
        log.debug("[HUB] {} unsubscribed from {}", clientId, channel.wireName());
        final var payload = status("unsubscribed");
        payload.put("channel", channel.wireName());
        sendDirect(subscription, SUBSCRIPTION_STATUS, payload);
        return subscription.channels();
    }

    public boolean connected(final String clientId) {
        return clients.containsKey(clientId);
    }

    private ClientSubscription requireClient(final String clientId) {
        final var subscription = clients.get(clientId);
        if (subscription == null) {
            throw new UnknownClientException(clientId);
        }
        return subscription;
    }

    private static Map<String, Object> status(final String status) {
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status);
        payload.put("timestamp", Instant.now().toString());
        return payload;
    }

    private void sendDirect(final ClientSubscription subscription, final String eventName, final Object payload) {
        try {
            subscription.deliver(eventName, payload);
        } catch (final DeliveryException e) {
            logDeliveryFailure(e);
            disconnect(subscription.clientId());
        }
    }

    // --- publishing ---

    /**
     * Enqueues a message on a channel. Periodic channels drop the message when full; the alert
     * channel waits up to the configured bound.
     *
     * @return {@code false} if the message was not queued
     */
    public boolean publish(final Channel channel, final Object message) {
        final var queue = queues.get(channel);
        if (channel.policy() == OverflowPolicy.DROP_NEWEST) {
            final var accepted = queue.offer(message);
            if (!accepted) {
                log.debug("[HUB] {} queue full, message dropped", channel.wireName());
            }
            return accepted;
        }
        try {
            if (queue.offer(message, config.alertPublishTimeout())) {
                return true;
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        alertPublishFailures.incrementAndGet();
        log.error("[HUB] {} queue full for {}, message not delivered: {}",
                channel.wireName(), config.alertPublishTimeout(), message);
        return false;
    }

    void drainOnce(final Channel channel) {
        try {
            for (final var item : queues.get(channel).drain()) {
                deliver(channel, item);
            }
        } catch (final RuntimeException e) {
            log.error("[HUB] {} delivery loop iteration failed", channel.wireName(), e);
        }
    }

    private void eventLoop(final Channel channel) {
        final var queue = queues.get(channel);
        while (running) {
            try {
                final var item = queue.poll(config.alertPollTimeout());
                if (item != null) {
                    deliver(channel, item);
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (final RuntimeException e) {
                log.error("[HUB] {} delivery loop iteration failed", channel.wireName(), e);
            }
        }
    }

    private void deliver(final Channel channel, final Object item) {
        final var channelSubscribers = subscribers.get(channel);
        for (final var subscription : channelSubscribers) {
            try {
                subscription.deliver(channel.eventName(), item);
            } catch (final DeliveryException e) {
                channelSubscribers.remove(subscription);
                subscription.leave(channel);
                logDeliveryFailure(e);
            }
        }
    }

    private static void logDeliveryFailure(final DeliveryException e) {
        if (e.expectedDisconnect()) {
            log.debug("[HUB] Client {} disconnected: {}", e.clientId(), e.rootCauseSummary());
        } else {
            log.warn("[HUB] {}", e.getMessage(), e.getCause());
        }
    }

    // --- statistics ---

    public HubStats stats() {
        final Map<String, HubStats.ChannelStats> channels = new LinkedHashMap<>();
        for (final var channel : Channel.values()) {
            final var queue = queues.get(channel);
            channels.put(channel.wireName(), new HubStats.ChannelStats(
                    subscribers.get(channel).size(), queue.size(), queue.capacity(), queue.dropped()));
        }
        return new HubStats(clients.size(), channels, alertPublishFailures.get());
    }

    int queueSize(final Channel channel) {
        return queues.get(channel).size();
    }
}
