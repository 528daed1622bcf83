package io.github.jakubt4.hawkeye.service.broadcast;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One connected client and the channels it joined.
 *
 * <p>Writes to the sink run one at a time on the client's own writer thread and are bounded by
 * {@code sendTimeout}. {@link #close()} is bounded too: once it returns no new write starts.
 */
@Slf4j
final class ClientSubscription {

    private final String clientId;
    private final ClientSink sink;
    private final Duration sendTimeout;
    private final Set<Channel> channels = ConcurrentHashMap.newKeySet();
    private final ExecutorService writer;
    private final AtomicBoolean sinkClosed = new AtomicBoolean();

    private volatile boolean closed;

    ClientSubscription(final String clientId, final ClientSink sink, final Duration sendTimeout) {
        this.clientId = clientId;
        this.sink = sink;
        this.sendTimeout = sendTimeout;
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            final var thread = new Thread(runnable, "hawkeye-client-" + clientId);
            thread.setDaemon(true);
            return thread;
        });
    }

    String clientId() {
        return clientId;
    }

    boolean join(final Channel channel) {
        return channels.add(channel);
    }

    boolean leave(final Channel channel) {
        return channels.remove(channel);
    }

    Set<Channel> channels() {
        return channels.isEmpty() ? EnumSet.noneOf(Channel.class) : EnumSet.copyOf(channels);
    }

    /**
     * Writes one event and waits for it at most {@code sendTimeout}.
     *
     * @return {@code false} if the client is already closed and nothing was sent
     * @throws DeliveryException if the sink failed or did not finish in time
     */
    boolean deliver(final String eventName, final Object payload) throws DeliveryException {
        if (closed) {
            return false;
        }
        final Future<Boolean> write;
        try {
            write = writer.submit(() -> {
                if (closed) {
                    return false;
                }
                sink.send(eventName, payload);
                return true;
            });
        } catch (final RejectedExecutionException e) {
            return false;
        }
        try {
            return write.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final ExecutionException e) {
            throw new DeliveryException(clientId, eventName, e.getCause());
        } catch (final TimeoutException e) {
            write.cancel(true);
            throw new DeliveryException(clientId, eventName,
                    new TimeoutException("Client did not accept " + eventName + " within " + sendTimeout));
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            write.cancel(true);
            throw new DeliveryException(clientId, eventName, e);
        }
    }

    /**
     * Marks the client closed, lets a write in flight finish within {@code sendTimeout} and ends
     * the sink. A write still stuck after that is interrupted.
     */
    void close() {
        if (closed) {
            return;
        }
        closed = true;
        channels.clear();
        try {
            writer.submit(this::closeSink);
        } catch (final RejectedExecutionException e) {
            log.debug("[HUB] Writer for {} already stopped", clientId);
        }
        writer.shutdown();
        try {
            if (!writer.awaitTermination(sendTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[HUB] Client {} stalled on write for {}, abandoning it", clientId, sendTimeout);
                writer.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
        closeSink();
    }

    /** Releases the writer of a subscription that was never registered. The sink is left alone. */
    void discard() {
        closed = true;
        writer.shutdownNow();
    }

    private void closeSink() {
        if (sinkClosed.compareAndSet(false, true)) {
            sink.close();
        }
    }
}
