package io.github.jakubt4.hawkeye.service.broadcast;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO in front of one channel's delivery loop.
 */
final class ChannelQueue {

    private final Channel channel;
    private final ArrayBlockingQueue<Object> queue;
    private final AtomicLong dropped = new AtomicLong();

    ChannelQueue(final Channel channel) {
        this(channel, channel.capacity());
    }

    ChannelQueue(final Channel channel, final int capacity) {
        this.channel = channel;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    Channel channel() {
        return channel;
    }

    /**
     * Non-blocking enqueue. A full queue rejects the new item.
     *
     * @return {@code false} if the item was dropped
     */
    boolean offer(final Object item) {
        if (queue.offer(item)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    /**
     * Enqueue that waits up to {@code timeout} for space.
     *
     * @return {@code false} if the queue stayed full for the whole bound
     */
    boolean offer(final Object item, final Duration timeout) throws InterruptedException {
        if (queue.offer(item, timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    Object poll(final Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Removes every queued item, oldest first. */
    List<Object> drain() {
        final var items = new ArrayList<>(queue.size());
        queue.drainTo(items);
        return items;
    }

    int size() {
        return queue.size();
    }

    int capacity() {
        return queue.size() + queue.remainingCapacity();
    }

    long dropped() {
        return dropped.get();
    }
}
