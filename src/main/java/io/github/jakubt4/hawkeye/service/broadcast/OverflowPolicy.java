package io.github.jakubt4.hawkeye.service.broadcast;

/** What {@link ChannelQueue} does with a publish that finds the queue full. */
public enum OverflowPolicy {
    /** Reject the incoming item; the producer never blocks. */
    DROP_NEWEST,
    /** Block the producer up to a bound, then count the failure. */
    BLOCK
}
