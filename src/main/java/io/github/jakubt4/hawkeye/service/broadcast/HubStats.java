package io.github.jakubt4.hawkeye.service.broadcast;

import java.util.Map;

/**
 * Point-in-time hub statistics.
 *
 * @param clients              connected clients
 * @param channels             per-channel figures keyed by channel name
 * @param alertPublishFailures alerts that could not be queued within the publish bound
 */
public record HubStats(int clients, Map<String, ChannelStats> channels, long alertPublishFailures) {

    public record ChannelStats(int subscribers, int queueDepth, int capacity, long dropped) {
    }
}
