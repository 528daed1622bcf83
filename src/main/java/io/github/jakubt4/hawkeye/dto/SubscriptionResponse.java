package io.github.jakubt4.hawkeye.dto;

import java.util.List;

/**
 * Channels a client is subscribed to after a subscribe/unsubscribe call.
 */
public record SubscriptionResponse(String clientId, List<String> channels) {
}
