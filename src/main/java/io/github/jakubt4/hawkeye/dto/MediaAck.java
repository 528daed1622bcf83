package io.github.jakubt4.hawkeye.dto;

/**
 * @param accepted {@code false} when the channel queue was full and the item was dropped
 */
public record MediaAck(boolean accepted, String channel) {
}
