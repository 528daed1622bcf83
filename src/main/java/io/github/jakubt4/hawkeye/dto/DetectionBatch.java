package io.github.jakubt4.hawkeye.dto;

import java.time.Instant;
import java.util.List;

/**
 * Detections for one frame, relayed on the detections channel.
 */
public record DetectionBatch(List<Detection> detections, Instant timestamp) {
}
