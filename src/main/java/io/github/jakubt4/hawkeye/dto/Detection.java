package io.github.jakubt4.hawkeye.dto;

import java.util.List;

/**
 * One object detected in a video frame.
 *
 * @param label      class label, e.g. {@code person}
 * @param confidence score in [0, 1]
 * @param bbox       bounding box {@code [x1, y1, x2, y2]} in pixels
 */
public record Detection(String label, double confidence, List<Double> bbox) {
}
