package io.github.jakubt4.hawkeye.dto;

import java.time.Instant;

/**
 * Encoded video frame relayed on the video channel.
 *
 * @param frame     encoded image, base64; {@code null} for metadata-only synthetic frames
 * @param format    image format, e.g. {@code jpeg}
 * @param width     width in pixels
 * @param height    height in pixels
 * @param sequence  frame counter assigned by the relay
 * @param timestamp time the relay accepted the frame
 */
public record VideoFrame(String frame, String format, int width, int height, long sequence, Instant timestamp) {
}
