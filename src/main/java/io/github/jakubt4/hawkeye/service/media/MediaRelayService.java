package io.github.jakubt4.hawkeye.service.media;

import io.github.jakubt4.hawkeye.config.HawkeyeProperties;
import io.github.jakubt4.hawkeye.dto.Detection;
import io.github.jakubt4.hawkeye.dto.DetectionBatch;
import io.github.jakubt4.hawkeye.dto.VideoFrame;
import io.github.jakubt4.hawkeye.service.broadcast.BroadcastHub;
import io.github.jakubt4.hawkeye.service.broadcast.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Boundary between the vision layer and the hub: frames go to the video channel, detections to
 * the detections channel. Optionally produces a synthetic 30 Hz frame feed for UI testing.
 */
@Slf4j
@Service
public class MediaRelayService {

    private static final String SYNTHETIC_FORMAT = "synthetic";

    private final BroadcastHub hub;
    private final HawkeyeProperties.Media config;
    private final AtomicLong sequence = new AtomicLong();

    public MediaRelayService(final BroadcastHub hub, final HawkeyeProperties properties) {
        this.hub = hub;
        this.config = properties.media();
        if (config.syntheticVideo()) {
            log.info("Synthetic video feed enabled — {}x{}", config.frameWidth(), config.frameHeight());
        }
    }

    /**
     * @return {@code false} if the video queue was full
     */
    public boolean publishFrame(final String frame, final String format, final int width, final int height) {
        final var videoFrame = new VideoFrame(frame, format, width, height, sequence.incrementAndGet(), Instant.now());
        return hub.publish(Channel.VIDEO, videoFrame);
    }

    /**
     * @return {@code false} if the detections queue was full
     */
    public boolean publishDetections(final List<Detection> detections) {
        final var batch = new DetectionBatch(detections == null ? List.of() : List.copyOf(detections), Instant.now());
        return hub.publish(Channel.DETECTIONS, batch);
    }

    @Scheduled(fixedRate = 33)
    void syntheticFrame() {
        if (!config.syntheticVideo()) {
            return;
        }
        publishFrame(null, SYNTHETIC_FORMAT, config.frameWidth(), config.frameHeight());
    }
}
