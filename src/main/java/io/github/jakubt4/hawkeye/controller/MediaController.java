package io.github.jakubt4.hawkeye.controller;

import io.github.jakubt4.hawkeye.dto.DetectionBatch;
import io.github.jakubt4.hawkeye.dto.MediaAck;
import io.github.jakubt4.hawkeye.dto.VideoFrame;
import io.github.jakubt4.hawkeye.service.broadcast.Channel;
import io.github.jakubt4.hawkeye.service.media.MediaRelayService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingestion endpoints for the vision pipeline. A full channel queue drops the item and is
 * reported back as {@code accepted=false}; the producer is never blocked.
 */
@RestController
@RequestMapping("/api/media")
@RequiredArgsConstructor
public class MediaController {

    private final MediaRelayService mediaRelayService;

    @PostMapping("/frames")
    public MediaAck frame(@RequestBody final VideoFrame frame) {
        if (frame.width() <= 0 || frame.height() <= 0) {
            throw new BadRequestException("Frame width and height must be positive");
        }
        final var accepted = mediaRelayService.publishFrame(frame.frame(), frame.format(), frame.width(), frame.height());
        return new MediaAck(accepted, Channel.VIDEO.wireName());
    }

    @PostMapping("/detections")
    public MediaAck detections(@RequestBody final DetectionBatch batch) {
        if (batch.detections() == null) {
            throw new BadRequestException("detections is required");
        }
        final var accepted = mediaRelayService.publishDetections(batch.detections());
        return new MediaAck(accepted, Channel.DETECTIONS.wireName());
    }
}
