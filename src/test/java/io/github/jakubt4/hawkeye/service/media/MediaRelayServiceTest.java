package io.github.jakubt4.hawkeye.service.media;

import io.github.jakubt4.hawkeye.TestProperties;
import io.github.jakubt4.hawkeye.config.HawkeyeProperties;
import io.github.jakubt4.hawkeye.dto.Detection;
import io.github.jakubt4.hawkeye.dto.DetectionBatch;
import io.github.jakubt4.hawkeye.dto.VideoFrame;
import io.github.jakubt4.hawkeye.service.broadcast.BroadcastHub;
import io.github.jakubt4.hawkeye.service.broadcast.Channel;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MediaRelayServiceTest {

    private final BroadcastHub hub = mock(BroadcastHub.class);

    @Test
    void framesAreNumberedAndPublishedOnVideoChannel() {
        when(hub.publish(eq(Channel.VIDEO), any())).thenReturn(true, false);
        final var relay = new MediaRelayService(hub, TestProperties.hawkeye());

        assertThat(relay.publishFrame("AAEC", "jpeg", 640, 480)).isTrue();
        assertThat(relay.publishFrame("AAED", "jpeg", 640, 480)).isFalse();

        final var frames = ArgumentCaptor.forClass(Object.class);
        verify(hub, times(2)).publish(eq(Channel.VIDEO), frames.capture());
        assertThat(frames.getAllValues()).extracting(f -> ((VideoFrame) f).sequence()).containsExactly(1L, 2L);
    }

    @Test
    void detectionsArePublishedAsOneBatch() {
        final var relay = new MediaRelayService(hub, TestProperties.hawkeye());
        final var person = new Detection("person", 0.91, List.of(10.0, 20.0, 110.0, 220.0));

        relay.publishDetections(List.of(person));

        final var batch = ArgumentCaptor.forClass(Object.class);
        verify(hub).publish(eq(Channel.DETECTIONS), batch.capture());
        assertThat(((DetectionBatch) batch.getValue()).detections()).containsExactly(person);
    }

    @Test
    void syntheticFeedIsSilentUnlessEnabled() {
        final var disabled = new MediaRelayService(hub, TestProperties.hawkeye());
        disabled.syntheticFrame();
        verifyNoInteractions(hub);

        final var base = TestProperties.hawkeye();
        final var enabled = new MediaRelayService(hub, new HawkeyeProperties(base.simulator(), base.commands(),
                base.hardware(), base.broadcast(), new HawkeyeProperties.Media(true, 1280, 720)));
        enabled.syntheticFrame();

        final var frame = ArgumentCaptor.forClass(Object.class);
        verify(hub).publish(eq(Channel.VIDEO), frame.capture());
        assertThat(((VideoFrame) frame.getValue()).width()).isEqualTo(1280);
        assertThat(((VideoFrame) frame.getValue()).frame()).isNull();
    }
}
