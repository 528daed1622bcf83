package io.github.jakubt4.hawkeye.service.broadcast;

import io.github.jakubt4.hawkeye.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class BroadcastHubTest {

    private BroadcastHub hub;

    @BeforeEach
    void setUp() {
        hub = new BroadcastHub(TestProperties.broadcast(Duration.ofMillis(100)));
    }

    @AfterEach
    void tearDown() {
        hub.stop();
    }

    @Test
    void connectAnnouncesConnectionStatus() {
        final var sink = new RecordingSink();

        assertThat(hub.connect("c1", sink)).isTrue();

        assertThat(sink.events).singleElement()
                .satisfies(event -> assertThat(event.name()).isEqualTo(BroadcastHub.CONNECTION_STATUS));
        assertThat(hub.connect("c1", new RecordingSink())).isFalse();
    }

    @Test
    void subscribeAndUnsubscribeAreAcknowledged() {
        final var sink = new RecordingSink();
        hub.connect("c1", sink);

        assertThat(hub.subscribe("c1", Channel.TELEMETRY)).containsExactly(Channel.TELEMETRY);
        assertThat(hub.subscribe("c1", Channel.ALERTS)).containsExactlyInAnyOrder(Channel.TELEMETRY, Channel.ALERTS);
        assertThat(hub.unsubscribe("c1", Channel.TELEMETRY)).containsExactly(Channel.ALERTS);

        assertThat(sink.events).extracting(RecordingSink.Event::name)
                .containsExactly(BroadcastHub.CONNECTION_STATUS, BroadcastHub.SUBSCRIPTION_STATUS,
                        BroadcastHub.SUBSCRIPTION_STATUS, BroadcastHub.SUBSCRIPTION_STATUS);
    }

    @Test
    void subscribeRejectsUnknownClient() {
        assertThatThrownBy(() -> hub.subscribe("ghost", Channel.VIDEO)).isInstanceOf(UnknownClientException.class);
    }

    @Test
    void deliversOnlyToSubscribersInFifoOrder() {
        final var subscribed = new RecordingSink();
        final var other = new RecordingSink();
        hub.connect("a", subscribed);
        hub.connect("b", other);
        hub.subscribe("a", Channel.DETECTIONS);

        IntStream.range(0, 5).forEach(i -> hub.publish(Channel.DETECTIONS, i));
        hub.drainOnce(Channel.DETECTIONS);

        assertThat(subscribed.payloads(Channel.DETECTIONS)).containsExactly(0, 1, 2, 3, 4);
        assertThat(other.payloads(Channel.DETECTIONS)).isEmpty();
    }

    @Test
    void failingClientIsRemovedFromThatChannelOnly() {
        final var healthy = new RecordingSink();
        final var broken = new RecordingSink()
                .failWhen(event -> event.name().equals(Channel.TELEMETRY.eventName()) && Integer.valueOf(1).equals(event.payload()));
        hub.connect("healthy", healthy);
        hub.connect("broken", broken);
        hub.subscribe("healthy", Channel.TELEMETRY);
        hub.subscribe("broken", Channel.TELEMETRY);
        hub.subscribe("broken", Channel.VIDEO);

        IntStream.range(0, 4).forEach(i -> hub.publish(Channel.TELEMETRY, i));
        hub.drainOnce(Channel.TELEMETRY);
        hub.publish(Channel.VIDEO, "frame");
        hub.drainOnce(Channel.VIDEO);

        assertThat(healthy.payloads(Channel.TELEMETRY)).containsExactly(0, 1, 2, 3);
        assertThat(broken.payloads(Channel.TELEMETRY)).containsExactly(0);
        assertThat(broken.payloads(Channel.VIDEO)).containsExactly("frame");
        assertThat(hub.stats().channels().get("telemetry").subscribers()).isEqualTo(1);
        assertThat(hub.connected("broken")).isTrue();
    }

    @Test
    void survivorReceivesEverythingAfterPeerDisconnectsMidBroadcast() throws InterruptedException {
        final var survivor = new RecordingSink();
        final var leaver = new RecordingSink();
        hub.connect("survivor", survivor);
        hub.connect("leaver", leaver);
        hub.subscribe("survivor", Channel.TELEMETRY);
        hub.subscribe("leaver", Channel.TELEMETRY);
        hub.start();

        for (var i = 0; i < 30; i++) {
            hub.publish(Channel.TELEMETRY, i);
            if (i == 10) {
                hub.disconnect("leaver");
            }
            Thread.sleep(5);
        }

        final var deadline = System.currentTimeMillis() + 2_000;
        while (survivor.payloads(Channel.TELEMETRY).size() < 30 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertThat(survivor.payloads(Channel.TELEMETRY)).containsExactlyElementsOf(IntStream.range(0, 30).boxed().toList());
        assertThat(leaver.closed).isTrue();
        assertThat(leaver.payloads(Channel.TELEMETRY)).hasSizeLessThanOrEqualTo(11);
        final var receivedByLeaver = leaver.events.size();

        hub.publish(Channel.TELEMETRY, 99);
        Thread.sleep(300);
        assertThat(leaver.events).hasSize(receivedByLeaver);
    }

    @Test
    void alertsAreDeliveredByTheEventLoop() throws InterruptedException {
        final var sink = new RecordingSink();
        hub.connect("c1", sink);
        hub.subscribe("c1", Channel.ALERTS);
        hub.start();

        hub.publish(Channel.ALERTS, "engine hot");

        final var deadline = System.currentTimeMillis() + 2_000;
        while (sink.payloads(Channel.ALERTS).isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(sink.payloads(Channel.ALERTS)).containsExactly("engine hot");
    }

    @Test
    void fullAlertQueueBlocksThenCountsFailure() {
        for (var i = 0; i < Channel.ALERTS.capacity(); i++) {
            assertThat(hub.publish(Channel.ALERTS, "alert " + i)).isTrue();
        }

        assertThat(hub.publish(Channel.ALERTS, "one too many")).isFalse();

        final var stats = hub.stats();
        assertThat(stats.alertPublishFailures()).isEqualTo(1);
        assertThat(stats.channels().get("alerts").queueDepth()).isEqualTo(20);
    }

    @Test
    void stopClosesEveryClient() {
        final var sink = new RecordingSink();
        hub.connect("c1", sink);
        hub.start();

        hub.stop();

        assertThat(sink.closed).isTrue();
        assertThat(hub.stats().clients()).isZero();
        assertThat(hub.running()).isFalse();
    }

    @Test
    void statsReportQueueDepthAndDrops() {
        IntStream.range(0, 12).forEach(i -> hub.publish(Channel.VIDEO, i));

        final var video = hub.stats().channels().get("video");

        assertThat(video.queueDepth()).isEqualTo(10);
        assertThat(video.capacity()).isEqualTo(10);
        assertThat(video.dropped()).isEqualTo(2);
    }

    @Test
    void subscribeRacingDisconnectNeverLeavesAStaleSubscriber() throws InterruptedException {
        for (var i = 0; i < 500; i++) {
            final var id = "racer-" + i;
            hub.connect(id, new RecordingSink());
            final var go = new CountDownLatch(1);
            final var subscriber = new Thread(() -> {
                try {
                    go.await();
                    hub.subscribe(id, Channel.TELEMETRY);
                } catch (final UnknownClientException e) {
                    // disconnect won
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            subscriber.start();
            go.countDown();
            hub.disconnect(id);
            subscriber.join(5_000);
        }

        final var stats = hub.stats();
        assertThat(stats.clients()).isZero();
        assertThat(stats.channels().get("telemetry").subscribers()).isZero();
    }

    @Test
    void stalledClientIsDroppedWithoutHoldingUpPeersOrDisconnect() {
        final var release = new CountDownLatch(1);
        final var stalled = new StallingSink(release);
        final var healthy = new RecordingSink();
        hub.connect("stalled", stalled);
        hub.connect("healthy", healthy);
        hub.subscribe("stalled", Channel.TELEMETRY);
        hub.subscribe("healthy", Channel.TELEMETRY);

        try {
            hub.publish(Channel.TELEMETRY, 1);
            hub.publish(Channel.TELEMETRY, 2);
            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> hub.drainOnce(Channel.TELEMETRY));

            assertThat(healthy.payloads(Channel.TELEMETRY)).containsExactly(1, 2);
            assertThat(hub.stats().channels().get("telemetry").subscribers()).isEqualTo(1);

            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> assertThat(hub.disconnect("stalled")).isTrue());
            assertThat(stalled.closed).isTrue();
        } finally {
            release.countDown();
        }
    }

    /** Blocks inside {@code send} on telemetry until released. */
    private static final class StallingSink implements ClientSink {

        private final CountDownLatch release;
        volatile boolean closed;

        StallingSink(final CountDownLatch release) {
            this.release = release;
        }

        @Override
        public void send(final String eventName, final Object payload) throws IOException {
            if (!eventName.equals(Channel.TELEMETRY.eventName())) {
                return;
            }
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("write interrupted");
            }
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
