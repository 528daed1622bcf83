package io.github.jakubt4.hawkeye.service.hardware;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.hawkeye.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GpsDeviceAdapterTest {

    private MutableClock clock;
    private GpsDeviceAdapter adapter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        adapter = new GpsDeviceAdapter(0, Duration.ofSeconds(5), new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() {
        adapter.close();
    }

    @Test
    void openTimesOutWithoutFix() {
        assertThatThrownBy(() -> adapter.open(Duration.ofMillis(100))).isInstanceOf(SocketTimeoutException.class);
        assertThat(adapter.sample()).isNull();
        assertThat(adapter.health()).isFalse();
    }

    @Test
    void receivesFixOverUdp() throws Exception {
        assertThatThrownBy(() -> adapter.open(Duration.ofMillis(50))).isInstanceOf(SocketTimeoutException.class);

        final var json = """
                {"lat": 33.7, "lng": 73.1, "altitude": 512.5, "satellites": 9, "timestamp": 1767225600000}
                """.getBytes(StandardCharsets.UTF_8);
        try (var sender = new DatagramSocket()) {
            sender.send(new DatagramPacket(json, json.length, InetAddress.getLoopbackAddress(), adapter.localPort()));
        }

        adapter.open(Duration.ofSeconds(2));

        final var sample = adapter.sample();
        assertThat(sample.live()).isTrue();
        assertThat(sample.position().lat()).isEqualTo(33.7);
        assertThat(sample.position().lng()).isEqualTo(73.1);
        assertThat(sample.position().alt()).isEqualTo(512.5);
        assertThat(sample.satellites()).isEqualTo(9);
        assertThat(sample.timestamp()).isEqualTo(Instant.ofEpochMilli(1767225600000L));
        assertThat(adapter.health()).isTrue();
    }

    @Test
    void malformedAndOutOfRangeDatagramsAreIgnored() {
        feed("not json");
        feed("{\"lat\": 95.0, \"lng\": 73.1}");
        feed("{\"lng\": 73.1}");

        assertThat(adapter.sample()).isNull();
    }

    @Test
    void becomesUnhealthyOnceFixIsStale() {
        feed("{\"lat\": 33.7, \"lng\": 73.1}");
        assertThat(adapter.health()).isTrue();
        assertThat(adapter.sample().satellites()).isZero();

        clock.advance(Duration.ofSeconds(5));
        assertThat(adapter.health()).isTrue();

        clock.advance(Duration.ofMillis(1));
        assertThat(adapter.health()).isFalse();
    }

    private void feed(final String datagram) {
        final var bytes = datagram.getBytes(StandardCharsets.UTF_8);
        adapter.handleDatagram(bytes, 0, bytes.length);
    }
}
