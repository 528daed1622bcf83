package io.github.jakubt4.hawkeye.service.hardware;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.hawkeye.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Device-backed telemetry source. Listens for normalized GPS fixes (JSON datagrams) from the
 * GPS/MAVLink bridge on a dedicated receive thread and keeps the newest one.
 *
 * <p>Datagram layout:
 * <pre>
 *   {"lat": 33.6844, "lng": 73.0479, "altitude": 512.4, "satellites": 9, "timestamp": 1760000000000}
 * </pre>
 */
@Slf4j
public class GpsDeviceAdapter implements HardwareAdapter {

    private static final int MAX_DATAGRAM = 1024;

    private final int port;
    private final Duration staleAfter;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        final var thread = new Thread(runnable, "hawkeye-gps-receiver");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicReference<TelemetrySample> latest = new AtomicReference<>();
    private final CountDownLatch firstFix = new CountDownLatch(1);

    private volatile DatagramSocket socket;
    private volatile Instant lastReceivedAt;
    private volatile boolean running;

    public GpsDeviceAdapter(final int port, final Duration staleAfter, final ObjectMapper objectMapper, final Clock clock) {
        this.port = port;
        this.staleAfter = staleAfter;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Binds the UDP port (once) and waits for the first valid fix.
     *
     * @param timeout how long to wait for the first fix
     * @throws IOException if the port cannot be bound or no fix arrives in time
     */
    public synchronized void open(final Duration timeout) throws IOException {
        if (socket == null) {
            socket = new DatagramSocket(port);
            running = true;
            executor.submit(this::receiveLoop);
            log.info("[HARDWARE] GPS link listening on UDP port {}", socket.getLocalPort());
        }
        try {
            if (!firstFix.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new SocketTimeoutException("No GPS fix on UDP port " + localPort() + " within " + timeout);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for the first GPS fix");
        }
        log.info("[HARDWARE] GPS fix acquired — device telemetry active");
    }

    private void receiveLoop() {
        final var buffer = new byte[MAX_DATAGRAM];
        while (running) {
            final var packet = new DatagramPacket(buffer, buffer.length);
            try {
                socket.receive(packet);
            } catch (final IOException e) {
                if (running) {
                    log.error("[HARDWARE] GPS link failure: {}", e.getMessage());
                }
                return;
            }
            handleDatagram(packet.getData(), packet.getOffset(), packet.getLength());
        }
    }

    void handleDatagram(final byte[] data, final int offset, final int length) {
        final GpsFix fix;
        try {
            fix = objectMapper.readValue(data, offset, length, GpsFix.class);
        } catch (final IOException e) {
            log.debug("[HARDWARE] Ignoring malformed GPS datagram: {}", e.getMessage());
            return;
        }
        if (!isValid(fix)) {
            log.debug("[HARDWARE] Ignoring out-of-range GPS fix: {}", fix);
            return;
        }

        final var now = clock.instant();
        final var timestamp = fix.timestamp() == null ? now : Instant.ofEpochMilli(fix.timestamp());
        final var altitude = fix.altitude() == null ? 0.0 : fix.altitude();
        final var satellites = fix.satellites() == null ? 0 : fix.satellites();

        latest.set(new TelemetrySample(new GeoPoint(fix.lat(), fix.lng(), altitude), satellites, timestamp, true));
        lastReceivedAt = now;
        firstFix.countDown();
    }

    private static boolean isValid(final GpsFix fix) {
        return fix.lat() != null && fix.lng() != null
                && fix.lat() >= -90 && fix.lat() <= 90
                && fix.lng() >= -180 && fix.lng() <= 180;
    }

    int localPort() {
        final var current = socket;
        return current == null ? port : current.getLocalPort();
    }

    @Override
    public TelemetrySample sample() {
        return latest.get();
    }

    /** Healthy while the newest fix is younger than {@code staleAfter}. */
    @Override
    public boolean health() {
        final var received = lastReceivedAt;
        return received != null && Duration.between(received, clock.instant()).compareTo(staleAfter) <= 0;
    }

    @Override
    public void close() {
        running = false;
        final var current = socket;
        if (current != null && !current.isClosed()) {
            current.close();
            log.info("[HARDWARE] GPS link closed");
        }
        executor.shutdown();
    }
}
