package io.github.jakubt4.hawkeye.service;

import io.github.jakubt4.hawkeye.config.HawkeyeProperties;
import io.github.jakubt4.hawkeye.service.broadcast.BroadcastHub;
import io.github.jakubt4.hawkeye.service.command.CommandRouter;
import io.github.jakubt4.hawkeye.service.hardware.HardwareAdapter;
import io.github.jakubt4.hawkeye.service.simulation.DroneStateSimulator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runtime context of the drone: owns the periodic simulation tick and hardware poll and the
 * hub's delivery loops.
 *
 * <p>Lifecycle is {@code new → start → stop}. Stop closes command intake first, then lets the
 * periodic tasks and delivery loops finish their current iteration within a bound.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DroneRuntime implements SmartLifecycle {

    private final HawkeyeProperties properties;
    private final DroneStateSimulator simulator;
    private final HardwareAdapter hardware;
    private final BroadcastHub hub;
    private final CommandRouter commandRouter;

    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        hub.start();

        final var threadCounter = new AtomicInteger();
        scheduler = Executors.newScheduledThreadPool(2, runnable -> {
            final var thread = new Thread(runnable, "hawkeye-runtime-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        final var tickMs = properties.simulator().tickPeriod().toMillis();
        final var pollMs = properties.hardware().pollPeriod().toMillis();
        scheduler.scheduleAtFixedRate(this::pollHardware, 0, pollMs, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::tick, tickMs, tickMs, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Drone runtime started — tick={}ms, hardware poll={}ms, degraded={}",
                tickMs, pollMs, hardware.degraded());
    }

    private void tick() {
        try {
            simulator.tick();
        } catch (final RuntimeException e) {
            log.error("[TICK] Simulation tick failed", e);
        }
    }

    private void pollHardware() {
        try {
            hardware.poll();
        } catch (final RuntimeException e) {
            log.error("[HARDWARE] Poll failed", e);
        }
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        commandRouter.stopAccepting();
        running = false;

        scheduler.shutdown();
        final var timeout = properties.broadcast().shutdownTimeout();
        try {
            if (!scheduler.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Periodic tasks still running after {}", timeout);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        hub.stop();
        log.info("Drone runtime stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
