package com.dev.watchsync.engine;

import com.dev.watchsync.domain.PlaybackSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

@Slf4j
public class SnapshotBroadcaster {

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration interval;
    private final Supplier<LocalPlayer> player;
    private final SyncTransport transport;

    // checked by every tick so that a tick racing stop() sends nothing
    private volatile boolean active;
    private ScheduledFuture<?> timer;
    private long lastCapturedAtEpochMs;

    public SnapshotBroadcaster(TaskScheduler scheduler,
                               Clock clock,
                               Duration interval,
                               Supplier<LocalPlayer> player,
                               SyncTransport transport) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.interval = interval;
        this.player = player;
        this.transport = transport;
    }

    public synchronized void start() {
        if (active) {
            return;
        }
        active = true;
        timer = scheduler.scheduleAtFixedRate(this::tick,
                Instant.ofEpochMilli(clock.millis()).plus(interval), interval);
        log.debug("Snapshot broadcast started every {}", interval);
    }

    public synchronized void stop() {
        active = false;
        if (timer != null) {
            timer.cancel(false);
            timer = null;
            log.debug("Snapshot broadcast stopped");
        }
    }

    public boolean isActive() {
        return active;
    }

    public synchronized boolean broadcastNow() {
        LocalPlayer source = player.get();
        if (source == null) {
            return false;
        }
        lastCapturedAtEpochMs = Math.max(lastCapturedAtEpochMs, clock.millis());
        PlaybackSnapshot snapshot = PlaybackSnapshot.builder()
                .position(Math.max(0.0, source.currentTime()))
                .playing(!source.isPaused())
                .rate(source.playbackRate())
                .capturedAtEpochMs(lastCapturedAtEpochMs)
                .contentRef(source.contentRef())
                .build();
        transport.publishSnapshot(snapshot);
        return true;
    }

    private void tick() {
        if (!active) {
            return;
        }
        broadcastNow();
    }
}
