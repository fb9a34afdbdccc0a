package com.dev.watchsync.engine;

import com.dev.watchsync.domain.DiscreteEvent;
import com.dev.watchsync.domain.PlaybackSnapshot;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Slf4j
public class SyncSession implements AutoCloseable {

    @Getter
    private final String roomCode;
    @Getter
    private final SyncEngine engine;
    private final ThreadPoolTaskScheduler scheduler;
    private final SyncTransport transport;

    private volatile boolean closed;

    SyncSession(String roomCode, SyncEngine engine, ThreadPoolTaskScheduler scheduler, SyncTransport transport) {
        this.roomCode = roomCode;
        this.engine = engine;
        this.scheduler = scheduler;
        this.transport = transport;
    }

    public String getParticipantId() {
        return engine.getParticipantId();
    }

    public void attach(LocalPlayer player) {
        dispatch("attach", () -> engine.attach(player));
    }

    public void detach() {
        dispatch("detach", engine::detach);
    }

    public void onSnapshot(PlaybackSnapshot snapshot) {
        dispatch("snapshot", () -> {
            Correction correction = engine.onSnapshot(snapshot);
            log.trace("[{}] snapshot -> {}", roomCode, correction);
        });
    }

    public void onDiscreteEvent(DiscreteEvent event) {
        dispatch("event", () -> engine.onDiscreteEvent(event));
    }

    public void onBuffering(boolean buffering) {
        dispatch("buffering", () -> engine.onBuffering(buffering));
    }

    public void onHostChanged(String hostId) {
        dispatch("host-changed", () -> engine.onHostChanged(hostId));
    }

    public void onResyncRequested() {
        dispatch("resync", engine::onResyncRequested);
    }

    public void requestSync() {
        dispatch("request-sync", engine::requestSync);
    }

    public void emitPlay() {
        dispatch("emit-play", engine::emitPlay);
    }

    public void emitPause() {
        dispatch("emit-pause", engine::emitPause);
    }

    public void emitSeek(double position) {
        dispatch("emit-seek", () -> engine.emitSeek(position));
    }

    public void emitSourceChanged(String contentRef) {
        dispatch("emit-source", () -> engine.emitSourceChanged(contentRef));
    }

    public void emitBuffering(boolean buffering) {
        dispatch("emit-buffering", () -> engine.emitBuffering(buffering));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        // cancels all three timers before the thread goes away
        engine.close();
        scheduler.shutdown();
        transport.close();
        log.info("[{}] sync session for {} closed", roomCode, getParticipantId());
    }

    private void dispatch(String what, Runnable task) {
        if (closed) {
            log.debug("[{}] {} after close ignored", roomCode, what);
            return;
        }
        try {
            scheduler.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("[{}] {} failed", roomCode, what, e);
                }
            });
        } catch (TaskRejectedException e) {
            log.debug("[{}] {} rejected: {}", roomCode, what, e.getMessage());
        }
    }
}
