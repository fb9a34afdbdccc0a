package com.dev.watchsync.engine;

import com.dev.watchsync.config.SyncProperties;
import com.dev.watchsync.domain.DiscreteEvent;
import com.dev.watchsync.domain.PlaybackSnapshot;
import com.dev.watchsync.domain.Role;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Playback synchronization for one participant of one watch session.
 * <p>
 * As host it broadcasts snapshots and forwards user actions on the local player as discrete events. As peer it
 * reconciles the local player with whatever the host sends. All methods are expected to run on the session's
 * single scheduler thread; player callbacks are hopped onto it.
 */
@Slf4j
public class SyncEngine {

    @Getter
    private final String participantId;
    private final Clock clock;
    private final TaskScheduler scheduler;
    private final SyncTransport transport;
    private final ClockEstimator estimator;
    private final FeedbackSuppressor suppressor;
    private final DriftReconciler reconciler;
    private final SnapshotBroadcaster broadcaster;
    private final RoleController roleController;
    private final PlayerListener playerEvents = new PlayerEvents();

    private volatile LocalPlayer player;
    private volatile boolean closed;
    private long lastSnapshotAtEpochMs = -1L;
    private String hostId;
    private boolean hostBuffering;
    private boolean pausedForHostBuffering;

    public SyncEngine(String participantId,
                      SyncProperties properties,
                      Clock clock,
                      TaskScheduler scheduler,
                      SyncTransport transport) {
        this.participantId = participantId;
        this.clock = clock;
        this.scheduler = scheduler;
        this.transport = transport;
        this.estimator = new ClockEstimator(clock);
        this.suppressor = new FeedbackSuppressor(clock, scheduler, properties.suppressionWindow());
        this.reconciler = new DriftReconciler(properties, clock, scheduler, suppressor, this::currentPlayer);
        this.broadcaster = new SnapshotBroadcaster(scheduler, clock, properties.broadcastInterval(),
                this::currentPlayer, transport);
        this.roleController = new RoleController(broadcaster);
    }

    public void attach(LocalPlayer localPlayer) {
        if (closed) {
            return;
        }
        LocalPlayer previous = this.player;
        if (previous != null && previous != localPlayer) {
            previous.setListener(PlayerListener.NOOP);
        }
        this.player = localPlayer;
        localPlayer.setListener(playerEvents);
    }

    public void detach() {
        LocalPlayer previous = this.player;
        this.player = null;
        if (previous != null) {
            previous.setListener(PlayerListener.NOOP);
        }
    }

    // ---- inbound ----

    public Correction onSnapshot(PlaybackSnapshot snapshot) {
        if (closed || player == null || roleController.isHost()) {
            return Correction.SKIPPED;
        }
        if (snapshot == null || !snapshot.isWellFormed()) {
            log.warn("Rejecting malformed snapshot {}", snapshot);
            return Correction.SKIPPED;
        }
        if (hostBuffering) {
            log.debug("Host is buffering, holding snapshot captured at {}", snapshot.getCapturedAtEpochMs());
            return Correction.SKIPPED;
        }
        if (snapshot.getCapturedAtEpochMs() < lastSnapshotAtEpochMs) {
            log.debug("Discarding out-of-order snapshot captured at {} (last {})",
                    snapshot.getCapturedAtEpochMs(), lastSnapshotAtEpochMs);
            return Correction.SKIPPED;
        }
        lastSnapshotAtEpochMs = snapshot.getCapturedAtEpochMs();

        if (snapshot.getContentRef() != null && reconciler.loadSource(snapshot.getContentRef())) {
            return Correction.SOURCE_LOADED;
        }
        double estimated = estimator.estimateHostPosition(snapshot);
        return reconciler.reconcile(estimated, snapshot.isPlaying());
    }

    public boolean onDiscreteEvent(DiscreteEvent event) {
        if (closed || player == null || roleController.isHost()) {
            return false;
        }
        if (event == null || !event.isWellFormed()) {
            log.warn("Rejecting malformed event {}", event);
            return false;
        }
        log.debug("Applying {}", event);
        clearBufferingHold();
        return reconciler.apply(event);
    }

    public boolean onBuffering(boolean buffering) {
        if (closed || player == null || roleController.isHost() || buffering == hostBuffering) {
            return false;
        }
        hostBuffering = buffering;
        if (buffering) {
            pausedForHostBuffering = reconciler.holdForHostBuffering();
        } else {
            if (pausedForHostBuffering) {
                reconciler.resumeAfterHostBuffering();
            }
            pausedForHostBuffering = false;
        }
        log.debug("Host buffering={}", buffering);
        return true;
    }

    public void onRoleChanged(Role role) {
        if (closed) {
            return;
        }
        if (roleController.setRole(role) && role == Role.HOST) {
            reconciler.cancelNudge();
        }
    }

    public void onHostChanged(String hostId) {
        if (!Objects.equals(this.hostId, hostId)) {
            // capture times are only comparable within one host's clock
            this.hostId = hostId;
            lastSnapshotAtEpochMs = -1L;
            clearBufferingHold();
        }
        onRoleChanged(Objects.equals(participantId, hostId) ? Role.HOST : Role.PEER);
    }

    public void onResyncRequested() {
        if (closed || !roleController.isHost()) {
            return;
        }
        broadcaster.broadcastNow();
    }

    // ---- outbound ----

    public boolean emitPlay() {
        LocalPlayer source = player;
        if (!canEmit() || source == null) {
            return false;
        }
        transport.publishEvent(DiscreteEvent.play(source.currentTime()));
        return true;
    }

    public boolean emitPause() {
        LocalPlayer source = player;
        if (!canEmit() || source == null) {
            return false;
        }
        transport.publishEvent(DiscreteEvent.pause(source.currentTime()));
        return true;
    }

    public boolean emitSeek(double position) {
        if (!canEmit()) {
            return false;
        }
        transport.publishEvent(DiscreteEvent.seek(position));
        return true;
    }

    public boolean emitSourceChanged(String contentRef) {
        if (!canEmit()) {
            return false;
        }
        transport.publishEvent(DiscreteEvent.sourceChanged(contentRef));
        return true;
    }

    public boolean emitBuffering(boolean buffering) {
        if (!canEmit()) {
            return false;
        }
        transport.publishBuffering(buffering);
        return true;
    }

    public void requestSync() {
        if (closed) {
            return;
        }
        transport.requestSync();
    }

    // ---- lifecycle ----

    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        broadcaster.stop();
        reconciler.cancelNudge();
        suppressor.cancel();
        detach();
        log.debug("Engine for {} closed", participantId);
    }

    public boolean isClosed() {
        return closed;
    }

    public Optional<Role> getRole() {
        return roleController.getRole();
    }

    public boolean isSuppressed() {
        return suppressor.isSuppressed();
    }

    public long getSuppressUntilEpochMs() {
        return suppressor.getSuppressUntilEpochMs();
    }

    public double getLastAppliedRate() {
        return reconciler.getLastAppliedRate();
    }

    public boolean isHoldingForHostBuffering() {
        return hostBuffering;
    }

    public boolean isBroadcasting() {
        return broadcaster.isActive();
    }

    private boolean canEmit() {
        if (closed || !roleController.isHost()) {
            return false;
        }
        if (suppressor.isSuppressed()) {
            log.debug("Dropping emission inside suppression window");
            return false;
        }
        return true;
    }

    private void clearBufferingHold() {
        hostBuffering = false;
        pausedForHostBuffering = false;
    }

    private LocalPlayer currentPlayer() {
        return closed ? null : player;
    }

    private void hop(Runnable task) {
        if (closed) {
            return;
        }
        try {
            scheduler.schedule(task, clock.instant());
        } catch (TaskRejectedException e) {
            log.debug("Player event after shutdown ignored: {}", e.getMessage());
        }
    }

    private class PlayerEvents implements PlayerListener {
        @Override
        public void played(double position) {
            hop(SyncEngine.this::emitPlay);
        }

        @Override
        public void paused(double position) {
            hop(SyncEngine.this::emitPause);
        }

        @Override
        public void seeked(double position) {
            hop(() -> emitSeek(position));
        }

        @Override
        public void sourceChanged(String contentRef) {
            hop(() -> emitSourceChanged(contentRef));
        }

        @Override
        public void bufferingChanged(boolean buffering) {
            hop(() -> emitBuffering(buffering));
        }
    }
}
