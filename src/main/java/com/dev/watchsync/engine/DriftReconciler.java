package com.dev.watchsync.engine;

import com.dev.watchsync.config.SyncProperties;
import com.dev.watchsync.domain.DiscreteEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Brings the local player onto the host's estimated position.
 * <ul>
 *     <li>drift up to the convergence threshold: leave the player alone and drop any speed nudge;</li>
 *     <li>drift up to the hard-seek threshold: run slightly faster or slower for a while;</li>
 *     <li>anything larger: seek straight to the host and copy its play/pause state.</li>
 * </ul>
 * Every mutation opens the feedback suppression window first.
 */
@Slf4j
public class DriftReconciler {

    static final double BASE_RATE = 1.0;

    private final SyncProperties properties;
    private final Clock clock;
    private final TaskScheduler scheduler;
    private final FeedbackSuppressor suppressor;
    private final Supplier<LocalPlayer> player;

    private ScheduledFuture<?> rateReset;
    private double lastAppliedRate = BASE_RATE;

    public DriftReconciler(SyncProperties properties,
                           Clock clock,
                           TaskScheduler scheduler,
                           FeedbackSuppressor suppressor,
                           Supplier<LocalPlayer> player) {
        this.properties = properties;
        this.clock = clock;
        this.scheduler = scheduler;
        this.suppressor = suppressor;
        this.player = player;
    }

    public Correction reconcile(double estimatedHostPosition, boolean hostPlaying) {
        LocalPlayer target = player.get();
        if (target == null) {
            return Correction.SKIPPED;
        }
        double local = target.currentTime();
        double drift = Math.abs(local - estimatedHostPosition);

        if (drift <= properties.convergenceThreshold()) {
            cancelNudge();
            return Correction.CONVERGED;
        }

        if (drift <= properties.hardSeekThreshold()) {
            boolean behind = local < estimatedHostPosition;
            nudge(target, behind ? BASE_RATE + properties.rateNudge() : BASE_RATE - properties.rateNudge());
            return behind ? Correction.SPEED_UP : Correction.SLOW_DOWN;
        }

        log.debug("Hard seek: local={} host={} drift={}", local, estimatedHostPosition, drift);
        suppressor.suppress();
        target.seek(estimatedHostPosition);
        cancelNudge();
        if (hostPlaying && target.isPaused()) {
            target.play();
        } else if (!hostPlaying && !target.isPaused()) {
            target.pause();
        }
        return Correction.HARD_SEEK;
    }

    public boolean apply(DiscreteEvent event) {
        LocalPlayer target = player.get();
        if (target == null) {
            return false;
        }
        suppressor.suppress();
        cancelNudge();
        switch (event.getType()) {
            case PLAY -> {
                target.seek(event.getPosition());
                if (target.isPaused()) {
                    target.play();
                }
            }
            case PAUSE -> {
                target.seek(event.getPosition());
                if (!target.isPaused()) {
                    target.pause();
                }
            }
            case SEEK -> target.seek(event.getPosition());
            case SOURCE_CHANGED -> loadSource(target, event.getContentRef());
        }
        return true;
    }

    public boolean holdForHostBuffering() {
        LocalPlayer target = player.get();
        if (target == null) {
            return false;
        }
        suppressor.suppress();
        cancelNudge();
        if (target.isPaused()) {
            return false;
        }
        target.pause();
        return true;
    }

    public void resumeAfterHostBuffering() {
        LocalPlayer target = player.get();
        if (target == null || !target.isPaused()) {
            return;
        }
        suppressor.suppress();
        target.play();
    }

    public boolean loadSource(String contentRef) {
        LocalPlayer target = player.get();
        if (target == null || Objects.equals(target.contentRef(), contentRef)) {
            return false;
        }
        suppressor.suppress();
        cancelNudge();
        loadSource(target, contentRef);
        return true;
    }

    public synchronized void cancelNudge() {
        if (rateReset != null) {
            rateReset.cancel(false);
            rateReset = null;
        }
        resetRate();
    }

    public double getLastAppliedRate() {
        return lastAppliedRate;
    }

    private void loadSource(LocalPlayer target, String contentRef) {
        if (!Objects.equals(target.contentRef(), contentRef)) {
            log.info("Loading content {}", contentRef);
            target.load(contentRef);
        }
    }

    private synchronized void nudge(LocalPlayer target, double rate) {
        if (target.playbackRate() != rate) {
            suppressor.suppress();
            target.setPlaybackRate(rate);
        }
        lastAppliedRate = rate;
        if (rateReset != null) {
            rateReset.cancel(false);
        }
        rateReset = scheduler.schedule(this::expireNudge,
                Instant.ofEpochMilli(clock.millis()).plus(properties.rateNudgeDuration()));
    }

    private synchronized void expireNudge() {
        rateReset = null;
        resetRate();
    }

    private void resetRate() {
        lastAppliedRate = BASE_RATE;
        LocalPlayer target = player.get();
        if (target != null && target.playbackRate() != BASE_RATE) {
            suppressor.suppress();
            target.setPlaybackRate(BASE_RATE);
        }
    }
}
