package com.dev.watchsync.engine;

import com.dev.watchsync.config.SyncProperties;
import com.dev.watchsync.domain.DiscreteEvent;
import com.dev.watchsync.player.SimulatedPlayer;
import com.dev.watchsync.support.ManualTaskScheduler;
import com.dev.watchsync.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class DriftReconcilerTest {

    private final MutableClock clock = new MutableClock(5_000_000L);
    private final ManualTaskScheduler scheduler = new ManualTaskScheduler(clock);
    private final FeedbackSuppressor suppressor = new FeedbackSuppressor(clock, scheduler, Duration.ofMillis(500));
    private final AtomicReference<LocalPlayer> slot = new AtomicReference<>();
    private final DriftReconciler reconciler = new DriftReconciler(
            SyncProperties.defaults(), clock, scheduler, suppressor, slot::get);

    private SimulatedPlayer player;

    @BeforeEach
    void setUp() {
        player = new SimulatedPlayer(clock);
        slot.set(player);
    }

    @Test
    void driftOfExactlyTheConvergenceThresholdIsLeftAlone() {
        assertThat(reconciler.reconcile(0.1, false)).isEqualTo(Correction.CONVERGED);
        assertThat(player.playbackRate()).isEqualTo(1.0);
    }

    @Test
    void driftJustAboveConvergenceIsNudged() {
        assertThat(reconciler.reconcile(0.11, false)).isEqualTo(Correction.SPEED_UP);
        assertThat(player.playbackRate()).isEqualTo(1.05);
    }

    @Test
    void driftOfExactlyTheHardSeekThresholdIsStillNudged() {
        assertThat(reconciler.reconcile(0.5, false)).isEqualTo(Correction.SPEED_UP);
        assertThat(player.currentTime()).isEqualTo(0.0);
    }

    @Test
    void driftJustAboveHardSeekThresholdSeeks() {
        assertThat(reconciler.reconcile(0.51, false)).isEqualTo(Correction.HARD_SEEK);
        assertThat(player.currentTime()).isEqualTo(0.51);
        assertThat(suppressor.isSuppressed()).isTrue();
    }

    @Test
    void aheadOfHostSlowsDown() {
        player.seek(10.3);

        assertThat(reconciler.reconcile(10.0, false)).isEqualTo(Correction.SLOW_DOWN);
        assertThat(player.playbackRate()).isEqualTo(0.95);
    }

    @Test
    void nudgeIsResetAfterTwoSeconds() {
        reconciler.reconcile(0.3, false);

        scheduler.advance(Duration.ofMillis(1999));
        assertThat(player.playbackRate()).isEqualTo(1.05);

        scheduler.advance(Duration.ofMillis(1));
        assertThat(player.playbackRate()).isEqualTo(1.0);
        assertThat(reconciler.getLastAppliedRate()).isEqualTo(1.0);
    }

    @Test
    void renudgeReplacesThePendingReset() {
        reconciler.reconcile(0.3, false);
        scheduler.advance(Duration.ofMillis(1500));
        reconciler.reconcile(0.3, false);

        scheduler.advance(Duration.ofMillis(1500));
        assertThat(player.playbackRate()).isEqualTo(1.05);

        scheduler.advance(Duration.ofMillis(500));
        assertThat(player.playbackRate()).isEqualTo(1.0);
    }

    @Test
    void convergingCancelsAnActiveNudge() {
        reconciler.reconcile(0.3, false);

        assertThat(reconciler.reconcile(0.0, false)).isEqualTo(Correction.CONVERGED);

        assertThat(player.playbackRate()).isEqualTo(1.0);
        scheduler.advance(Duration.ofMillis(3000));
        assertThat(player.playbackRate()).isEqualTo(1.0);
    }

    @Test
    void hardSeekAlignsPlayState() {
        assertThat(player.isPaused()).isTrue();

        reconciler.reconcile(20.0, true);
        assertThat(player.isPaused()).isFalse();

        reconciler.reconcile(40.0, false);
        assertThat(player.isPaused()).isTrue();
        assertThat(player.currentTime()).isEqualTo(40.0);
    }

    @Test
    void hardSeekResetsANudgedRate() {
        reconciler.reconcile(0.3, false);

        reconciler.reconcile(30.0, false);

        assertThat(player.playbackRate()).isEqualTo(1.0);
    }

    @Test
    void discreteEventsIgnoreDriftThresholds() {
        player.seek(55.02);

        assertThat(reconciler.apply(DiscreteEvent.seek(55.0))).isTrue();

        assertThat(player.currentTime()).isEqualTo(55.0);
        assertThat(suppressor.isSuppressed()).isTrue();
    }

    @Test
    void playAndPauseEventsSetPositionAndState() {
        reconciler.apply(DiscreteEvent.play(12.0));
        assertThat(player.isPaused()).isFalse();
        assertThat(player.currentTime()).isEqualTo(12.0);

        reconciler.apply(DiscreteEvent.pause(14.0));
        assertThat(player.isPaused()).isTrue();
        assertThat(player.currentTime()).isEqualTo(14.0);
    }

    @Test
    void sourceChangeLoadsOnlyNewContent() {
        reconciler.apply(DiscreteEvent.sourceChanged("magnet:?xt=urn:btih:abc"));
        assertThat(player.contentRef()).isEqualTo("magnet:?xt=urn:btih:abc");

        assertThat(reconciler.loadSource("magnet:?xt=urn:btih:abc")).isFalse();
        assertThat(reconciler.loadSource("yt:dQw4w9WgXcQ")).isTrue();
        assertThat(player.contentRef()).isEqualTo("yt:dQw4w9WgXcQ");
    }

    @Test
    void withoutPlayerNothingHappens() {
        slot.set(null);

        assertThat(reconciler.reconcile(10.0, true)).isEqualTo(Correction.SKIPPED);
        assertThat(reconciler.apply(DiscreteEvent.pause(3.0))).isFalse();
        assertThat(suppressor.isSuppressed()).isFalse();
    }
}
