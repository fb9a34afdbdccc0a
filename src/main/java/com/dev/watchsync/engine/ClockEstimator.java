package com.dev.watchsync.engine;

import com.dev.watchsync.domain.PlaybackSnapshot;

import java.time.Clock;

public class ClockEstimator {

    private final Clock clock;

    public ClockEstimator(Clock clock) {
        this.clock = clock;
    }

    public double estimateHostPosition(PlaybackSnapshot snapshot) {
        return estimateHostPosition(snapshot, clock.millis());
    }

    public double estimateHostPosition(PlaybackSnapshot snapshot, long nowEpochMs) {
        if (!snapshot.isPlaying()) {
            // a paused host does not move, however late the snapshot arrives
            return snapshot.getPosition();
        }
        long elapsedMs = Math.max(0L, nowEpochMs - snapshot.getCapturedAtEpochMs());
        return snapshot.getPosition() + elapsedMs / 1000.0;
    }
}
