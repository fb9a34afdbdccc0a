package com.dev.watchsync.player;

import com.dev.watchsync.engine.LocalPlayer;
import com.dev.watchsync.engine.PlayerListener;
import lombok.Setter;

import java.time.Clock;

public class SimulatedPlayer implements LocalPlayer {

    private final Clock clock;

    @Setter
    private volatile PlayerListener listener = PlayerListener.NOOP;

    private double anchorPosition;
    private long anchorEpochMs;
    private double rate = 1.0;
    private boolean paused = true;
    private boolean buffering;
    private String contentRef;

    public SimulatedPlayer(Clock clock) {
        this(clock, null);
    }

    public SimulatedPlayer(Clock clock, String contentRef) {
        this.clock = clock;
        this.contentRef = contentRef;
        this.anchorEpochMs = clock.millis();
    }

    @Override
    public synchronized double currentTime() {
        if (paused || buffering) {
            return anchorPosition;
        }
        return anchorPosition + (clock.millis() - anchorEpochMs) / 1000.0 * rate;
    }

    @Override
    public void seek(double position) {
        synchronized (this) {
            anchorPosition = Math.max(0.0, position);
            anchorEpochMs = clock.millis();
        }
        listener.seeked(position);
    }

    @Override
    public synchronized double playbackRate() {
        return rate;
    }

    @Override
    public synchronized void setPlaybackRate(double rate) {
        reanchor();
        this.rate = rate;
    }

    @Override
    public synchronized boolean isPaused() {
        return paused;
    }

    @Override
    public void play() {
        double position;
        synchronized (this) {
            if (!paused) {
                return;
            }
            reanchor();
            paused = false;
            position = anchorPosition;
        }
        listener.played(position);
    }

    @Override
    public void pause() {
        double position;
        synchronized (this) {
            if (paused) {
                return;
            }
            reanchor();
            paused = true;
            position = anchorPosition;
        }
        listener.paused(position);
    }

    @Override
    public synchronized String contentRef() {
        return contentRef;
    }

    @Override
    public void load(String contentRef) {
        synchronized (this) {
            this.contentRef = contentRef;
            this.anchorPosition = 0.0;
            this.anchorEpochMs = clock.millis();
            this.paused = true;
        }
        listener.sourceChanged(contentRef);
    }

    public synchronized boolean isBuffering() {
        return buffering;
    }

    public void setBuffering(boolean buffering) {
        synchronized (this) {
            if (this.buffering == buffering) {
                return;
            }
            reanchor();
            this.buffering = buffering;
        }
        listener.bufferingChanged(buffering);
    }

    private void reanchor() {
        anchorPosition = currentTime();
        anchorEpochMs = clock.millis();
    }
}
