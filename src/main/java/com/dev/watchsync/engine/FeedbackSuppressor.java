package com.dev.watchsync.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Timed latch opened after every programmatic player mutation. While open, player callbacks must not be sent
 * out as if the user had caused them. Expiry is decided by the clock; the expiry timer only resets the state.
 */
@Slf4j
public class FeedbackSuppressor {

    private final Clock clock;
    private final TaskScheduler scheduler;
    private final Duration window;

    private volatile long suppressUntilEpochMs;
    private ScheduledFuture<?> expiry;

    public FeedbackSuppressor(Clock clock, TaskScheduler scheduler, Duration window) {
        this.clock = clock;
        this.scheduler = scheduler;
        this.window = window;
    }

    public synchronized void suppress() {
        long until = clock.millis() + window.toMillis();
        suppressUntilEpochMs = Math.max(suppressUntilEpochMs, until);
        if (expiry != null) {
            expiry.cancel(false);
        }
        expiry = scheduler.schedule(this::expire, Instant.ofEpochMilli(suppressUntilEpochMs));
    }

    public boolean isSuppressed() {
        return clock.millis() < suppressUntilEpochMs;
    }

    public long getSuppressUntilEpochMs() {
        return suppressUntilEpochMs;
    }

    public synchronized void cancel() {
        if (expiry != null) {
            expiry.cancel(false);
            expiry = null;
        }
        suppressUntilEpochMs = 0L;
    }

    private synchronized void expire() {
        if (clock.millis() >= suppressUntilEpochMs) {
            suppressUntilEpochMs = 0L;
            expiry = null;
            log.trace("Suppression window closed");
        }
    }
}
