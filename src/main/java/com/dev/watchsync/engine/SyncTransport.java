package com.dev.watchsync.engine;

import com.dev.watchsync.domain.DiscreteEvent;
import com.dev.watchsync.domain.PlaybackSnapshot;

public interface SyncTransport {

    void publishSnapshot(PlaybackSnapshot snapshot);

    void publishEvent(DiscreteEvent event);

    void publishBuffering(boolean buffering);

    void requestSync();

    default void close() {
    }
}
