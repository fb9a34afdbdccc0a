package com.dev.watchsync.domain;

public enum DiscreteEventType {
    PLAY,
    PAUSE,
    SEEK,
    SOURCE_CHANGED;

    public boolean carriesPosition() {
        return this != SOURCE_CHANGED;
    }
}
