package com.dev.watchsync.engine;

public enum Correction {
    SKIPPED,
    CONVERGED,
    SPEED_UP,
    SLOW_DOWN,
    HARD_SEEK,
    SOURCE_LOADED
}
