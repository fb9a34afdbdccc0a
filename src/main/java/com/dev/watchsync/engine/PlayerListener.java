package com.dev.watchsync.engine;

public interface PlayerListener {
    PlayerListener NOOP = new PlayerListener() {
        @Override
        public void played(double position) {}

        @Override
        public void paused(double position) {}

        @Override
        public void seeked(double position) {}

        @Override
        public void sourceChanged(String contentRef) {}

        @Override
        public void bufferingChanged(boolean buffering) {}
    };

    void played(double position);

    void paused(double position);

    void seeked(double position);

    void sourceChanged(String contentRef);

    void bufferingChanged(boolean buffering);
}
