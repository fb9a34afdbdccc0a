package com.dev.watchsync.engine;

public interface LocalPlayer {

    double currentTime();

    void seek(double position);

    double playbackRate();

    void setPlaybackRate(double rate);

    boolean isPaused();

    void play();

    void pause();

    String contentRef();

    void load(String contentRef);

    void setListener(PlayerListener listener);
}
