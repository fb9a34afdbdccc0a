package com.dev.watchsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "sync")
public record SyncProperties(
        @DefaultValue("1500ms") Duration broadcastInterval,
        @DefaultValue("0.1") double convergenceThreshold,
        @DefaultValue("0.5") double hardSeekThreshold,
        @DefaultValue("0.05") double rateNudge,
        @DefaultValue("2000ms") Duration rateNudgeDuration,
        @DefaultValue("500ms") Duration suppressionWindow,
        @DefaultValue("ws://localhost:8080/ws") String relayUrl,
        @DefaultValue("10") int reconnectAttempts,
        @DefaultValue("1000ms") Duration reconnectDelay
) {

    public static SyncProperties defaults() {
        return new SyncProperties(
                Duration.ofMillis(1500),
                0.1,
                0.5,
                0.05,
                Duration.ofMillis(2000),
                Duration.ofMillis(500),
                "ws://localhost:8080/ws",
                10,
                Duration.ofMillis(1000));
    }
}
