package com.dev.watchsync.web.dto;

public record HostChangedNotice(
        String roomCode,
        String hostId
) {
}
