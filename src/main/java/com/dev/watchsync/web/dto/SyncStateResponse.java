package com.dev.watchsync.web.dto;

import com.dev.watchsync.domain.PlaybackSnapshot;

import java.util.Set;

public record SyncStateResponse(
        String roomCode,
        String hostId,
        Set<String> participants,
        PlaybackSnapshot snapshot
) {
}
