package com.dev.watchsync.web.dto;

public record ResyncPrompt(
        String roomCode,
        String requesterId
) {
}
