package com.dev.watchsync.web.dto;

import jakarta.validation.constraints.NotBlank;

public record SyncRequest(
        @NotBlank String participantId
) {
}
