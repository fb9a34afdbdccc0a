package com.dev.watchsync.web.dto;

import jakarta.validation.constraints.NotBlank;

public record JoinRequest(
        @NotBlank String participantId
) {
}
