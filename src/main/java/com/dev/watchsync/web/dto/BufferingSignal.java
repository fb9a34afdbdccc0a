package com.dev.watchsync.web.dto;

public record BufferingSignal(
        boolean buffering
) {
}
