package com.dev.watchsync.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class PlaybackSnapshot {
    @PositiveOrZero
    double position;
    boolean playing;
    @Positive
    @Builder.Default
    double rate = 1.0;
    @PositiveOrZero
    long capturedAtEpochMs;
    String contentRef;

    @JsonIgnore
    public boolean isWellFormed() {
        return Double.isFinite(position) && position >= 0
                && Double.isFinite(rate) && rate > 0
                && capturedAtEpochMs >= 0;
    }
}
