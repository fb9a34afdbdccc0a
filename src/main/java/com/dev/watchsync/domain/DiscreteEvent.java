package com.dev.watchsync.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DiscreteEvent {
    @NotNull
    DiscreteEventType type;
    Double position;
    String contentRef;

    public static DiscreteEvent play(double position) {
        return DiscreteEvent.builder().type(DiscreteEventType.PLAY).position(position).build();
    }

    public static DiscreteEvent pause(double position) {
        return DiscreteEvent.builder().type(DiscreteEventType.PAUSE).position(position).build();
    }

    public static DiscreteEvent seek(double position) {
        return DiscreteEvent.builder().type(DiscreteEventType.SEEK).position(position).build();
    }

    public static DiscreteEvent sourceChanged(String contentRef) {
        return DiscreteEvent.builder().type(DiscreteEventType.SOURCE_CHANGED).contentRef(contentRef).build();
    }

    @JsonIgnore
    public boolean isWellFormed() {
        if (type == null) {
            return false;
        }
        if (!type.carriesPosition()) {
            return true;
        }
        return position != null && Double.isFinite(position) && position >= 0;
    }
}
