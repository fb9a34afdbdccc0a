package com.dev.watchsync.relay;

import com.dev.watchsync.domain.DiscreteEvent;
import com.dev.watchsync.domain.PlaybackSnapshot;
import com.dev.watchsync.web.dto.BufferingSignal;
import com.dev.watchsync.web.dto.JoinRequest;
import com.dev.watchsync.web.dto.SyncRequest;
import jakarta.validation.Valid;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

@Controller
public class RelayController {

    private final RelayService relayService;

    public RelayController(RelayService relayService) {
        this.relayService = relayService;
    }

    @MessageMapping("/rooms/{code}/join")
    public void join(@DestinationVariable String code,
                     @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                     @Valid @Payload JoinRequest request) {
        relayService.join(code, sessionId, request.participantId());
    }

    @MessageMapping("/rooms/{code}/snapshot")
    public void snapshot(@DestinationVariable String code,
                         @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                         @Valid @Payload PlaybackSnapshot snapshot) {
        relayService.publishSnapshot(code, sessionId, snapshot);
    }

    @MessageMapping("/rooms/{code}/event")
    public void event(@DestinationVariable String code,
                      @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                      @Valid @Payload DiscreteEvent event) {
        relayService.publishEvent(code, sessionId, event);
    }

    @MessageMapping("/rooms/{code}/buffer")
    public void buffer(@DestinationVariable String code,
                       @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                       @Payload BufferingSignal signal) {
        relayService.publishBuffering(code, sessionId, signal);
    }

    @MessageMapping("/rooms/{code}/sync-request")
    public void syncRequest(@DestinationVariable String code,
                            @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                            @Valid @Payload SyncRequest request) {
        relayService.requestSync(code, sessionId, request.participantId());
    }
}
