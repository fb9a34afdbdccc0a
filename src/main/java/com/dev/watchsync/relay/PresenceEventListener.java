package com.dev.watchsync.relay;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
public class PresenceEventListener {

    private final RelayService relayService;

    public PresenceEventListener(RelayService relayService) {
        this.relayService = relayService;
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        relayService.leave(event.getSessionId());
    }
}
