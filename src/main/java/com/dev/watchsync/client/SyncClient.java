package com.dev.watchsync.client;

import com.dev.watchsync.config.SyncProperties;
import com.dev.watchsync.engine.LocalPlayer;
import com.dev.watchsync.engine.SyncSession;
import com.dev.watchsync.engine.SyncSessionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.WebSocketStompClient;

@Slf4j
@Component
public class SyncClient {

    private final SyncSessionFactory sessionFactory;
    private final WebSocketStompClient stompClient;
    private final TaskScheduler reconnectScheduler;
    private final SyncProperties properties;

    public SyncClient(SyncSessionFactory sessionFactory,
                      WebSocketStompClient stompClient,
                      @Qualifier(StompClientConfig.RECONNECT_SCHEDULER) TaskScheduler reconnectScheduler,
                      SyncProperties properties) {
        this.sessionFactory = sessionFactory;
        this.stompClient = stompClient;
        this.reconnectScheduler = reconnectScheduler;
        this.properties = properties;
    }

    public SyncSession join(String roomCode, String participantId, LocalPlayer player) {
        StompSyncTransport transport = new StompSyncTransport(stompClient, reconnectScheduler, properties, roomCode,
                participantId);
        SyncSession session = sessionFactory.open(roomCode, participantId, transport);
        session.attach(player);
        transport.connect(session).whenComplete((stompSession, error) -> {
            if (error != null) {
                log.warn("[{}] could not reach relay at {}: {}", roomCode, properties.relayUrl(), error.getMessage());
            }
        });
        return session;
    }
}
