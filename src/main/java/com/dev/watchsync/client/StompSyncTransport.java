package com.dev.watchsync.client;

import com.dev.watchsync.config.SyncProperties;
import com.dev.watchsync.domain.DiscreteEvent;
import com.dev.watchsync.domain.PlaybackSnapshot;
import com.dev.watchsync.engine.SyncSession;
import com.dev.watchsync.engine.SyncTransport;
import com.dev.watchsync.relay.RelayDestinations;
import com.dev.watchsync.web.dto.BufferingSignal;
import com.dev.watchsync.web.dto.HostChangedNotice;
import com.dev.watchsync.web.dto.JoinRequest;
import com.dev.watchsync.web.dto.ResyncPrompt;
import com.dev.watchsync.web.dto.SyncRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Connects a {@link SyncSession} to the relay over STOMP. Inbound frames are handed to the session, which moves
 * them onto its own thread; outbound sends are dropped while disconnected. A lost connection is retried a bounded
 * number of times, and every successful connect rejoins the room and asks for a resync.
 */
@Slf4j
public class StompSyncTransport extends StompSessionHandlerAdapter implements SyncTransport {

    private final WebSocketStompClient stompClient;
    private final TaskScheduler reconnectScheduler;
    private final String relayUrl;
    private final int maxReconnectAttempts;
    private final Duration reconnectDelay;
    private final String roomCode;
    private final String participantId;

    private volatile SyncSession session;
    private volatile StompSession stompSession;
    private volatile boolean closed;
    private int reconnectAttempts;
    private ScheduledFuture<?> pendingReconnect;

    public StompSyncTransport(WebSocketStompClient stompClient,
                              TaskScheduler reconnectScheduler,
                              SyncProperties properties,
                              String roomCode,
                              String participantId) {
        this.stompClient = stompClient;
        this.reconnectScheduler = reconnectScheduler;
        this.relayUrl = properties.relayUrl();
        this.maxReconnectAttempts = properties.reconnectAttempts();
        this.reconnectDelay = properties.reconnectDelay();
        this.roomCode = roomCode;
        this.participantId = participantId;
    }

    public CompletableFuture<StompSession> connect(SyncSession session) {
        this.session = session;
        return stompClient.connectAsync(relayUrl, this);
    }

    @Override
    public void afterConnected(StompSession stompSession, StompHeaders connectedHeaders) {
        this.stompSession = stompSession;
        synchronized (this) {
            reconnectAttempts = 0;
        }
        SyncSession target = session;
        subscribe(stompSession, RelayDestinations.host(roomCode), HostChangedNotice.class,
                notice -> target.onHostChanged(notice.hostId()));
        subscribe(stompSession, RelayDestinations.snapshots(roomCode), PlaybackSnapshot.class, target::onSnapshot);
        subscribe(stompSession, RelayDestinations.events(roomCode), DiscreteEvent.class, target::onDiscreteEvent);
        subscribe(stompSession, RelayDestinations.buffering(roomCode), BufferingSignal.class,
                signal -> target.onBuffering(signal.buffering()));
        subscribe(stompSession, RelayDestinations.directSnapshot(roomCode, participantId), PlaybackSnapshot.class,
                target::onSnapshot);
        subscribe(stompSession, RelayDestinations.resync(roomCode, participantId), ResyncPrompt.class,
                prompt -> target.onResyncRequested());
        subscribe(stompSession, RelayDestinations.errors(roomCode, participantId), Map.class,
                error -> log.warn("[{}] relay rejected a message: {}", roomCode, error.get("message")));

        send(RelayDestinations.join(roomCode), new JoinRequest(participantId));
        // a fresh connection knows nothing: late join or reconnect alike
        target.requestSync();
        log.info("[{}] connected to relay as {}", roomCode, participantId);
    }

    @Override
    public void handleException(StompSession stompSession, StompCommand command, StompHeaders headers,
                                byte[] payload, Throwable exception) {
        log.warn("[{}] failed to handle {} frame", roomCode, command, exception);
    }

    @Override
    public void handleTransportError(StompSession stompSession, Throwable exception) {
        log.warn("[{}] relay transport error: {}", roomCode, exception.getMessage());
        if (stompSession != null && stompSession.isConnected()) {
            return;
        }
        if (this.stompSession == stompSession) {
            this.stompSession = null;
        }
        scheduleReconnect();
    }

    @Override
    public void publishSnapshot(PlaybackSnapshot snapshot) {
        send(RelayDestinations.publishSnapshot(roomCode), snapshot);
    }

    @Override
    public void publishEvent(DiscreteEvent event) {
        send(RelayDestinations.publishEvent(roomCode), event);
    }

    @Override
    public void publishBuffering(boolean buffering) {
        send(RelayDestinations.publishBuffering(roomCode), new BufferingSignal(buffering));
    }

    @Override
    public void requestSync() {
        send(RelayDestinations.syncRequest(roomCode), new SyncRequest(participantId));
    }

    @Override
    public void close() {
        closed = true;
        synchronized (this) {
            if (pendingReconnect != null) {
                pendingReconnect.cancel(false);
                pendingReconnect = null;
            }
        }
        StompSession current = stompSession;
        stompSession = null;
        if (current != null && current.isConnected()) {
            current.disconnect();
        }
    }

    public boolean isConnected() {
        StompSession current = stompSession;
        return current != null && current.isConnected();
    }

    private synchronized void scheduleReconnect() {
        if (closed || session == null || pendingReconnect != null) {
            return;
        }
        if (reconnectAttempts >= maxReconnectAttempts) {
            log.error("[{}] giving up on relay at {} after {} attempts", roomCode, relayUrl, reconnectAttempts);
            return;
        }
        reconnectAttempts++;
        pendingReconnect = reconnectScheduler.schedule(this::reconnect,
                reconnectScheduler.getClock().instant().plus(reconnectDelay));
    }

    private void reconnect() {
        synchronized (this) {
            pendingReconnect = null;
            if (closed) {
                return;
            }
            log.info("[{}] reconnecting to relay, attempt {}/{}", roomCode, reconnectAttempts, maxReconnectAttempts);
        }
        try {
            stompClient.connectAsync(relayUrl, this);
        } catch (RuntimeException e) {
            log.warn("[{}] reconnect failed: {}", roomCode, e.getMessage());
            scheduleReconnect();
        }
    }

    private void send(String destination, Object payload) {
        StompSession current = stompSession;
        if (current == null || !current.isConnected()) {
            log.debug("[{}] not connected, dropping message for {}", roomCode, destination);
            return;
        }
        try {
            current.send(destination, payload);
        } catch (RuntimeException e) {
            log.warn("[{}] send to {} failed: {}", roomCode, destination, e.getMessage());
        }
    }

    private <T> void subscribe(StompSession stompSession, String destination, Class<T> type, Consumer<T> consumer) {
        stompSession.subscribe(destination, new StompFrameHandler() {
            @Override
            public Type getPayloadType(StompHeaders headers) {
                return type;
            }

            @Override
            public void handleFrame(StompHeaders headers, Object payload) {
                consumer.accept(type.cast(payload));
            }
        });
    }
}
