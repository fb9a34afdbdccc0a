package com.dev.watchsync.client;

import com.dev.watchsync.config.SyncProperties;
import com.dev.watchsync.domain.DiscreteEvent;
import com.dev.watchsync.domain.PlaybackSnapshot;
import com.dev.watchsync.engine.SyncSession;
import com.dev.watchsync.relay.RelayDestinations;
import com.dev.watchsync.support.ManualTaskScheduler;
import com.dev.watchsync.support.MutableClock;
import com.dev.watchsync.web.dto.BufferingSignal;
import com.dev.watchsync.web.dto.HostChangedNotice;
import com.dev.watchsync.web.dto.JoinRequest;
import com.dev.watchsync.web.dto.ResyncPrompt;
import com.dev.watchsync.web.dto.SyncRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.messaging.simp.stomp.ConnectionLostException;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StompSyncTransportTest {

    private static final String ROOM = "ROOM01";
    private static final String URL = "ws://relay.test/ws";
    private static final SyncProperties PROPERTIES = new SyncProperties(
            Duration.ofMillis(1500), 0.1, 0.5, 0.05, Duration.ofMillis(2000), Duration.ofMillis(500),
            URL, 3, Duration.ofMillis(1000));

    private final WebSocketStompClient stompClient = mock(WebSocketStompClient.class);
    private final StompSession stompSession = mock(StompSession.class);
    private final SyncSession session = mock(SyncSession.class);
    private final MutableClock clock = new MutableClock(0L);
    private final ManualTaskScheduler scheduler = new ManualTaskScheduler(clock);
    private StompSyncTransport transport;

    @BeforeEach
    void setUp() {
        transport = new StompSyncTransport(stompClient, scheduler, PROPERTIES, ROOM, "bob");
        when(stompClient.connectAsync(URL, transport)).thenReturn(new CompletableFuture<>());
        when(stompSession.isConnected()).thenReturn(true);
    }

    @Test
    void connectsThroughStompClient() {
        transport.connect(session);

        verify(stompClient).connectAsync(URL, transport);
        assertThat(transport.isConnected()).isFalse();
    }

    @Test
    void subscribesJoinsAndRequestsSyncOnConnect() {
        transport.connect(session);
        transport.afterConnected(stompSession, new StompHeaders());

        verify(stompSession).subscribe(eq(RelayDestinations.host(ROOM)), any(StompFrameHandler.class));
        verify(stompSession).subscribe(eq(RelayDestinations.snapshots(ROOM)), any(StompFrameHandler.class));
        verify(stompSession).subscribe(eq(RelayDestinations.events(ROOM)), any(StompFrameHandler.class));
        verify(stompSession).subscribe(eq(RelayDestinations.buffering(ROOM)), any(StompFrameHandler.class));
        verify(stompSession).subscribe(eq(RelayDestinations.directSnapshot(ROOM, "bob")), any(StompFrameHandler.class));
        verify(stompSession).subscribe(eq(RelayDestinations.resync(ROOM, "bob")), any(StompFrameHandler.class));
        verify(stompSession).subscribe(eq(RelayDestinations.errors(ROOM, "bob")), any(StompFrameHandler.class));

        InOrder order = inOrder(stompSession, session);
        order.verify(stompSession).send(RelayDestinations.join(ROOM), new JoinRequest("bob"));
        order.verify(session).requestSync();
        assertThat(transport.isConnected()).isTrue();
    }

    @Test
    void framesAreHandedToTheSession() {
        transport.connect(session);
        transport.afterConnected(stompSession, new StompHeaders());
        PlaybackSnapshot snapshot = PlaybackSnapshot.builder().position(4.0).capturedAtEpochMs(100L).build();
        DiscreteEvent event = DiscreteEvent.pause(4.0);

        handlerFor(RelayDestinations.snapshots(ROOM)).handleFrame(new StompHeaders(), snapshot);
        handlerFor(RelayDestinations.directSnapshot(ROOM, "bob")).handleFrame(new StompHeaders(), snapshot);
        handlerFor(RelayDestinations.events(ROOM)).handleFrame(new StompHeaders(), event);
        handlerFor(RelayDestinations.host(ROOM)).handleFrame(new StompHeaders(), new HostChangedNotice(ROOM, "alice"));
        handlerFor(RelayDestinations.resync(ROOM, "bob")).handleFrame(new StompHeaders(), new ResyncPrompt(ROOM, "carol"));

        verify(session, times(2)).onSnapshot(snapshot);
        verify(session).onDiscreteEvent(event);
        verify(session).onHostChanged("alice");
        verify(session).onResyncRequested();

        handlerFor(RelayDestinations.buffering(ROOM)).handleFrame(new StompHeaders(), new BufferingSignal(true));
        verify(session).onBuffering(true);
    }

    @Test
    void payloadTypesMatchDestinations() {
        transport.connect(session);
        transport.afterConnected(stompSession, new StompHeaders());

        assertThat(handlerFor(RelayDestinations.snapshots(ROOM)).getPayloadType(new StompHeaders()))
                .isEqualTo(PlaybackSnapshot.class);
        assertThat(handlerFor(RelayDestinations.events(ROOM)).getPayloadType(new StompHeaders()))
                .isEqualTo(DiscreteEvent.class);
        assertThat(handlerFor(RelayDestinations.host(ROOM)).getPayloadType(new StompHeaders()))
                .isEqualTo(HostChangedNotice.class);
    }

    @Test
    void publishesToAppDestinations() {
        transport.connect(session);
        transport.afterConnected(stompSession, new StompHeaders());
        PlaybackSnapshot snapshot = PlaybackSnapshot.builder().position(4.0).capturedAtEpochMs(100L).build();
        DiscreteEvent event = DiscreteEvent.seek(80.0);

        transport.publishSnapshot(snapshot);
        transport.publishEvent(event);
        transport.publishBuffering(true);
        transport.requestSync();

        verify(stompSession).send(RelayDestinations.publishSnapshot(ROOM), snapshot);
        verify(stompSession).send(RelayDestinations.publishBuffering(ROOM), new BufferingSignal(true));
        verify(stompSession).send(RelayDestinations.publishEvent(ROOM), event);
        verify(stompSession).send(RelayDestinations.syncRequest(ROOM), new SyncRequest("bob"));
    }

    @Test
    void dropsSendsWhileDisconnected() {
        transport.publishEvent(DiscreteEvent.play(1.0));

        transport.connect(session);
        transport.afterConnected(stompSession, new StompHeaders());
        when(stompSession.isConnected()).thenReturn(false);
        transport.publishEvent(DiscreteEvent.play(2.0));

        verify(stompSession, never()).send(eq(RelayDestinations.publishEvent(ROOM)), any());
    }

    @Test
    void failedSendDoesNotPropagate() {
        transport.connect(session);
        transport.afterConnected(stompSession, new StompHeaders());
        doThrow(new IllegalStateException("closed")).when(stompSession).send(anyString(), any());

        transport.requestSync();

        verify(stompSession).send(RelayDestinations.syncRequest(ROOM), new SyncRequest("bob"));
    }

    @Test
    void closeDisconnects() {
        transport.connect(session);
        transport.afterConnected(stompSession, new StompHeaders());

        transport.close();

        verify(stompSession).disconnect();
        assertThat(transport.isConnected()).isFalse();
    }

    @Test
    void lostConnectionIsReestablishedAndRejoins() {
        StompSession second = mock(StompSession.class);
        when(second.isConnected()).thenReturn(true);
        transport.connect(session);
        transport.afterConnected(stompSession, new StompHeaders());

        when(stompSession.isConnected()).thenReturn(false);
        transport.handleTransportError(stompSession, new ConnectionLostException("closed"));
        assertThat(transport.isConnected()).isFalse();

        scheduler.advance(Duration.ofMillis(999));
        verify(stompClient, times(1)).connectAsync(URL, transport);
        scheduler.advance(Duration.ofMillis(1));
        verify(stompClient, times(2)).connectAsync(URL, transport);

        transport.afterConnected(second, new StompHeaders());

        verify(second).send(RelayDestinations.join(ROOM), new JoinRequest("bob"));
        verify(second).subscribe(eq(RelayDestinations.snapshots(ROOM)), any(StompFrameHandler.class));
        verify(session, times(2)).requestSync();
        assertThat(transport.isConnected()).isTrue();
    }

    @Test
    void reconnectGivesUpAfterConfiguredAttempts() {
        transport.connect(session);

        for (int failure = 0; failure < 6; failure++) {
            transport.handleTransportError(null, new IllegalStateException("refused"));
            scheduler.advance(Duration.ofMillis(1000));
        }

        // initial connect plus three retries
        verify(stompClient, times(4)).connectAsync(URL, transport);
        assertThat(scheduler.pendingTasks()).isZero();
    }

    @Test
    void successfulConnectResetsRetryBudget() {
        transport.connect(session);
        for (int failure = 0; failure < 3; failure++) {
            transport.handleTransportError(null, new IllegalStateException("refused"));
            scheduler.advance(Duration.ofMillis(1000));
        }
        transport.afterConnected(stompSession, new StompHeaders());

        when(stompSession.isConnected()).thenReturn(false);
        transport.handleTransportError(stompSession, new ConnectionLostException("closed"));
        scheduler.advance(Duration.ofMillis(1000));

        verify(stompClient, times(5)).connectAsync(URL, transport);
    }

    @Test
    void errorOnLiveConnectionDoesNotReconnect() {
        transport.connect(session);
        transport.afterConnected(stompSession, new StompHeaders());

        transport.handleTransportError(stompSession, new IllegalStateException("glitch"));
        scheduler.advance(Duration.ofMillis(5000));

        verify(stompClient, times(1)).connectAsync(URL, transport);
    }

    @Test
    void closeStopsReconnecting() {
        transport.connect(session);
        transport.handleTransportError(null, new IllegalStateException("refused"));

        transport.close();
        scheduler.advance(Duration.ofMillis(5000));

        verify(stompClient, times(1)).connectAsync(URL, transport);
        assertThat(scheduler.pendingTasks()).isZero();
    }

    private StompFrameHandler handlerFor(String destination) {
        ArgumentCaptor<StompFrameHandler> captor = ArgumentCaptor.forClass(StompFrameHandler.class);
        verify(stompSession).subscribe(eq(destination), captor.capture());
        return captor.getValue();
    }
}
