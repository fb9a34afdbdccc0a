package com.dev.watchsync.relay;

import com.dev.watchsync.domain.DiscreteEvent;
import com.dev.watchsync.domain.PlaybackSnapshot;
import com.dev.watchsync.web.BadRequestException;
import com.dev.watchsync.web.ForbiddenOperationException;
import com.dev.watchsync.web.ResourceNotFoundException;
import com.dev.watchsync.web.dto.BufferingSignal;
import com.dev.watchsync.web.dto.HostChangedNotice;
import com.dev.watchsync.web.dto.ResyncPrompt;
import com.dev.watchsync.web.dto.SyncStateResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
public class RelayService {

    private final RoomPresenceRegistry presence;
    private final SnapshotCache snapshotCache;
    private final SimpMessagingTemplate messagingTemplate;

    public RelayService(RoomPresenceRegistry presence,
                        SnapshotCache snapshotCache,
                        SimpMessagingTemplate messagingTemplate) {
        this.presence = presence;
        this.snapshotCache = snapshotCache;
        this.messagingTemplate = messagingTemplate;
    }

    public HostChangedNotice join(String roomCode, String sessionId, String participantId) {
        RoomPresenceRegistry.JoinResult result = presence.join(roomCode, sessionId, participantId);
        HostChangedNotice notice = new HostChangedNotice(roomCode, result.hostId());
        // everyone learns the host on join, the newcomer included
        messagingTemplate.convertAndSend(RelayDestinations.host(roomCode), notice);
        log.info("[{}] {} joined (host {})", roomCode, participantId, result.hostId());
        return notice;
    }

    public void leave(String sessionId) {
        presence.leave(sessionId).ifPresent(result -> {
            log.info("[{}] {} left", result.roomCode(), result.participantId());
            if (result.roomClosed()) {
                snapshotCache.evict(result.roomCode());
            } else if (result.newHostId() != null) {
                // the cached capture time came from the old host's clock
                snapshotCache.evict(result.roomCode());
                messagingTemplate.convertAndSend(RelayDestinations.host(result.roomCode()),
                        new HostChangedNotice(result.roomCode(), result.newHostId()));
            }
        });
    }

    public void publishSnapshot(String roomCode, String sessionId, PlaybackSnapshot snapshot) {
        verifyHost(roomCode, sessionId);
        if (snapshot == null || !snapshot.isWellFormed()) {
            throw new BadRequestException("Malformed playback snapshot");
        }
        if (!snapshotCache.offer(roomCode, snapshot)) {
            log.debug("[{}] dropping stale snapshot captured at {}", roomCode, snapshot.getCapturedAtEpochMs());
            return;
        }
        messagingTemplate.convertAndSend(RelayDestinations.snapshots(roomCode), snapshot);
    }

    public void publishEvent(String roomCode, String sessionId, DiscreteEvent event) {
        verifyHost(roomCode, sessionId);
        if (event == null || !event.isWellFormed()) {
            throw new BadRequestException("Malformed playback event");
        }
        messagingTemplate.convertAndSend(RelayDestinations.events(roomCode), event);
    }

    public void publishBuffering(String roomCode, String sessionId, BufferingSignal signal) {
        verifyHost(roomCode, sessionId);
        if (signal == null) {
            throw new BadRequestException("Missing buffering signal");
        }
        messagingTemplate.convertAndSend(RelayDestinations.buffering(roomCode), signal);
    }

    public void requestSync(String roomCode, String sessionId, String participantId) {
        RoomPresenceRegistry.Membership member = membership(roomCode, sessionId);
        if (!member.participantId().equals(participantId)) {
            throw new BadRequestException("Sync request names " + participantId + " but came from "
                    + member.participantId());
        }
        snapshotCache.read(roomCode).ifPresent(snapshot -> messagingTemplate.convertAndSend(
                RelayDestinations.directSnapshot(roomCode, member.participantId()), snapshot));
        presence.hostOf(roomCode)
                .filter(hostId -> !hostId.equals(member.participantId()))
                .ifPresent(hostId -> messagingTemplate.convertAndSend(
                        RelayDestinations.resync(roomCode, hostId),
                        new ResyncPrompt(roomCode, member.participantId())));
    }

    public SyncStateResponse getState(String roomCode) {
        if (!presence.exists(roomCode)) {
            throw new ResourceNotFoundException("Room not found");
        }
        return new SyncStateResponse(
                roomCode,
                presence.hostOf(roomCode).orElse(null),
                presence.participantsOf(roomCode),
                snapshotCache.read(roomCode).orElse(null));
    }

    public Optional<RoomPresenceRegistry.Membership> findMembership(String sessionId) {
        return presence.findBySession(sessionId);
    }

    private RoomPresenceRegistry.Membership membership(String roomCode, String sessionId) {
        return presence.findBySession(sessionId)
                .filter(member -> member.roomCode().equals(roomCode))
                .orElseThrow(() -> new ResourceNotFoundException("Not a participant of room " + roomCode));
    }

    private void verifyHost(String roomCode, String sessionId) {
        membership(roomCode, sessionId);
        if (!presence.isHost(roomCode, sessionId)) {
            throw new ForbiddenOperationException("Only the host can publish playback state");
        }
    }
}
