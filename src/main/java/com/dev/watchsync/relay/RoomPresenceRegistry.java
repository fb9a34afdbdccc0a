package com.dev.watchsync.relay;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Slf4j
@Component
public class RoomPresenceRegistry {

    private final ConcurrentMap<String, ActiveRoom> rooms = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> sessionToRoom = new ConcurrentHashMap<>();

    public record Membership(String roomCode, String participantId) {
    }

    public record JoinResult(String hostId, boolean hostChanged) {
    }

    public record LeaveResult(String roomCode, String participantId, boolean wasHost, String newHostId,
                              boolean roomClosed) {
    }

    public JoinResult join(String roomCode, String sessionId, String participantId) {
        String previousRoom = sessionToRoom.get(sessionId);
        if (previousRoom != null && !previousRoom.equals(roomCode)) {
            leave(sessionId);
        }
        while (true) {
            ActiveRoom room = rooms.computeIfAbsent(roomCode, ActiveRoom::new);
            synchronized (room) {
                if (room.closed) {
                    // lost a race with the last participant leaving; retry on a fresh room
                    continue;
                }
                room.participants.put(sessionId, participantId);
                sessionToRoom.put(sessionId, roomCode);
                boolean hostChanged = false;
                if (room.hostId == null) {
                    room.hostId = participantId;
                    hostChanged = true;
                    log.info("[{}] {} hosts the room", roomCode, participantId);
                }
                return new JoinResult(room.hostId, hostChanged);
            }
        }
    }

    public Optional<LeaveResult> leave(String sessionId) {
        String roomCode = sessionToRoom.remove(sessionId);
        if (roomCode == null) {
            return Optional.empty();
        }
        ActiveRoom room = rooms.get(roomCode);
        if (room == null) {
            return Optional.empty();
        }
        synchronized (room) {
            String participantId = room.participants.remove(sessionId);
            if (participantId == null) {
                return Optional.empty();
            }
            boolean stillPresent = room.participants.containsValue(participantId);
            boolean wasHost = participantId.equals(room.hostId) && !stillPresent;
            if (room.participants.isEmpty()) {
                room.closed = true;
                rooms.remove(roomCode, room);
                log.info("[{}] room closed", roomCode);
                return Optional.of(new LeaveResult(roomCode, participantId, wasHost, null, true));
            }
            String newHostId = null;
            if (wasHost) {
                newHostId = room.participants.values().iterator().next();
                room.hostId = newHostId;
                log.info("[{}] host {} left, {} promoted", roomCode, participantId, newHostId);
            }
            return Optional.of(new LeaveResult(roomCode, participantId, wasHost, newHostId, false));
        }
    }

    public Optional<Membership> findBySession(String sessionId) {
        String roomCode = sessionToRoom.get(sessionId);
        if (roomCode == null) {
            return Optional.empty();
        }
        ActiveRoom room = rooms.get(roomCode);
        if (room == null) {
            return Optional.empty();
        }
        synchronized (room) {
            return Optional.ofNullable(room.participants.get(sessionId))
                    .map(participantId -> new Membership(roomCode, participantId));
        }
    }

    public Optional<String> hostOf(String roomCode) {
        ActiveRoom room = rooms.get(roomCode);
        if (room == null) {
            return Optional.empty();
        }
        synchronized (room) {
            return Optional.ofNullable(room.hostId);
        }
    }

    public boolean isHost(String roomCode, String sessionId) {
        ActiveRoom room = rooms.get(roomCode);
        if (room == null) {
            return false;
        }
        synchronized (room) {
            String participantId = room.participants.get(sessionId);
            return participantId != null && participantId.equals(room.hostId);
        }
    }

    public Set<String> participantsOf(String roomCode) {
        ActiveRoom room = rooms.get(roomCode);
        if (room == null) {
            return Set.of();
        }
        synchronized (room) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(room.participants.values()));
        }
    }

    public boolean exists(String roomCode) {
        return rooms.containsKey(roomCode);
    }

    private static final class ActiveRoom {
        private final String code;
        // session id -> participant id, in join order
        private final Map<String, String> participants = new LinkedHashMap<>();
        private String hostId;
        private boolean closed;

        private ActiveRoom(String code) {
            this.code = code;
        }

        @Override
        public String toString() {
            return "ActiveRoom[" + code + "]";
        }
    }
}
