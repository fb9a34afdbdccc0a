package com.dev.watchsync.relay;

import com.dev.watchsync.domain.PlaybackSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Slf4j
@Component
public class SnapshotCache {

    private static final Duration TTL = Duration.ofHours(6);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public SnapshotCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    public boolean offer(String roomCode, PlaybackSnapshot snapshot) {
        Optional<PlaybackSnapshot> current = read(roomCode);
        if (current.isPresent() && current.get().getCapturedAtEpochMs() > snapshot.getCapturedAtEpochMs()) {
            return false;
        }
        write(roomCode, snapshot);
        return true;
    }

    public Optional<PlaybackSnapshot> read(String roomCode) {
        String json = redisTemplate.opsForValue().get(snapshotKey(roomCode));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, PlaybackSnapshot.class));
        } catch (JsonProcessingException e) {
            log.warn("[{}] discarding unreadable cached snapshot", roomCode);
            return Optional.empty();
        }
    }

    public void evict(String roomCode) {
        redisTemplate.delete(snapshotKey(roomCode));
    }

    private void write(String roomCode, PlaybackSnapshot snapshot) {
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            redisTemplate.opsForValue().set(snapshotKey(roomCode), json, TTL);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize playback snapshot", e);
        }
    }

    private String snapshotKey(String roomCode) {
        return "sync:snapshot:" + roomCode;
    }
}
