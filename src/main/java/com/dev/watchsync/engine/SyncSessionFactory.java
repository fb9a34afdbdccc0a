package com.dev.watchsync.engine;

import com.dev.watchsync.config.SyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
public class SyncSessionFactory {

    private final SyncProperties properties;
    private final Clock clock;

    public SyncSessionFactory(SyncProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public SyncSession open(String roomCode, String participantId, SyncTransport transport) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setClock(clock);
        scheduler.setThreadNamePrefix("sync-" + roomCode + "-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.warn("[{}] sync task failed", roomCode, t));
        scheduler.initialize();

        SyncEngine engine = new SyncEngine(participantId, properties, clock, scheduler, transport);
        log.info("[{}] sync session opened for {}", roomCode, participantId);
        return new SyncSession(roomCode, engine, scheduler, transport);
    }
}
