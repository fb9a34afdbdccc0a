package com.dev.watchsync.engine;

import com.dev.watchsync.domain.Role;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
public class RoleController {

    private final SnapshotBroadcaster broadcaster;
    private final AtomicReference<Role> role = new AtomicReference<>();

    public RoleController(SnapshotBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    public synchronized boolean setRole(Role next) {
        Role current = role.get();
        if (current == next) {
            return false;
        }
        if (next == Role.HOST) {
            role.set(next);
            broadcaster.start();
        } else {
            // no snapshot may leave after the switch
            broadcaster.stop();
            role.set(next);
        }
        log.info("Role changed {} -> {}", current, next);
        return true;
    }

    public Optional<Role> getRole() {
        return Optional.ofNullable(role.get());
    }

    public boolean isHost() {
        return role.get() == Role.HOST;
    }
}
