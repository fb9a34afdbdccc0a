package com.dev.watchsync.domain;

public enum Role {
    HOST,
    PEER
}
