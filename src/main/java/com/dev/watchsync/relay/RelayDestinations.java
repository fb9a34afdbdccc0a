package com.dev.watchsync.relay;

public final class RelayDestinations {

    public static final String APP_PREFIX = "/app";

    private RelayDestinations() {
    }

    public static String join(String roomCode) {
        return APP_PREFIX + "/rooms/" + roomCode + "/join";
    }

    public static String publishSnapshot(String roomCode) {
        return APP_PREFIX + "/rooms/" + roomCode + "/snapshot";
    }

    public static String publishEvent(String roomCode) {
        return APP_PREFIX + "/rooms/" + roomCode + "/event";
    }

    public static String publishBuffering(String roomCode) {
        return APP_PREFIX + "/rooms/" + roomCode + "/buffer";
    }

    public static String syncRequest(String roomCode) {
        return APP_PREFIX + "/rooms/" + roomCode + "/sync-request";
    }

    public static String snapshots(String roomCode) {
        return room(roomCode) + "/snapshot";
    }

    public static String events(String roomCode) {
        return room(roomCode) + "/events";
    }

    public static String buffering(String roomCode) {
        return room(roomCode) + "/buffer";
    }

    public static String host(String roomCode) {
        return room(roomCode) + "/host";
    }

    public static String directSnapshot(String roomCode, String participantId) {
        return participant(roomCode, participantId) + "/snapshot";
    }

    public static String resync(String roomCode, String participantId) {
        return participant(roomCode, participantId) + "/resync";
    }

    public static String errors(String roomCode, String participantId) {
        return participant(roomCode, participantId) + "/errors";
    }

    private static String room(String roomCode) {
        return "/topic/rooms/" + roomCode;
    }

    private static String participant(String roomCode, String participantId) {
        return room(roomCode) + "/participants/" + participantId;
    }
}
