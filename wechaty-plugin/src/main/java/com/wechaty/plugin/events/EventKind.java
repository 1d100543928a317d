package com.wechaty.plugin.events;

import java.util.Optional;

/**
 * Event kinds the puppet can emit to plugins, with the positional arguments
 * each one takes.
 */
public enum EventKind {
    MESSAGE("message", "Message"),
    FRIENDSHIP("friendship", "Friendship"),
    LOGIN("login", "Contact"),
    LOGOUT("logout", "Contact"),
    ROOM_INVITE("room-invite", "RoomInvitation"),
    ROOM_JOIN("room-join", "Room, List<Contact> invitees, Contact inviter, Instant date"),
    ROOM_LEAVE("room-leave", "Room, List<Contact> leavers, Contact remover, Instant date"),
    ROOM_TOPIC("room-topic", "Room, String newTopic, String oldTopic, Contact changer, Instant date"),
    SCAN("scan", "String qrCode, String|ScanStatus status[, String data]"),
    ERROR("error", "EventErrorPayload"),
    HEARTBEAT("heartbeat", "EventHeartbeatPayload"),
    READY("ready", "EventReadyPayload");

    private final String key;
    private final String expectedArgs;

    EventKind(String key, String expectedArgs) {
        this.key = key;
        this.expectedArgs = expectedArgs;
    }

    /** Name the puppet emits the event under, e.g. "room-join". */
    public String key() {
        return key;
    }

    public String expectedArgs() {
        return expectedArgs;
    }

    public static Optional<EventKind> fromKey(String key) {
        for (EventKind kind : values()) {
            if (kind.key.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
