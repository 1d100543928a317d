package com.wechaty.puppet;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Payload schemas exchanged with the puppet.
 */
public final class PuppetTypes {

    private PuppetTypes() {
    }

    // =========================================================================
    // Contacts and rooms
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContactPayload {
        private String id;
        private String name;
        /** Alias the logged-in user gave this contact. */
        private String alias;
        private String avatar;
        private boolean friend;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RoomPayload {
        private String id;
        private String topic;
        private String ownerId;
        @Builder.Default
        private List<String> memberIds = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RoomMemberPayload {
        /** Contact id of the member. */
        private String id;
        private String name;
        /** Display name the member set for this room only. */
        private String roomAlias;
        private String inviterId;
    }

    // =========================================================================
    // Messages
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessagePayload {
        private String id;
        @Builder.Default
        private MessageType type = MessageType.TEXT;
        private String text;
        private String talkerId;
        /** Set when the message was sent in a room. */
        private String roomId;
        private String listenerId;
        /** Contact ids the message structurally mentions. */
        @Builder.Default
        private List<String> mentionIds = new ArrayList<>();
        private Instant timestamp;
    }

    // =========================================================================
    // Friendship and invitations
    // =========================================================================

    public enum FriendshipType {
        UNKNOWN,
        CONFIRM,
        RECEIVE,
        VERIFY
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FriendshipPayload {
        private String id;
        private String contactId;
        private String hello;
        @Builder.Default
        private FriendshipType type = FriendshipType.UNKNOWN;
        private Instant timestamp;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RoomInvitationPayload {
        private String id;
        private String inviterId;
        private String topic;
        private int memberCount;
        private Instant timestamp;
    }

    // =========================================================================
    // Lifecycle events
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventErrorPayload {
        private String data;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventHeartbeatPayload {
        private String data;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventReadyPayload {
        private String data;
    }
}
