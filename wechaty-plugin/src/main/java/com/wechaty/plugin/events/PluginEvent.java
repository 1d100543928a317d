package com.wechaty.plugin.events;

import com.wechaty.plugin.WechatyPlugin;
import com.wechaty.puppet.PuppetTypes.EventErrorPayload;
import com.wechaty.puppet.PuppetTypes.EventHeartbeatPayload;
import com.wechaty.puppet.PuppetTypes.EventReadyPayload;
import com.wechaty.puppet.ScanStatus;
import com.wechaty.user.Contact;
import com.wechaty.user.Friendship;
import com.wechaty.user.Message;
import com.wechaty.user.Room;
import com.wechaty.user.RoomInvitation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A validated event, one variant per {@link EventKind}, each carrying exactly
 * the payload its plugin handler takes.
 */
public sealed interface PluginEvent {

    EventKind kind();

    /**
     * Invoke the handler for this event on {@code plugin}.
     */
    void deliverTo(WechatyPlugin plugin) throws Exception;

    // =========================================================================
    // Messages and contacts
    // =========================================================================

    record MessageEvent(Message message) implements PluginEvent {
        public MessageEvent {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public EventKind kind() {
            return EventKind.MESSAGE;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onMessage(message);
        }
    }

    record FriendshipEvent(Friendship friendship) implements PluginEvent {
        public FriendshipEvent {
            Objects.requireNonNull(friendship, "friendship");
        }

        @Override
        public EventKind kind() {
            return EventKind.FRIENDSHIP;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onFriendship(friendship);
        }
    }

    record LoginEvent(Contact contact) implements PluginEvent {
        public LoginEvent {
            Objects.requireNonNull(contact, "contact");
        }

        @Override
        public EventKind kind() {
            return EventKind.LOGIN;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onLogin(contact);
        }
    }

    record LogoutEvent(Contact contact) implements PluginEvent {
        public LogoutEvent {
            Objects.requireNonNull(contact, "contact");
        }

        @Override
        public EventKind kind() {
            return EventKind.LOGOUT;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onLogout(contact);
        }
    }

    // =========================================================================
    // Rooms
    // =========================================================================

    record RoomInviteEvent(RoomInvitation roomInvitation) implements PluginEvent {
        public RoomInviteEvent {
            Objects.requireNonNull(roomInvitation, "roomInvitation");
        }

        @Override
        public EventKind kind() {
            return EventKind.ROOM_INVITE;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onRoomInvite(roomInvitation);
        }
    }

    record RoomJoinEvent(Room room, List<Contact> invitees, Contact inviter, Instant date)
            implements PluginEvent {
        public RoomJoinEvent {
            Objects.requireNonNull(room, "room");
            invitees = List.copyOf(invitees);
            Objects.requireNonNull(inviter, "inviter");
            Objects.requireNonNull(date, "date");
        }

        @Override
        public EventKind kind() {
            return EventKind.ROOM_JOIN;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onRoomJoin(room, invitees, inviter, date);
        }
    }

    record RoomLeaveEvent(Room room, List<Contact> leavers, Contact remover, Instant date)
            implements PluginEvent {
        public RoomLeaveEvent {
            Objects.requireNonNull(room, "room");
            leavers = List.copyOf(leavers);
            Objects.requireNonNull(remover, "remover");
            Objects.requireNonNull(date, "date");
        }

        @Override
        public EventKind kind() {
            return EventKind.ROOM_LEAVE;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onRoomLeave(room, leavers, remover, date);
        }
    }

    record RoomTopicEvent(Room room, String newTopic, String oldTopic, Contact changer, Instant date)
            implements PluginEvent {
        public RoomTopicEvent {
            Objects.requireNonNull(room, "room");
            Objects.requireNonNull(newTopic, "newTopic");
            Objects.requireNonNull(oldTopic, "oldTopic");
            Objects.requireNonNull(changer, "changer");
            Objects.requireNonNull(date, "date");
        }

        @Override
        public EventKind kind() {
            return EventKind.ROOM_TOPIC;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onRoomTopic(room, newTopic, oldTopic, changer, date);
        }
    }

    // =========================================================================
    // Puppet lifecycle
    // =========================================================================

    /**
     * @param data extra data attached to the status, may be null
     */
    record ScanEvent(String qrCode, ScanStatus status, String data) implements PluginEvent {
        public ScanEvent {
            Objects.requireNonNull(qrCode, "qrCode");
            Objects.requireNonNull(status, "status");
        }

        @Override
        public EventKind kind() {
            return EventKind.SCAN;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onScan(qrCode, status, data);
        }
    }

    record ErrorEvent(EventErrorPayload payload) implements PluginEvent {
        public ErrorEvent {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public EventKind kind() {
            return EventKind.ERROR;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onError(payload);
        }
    }

    record HeartbeatEvent(EventHeartbeatPayload payload) implements PluginEvent {
        public HeartbeatEvent {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public EventKind kind() {
            return EventKind.HEARTBEAT;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onHeartbeat(payload);
        }
    }

    record ReadyEvent(EventReadyPayload payload) implements PluginEvent {
        public ReadyEvent {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public EventKind kind() {
            return EventKind.READY;
        }

        @Override
        public void deliverTo(WechatyPlugin plugin) throws Exception {
            plugin.onReady(payload);
        }
    }
}
