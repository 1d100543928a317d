package com.wechaty.plugin.events;

import com.wechaty.plugin.events.PluginEvent.ErrorEvent;
import com.wechaty.plugin.events.PluginEvent.FriendshipEvent;
import com.wechaty.plugin.events.PluginEvent.HeartbeatEvent;
import com.wechaty.plugin.events.PluginEvent.LoginEvent;
import com.wechaty.plugin.events.PluginEvent.LogoutEvent;
import com.wechaty.plugin.events.PluginEvent.MessageEvent;
import com.wechaty.plugin.events.PluginEvent.ReadyEvent;
import com.wechaty.plugin.events.PluginEvent.RoomInviteEvent;
import com.wechaty.plugin.events.PluginEvent.RoomJoinEvent;
import com.wechaty.plugin.events.PluginEvent.RoomLeaveEvent;
import com.wechaty.plugin.events.PluginEvent.RoomTopicEvent;
import com.wechaty.plugin.events.PluginEvent.ScanEvent;
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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts untyped puppet events, a kind name plus positional arguments, into
 * {@link PluginEvent}s, checking arity and argument types per kind.
 */
public final class EventContracts {

    private EventContracts() {
    }

    /**
     * Validate {@code args} against the contract of {@code kind}.
     *
     * @throws EventContractViolationException for an unknown kind, a wrong
     *                                         number of arguments or an argument
     *                                         of the wrong type
     */
    public static PluginEvent parse(String kind, Object... args) {
        Object[] values = args != null ? args : new Object[0];
        EventKind eventKind = EventKind.fromKey(kind)
                .orElseThrow(() -> new EventContractViolationException(kind, "unknown event kind"));

        return switch (eventKind) {
            case MESSAGE -> {
                requireArity(eventKind, values, 1, 1);
                yield new MessageEvent(arg(eventKind, values, 0, Message.class));
            }
            case FRIENDSHIP -> {
                requireArity(eventKind, values, 1, 1);
                yield new FriendshipEvent(arg(eventKind, values, 0, Friendship.class));
            }
            case LOGIN -> {
                requireArity(eventKind, values, 1, 1);
                yield new LoginEvent(arg(eventKind, values, 0, Contact.class));
            }
            case LOGOUT -> {
                requireArity(eventKind, values, 1, 1);
                yield new LogoutEvent(arg(eventKind, values, 0, Contact.class));
            }
            case ROOM_INVITE -> {
                requireArity(eventKind, values, 1, 1);
                yield new RoomInviteEvent(arg(eventKind, values, 0, RoomInvitation.class));
            }
            case ROOM_JOIN -> {
                requireArity(eventKind, values, 4, 4);
                yield new RoomJoinEvent(
                        arg(eventKind, values, 0, Room.class),
                        contacts(eventKind, values, 1),
                        arg(eventKind, values, 2, Contact.class),
                        arg(eventKind, values, 3, Instant.class));
            }
            case ROOM_LEAVE -> {
                requireArity(eventKind, values, 4, 4);
                yield new RoomLeaveEvent(
                        arg(eventKind, values, 0, Room.class),
                        contacts(eventKind, values, 1),
                        arg(eventKind, values, 2, Contact.class),
                        arg(eventKind, values, 3, Instant.class));
            }
            case ROOM_TOPIC -> {
                requireArity(eventKind, values, 5, 5);
                yield new RoomTopicEvent(
                        arg(eventKind, values, 0, Room.class),
                        arg(eventKind, values, 1, String.class),
                        arg(eventKind, values, 2, String.class),
                        arg(eventKind, values, 3, Contact.class),
                        arg(eventKind, values, 4, Instant.class));
            }
            case SCAN -> {
                requireArity(eventKind, values, 2, 3);
                String data = values.length == 3 && values[2] != null
                        ? arg(eventKind, values, 2, String.class)
                        : null;
                yield new ScanEvent(
                        arg(eventKind, values, 0, String.class),
                        scanStatus(eventKind, values, 1),
                        data);
            }
            case ERROR -> {
                requireArity(eventKind, values, 1, 1);
                yield new ErrorEvent(arg(eventKind, values, 0, EventErrorPayload.class));
            }
            case HEARTBEAT -> {
                requireArity(eventKind, values, 1, 1);
                yield new HeartbeatEvent(arg(eventKind, values, 0, EventHeartbeatPayload.class));
            }
            case READY -> {
                requireArity(eventKind, values, 1, 1);
                yield new ReadyEvent(arg(eventKind, values, 0, EventReadyPayload.class));
            }
        };
    }

    // =========================================================================
    // Checks
    // =========================================================================

    private static void requireArity(EventKind kind, Object[] values, int min, int max) {
        if (values.length < min || values.length > max) {
            throw violation(kind, values);
        }
    }

    private static <T> T arg(EventKind kind, Object[] values, int index, Class<T> type) {
        Object value = values[index];
        if (!type.isInstance(value)) {
            throw violation(kind, values);
        }
        return type.cast(value);
    }

    private static List<Contact> contacts(EventKind kind, Object[] values, int index) {
        if (!(values[index] instanceof List<?> list)) {
            throw violation(kind, values);
        }
        List<Contact> contacts = new ArrayList<>(list.size());
        for (Object element : list) {
            if (!(element instanceof Contact contact)) {
                throw violation(kind, values);
            }
            contacts.add(contact);
        }
        return contacts;
    }

    private static ScanStatus scanStatus(EventKind kind, Object[] values, int index) {
        Object value = values[index];
        if (value instanceof ScanStatus status) {
            return status;
        }
        if (value instanceof String text) {
            try {
                return ScanStatus.fromValue(text);
            } catch (IllegalArgumentException e) {
                throw violation(kind, values);
            }
        }
        throw violation(kind, values);
    }

    private static EventContractViolationException violation(EventKind kind, Object[] values) {
        return new EventContractViolationException(kind.key(),
                "expected (" + kind.expectedArgs() + "), got (" + describe(values) + ")");
    }

    static String describe(Object[] values) {
        return Arrays.stream(values)
                .map(value -> value == null ? "null" : value.getClass().getSimpleName())
                .collect(Collectors.joining(", "));
    }
}
