package com.wechaty.puppet;

import com.wechaty.puppet.PuppetTypes.ContactPayload;
import com.wechaty.puppet.PuppetTypes.FriendshipPayload;
import com.wechaty.puppet.PuppetTypes.MessagePayload;
import com.wechaty.puppet.PuppetTypes.RoomInvitationPayload;
import com.wechaty.puppet.PuppetTypes.RoomMemberPayload;
import com.wechaty.puppet.PuppetTypes.RoomPayload;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory puppet whose payloads are added by the test.
 */
public class FakePuppet implements Puppet {

    private final Map<String, ContactPayload> contacts = new LinkedHashMap<>();
    private final Map<String, RoomPayload> rooms = new LinkedHashMap<>();
    private final Map<String, Map<String, RoomMemberPayload>> roomMembers = new LinkedHashMap<>();
    private final Map<String, MessagePayload> messages = new LinkedHashMap<>();
    private final Map<String, FriendshipPayload> friendships = new LinkedHashMap<>();
    private final Map<String, RoomInvitationPayload> invitations = new LinkedHashMap<>();
    private String selfId;

    public FakePuppet login(String contactId) {
        this.selfId = contactId;
        return this;
    }

    public FakePuppet addContact(ContactPayload payload) {
        contacts.put(payload.getId(), payload);
        return this;
    }

    public FakePuppet addRoom(RoomPayload payload) {
        rooms.put(payload.getId(), payload);
        return this;
    }

    public FakePuppet addRoomMember(String roomId, RoomMemberPayload payload) {
        roomMembers.computeIfAbsent(roomId, k -> new LinkedHashMap<>()).put(payload.getId(), payload);
        return this;
    }

    public FakePuppet addMessage(MessagePayload payload) {
        messages.put(payload.getId(), payload);
        return this;
    }

    public FakePuppet addFriendship(FriendshipPayload payload) {
        friendships.put(payload.getId(), payload);
        return this;
    }

    public FakePuppet addRoomInvitation(RoomInvitationPayload payload) {
        invitations.put(payload.getId(), payload);
        return this;
    }

    @Override
    public Optional<String> selfId() {
        return Optional.ofNullable(selfId);
    }

    @Override
    public ContactPayload contactPayload(String contactId) {
        return require(contacts, contactId, "contact");
    }

    @Override
    public RoomPayload roomPayload(String roomId) {
        return require(rooms, roomId, "room");
    }

    @Override
    public List<String> roomMembers(String roomId) {
        return List.copyOf(roomMembers.getOrDefault(roomId, Map.of()).keySet());
    }

    @Override
    public Optional<RoomMemberPayload> roomMemberPayload(String roomId, String contactId) {
        return Optional.ofNullable(roomMembers.getOrDefault(roomId, Map.of()).get(contactId));
    }

    @Override
    public MessagePayload messagePayload(String messageId) {
        return require(messages, messageId, "message");
    }

    @Override
    public FriendshipPayload friendshipPayload(String friendshipId) {
        return require(friendships, friendshipId, "friendship");
    }

    @Override
    public RoomInvitationPayload roomInvitationPayload(String roomInvitationId) {
        return require(invitations, roomInvitationId, "room invitation");
    }

    private static <T> T require(Map<String, T> store, String id, String kind) {
        T payload = store.get(id);
        if (payload == null) {
            throw new PuppetException(kind + " not found: " + id, id);
        }
        return payload;
    }
}
