package com.wechaty.user;

import com.wechaty.puppet.MessageType;
import com.wechaty.puppet.Puppet;
import com.wechaty.puppet.PuppetTypes.MessagePayload;
import com.wechaty.user.mention.MentionTextExtractor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A message received from a contact or in a room.
 */
public class Message extends Accessory<MessagePayload> {

    public Message(Puppet puppet, String id) {
        super(puppet, id);
    }

    @Override
    protected MessagePayload loadPayload() {
        return getPuppet().messagePayload(getId());
    }

    public String text() {
        String text = payload().getText();
        return text != null ? text : "";
    }

    public MessageType type() {
        MessageType type = payload().getType();
        return type != null ? type : MessageType.UNKNOWN;
    }

    public Optional<Contact> talker() {
        return Optional.ofNullable(payload().getTalkerId())
                .map(talkerId -> new Contact(getPuppet(), talkerId));
    }

    public Optional<Room> room() {
        String roomId = payload().getRoomId();
        if (roomId == null || roomId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Room(getPuppet(), roomId));
    }

    public Optional<Instant> date() {
        return Optional.ofNullable(payload().getTimestamp());
    }

    /** Contact ids structurally mentioned by this message. */
    public List<String> mentionIds() {
        List<String> ids = payload().getMentionIds();
        return ids != null ? List.copyOf(ids) : List.of();
    }

    public List<Contact> mentionList() {
        return mentionIds().stream()
                .map(contactId -> new Contact(getPuppet(), contactId))
                .toList();
    }

    /** Whether the logged-in account is among the mentioned contacts. */
    public boolean mentionSelf() {
        return getPuppet().selfId().map(mentionIds()::contains).orElse(false);
    }

    /**
     * Message text with the mention tokens of the mentioned members removed.
     * Messages outside a room, or without structured mentions, are returned as is.
     */
    public String mentionText() {
        String text = text();
        List<String> mentionIds = mentionIds();
        Optional<Room> room = room();
        if (room.isEmpty() || mentionIds.isEmpty()) {
            return text;
        }
        return MentionTextExtractor.extract(text, room.get().memberDirectory(mentionIds), mentionIds);
    }
}
