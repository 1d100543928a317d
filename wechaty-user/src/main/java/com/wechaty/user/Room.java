package com.wechaty.user;

import com.wechaty.puppet.Puppet;
import com.wechaty.puppet.PuppetException;
import com.wechaty.puppet.PuppetTypes.ContactPayload;
import com.wechaty.puppet.PuppetTypes.RoomMemberPayload;
import com.wechaty.puppet.PuppetTypes.RoomPayload;
import com.wechaty.user.mention.MemberDirectory;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A group chat.
 */
@Slf4j
public class Room extends Accessory<RoomPayload> {

    public Room(Puppet puppet, String id) {
        super(puppet, id);
    }

    @Override
    protected RoomPayload loadPayload() {
        return getPuppet().roomPayload(getId());
    }

    public String topic() {
        String topic = payload().getTopic();
        return topic != null ? topic : "";
    }

    public Optional<Contact> owner() {
        return Optional.ofNullable(payload().getOwnerId())
                .map(ownerId -> new Contact(getPuppet(), ownerId));
    }

    public List<Contact> members() {
        return getPuppet().roomMembers(getId()).stream()
                .map(memberId -> new Contact(getPuppet(), memberId))
                .toList();
    }

    /**
     * Display name the member set for this room, if any.
     */
    public Optional<String> alias(Contact member) {
        return getPuppet().roomMemberPayload(getId(), member.getId())
                .map(RoomMemberPayload::getRoomAlias)
                .filter(alias -> !alias.isBlank());
    }

    /**
     * Snapshot of the room's members with their names and room aliases.
     */
    public MemberDirectory memberDirectory() {
        return memberDirectory(getPuppet().roomMembers(getId()));
    }

    /**
     * Directory of the given members only. A member whose payloads cannot be
     * loaded is logged and left out.
     */
    public MemberDirectory memberDirectory(Collection<String> memberIds) {
        MemberDirectory directory = new MemberDirectory();
        for (String memberId : memberIds) {
            try {
                Optional<RoomMemberPayload> member = getPuppet().roomMemberPayload(getId(), memberId);
                ContactPayload contact = getPuppet().contactPayload(memberId);
                String name = contact != null && contact.getName() != null
                        ? contact.getName()
                        : member.map(RoomMemberPayload::getName).orElse(null);
                directory.put(memberId, name, member.map(RoomMemberPayload::getRoomAlias).orElse(null));
            } catch (PuppetException e) {
                log.warn("room <{}>: skipping member <{}>: {}", getId(), memberId, e.getMessage());
            }
        }
        return directory;
    }
}
