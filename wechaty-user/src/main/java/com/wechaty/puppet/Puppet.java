package com.wechaty.puppet;

import com.wechaty.puppet.PuppetTypes.ContactPayload;
import com.wechaty.puppet.PuppetTypes.FriendshipPayload;
import com.wechaty.puppet.PuppetTypes.MessagePayload;
import com.wechaty.puppet.PuppetTypes.RoomInvitationPayload;
import com.wechaty.puppet.PuppetTypes.RoomMemberPayload;
import com.wechaty.puppet.PuppetTypes.RoomPayload;

import java.util.List;
import java.util.Optional;

/**
 * Chat backend transport. Supplies raw payloads for the user objects; the
 * events it produces are fed to the plugin manager by the host.
 *
 * <p>
 * Lookups for unknown ids throw {@link PuppetException}, except
 * {@link #roomMemberPayload} which reports a non-member as empty.
 * </p>
 */
public interface Puppet {

    /** Contact id of the logged-in account, if logged in. */
    Optional<String> selfId();

    ContactPayload contactPayload(String contactId);

    RoomPayload roomPayload(String roomId);

    /** Contact ids of the room's members. */
    List<String> roomMembers(String roomId);

    Optional<RoomMemberPayload> roomMemberPayload(String roomId, String contactId);

    MessagePayload messagePayload(String messageId);

    FriendshipPayload friendshipPayload(String friendshipId);

    RoomInvitationPayload roomInvitationPayload(String roomInvitationId);
}
