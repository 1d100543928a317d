package com.wechaty.user;

import com.wechaty.puppet.Puppet;
import com.wechaty.puppet.PuppetTypes.RoomInvitationPayload;

/**
 * An invitation for the bot to join a room.
 */
public class RoomInvitation extends Accessory<RoomInvitationPayload> {

    public RoomInvitation(Puppet puppet, String id) {
        super(puppet, id);
    }

    @Override
    protected RoomInvitationPayload loadPayload() {
        return getPuppet().roomInvitationPayload(getId());
    }

    public Contact inviter() {
        return new Contact(getPuppet(), payload().getInviterId());
    }

    public String topic() {
        String topic = payload().getTopic();
        return topic != null ? topic : "";
    }

    public int memberCount() {
        return payload().getMemberCount();
    }
}
