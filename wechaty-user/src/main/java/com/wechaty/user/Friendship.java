package com.wechaty.user;

import com.wechaty.puppet.Puppet;
import com.wechaty.puppet.PuppetTypes.FriendshipPayload;
import com.wechaty.puppet.PuppetTypes.FriendshipType;

/**
 * A friend request or its confirmation.
 */
public class Friendship extends Accessory<FriendshipPayload> {

    public Friendship(Puppet puppet, String id) {
        super(puppet, id);
    }

    @Override
    protected FriendshipPayload loadPayload() {
        return getPuppet().friendshipPayload(getId());
    }

    public Contact contact() {
        return new Contact(getPuppet(), payload().getContactId());
    }

    public String hello() {
        String hello = payload().getHello();
        return hello != null ? hello : "";
    }

    public FriendshipType type() {
        return payload().getType();
    }
}
