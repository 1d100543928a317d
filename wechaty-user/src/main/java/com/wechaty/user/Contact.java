package com.wechaty.user;

import com.wechaty.puppet.Puppet;
import com.wechaty.puppet.PuppetTypes.ContactPayload;

import java.util.Optional;

/**
 * A chat account: friend, room member, or the bot itself.
 */
public class Contact extends Accessory<ContactPayload> {

    public Contact(Puppet puppet, String id) {
        super(puppet, id);
    }

    @Override
    protected ContactPayload loadPayload() {
        return getPuppet().contactPayload(getId());
    }

    public String name() {
        String name = payload().getName();
        return name != null ? name : "";
    }

    /** Alias the logged-in user gave this contact. */
    public Optional<String> alias() {
        return Optional.ofNullable(payload().getAlias()).filter(a -> !a.isBlank());
    }

    public boolean isFriend() {
        return payload().isFriend();
    }

    /** Whether this contact is the logged-in account. */
    public boolean isSelf() {
        return getPuppet().selfId().map(getId()::equals).orElse(false);
    }
}
