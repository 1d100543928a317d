package com.wechaty.plugin.runtime;

import com.wechaty.puppet.Puppet;
import com.wechaty.user.Contact;
import com.wechaty.user.Message;
import com.wechaty.user.Room;

/**
 * Handle to the host bot that plugins are bound to.
 */
public interface WechatyRuntime {

    /** Name of the bot, used in logs. */
    String name();

    Puppet puppet();

    default Contact contact(String contactId) {
        return new Contact(puppet(), contactId);
    }

    default Room room(String roomId) {
        return new Room(puppet(), roomId);
    }

    default Message message(String messageId) {
        return new Message(puppet(), messageId);
    }
}
