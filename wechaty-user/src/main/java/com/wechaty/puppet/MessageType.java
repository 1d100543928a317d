package com.wechaty.puppet;

/**
 * Message content types understood by the puppet.
 */
public enum MessageType {
    UNKNOWN,
    ATTACHMENT,
    AUDIO,
    CONTACT,
    CHAT_HISTORY,
    EMOTICON,
    IMAGE,
    TEXT,
    LOCATION,
    MINI_PROGRAM,
    GROUP_NOTE,
    TRANSFER,
    RED_ENVELOPE,
    RECALLED,
    URL,
    VIDEO
}
