package com.wechaty.user.mention;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Room members keyed by contact id, with their display name and optional
 * room alias. Built per room by the caller; the extractor never caches it.
 */
public class MemberDirectory {

    /**
     * One room member.
     *
     * @param id        contact id
     * @param name      display name, may be null
     * @param roomAlias room-specific display name, may be null
     */
    public record Member(String id, String name, String roomAlias) {

        /**
         * The name a mention of this member shows: the room alias when set,
         * otherwise the display name. Empty when neither is usable.
         */
        public Optional<String> mentionName() {
            if (roomAlias != null && !roomAlias.isBlank()) {
                return Optional.of(roomAlias);
            }
            if (name != null && !name.isBlank()) {
                return Optional.of(name);
            }
            return Optional.empty();
        }
    }

    private final Map<String, Member> members = new LinkedHashMap<>();

    public MemberDirectory put(String id, String name, String roomAlias) {
        members.put(id, new Member(id, name, roomAlias));
        return this;
    }

    public MemberDirectory put(String id, String name) {
        return put(id, name, null);
    }

    public Optional<Member> get(String id) {
        return Optional.ofNullable(members.get(id));
    }

    public Map<String, Member> asMap() {
        return Collections.unmodifiableMap(members);
    }

    public int size() {
        return members.size();
    }
}
