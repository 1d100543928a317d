package com.wechaty.user.mention;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Strips "@name" mention tokens from a room message body.
 *
 * <p>
 * Only members listed in the structured mention ids are eligible for removal;
 * "@name" text that the backend did not report as a mention stays. A member
 * with a room alias is matched by the alias only. A token is removed only where
 * it literally occurs and is followed by a space, a four-per-em space
 * (U+2005, inserted by chat clients after a mention) or the end of the text;
 * that one separator goes with it. All tokens are matched in a single pass
 * over the original text, longest first at each position.
 * </p>
 */
public final class MentionTextExtractor {

    private MentionTextExtractor() {
    }

    public static final String MENTION_MARKER = "@";

    private static final String SEPARATOR = "(?: |\\u2005|$)";

    /**
     * Remove the mention tokens of {@code mentionedIds} from {@code text}.
     *
     * @param text         message text
     * @param directory    members of the room the message was sent in
     * @param mentionedIds contact ids the message structurally mentions
     * @return the text without mention tokens, trimmed; the original text when
     *         nothing is mentioned
     */
    public static String extract(String text, MemberDirectory directory,
            Collection<String> mentionedIds) {
        if (text == null || text.isEmpty() || mentionedIds == null || mentionedIds.isEmpty()) {
            return text;
        }

        List<String> tokens = resolveTokens(directory, mentionedIds);
        if (tokens.isEmpty()) {
            return text.strip();
        }
        // one pass, so a removal never creates a token that was not in the text
        String alternation = tokens.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?:" + alternation + ")" + SEPARATOR)
                .matcher(text)
                .replaceAll("")
                .strip();
    }

    /**
     * Mention tokens for the given ids, longest first so that a shorter name
     * never cuts into a longer one that shares its prefix.
     */
    static List<String> resolveTokens(MemberDirectory directory, Collection<String> mentionedIds) {
        List<String> tokens = new ArrayList<>();
        if (directory == null) {
            return tokens;
        }
        for (String id : mentionedIds) {
            Optional<String> mentionName = directory.get(id).flatMap(MemberDirectory.Member::mentionName);
            if (mentionName.isEmpty()) {
                continue;
            }
            String token = MENTION_MARKER + mentionName.get();
            if (!tokens.contains(token)) {
                tokens.add(token);
            }
        }
        tokens.sort(Comparator.comparingInt(String::length).reversed());
        return tokens;
    }
}
