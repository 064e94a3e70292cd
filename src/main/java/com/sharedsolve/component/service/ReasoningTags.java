package com.sharedsolve.component.service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes reasoning blocks such as {@code <think>...</think>} that some models prepend to
 * their answer.
 */
final class ReasoningTags {

    private static final List<String> TAGS = List.of("redacted_reasoning", "think", "reasoning", "thought", "thinking");
    private static final List<Pattern> BLOCKS = TAGS.stream()
            .map(tag -> Pattern.compile("<" + tag + "(?:\\s[^>]*)?>.*?</" + tag + ">",
                    Pattern.DOTALL | Pattern.CASE_INSENSITIVE))
            .toList();
    private static final List<Pattern> SELF_CLOSING = TAGS.stream()
            .map(tag -> Pattern.compile("<" + tag + "(?:\\s[^>]*)?/>", Pattern.CASE_INSENSITIVE))
            .toList();
    private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n\\s*\\n\\s*\\n+");

    private ReasoningTags() {
    }

    static String strip(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String cleaned = text;
        for (Pattern block : BLOCKS) {
            cleaned = block.matcher(cleaned).replaceAll("");
        }
        for (Pattern selfClosing : SELF_CLOSING) {
            cleaned = selfClosing.matcher(cleaned).replaceAll("");
        }
        return EXTRA_BLANK_LINES.matcher(cleaned).replaceAll("\n\n").trim();
    }
}
