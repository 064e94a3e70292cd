package com.sharedsolve.extraction;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * The recovery strategies {@link ResponseExtractor} chains together.
 *
 * <p>The balanced-object finders count braces without looking at string literals, so text
 * with several unrelated brace fragments can yield a wrong slice. Callers parse every
 * candidate and move on when it does not parse.</p>
 */
public final class RecoveryStrategies {

    static final String FENCE = "```";
    static final String LABELED_FENCE = "```json";
    private static final String JSON_LABEL = "json";

    private RecoveryStrategies() {
    }

    /**
     * Interior of the first {@code ```json} block; runs to the end of the text when the block
     * is never closed.
     */
    public static RecoveryStrategy labeledFence() {
        return RecoveryStrategy.of("labeled-fence", text -> {
            int start = text.indexOf(LABELED_FENCE);
            if (start < 0) {
                return Optional.empty();
            }
            String rest = text.substring(start + LABELED_FENCE.length());
            int end = rest.indexOf(FENCE);
            return Optional.of((end < 0 ? rest : rest.substring(0, end)).trim());
        });
    }

    /**
     * First fenced block whose interior (minus an optional {@code json} label) is accepted by
     * {@code parses}.
     */
    public static RecoveryStrategy firstParsableFence(Predicate<String> parses) {
        return RecoveryStrategy.of("parsable-fence", text -> {
            if (!text.contains(FENCE)) {
                return Optional.empty();
            }
            String[] parts = text.split(FENCE, -1);
            for (int i = 1; i < parts.length; i += 2) {
                String block = parts[i].trim();
                if (block.startsWith(JSON_LABEL)) {
                    block = block.substring(JSON_LABEL.length()).trim();
                }
                if (parses.test(block)) {
                    return Optional.of(block);
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Slice from the first {@code {} to the last {@code }}.
     */
    public static RecoveryStrategy outerBraces() {
        return RecoveryStrategy.of("outer-braces", text -> {
            int first = text.indexOf('{');
            int last = text.lastIndexOf('}');
            if (first < 0 || last <= first) {
                return Optional.empty();
            }
            return Optional.of(text.substring(first, last + 1));
        });
    }

    /**
     * Object ending at the last {@code }}, found by scanning backwards for its matching
     * opening brace.
     */
    public static RecoveryStrategy lastBalancedObject() {
        return RecoveryStrategy.of("last-balanced-object", text -> {
            int end = text.lastIndexOf('}');
            if (end < 0) {
                return Optional.empty();
            }
            int depth = 0;
            for (int i = end; i >= 0; i--) {
                char c = text.charAt(i);
                if (c == '}') {
                    depth++;
                } else if (c == '{') {
                    depth--;
                    if (depth == 0) {
                        return Optional.of(text.substring(i, end + 1));
                    }
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Object starting at the first {@code {}, found by scanning forwards for its matching
     * closing brace.
     */
    public static RecoveryStrategy firstBalancedObject() {
        return RecoveryStrategy.of("first-balanced-object", text -> {
            int start = text.indexOf('{');
            if (start < 0) {
                return Optional.empty();
            }
            int depth = 0;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return Optional.of(text.substring(start, i + 1));
                    }
                }
            }
            return Optional.empty();
        });
    }
}
