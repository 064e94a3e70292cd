package com.sharedsolve.extraction;

import java.util.Optional;
import java.util.function.Function;

/**
 * One way of locating a structured-object candidate inside free-form model output.
 * Implementations are pure: the same text always yields the same candidate.
 */
public interface RecoveryStrategy {

    String name();

    Optional<String> candidate(String text);

    static RecoveryStrategy of(String name, Function<String, Optional<String>> finder) {
        return new RecoveryStrategy() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<String> candidate(String text) {
                return text == null ? Optional.empty() : finder.apply(text);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
