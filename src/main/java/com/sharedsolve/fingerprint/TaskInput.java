package com.sharedsolve.fingerprint;

import org.springframework.lang.Nullable;

/**
 * One input item of a task: the user's query and, optionally, the artifact it refers to.
 */
public record TaskInput(String query, @Nullable String artifact) {

    public static TaskInput of(String query) {
        return new TaskInput(query, null);
    }
}
