package com.sharedsolve.coordination;

import java.util.Locale;

/**
 * How a node takes part in solution sharing. Configured per node, not per request.
 */
public enum NodeRole {
    /** Always generates locally and never touches the shared store. */
    SOLO("normal"),
    /** Generates locally and publishes the result for sibling nodes. */
    PRODUCER("parent"),
    /** Waits for a sibling's published result and generates locally only on timeout. */
    WAITER("child");

    private final String legacyName;

    NodeRole(String legacyName) {
        this.legacyName = legacyName;
    }

    public static NodeRole from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Node role must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (NodeRole role : values()) {
            if (role.name().toLowerCase(Locale.ROOT).equals(normalized) || role.legacyName.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown node role: " + value);
    }
}
