package com.sharedsolve.fingerprint;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Lowercase hex SHA-256 digest identifying the canonical content of a task.
 */
public record TaskFingerprint(String value) {

    private static final Pattern HEX_256 = Pattern.compile("[0-9a-f]{64}");

    public TaskFingerprint {
        Objects.requireNonNull(value, "fingerprint value");
        if (!HEX_256.matcher(value).matches()) {
            throw new IllegalArgumentException("Fingerprint must be 64 lowercase hex characters: " + value);
        }
    }

    public String abbreviated() {
        return value.substring(0, 16) + "...";
    }

    @Override
    public String toString() {
        return value;
    }
}
