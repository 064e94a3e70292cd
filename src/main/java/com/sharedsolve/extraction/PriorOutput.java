package com.sharedsolve.extraction;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Read-only view of an earlier result in the same task chain.
 */
public record PriorOutput(String sourceName, @Nullable String task, @Nullable String reply, @Nullable String artifact) {

    public boolean hasArtifact() {
        return StringUtils.hasText(artifact) && !ComponentResult.NO_UPDATE.equals(artifact);
    }
}
