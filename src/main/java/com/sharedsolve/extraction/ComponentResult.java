package com.sharedsolve.extraction;

import org.springframework.lang.Nullable;

/**
 * Structured outcome of a task: the conversational reply and the working artifact.
 *
 * <p>The artifact is either new content, an artifact carried forward from an earlier output,
 * or {@link #NO_UPDATE}.</p>
 */
public record ComponentResult(String reply, String artifact) {

    public static final String NO_UPDATE = "no update";

    public ComponentResult(@Nullable String reply, @Nullable String artifact) {
        this.reply = reply == null ? "" : reply;
        this.artifact = artifact == null ? NO_UPDATE : artifact;
    }

    public static ComponentResult replyOnly(String reply) {
        return new ComponentResult(reply, NO_UPDATE);
    }

    public boolean isNoUpdate() {
        return NO_UPDATE.equals(artifact);
    }

    public ComponentResult withArtifact(String newArtifact) {
        return new ComponentResult(reply, newArtifact);
    }
}
