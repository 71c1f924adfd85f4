package com.libragraph.backup.archivers.content;

import com.libragraph.backup.types.model.MessageBody;

import java.util.Objects;

/**
 * Outcome of converting a chat item payload back to local message contents.
 */
public sealed interface ContentsRestoreResult {

    record Restored(MessageBody body, boolean remotelyDeleted) implements ContentsRestoreResult {
        public Restored {
            Objects.requireNonNull(body, "body cannot be null");
        }
    }

    /** The payload is not message content. */
    record Invalid(String reason) implements ContentsRestoreResult {}
}
