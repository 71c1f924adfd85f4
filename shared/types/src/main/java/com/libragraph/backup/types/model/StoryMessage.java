package com.libragraph.backup.types.model;

import com.libragraph.backup.types.ThreadUniqueId;

import java.util.Objects;

/**
 * A story post. Stories are ephemeral and never written to a backup.
 */
public record StoryMessage(
        long rowId,
        String uniqueId,
        ThreadUniqueId threadUniqueId,
        long timestamp,
        String authorAddress
) implements Interaction {

    public StoryMessage {
        Objects.requireNonNull(uniqueId, "uniqueId cannot be null");
        Objects.requireNonNull(threadUniqueId, "threadUniqueId cannot be null");
    }

    @Override
    public StoryMessage withRowId(long rowId) {
        return new StoryMessage(rowId, uniqueId, threadUniqueId, timestamp, authorAddress);
    }
}
