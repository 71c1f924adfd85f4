package com.libragraph.backup.archivers.api;

import com.libragraph.backup.types.ChatItemId;

import java.util.Objects;

/**
 * An {@link ArchiveFrameError} tagged with the chat item it belongs to.
 */
public record ArchiveItemError(ChatItemId objectId, ArchiveFrameError error) {

    public ArchiveItemError {
        Objects.requireNonNull(objectId, "objectId cannot be null");
        Objects.requireNonNull(error, "error cannot be null");
    }

    public static ArchiveItemError of(ChatItemId objectId, ArchiveFrameError error) {
        return new ArchiveItemError(objectId, error);
    }
}
