package com.libragraph.backup.archivers.content;

import com.libragraph.backup.archivers.api.ArchiveItemError;
import com.libragraph.backup.frames.ChatItemPayload;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of converting a message's contents to a chat item payload.
 */
public sealed interface ContentsArchiveResult {

    /** Converted, possibly with dropped parts listed in {@code errors}. */
    record Archived(ChatItemPayload payload, List<ArchiveItemError> errors) implements ContentsArchiveResult {
        public Archived {
            Objects.requireNonNull(payload, "payload cannot be null");
            errors = List.copyOf(errors);
        }
    }

    record Failed(List<ArchiveItemError> errors) implements ContentsArchiveResult {
        public Failed {
            errors = List.copyOf(errors);
        }
    }
}
