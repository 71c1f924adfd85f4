package com.libragraph.backup.archivers.api;

import com.libragraph.backup.types.ChatItemId;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of restoring one chat item frame.
 */
public sealed interface RestoreFrameResult {

    record Success() implements RestoreFrameResult {}

    record PartialRestore(ChatItemId id, List<RestoreFrameError> errors) implements RestoreFrameResult {
        public PartialRestore {
            Objects.requireNonNull(id, "id cannot be null");
            errors = List.copyOf(errors);
        }
    }

    record Failure(ChatItemId id, List<RestoreFrameError> errors) implements RestoreFrameResult {
        public Failure {
            Objects.requireNonNull(id, "id cannot be null");
            errors = List.copyOf(errors);
        }
    }

    static RestoreFrameResult success() {
        return new Success();
    }

    static RestoreFrameResult failure(ChatItemId id, RestoreFrameError error) {
        return new Failure(id, List.of(error));
    }

    static RestoreFrameResult failure(ChatItemId id, List<RestoreFrameError> errors) {
        return new Failure(id, errors);
    }

    static RestoreFrameResult partial(ChatItemId id, List<RestoreFrameError> errors) {
        return new PartialRestore(id, errors);
    }
}
