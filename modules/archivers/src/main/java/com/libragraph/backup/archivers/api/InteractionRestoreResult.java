package com.libragraph.backup.archivers.api;

import java.util.List;

/**
 * Outcome of restoring one chat item with a variant.
 */
public sealed interface InteractionRestoreResult {

    record Success() implements InteractionRestoreResult {}

    /** The item was inserted but some parts of it were dropped. */
    record PartialRestore(List<RestoreFrameError> errors) implements InteractionRestoreResult {
        public PartialRestore {
            errors = List.copyOf(errors);
        }
    }

    /** Nothing was inserted. */
    record MessageFailure(List<RestoreFrameError> errors) implements InteractionRestoreResult {
        public MessageFailure {
            errors = List.copyOf(errors);
        }
    }

    static InteractionRestoreResult success() {
        return new Success();
    }

    static InteractionRestoreResult successOrPartial(List<RestoreFrameError> errors) {
        return errors.isEmpty() ? new Success() : new PartialRestore(errors);
    }

    static InteractionRestoreResult messageFailure(RestoreFrameError error) {
        return new MessageFailure(List.of(error));
    }
}
