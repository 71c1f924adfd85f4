package com.libragraph.backup.archivers.api;

import com.libragraph.backup.types.ThreadUniqueId;

import java.util.Objects;

/**
 * Why a chat item could not be restored, or was restored with losses.
 */
public sealed interface RestoreFrameError {

    record IdentifierNotFound(RestoreId id) implements RestoreFrameError {
        public IdentifierNotFound {
            Objects.requireNonNull(id, "id cannot be null");
        }
    }

    /** The context maps the chat to a thread that is not in the database. */
    record ReferencedDatabaseObjectNotFound(ThreadUniqueId threadUniqueId) implements RestoreFrameError {}

    record InvalidFrame(String reason) implements RestoreFrameError {}

    record DatabaseInsertionFailed(Throwable cause) implements RestoreFrameError {}

    /** No variant claims the chat item; only reported in strict mode. */
    record UnsupportedChatItem(String reason) implements RestoreFrameError {}

    static RestoreFrameError identifierNotFound(RestoreId id) {
        return new IdentifierNotFound(id);
    }

    static RestoreFrameError threadNotFound(ThreadUniqueId threadUniqueId) {
        return new ReferencedDatabaseObjectNotFound(threadUniqueId);
    }

    static RestoreFrameError invalidFrame(String reason) {
        return new InvalidFrame(reason);
    }

    static RestoreFrameError insertionFailed(Throwable cause) {
        return new DatabaseInsertionFailed(cause);
    }

    static RestoreFrameError unsupported(String reason) {
        return new UnsupportedChatItem(reason);
    }
}
