package com.libragraph.backup.archivers.api;

import com.libragraph.backup.frames.stream.FrameWriteError;

import java.util.Objects;

/**
 * Why a single chat item could not be archived, or was archived with losses.
 */
public sealed interface ArchiveFrameError {

    record ReferencedIdMissing(ReferencedId id) implements ArchiveFrameError {
        public ReferencedIdMissing {
            Objects.requireNonNull(id, "id cannot be null");
        }
    }

    record SerializationFailed(Throwable cause) implements ArchiveFrameError {}

    record WriteFailed(Throwable cause) implements ArchiveFrameError {}

    /** No variant claims the interaction; only reported in strict mode. */
    record UnsupportedInteraction(String type) implements ArchiveFrameError {}

    record InvalidContent(ContentError reason) implements ArchiveFrameError {
        public InvalidContent {
            Objects.requireNonNull(reason, "reason cannot be null");
        }
    }

    enum ContentError {
        EMPTY_MESSAGE,
        EMPTY_REVISION
    }

    static ArchiveFrameError referencedIdMissing(ReferencedId id) {
        return new ReferencedIdMissing(id);
    }

    static ArchiveFrameError unsupported(String type) {
        return new UnsupportedInteraction(type);
    }

    static ArchiveFrameError invalidContent(ContentError reason) {
        return new InvalidContent(reason);
    }

    static ArchiveFrameError fromWriteError(FrameWriteError error) {
        return switch (error.kind()) {
            case SERIALIZATION -> new SerializationFailed(error.cause());
            case IO -> new WriteFailed(error.cause());
        };
    }
}
