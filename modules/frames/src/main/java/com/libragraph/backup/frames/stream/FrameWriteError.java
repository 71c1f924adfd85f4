package com.libragraph.backup.frames.stream;

import java.util.Objects;

/**
 * Why a frame could not be appended to the stream.
 */
public record FrameWriteError(Kind kind, Throwable cause) {

    public enum Kind {
        /** The frame could not be built or encoded; the stream is untouched. */
        SERIALIZATION,

        /** Writing the encoded frame failed; the stream may hold a truncated record. */
        IO
    }

    public FrameWriteError {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(cause, "cause cannot be null");
    }

    public static FrameWriteError serialization(Throwable cause) {
        return new FrameWriteError(Kind.SERIALIZATION, cause);
    }

    public static FrameWriteError io(Throwable cause) {
        return new FrameWriteError(Kind.IO, cause);
    }

    public String message() {
        return kind + ": " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
