package com.libragraph.backup.frames.stream;

import java.util.Optional;

/**
 * Append-only sink for backup frames.
 *
 * <p>Implementations own encoding and flushing, and report every failure as a value:
 * {@link #writeFrame} never throws.
 */
public interface FrameOutputStream {

    /**
     * Builds a frame with the given builder and appends it.
     *
     * @return empty on success, otherwise the reason the frame was not written
     */
    Optional<FrameWriteError> writeFrame(FrameBuilder builder);
}
