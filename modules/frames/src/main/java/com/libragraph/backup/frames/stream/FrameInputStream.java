package com.libragraph.backup.frames.stream;

import com.libragraph.backup.frames.Frame;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Sequential reader over the frames of a backup stream.
 */
public interface FrameInputStream extends Closeable {

    /**
     * Reads the next frame.
     *
     * @return the frame, or empty at end of stream
     * @throws IOException if the stream is unreadable or a frame is malformed
     */
    Optional<Frame> readFrame() throws IOException;
}
