package com.libragraph.backup.frames.stream;

import com.libragraph.backup.frames.Frame;

/**
 * Assembles one frame on demand. Any exception thrown while building is reported
 * by the stream as a serialization error, never propagated.
 */
@FunctionalInterface
public interface FrameBuilder {

    Frame build() throws Exception;
}
