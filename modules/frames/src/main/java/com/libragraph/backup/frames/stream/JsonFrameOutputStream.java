package com.libragraph.backup.frames.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.libragraph.backup.frames.Frame;
import org.jboss.logging.Logger;

import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes frames as newline-delimited JSON, one frame per line.
 *
 * <p>Each frame is fully encoded before any byte reaches the target, so a
 * serialization failure never leaves a partial record behind.
 */
public class JsonFrameOutputStream implements FrameOutputStream, Flushable {

    private static final Logger log = Logger.getLogger(JsonFrameOutputStream.class);

    private static final byte NEWLINE = '\n';

    private final OutputStream target;
    private final ObjectWriter writer;
    private long framesWritten;

    public JsonFrameOutputStream(OutputStream target) {
        this(target, FrameMapper.create());
    }

    public JsonFrameOutputStream(OutputStream target, ObjectMapper mapper) {
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.writer = mapper.writerFor(Frame.class);
    }

    @Override
    public Optional<FrameWriteError> writeFrame(FrameBuilder builder) {
        byte[] encoded;
        try {
            Frame frame = builder.build();
            Objects.requireNonNull(frame, "frame builder returned null");
            encoded = writer.writeValueAsBytes(frame);
        } catch (Exception e) {
            log.debugf("Frame #%d could not be encoded: %s", framesWritten + 1, e.getMessage());
            return Optional.of(FrameWriteError.serialization(e));
        }

        try {
            target.write(encoded);
            target.write(NEWLINE);
        } catch (IOException e) {
            log.debugf("Frame #%d could not be written: %s", framesWritten + 1, e.getMessage());
            return Optional.of(FrameWriteError.io(e));
        }

        framesWritten++;
        return Optional.empty();
    }

    @Override
    public void flush() throws IOException {
        target.flush();
    }

    public long framesWritten() {
        return framesWritten;
    }
}
