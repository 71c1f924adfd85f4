package com.libragraph.backup.frames.stream;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.backup.frames.Frame;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads frames written by {@link JsonFrameOutputStream}.
 */
public class JsonFrameInputStream implements FrameInputStream {

    private final MappingIterator<Frame> frames;
    private long framesRead;

    public JsonFrameInputStream(InputStream source) throws IOException {
        this(source, FrameMapper.create());
    }

    public JsonFrameInputStream(InputStream source, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(source, "source cannot be null");
        this.frames = mapper.readerFor(Frame.class).readValues(source);
    }

    @Override
    public Optional<Frame> readFrame() throws IOException {
        if (!frames.hasNextValue()) {
            return Optional.empty();
        }
        Frame frame = frames.nextValue();
        framesRead++;
        return Optional.of(frame);
    }

    public long framesRead() {
        return framesRead;
    }

    /** Releases the parser; the underlying stream stays open. */
    @Override
    public void close() throws IOException {
        frames.close();
    }
}
