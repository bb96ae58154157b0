package com.adapterhost.ipc.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a byte stream into delimiter-terminated frames. Chunks may end anywhere, including inside a
 * multi-byte UTF-8 sequence; bytes are only decoded once a whole frame is buffered. Empty frames are
 * dropped. One decoder per connection; not thread-safe.
 */
public final class FrameDecoder {

    private final int maxFrameBytes;
    private byte[] buffer = new byte[8192];
    private int size;
    private int scanned;

    public FrameDecoder(int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Appends {@code chunk} (position to limit) and returns every frame it completes, without delimiters.
     *
     * @throws FrameTooLargeException if a complete or partial frame exceeds the limit; buffered bytes are dropped
     */
    public List<byte[]> decode(ByteBuffer chunk) {
        int length = chunk.remaining();
        ensureCapacity(size + length);
        chunk.get(buffer, size, length);
        size += length;
        return drain();
    }

    public List<byte[]> decode(byte[] chunk) {
        return decode(ByteBuffer.wrap(chunk));
    }

    /** Bytes held for an incomplete frame. */
    public int buffered() {
        return size;
    }

    private List<byte[]> drain() {
        List<byte[]> frames = new ArrayList<>();
        int start = 0;
        for (int i = scanned; i < size; i++) {
            if (buffer[i] == EnvelopeCodec.FRAME_DELIMITER) {
                if (i - start > maxFrameBytes) {
                    throw tooLarge();
                }
                if (i > start) {
                    frames.add(Arrays.copyOfRange(buffer, start, i));
                }
                start = i + 1;
            }
        }
        if (start > 0) {
            System.arraycopy(buffer, start, buffer, 0, size - start);
            size -= start;
        }
        scanned = size;
        if (size > maxFrameBytes) {
            throw tooLarge();
        }
        return frames;
    }

    private FrameTooLargeException tooLarge() {
        size = 0;
        scanned = 0;
        return new FrameTooLargeException(maxFrameBytes);
    }

    private void ensureCapacity(int needed) {
        if (needed <= buffer.length) return;
        int capacity = buffer.length;
        while (capacity < needed) {
            capacity = capacity > Integer.MAX_VALUE / 2 ? Integer.MAX_VALUE - 8 : capacity * 2;
        }
        buffer = Arrays.copyOf(buffer, capacity);
    }
}
