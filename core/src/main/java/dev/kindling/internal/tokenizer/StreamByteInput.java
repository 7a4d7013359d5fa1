/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.tokenizer;

import java.io.IOException;
import java.io.InputStream;

/**
 * {@link ByteInput} reading an {@link InputStream} in chunks.
 * <p>
 * Only the bytes from the last released position onwards are kept; the window grows
 * when a single row is longer than the current buffer.
 * </p>
 */
public class StreamByteInput implements ByteInput {

    static final int CHUNK_SIZE = 64 * 1024;

    private final InputStream stream;
    private byte[] buffer;
    // absolute offset of buffer[0]
    private long bufferStart;
    private int count;
    private long released;
    private boolean eof;

    public StreamByteInput(InputStream stream) {
        this(stream, CHUNK_SIZE);
    }

    StreamByteInput(InputStream stream, int initialCapacity) {
        this.stream = stream;
        this.buffer = new byte[initialCapacity];
    }

    @Override
    public int get(long position) throws IOException {
        if (position < bufferStart) {
            throw new IllegalStateException("Offset " + position + " has already been released (window starts at " + bufferStart + ")");
        }
        while (position >= bufferStart + count) {
            if (eof || !fill()) {
                return EOF;
            }
        }
        return buffer[(int) (position - bufferStart)] & 0xFF;
    }

    @Override
    public void release(long position) {
        if (position > released) {
            released = position;
        }
    }

    @Override
    public long size() {
        return eof ? bufferStart + count : -1;
    }

    private boolean fill() throws IOException {
        int discard = (int) Math.min(released - bufferStart, count);
        if (discard > 0) {
            System.arraycopy(buffer, discard, buffer, 0, count - discard);
            count -= discard;
            bufferStart += discard;
        }
        if (buffer.length - count < CHUNK_SIZE / 4) {
            byte[] grown = new byte[Math.max(buffer.length * 2, count + CHUNK_SIZE)];
            System.arraycopy(buffer, 0, grown, 0, count);
            buffer = grown;
        }
        int read = stream.read(buffer, count, buffer.length - count);
        if (read < 0) {
            eof = true;
            return false;
        }
        count += read;
        return true;
    }
}
