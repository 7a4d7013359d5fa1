/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.tokenizer;

import java.nio.ByteBuffer;

/**
 * {@link ByteInput} over a fully resident buffer: a memory-mapped file or a byte array.
 * Offsets are relative to the buffer's position zero; the buffer is never modified.
 */
public class BufferByteInput implements ByteInput {

    private final ByteBuffer buffer;
    private final int limit;

    public BufferByteInput(ByteBuffer buffer) {
        this.buffer = buffer;
        this.limit = buffer.limit();
    }

    public static BufferByteInput of(byte[] bytes) {
        return new BufferByteInput(ByteBuffer.wrap(bytes));
    }

    @Override
    public int get(long position) {
        if (position >= limit) {
            return EOF;
        }
        return buffer.get((int) position) & 0xFF;
    }

    @Override
    public void release(long position) {
    }

    @Override
    public long size() {
        return limit;
    }
}
