/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.tokenizer;

import java.io.IOException;

/**
 * Pull-based access to the bytes of a CSV input, addressed by absolute offset.
 * <p>
 * The tokenizer reads forward from its start offset and announces via {@link #release(long)}
 * which bytes it will not look at again, so chunked implementations can discard them.
 * </p>
 */
public interface ByteInput {

    /** Returned by {@link #get(long)} at and after the end of the input. */
    int EOF = -1;

    /**
     * Returns the byte at the given absolute offset as an unsigned value, or {@link #EOF}.
     *
     * @throws IllegalStateException if the offset lies before a released position
     */
    int get(long position) throws IOException;

    /**
     * Bytes before the given offset are no longer needed.
     */
    void release(long position);

    /**
     * The total number of bytes, or -1 if not known before reaching the end.
     */
    long size();
}
