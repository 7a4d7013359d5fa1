/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import java.io.IOException;

import dev.kindling.internal.tokenizer.ByteInput;
import dev.kindling.reader.ByteRange;

/**
 * Row boundaries of a byte range.
 * <p>
 * A row belongs to the range containing its first byte. Phase one finds the first row
 * start at or after the range offset: offset 0 itself, or the byte after the first
 * {@code \n} at or after {@code offset - 1}. Phase two, enforced while selecting rows,
 * stops at the first row starting at or after {@link #windowEnd}.
 * </p>
 * <p>
 * The scan for the first row start does not track quoting, so inputs read in ranges must
 * not contain line breaks within quoted fields.
 * </p>
 */
final class RowBoundaryScanner {

    private RowBoundaryScanner() {
    }

    /**
     * Offset of the first row starting at or after the range offset; the input size if there is none.
     */
    static long firstRowStart(ByteInput input, ByteRange range) throws IOException {
        if (range == null || range.offset() == 0) {
            return 0;
        }
        long p = range.offset() - 1;
        input.release(p);
        while (true) {
            int c = input.get(p);
            if (c == ByteInput.EOF) {
                return p;
            }
            input.release(p);
            if (c == '\n') {
                return p + 1;
            }
            p++;
        }
    }

    /**
     * The offset from which no rows are read, with ranges extending past the end of the
     * input clamped to its size.
     */
    static long windowEnd(ByteRange range, long inputSize) {
        if (range == null) {
            return Long.MAX_VALUE;
        }
        return inputSize >= 0 ? Math.min(range.end(), inputSize) : range.end();
    }
}
