/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

import java.util.ArrayList;
import java.util.List;

/**
 * A window {@code [offset, offset + length)} of an input to be parsed on its own.
 * <p>
 * A row belongs to the window containing its first byte; the window reads past its end
 * as needed to complete such a row. Reading consecutive windows and concatenating the
 * results in offset order yields the same table as reading the whole input.
 * </p>
 */
public record ByteRange(long offset, long length) {

    public ByteRange {
        if (offset < 0) {
            throw new IllegalArgumentException("Byte range offset cannot be negative: " + offset);
        }
        if (length < 0) {
            throw new IllegalArgumentException("Byte range length cannot be negative: " + length);
        }
    }

    /**
     * Exclusive end of this window, saturating instead of overflowing.
     */
    public long end() {
        long end = offset + length;
        return end < 0 ? Long.MAX_VALUE : end;
    }

    public boolean isFirst() {
        return offset == 0;
    }

    /**
     * Splits an input of the given size into consecutive windows of {@code segmentBytes}
     * each; the last one may be shorter.
     */
    public static List<ByteRange> split(long size, long segmentBytes) {
        if (segmentBytes <= 0) {
            throw new IllegalArgumentException("Segment size must be positive: " + segmentBytes);
        }
        List<ByteRange> ranges = new ArrayList<>();
        for (long offset = 0; offset < size; offset += segmentBytes) {
            ranges.add(new ByteRange(offset, Math.min(segmentBytes, size - offset)));
        }
        if (ranges.isEmpty()) {
            ranges.add(new ByteRange(0, 0));
        }
        return ranges;
    }
}
