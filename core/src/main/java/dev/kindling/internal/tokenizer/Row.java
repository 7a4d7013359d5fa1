/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.tokenizer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One tokenized row: the unescaped field contents packed into a scratch array, plus the
 * span and quoted flag of every field and the absolute offsets of the row's first byte
 * and of the byte after its terminator.
 * <p>
 * Instances are reused by the tokenizer for every row; use {@link #copy()} to retain one.
 * Unquoted fields are already trimmed; quoted fields hold the text between the quotes with
 * doubled quotes collapsed.
 * </p>
 */
public final class Row {

    private static final int INITIAL_FIELDS = 16;

    private byte[] data;
    private int length;
    private int[] starts;
    private int[] ends;
    private boolean[] quoted;
    private int fieldCount;
    private long startOffset;
    private long endOffset;

    public Row() {
        this(256, INITIAL_FIELDS);
    }

    private Row(int dataCapacity, int fieldCapacity) {
        this.data = new byte[dataCapacity];
        this.starts = new int[fieldCapacity];
        this.ends = new int[fieldCapacity];
        this.quoted = new boolean[fieldCapacity];
    }

    /**
     * Creates a row from already separated fields, e.g. for tests or header names.
     */
    public static Row of(String... fields) {
        Row row = new Row();
        row.reset(0);
        for (String field : fields) {
            byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
            int start = row.length;
            for (byte b : bytes) {
                row.append(b);
            }
            row.endField(start, false);
        }
        return row;
    }

    void reset(long startOffset) {
        this.length = 0;
        this.fieldCount = 0;
        this.startOffset = startOffset;
        this.endOffset = startOffset;
    }

    void append(byte b) {
        if (length == data.length) {
            data = Arrays.copyOf(data, data.length * 2);
        }
        data[length++] = b;
    }

    int length() {
        return length;
    }

    /**
     * Drops trailing spaces and tabs, but not below the given position.
     */
    void trimTrailing(int floor, int keep) {
        while (length > floor && isTrimmable(data[length - 1], keep)) {
            length--;
        }
    }

    void endField(int start, boolean isQuoted) {
        if (fieldCount == starts.length) {
            int capacity = fieldCount * 2;
            starts = Arrays.copyOf(starts, capacity);
            ends = Arrays.copyOf(ends, capacity);
            quoted = Arrays.copyOf(quoted, capacity);
        }
        starts[fieldCount] = start;
        ends[fieldCount] = length;
        quoted[fieldCount] = isQuoted;
        fieldCount++;
    }

    void setEndOffset(long endOffset) {
        this.endOffset = endOffset;
    }

    public int fieldCount() {
        return fieldCount;
    }

    /** Backing array of all field contents; valid until the row is reused. */
    public byte[] data() {
        return data;
    }

    public int fieldStart(int field) {
        return starts[field];
    }

    public int fieldEnd(int field) {
        return ends[field];
    }

    public int fieldLength(int field) {
        return ends[field] - starts[field];
    }

    public boolean isQuoted(int field) {
        return quoted[field];
    }

    public String field(int field) {
        return new String(data, starts[field], ends[field] - starts[field], StandardCharsets.UTF_8);
    }

    public List<String> fields() {
        List<String> fields = new ArrayList<>(fieldCount);
        for (int i = 0; i < fieldCount; i++) {
            fields.add(field(i));
        }
        return fields;
    }

    /** Absolute offset of the row's first byte. */
    public long startOffset() {
        return startOffset;
    }

    /** Absolute offset of the first byte after the row's terminator. */
    public long endOffset() {
        return endOffset;
    }

    public Row copy() {
        Row copy = new Row(Math.max(length, 1), Math.max(fieldCount, 1));
        copy.copyFrom(this);
        return copy;
    }

    /**
     * Replaces the contents of this row with those of the given one.
     */
    public void copyFrom(Row other) {
        if (data.length < other.length) {
            data = new byte[other.length];
        }
        if (starts.length < other.fieldCount) {
            starts = new int[other.fieldCount];
            ends = new int[other.fieldCount];
            quoted = new boolean[other.fieldCount];
        }
        System.arraycopy(other.data, 0, data, 0, other.length);
        System.arraycopy(other.starts, 0, starts, 0, other.fieldCount);
        System.arraycopy(other.ends, 0, ends, 0, other.fieldCount);
        System.arraycopy(other.quoted, 0, quoted, 0, other.fieldCount);
        length = other.length;
        fieldCount = other.fieldCount;
        startOffset = other.startOffset;
        endOffset = other.endOffset;
    }

    static boolean isTrimmable(int b, int keep) {
        return (b == ' ' || b == '\t') && b != keep;
    }

    @Override
    public String toString() {
        return "Row[" + startOffset + ".." + endOffset + ", " + fields() + "]";
    }
}
