/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.BitSet;

import dev.kindling.internal.conversion.ValueParser;
import dev.kindling.reader.ConversionException;
import dev.kindling.schema.ColumnSchema;
import dev.kindling.schema.DType;
import dev.kindling.table.Column;

/**
 * Accumulates the values of one column of a known type while rows are read.
 * <p>
 * Fields are checked for missing-value tokens first; every other field must convert to
 * the column type. A field that does not raises a {@link ConversionException}, unless
 * missing-value filtering is disabled, in which case it is stored as missing.
 * Columns of an explicit numeric type accept boolean tokens as 1 and 0.
 * </p>
 */
abstract class ColumnBuilder implements ColumnAccumulator {

    private static final int INITIAL_CAPACITY = 1024;

    protected final String name;
    protected final int sourceIndex;
    protected final ValueParser parser;
    protected final BitSet nulls = new BitSet();
    protected int size;
    protected int capacity;

    ColumnBuilder(String name, int sourceIndex, ValueParser parser) {
        this.name = name;
        this.sourceIndex = sourceIndex;
        this.parser = parser;
    }

    static ColumnBuilder forType(DType type, String name, int sourceIndex, ValueParser parser) {
        return switch (type) {
            case INT32 -> new Int32Builder(name, sourceIndex, parser);
            case INT64 -> new Int64Builder(name, sourceIndex, parser);
            case FLOAT32 -> new Float32Builder(name, sourceIndex, parser);
            case FLOAT64 -> new Float64Builder(name, sourceIndex, parser);
            case BOOL -> new BoolBuilder(name, sourceIndex, parser);
            case DATE -> new DateBuilder(name, sourceIndex, parser);
            case CATEGORY -> new CategoryBuilder(name, sourceIndex, parser);
            case STR -> new StrBuilder(name, sourceIndex, parser);
        };
    }

    /**
     * The column type, or null while it is not yet known.
     */
    abstract DType type();

    @Override
    public int size() {
        return size;
    }

    @Override
    public void append(byte[] data, int start, int end, boolean quoted, long row, long byteOffset) throws ConversionException {
        int s = ValueParser.trimStart(data, start, end);
        int e = ValueParser.trimEnd(data, s, end);
        if (parser.isNa(data, s, e)) {
            appendNull();
            return;
        }
        ensureCapacity();
        if (!set(size, data, start, end, s, e, quoted)) {
            if (!parser.naFilter()) {
                appendNull();
                return;
            }
            throw new ConversionException(row, byteOffset, sourceIndex, name, type(),
                    new String(data, start, end - start, StandardCharsets.UTF_8));
        }
        size++;
    }

    @Override
    public void appendNull() {
        ensureCapacity();
        nulls.set(size);
        size++;
    }

    private void ensureCapacity() {
        if (size == capacity) {
            capacity = capacity == 0 ? INITIAL_CAPACITY : capacity * 2;
            grow(capacity);
        }
    }

    /**
     * Converts the field and stores it at the given index.
     *
     * @return false if the field does not convert
     */
    abstract boolean set(int index, byte[] data, int start, int end, int trimmedStart, int trimmedEnd, boolean quoted);

    abstract void grow(int capacity);

    abstract Column build(ColumnSchema schema);

    @Override
    public Column build(boolean partial) {
        return build(new ColumnSchema(name, type(), sourceIndex));
    }

    static final class Int32Builder extends ColumnBuilder {
        private int[] values = new int[0];

        Int32Builder(String name, int sourceIndex, ValueParser parser) {
            super(name, sourceIndex, parser);
        }

        @Override
        DType type() {
            return DType.INT32;
        }

        @Override
        boolean set(int index, byte[] data, int start, int end, int s, int e, boolean quoted) {
            if (!parser.parseInt(data, s, e, true)) {
                return false;
            }
            values[index] = (int) parser.longValue();
            return true;
        }

        @Override
        void grow(int capacity) {
            values = Arrays.copyOf(values, capacity);
        }

        @Override
        Column build(ColumnSchema schema) {
            return new Column.Int32Column(schema, Arrays.copyOf(values, size), nulls, size);
        }
    }

    static final class Int64Builder extends ColumnBuilder {
        private long[] values = new long[0];

        Int64Builder(String name, int sourceIndex, ValueParser parser) {
            super(name, sourceIndex, parser);
        }

        @Override
        DType type() {
            return DType.INT64;
        }

        @Override
        boolean set(int index, byte[] data, int start, int end, int s, int e, boolean quoted) {
            if (!parser.parseLong(data, s, e, true)) {
                return false;
            }
            values[index] = parser.longValue();
            return true;
        }

        @Override
        void grow(int capacity) {
            values = Arrays.copyOf(values, capacity);
        }

        @Override
        Column build(ColumnSchema schema) {
            return new Column.Int64Column(schema, Arrays.copyOf(values, size), nulls, size);
        }
    }

    static final class Float32Builder extends ColumnBuilder {
        private float[] values = new float[0];

        Float32Builder(String name, int sourceIndex, ValueParser parser) {
            super(name, sourceIndex, parser);
        }

        @Override
        DType type() {
            return DType.FLOAT32;
        }

        @Override
        boolean set(int index, byte[] data, int start, int end, int s, int e, boolean quoted) {
            if (!parser.parseFloat(data, s, e, true)) {
                return false;
            }
            values[index] = parser.floatValue();
            return true;
        }

        @Override
        void grow(int capacity) {
            values = Arrays.copyOf(values, capacity);
        }

        @Override
        Column build(ColumnSchema schema) {
            return new Column.Float32Column(schema, Arrays.copyOf(values, size), nulls, size);
        }
    }

    static final class Float64Builder extends ColumnBuilder {
        private double[] values = new double[0];

        Float64Builder(String name, int sourceIndex, ValueParser parser) {
            super(name, sourceIndex, parser);
        }

        @Override
        DType type() {
            return DType.FLOAT64;
        }

        @Override
        boolean set(int index, byte[] data, int start, int end, int s, int e, boolean quoted) {
            if (!parser.parseDouble(data, s, e, true)) {
                return false;
            }
            values[index] = parser.doubleValue();
            return true;
        }

        @Override
        void grow(int capacity) {
            values = Arrays.copyOf(values, capacity);
        }

        @Override
        Column build(ColumnSchema schema) {
            return new Column.Float64Column(schema, Arrays.copyOf(values, size), nulls, size);
        }
    }

    static final class BoolBuilder extends ColumnBuilder {
        private boolean[] values = new boolean[0];

        BoolBuilder(String name, int sourceIndex, ValueParser parser) {
            super(name, sourceIndex, parser);
        }

        @Override
        DType type() {
            return DType.BOOL;
        }

        @Override
        boolean set(int index, byte[] data, int start, int end, int s, int e, boolean quoted) {
            if (!parser.parseBoolean(data, s, e)) {
                return false;
            }
            values[index] = parser.booleanValue();
            return true;
        }

        @Override
        void grow(int capacity) {
            values = Arrays.copyOf(values, capacity);
        }

        @Override
        Column build(ColumnSchema schema) {
            return new Column.BoolColumn(schema, Arrays.copyOf(values, size), nulls, size);
        }
    }

    static final class DateBuilder extends ColumnBuilder {
        private long[] values = new long[0];

        DateBuilder(String name, int sourceIndex, ValueParser parser) {
            super(name, sourceIndex, parser);
        }

        @Override
        DType type() {
            return DType.DATE;
        }

        @Override
        boolean set(int index, byte[] data, int start, int end, int s, int e, boolean quoted) {
            if (!parser.parseDate(data, s, e)) {
                return false;
            }
            values[index] = parser.dateValue();
            return true;
        }

        @Override
        void grow(int capacity) {
            values = Arrays.copyOf(values, capacity);
        }

        @Override
        Column build(ColumnSchema schema) {
            return new Column.DateColumn(schema, Arrays.copyOf(values, size), nulls, size);
        }
    }

    static final class CategoryBuilder extends ColumnBuilder {
        private int[] values = new int[0];

        CategoryBuilder(String name, int sourceIndex, ValueParser parser) {
            super(name, sourceIndex, parser);
        }

        @Override
        DType type() {
            return DType.CATEGORY;
        }

        @Override
        boolean set(int index, byte[] data, int start, int end, int s, int e, boolean quoted) {
            values[index] = parser.categoryCode(data, s, e);
            return true;
        }

        @Override
        void grow(int capacity) {
            values = Arrays.copyOf(values, capacity);
        }

        @Override
        Column build(ColumnSchema schema) {
            return new Column.CategoryColumn(schema, Arrays.copyOf(values, size), nulls, size);
        }
    }

    static final class StrBuilder extends ColumnBuilder {
        private String[] values = new String[0];

        StrBuilder(String name, int sourceIndex, ValueParser parser) {
            super(name, sourceIndex, parser);
        }

        @Override
        DType type() {
            return DType.STR;
        }

        @Override
        boolean set(int index, byte[] data, int start, int end, int s, int e, boolean quoted) {
            // quoted text is kept verbatim, unquoted fields arrive trimmed
            values[index] = quoted
                    ? new String(data, start, end - start, StandardCharsets.UTF_8)
                    : new String(data, s, e - s, StandardCharsets.UTF_8);
            return true;
        }

        @Override
        void grow(int capacity) {
            values = Arrays.copyOf(values, capacity);
        }

        @Override
        Column build(ColumnSchema schema) {
            return new Column.StringColumn(schema, Arrays.copyOf(values, size), nulls, size);
        }
    }
}
