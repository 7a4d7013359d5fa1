/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.table;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.BitSet;

import dev.kindling.schema.ColumnSchema;

/**
 * A parsed column: values in a typed primitive array plus a {@link BitSet} of missing
 * entries.
 * <p>
 * The {@code values()} and {@link #nulls()} accessors return the backing storage without
 * copying; callers must not modify it. {@link Table#concat} copies into new storage.
 * </p>
 */
public sealed interface Column
        permits Column.Int32Column, Column.Int64Column, Column.Float32Column, Column.Float64Column,
        Column.BoolColumn, Column.DateColumn, Column.CategoryColumn, Column.StringColumn {

    ColumnSchema column();

    /** Flags of missing (NA) values; the backing set, not a copy. */
    BitSet nulls();

    int size();

    /** Get the value at index, boxing primitives; null for missing values. */
    Object getValue(int index);

    default String name() {
        return column().name();
    }

    default boolean isNull(int index) {
        return nulls().get(index);
    }

    default int nullCount() {
        return nulls().cardinality();
    }

    record Int32Column(ColumnSchema column, int[] values, BitSet nulls, int size) implements Column {
        public int get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record Int64Column(ColumnSchema column, long[] values, BitSet nulls, int size) implements Column {
        public long get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record Float32Column(ColumnSchema column, float[] values, BitSet nulls, int size) implements Column {
        public float get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record Float64Column(ColumnSchema column, double[] values, BitSet nulls, int size) implements Column {
        public double get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record BoolColumn(ColumnSchema column, boolean[] values, BitSet nulls, int size) implements Column {
        public boolean get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    /**
     * Timestamps as milliseconds since 1970-01-01T00:00, without time zone.
     */
    record DateColumn(ColumnSchema column, long[] values, BitSet nulls, int size) implements Column {
        public long get(int index) {
            return values[index];
        }

        public LocalDateTime getDateTime(int index) {
            if (isNull(index)) {
                return null;
            }
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(values[index]), ZoneOffset.UTC);
        }

        @Override
        public Object getValue(int index) {
            return getDateTime(index);
        }
    }

    /**
     * Category codes: hashes of the field text, equal for equal text in any read.
     */
    record CategoryColumn(ColumnSchema column, int[] values, BitSet nulls, int size) implements Column {
        public int get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record StringColumn(ColumnSchema column, String[] values, BitSet nulls, int size) implements Column {
        public String get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }
}
