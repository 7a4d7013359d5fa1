/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

/**
 * Selects the column used as row index of the resulting table.
 * <p>
 * The index column is parsed like any other column; it is only excluded from
 * {@link dev.kindling.table.Table#dataColumns()}.
 * </p>
 */
public sealed interface IndexColumn permits IndexColumn.None, IndexColumn.Named, IndexColumn.At {

    /**
     * No index column. Since no column is ever selected automatically, this is the same
     * as not specifying an index column at all.
     */
    static IndexColumn none() {
        return None.INSTANCE;
    }

    static IndexColumn named(String name) {
        return new Named(name);
    }

    /**
     * The column at the given position of the CSV row.
     */
    static IndexColumn at(int position) {
        return new At(position);
    }

    final class None implements IndexColumn {
        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public String toString() {
            return "none";
        }
    }

    record Named(String name) implements IndexColumn {
        public Named {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Index column name cannot be null or empty");
            }
        }
    }

    record At(int position) implements IndexColumn {
        public At {
            if (position < 0) {
                throw new IllegalArgumentException("Index column position cannot be negative: " + position);
            }
        }
    }
}
