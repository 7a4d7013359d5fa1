/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

/**
 * Which row, if any, of the input holds the column names.
 * <p>
 * Row numbers count rows after comment lines, skipped blank lines and {@code skipRows}
 * have been removed.
 * </p>
 */
public sealed interface HeaderSpec permits HeaderSpec.Infer, HeaderSpec.None, HeaderSpec.Row {

    /**
     * The first row is the header, unless explicit column names are given.
     */
    static HeaderSpec infer() {
        return Infer.INSTANCE;
    }

    /**
     * There is no header row; every row is data.
     */
    static HeaderSpec none() {
        return None.INSTANCE;
    }

    /**
     * The given row is the header; rows before it are discarded.
     */
    static HeaderSpec row(int index) {
        return new Row(index);
    }

    final class Infer implements HeaderSpec {
        private static final Infer INSTANCE = new Infer();

        private Infer() {
        }

        @Override
        public String toString() {
            return "infer";
        }
    }

    final class None implements HeaderSpec {
        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public String toString() {
            return "none";
        }
    }

    record Row(int index) implements HeaderSpec {
        public Row {
            if (index < 0) {
                throw new IllegalArgumentException("Header row cannot be negative: " + index);
            }
        }
    }
}
