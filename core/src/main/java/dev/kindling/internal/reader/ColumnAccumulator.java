/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import dev.kindling.reader.CsvParseException;
import dev.kindling.table.Column;

/**
 * Receives the fields of one selected column, row by row, and produces the final column.
 */
interface ColumnAccumulator {

    /**
     * Appends one field.
     *
     * @param data the row's field contents
     * @param start start of the field within {@code data}
     * @param end end of the field within {@code data}
     * @param quoted whether the field was quoted
     * @param row index of the data row within the read, for error reporting
     * @param byteOffset absolute offset of the row, for error reporting
     */
    void append(byte[] data, int start, int end, boolean quoted, long row, long byteOffset) throws CsvParseException;

    /**
     * Appends a missing value, e.g. for a field absent from a short row.
     */
    void appendNull();

    int size();

    /**
     * Produces the column once all rows have been appended.
     *
     * @param partial whether this read is one of several byte ranges of an input
     */
    Column build(boolean partial) throws CsvParseException;
}
