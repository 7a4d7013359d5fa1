/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

import java.io.IOException;

/**
 * Base class of errors caused by the content of a CSV input. Any such error aborts the
 * read; no partial table is returned.
 * <p>
 * Carries as much context as is known: the data row (0-based, counted within the read),
 * the byte offset of that row, the column and the raw field text. Unknown values are
 * reported as -1 or null.
 * </p>
 */
public class CsvParseException extends IOException {

    private final long row;
    private final long byteOffset;
    private final int column;
    private final String columnName;
    private final String rawValue;

    public CsvParseException(String message, long row, long byteOffset, int column, String columnName, String rawValue) {
        super(message);
        this.row = row;
        this.byteOffset = byteOffset;
        this.column = column;
        this.columnName = columnName;
        this.rawValue = rawValue;
    }

    public long getRow() {
        return row;
    }

    public long getByteOffset() {
        return byteOffset;
    }

    public int getColumn() {
        return column;
    }

    public String getColumnName() {
        return columnName;
    }

    public String getRawValue() {
        return rawValue;
    }
}
