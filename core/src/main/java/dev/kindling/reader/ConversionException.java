/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

import dev.kindling.schema.DType;

/**
 * A field's text cannot be parsed as the type of its column.
 */
public class ConversionException extends CsvParseException {

    private final DType type;

    public ConversionException(long row, long byteOffset, int column, String columnName, DType type, String rawValue) {
        super("Cannot convert '" + rawValue + "' to " + type + " in row " + row + ", column " + column
                + " ('" + columnName + "') at byte offset " + byteOffset,
                row, byteOffset, column, columnName, rawValue);
        this.type = type;
    }

    public DType getType() {
        return type;
    }
}
