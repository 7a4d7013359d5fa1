/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

/**
 * The input has no data rows and types were not given for all columns, so they cannot
 * be inferred. Specifying the types explicitly makes such a read succeed with an empty
 * table.
 */
public class EmptyInputException extends CsvParseException {

    public EmptyInputException() {
        super("Input has no columns and no data rows", -1, -1, -1, null, null);
    }

    public EmptyInputException(String columnName) {
        super("No data rows to infer the type of column '" + columnName + "' from; specify its type explicitly",
                -1, -1, -1, columnName, null);
    }
}
