/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

/**
 * A quoted field is still open when the input ends.
 */
public class MalformedQuotingException extends CsvParseException {

    public MalformedQuotingException(long byteOffset, int column) {
        super("Unterminated quoted field in column " + column + " of the row starting at byte offset " + byteOffset,
                -1, byteOffset, column, null, null);
    }
}
