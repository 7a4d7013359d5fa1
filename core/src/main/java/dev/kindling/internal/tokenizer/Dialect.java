/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.tokenizer;

import dev.kindling.reader.CsvOptions;

/**
 * The conventions by which bytes split into rows and fields.
 *
 * @param delimiter the field separator; ignored in whitespace mode
 * @param whitespace whether runs of spaces and tabs separate fields
 * @param quoting whether quoted fields are recognized
 * @param quoteChar the quote byte
 * @param commentChar the comment byte, or -1
 * @param skipBlankLines whether lines of only spaces and tabs are dropped
 */
public record Dialect(byte delimiter, boolean whitespace, boolean quoting, byte quoteChar, int commentChar,
                      boolean skipBlankLines) {

    public static Dialect of(CsvOptions options) {
        return new Dialect(options.delimiter(), options.delimWhitespace(), options.quoting(), options.quoteChar(),
                options.commentChar(), options.skipBlankLines());
    }

    public Dialect withDelimiter(byte delimiter) {
        return new Dialect(delimiter, false, quoting, quoteChar, commentChar, skipBlankLines);
    }

    public Dialect withWhitespace() {
        return new Dialect(delimiter, true, quoting, quoteChar, commentChar, skipBlankLines);
    }

    public Dialect withSkipBlankLines(boolean skipBlankLines) {
        return new Dialect(delimiter, whitespace, quoting, quoteChar, commentChar, skipBlankLines);
    }

    /**
     * The byte that is never trimmed from unquoted fields, or -1.
     */
    int keptWhitespace() {
        return whitespace ? -1 : delimiter;
    }

    public String describeDelimiter() {
        if (whitespace) {
            return "whitespace";
        }
        return switch (delimiter) {
            case '\t' -> "\\t";
            default -> String.valueOf((char) delimiter);
        };
    }
}
