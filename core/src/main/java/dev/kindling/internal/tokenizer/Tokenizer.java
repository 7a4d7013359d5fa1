/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.tokenizer;

import java.io.IOException;

import dev.kindling.reader.MalformedQuotingException;

/**
 * Splits the bytes of a {@link ByteInput} into rows and fields according to a {@link Dialect}.
 * <p>
 * Rows are produced lazily by {@link #next(Row)}, starting at a given offset, which must be
 * the first byte of a line. Comment lines are dropped, as are blank lines when the dialect
 * skips them; neither is ever returned as a row.
 * </p>
 * <p>
 * Quoting follows a permissive dialect: a field is quoted if its first byte after leading
 * spaces and tabs is the quote character. Bytes between the closing quote and the next
 * delimiter are appended to the field (trailing whitespace dropped), and another quote
 * character there opens a new quoted section. Quote characters inside unquoted fields are
 * plain content.
 * </p>
 */
public class Tokenizer {

    private final ByteInput input;
    private final Dialect dialect;
    private final boolean releaseConsumed;
    private final int keep;
    private long position;

    /**
     * @param input the bytes to tokenize
     * @param dialect the tokenizing rules
     * @param start absolute offset of the first line to read
     */
    public Tokenizer(ByteInput input, Dialect dialect, long start) {
        this(input, dialect, start, true);
    }

    private Tokenizer(ByteInput input, Dialect dialect, long start, boolean releaseConsumed) {
        this.input = input;
        this.dialect = dialect;
        this.position = start;
        this.releaseConsumed = releaseConsumed;
        this.keep = dialect.keptWhitespace();
    }

    /**
     * A tokenizer that never releases input, for looking ahead without consuming it.
     */
    static Tokenizer forSampling(ByteInput input, Dialect dialect, long start) {
        return new Tokenizer(input, dialect, start, false);
    }

    public Dialect dialect() {
        return dialect;
    }

    /**
     * Absolute offset of the next line to be read.
     */
    public long position() {
        return position;
    }

    /**
     * Reads the next row into the given instance.
     *
     * @return false if the input is exhausted
     * @throws MalformedQuotingException if a quoted field is not closed before the end of the input
     */
    public boolean next(Row row) throws IOException {
        while (true) {
            long lineStart = position;
            long p = lineStart;
            int c = input.get(p);
            if (c == ByteInput.EOF) {
                return false;
            }

            while (isSpace(c)) {
                c = input.get(++p);
            }

            if (c == ByteInput.EOF || c == '\n' || c == '\r') {
                position = skipTerminator(p, c);
                release();
                if (dialect.skipBlankLines()) {
                    continue;
                }
                row.reset(lineStart);
                row.endField(0, false);
                row.setEndOffset(position);
                return true;
            }

            if (c == dialect.commentChar()) {
                position = skipLine(p);
                release();
                continue;
            }

            row.reset(lineStart);
            position = dialect.whitespace() ? readWhitespaceSeparated(row, lineStart, p) : readDelimited(row, lineStart, lineStart);
            row.setEndOffset(position);
            release();
            return true;
        }
    }

    private long readDelimited(Row row, long lineStart, long p) throws IOException {
        byte delimiter = dialect.delimiter();
        while (true) {
            int c = input.get(p);
            while (isSpace(c)) {
                c = input.get(++p);
            }

            int start = row.length();
            boolean quoted = dialect.quoting() && c == dialect.quoteChar();
            if (quoted) {
                p = readQuotedTail(row, lineStart, p, start, delimiter);
            }
            else {
                while (!isFieldEnd(c, delimiter)) {
                    row.append((byte) c);
                    c = input.get(++p);
                }
                row.trimTrailing(start, keep);
            }
            row.endField(start, quoted);

            c = input.get(p);
            if (c == delimiter) {
                p++;
                continue;
            }
            return finishLine(p, c);
        }
    }

    private long readWhitespaceSeparated(Row row, long lineStart, long p) throws IOException {
        while (true) {
            int c = input.get(p);
            int start = row.length();
            boolean quoted = dialect.quoting() && c == dialect.quoteChar();
            if (quoted) {
                p = readQuotedTail(row, lineStart, p, start, -1);
            }
            else {
                while (!isFieldEnd(c, -1)) {
                    row.append((byte) c);
                    c = input.get(++p);
                }
            }
            row.endField(start, quoted);

            c = input.get(p);
            while (isSpace(c)) {
                c = input.get(++p);
            }
            if (isFieldEnd(c, -1)) {
                return finishLine(p, c);
            }
        }
    }

    /**
     * Reads a field starting with a quote at {@code p}, including any text that follows the
     * closing quote up to the end of the field.
     *
     * @return offset of the byte that ended the field
     */
    private long readQuotedTail(Row row, long lineStart, long p, int start, int delimiter) throws IOException {
        int quote = dialect.quoteChar() & 0xFF;
        int protectedLength = start;
        int c = quote;
        while (true) {
            if (c == quote) {
                p = readQuotedSection(row, lineStart, p + 1, start);
                protectedLength = row.length();
                c = input.get(p);
                continue;
            }
            if (isFieldEnd(c, delimiter)) {
                break;
            }
            row.append((byte) c);
            c = input.get(++p);
        }
        row.trimTrailing(protectedLength, -1);
        return p;
    }

    /**
     * Copies the content of a quoted section to the row, collapsing doubled quotes.
     *
     * @return offset of the byte after the closing quote
     */
    private long readQuotedSection(Row row, long lineStart, long p, int fieldStart) throws IOException {
        int quote = dialect.quoteChar() & 0xFF;
        while (true) {
            int c = input.get(p);
            if (c == ByteInput.EOF) {
                throw new MalformedQuotingException(lineStart, row.fieldCount());
            }
            if (c == quote) {
                if (input.get(p + 1) == quote) {
                    row.append((byte) c);
                    p += 2;
                    continue;
                }
                return p + 1;
            }
            row.append((byte) c);
            p++;
        }
    }

    private long finishLine(long p, int c) throws IOException {
        if (c == dialect.commentChar()) {
            return skipLine(p);
        }
        return skipTerminator(p, c);
    }

    private long skipLine(long p) throws IOException {
        int c = input.get(p);
        while (c != ByteInput.EOF && c != '\n' && c != '\r') {
            c = input.get(++p);
        }
        return skipTerminator(p, c);
    }

    private long skipTerminator(long p, int c) throws IOException {
        if (c == '\r') {
            return input.get(p + 1) == '\n' ? p + 2 : p + 1;
        }
        if (c == '\n') {
            return p + 1;
        }
        return p;
    }

    private boolean isFieldEnd(int c, int delimiter) {
        if (c == ByteInput.EOF || c == '\n' || c == '\r' || c == dialect.commentChar()) {
            return true;
        }
        if (delimiter < 0) {
            return c == ' ' || c == '\t';
        }
        return c == delimiter;
    }

    private boolean isSpace(int c) {
        return Row.isTrimmable(c, keep);
    }

    private void release() {
        if (releaseConsumed) {
            input.release(position);
        }
    }
}
