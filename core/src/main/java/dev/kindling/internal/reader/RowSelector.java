/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Set;

import dev.kindling.internal.tokenizer.Row;
import dev.kindling.internal.tokenizer.Tokenizer;
import dev.kindling.reader.CsvOptions;
import dev.kindling.reader.HeaderSpec;

/**
 * Classifies the tokenizer's rows into skipped rows, the header row and data rows.
 * <p>
 * On the row stream (comment and blank lines already filtered by the tokenizer), the
 * selection applies, in this order: {@code skipRows} (a count, or explicit indices into the
 * stream), the header, {@code nrows}, and {@code skipFooter}. Rows starting at or after the
 * window end are never returned. Ranges not starting at offset 0 apply neither skipped rows
 * nor the header, as those belong to the first range.
 * </p>
 */
class RowSelector {

    private final Tokenizer tokenizer;
    private final CsvOptions options;
    private final boolean firstRange;
    private final long windowEnd;
    private final Set<Integer> skipIndices;

    private long streamIndex;
    private long dataRows;
    private boolean exhausted;
    private ArrayDeque<Row> footer;
    private Row spare;

    /**
     * @param tokenizer positioned at the first row of the range
     * @param firstRange whether the range starts at offset 0
     * @param windowEnd absolute offset at which no new rows start; {@code Long.MAX_VALUE} for no limit
     */
    RowSelector(Tokenizer tokenizer, CsvOptions options, boolean firstRange, long windowEnd) {
        this.tokenizer = tokenizer;
        this.options = options;
        this.firstRange = firstRange;
        this.windowEnd = windowEnd;
        this.skipIndices = options.skipRowIndices();
    }

    /**
     * Consumes skipped leading rows and the header row, if any.
     *
     * @return the header fields, or null if no header row is read
     */
    List<String> readHeader() throws IOException {
        if (!firstRange) {
            return null;
        }
        HeaderSpec header = options.header();
        int headerRow;
        if (header instanceof HeaderSpec.Row explicit) {
            headerRow = explicit.index();
        }
        else if (header instanceof HeaderSpec.Infer && options.names() == null) {
            headerRow = 0;
        }
        else {
            return null;
        }

        Row row = new Row();
        for (int i = 0; i <= headerRow; i++) {
            if (!pullFiltered(row)) {
                return null;
            }
        }
        return row.fields();
    }

    /**
     * Reads the next data row into the given instance.
     *
     * @return false once there are no more data rows
     */
    boolean next(Row row) throws IOException {
        if (options.nrows() != CsvOptions.NO_LIMIT && dataRows >= options.nrows()) {
            return false;
        }
        boolean found = options.skipFooter() > 0 ? nextBeforeFooter(row) : pullFiltered(row);
        if (found) {
            dataRows++;
        }
        return found;
    }

    /**
     * Number of data rows returned so far.
     */
    long dataRows() {
        return dataRows;
    }

    private boolean nextBeforeFooter(Row row) throws IOException {
        int footerRows = options.skipFooter();
        if (footer == null) {
            footer = new ArrayDeque<>(footerRows + 1);
            while (footer.size() < footerRows) {
                Row buffered = new Row();
                if (!pullFiltered(buffered)) {
                    return false;
                }
                footer.addLast(buffered);
            }
            spare = new Row();
        }
        if (!pullFiltered(spare)) {
            return false;
        }
        footer.addLast(spare);
        Row oldest = footer.removeFirst();
        row.copyFrom(oldest);
        spare = oldest;
        return true;
    }

    /**
     * Next row of the stream that is not skipped by {@code skipRows}.
     */
    private boolean pullFiltered(Row row) throws IOException {
        while (true) {
            if (exhausted || tokenizer.position() >= windowEnd || !tokenizer.next(row)) {
                exhausted = true;
                return false;
            }
            if (row.startOffset() >= windowEnd) {
                exhausted = true;
                return false;
            }
            long index = streamIndex++;
            if (firstRange && isSkipped(index)) {
                continue;
            }
            return true;
        }
    }

    private boolean isSkipped(long index) {
        if (index < options.skipRows()) {
            return true;
        }
        return !skipIndices.isEmpty() && index <= Integer.MAX_VALUE && skipIndices.contains((int) index);
    }
}
