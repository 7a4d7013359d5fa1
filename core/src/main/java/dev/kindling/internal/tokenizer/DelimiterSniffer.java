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
 * Detects the field delimiter from the first rows of an input.
 * <p>
 * Each candidate ({@code ,}, {@code ;}, tab, {@code |}, whitespace runs) tokenizes the same
 * sample. A candidate qualifies if it splits every sampled row into the same number of fields,
 * and that number is larger than one. The qualifying candidate with the most fields wins, ties
 * going to the earlier candidate; without any, the comma is used.
 * </p>
 */
public final class DelimiterSniffer {

    static final int MAX_SAMPLE_ROWS = 20;

    private static final byte[] CANDIDATES = { ',', ';', '\t', '|' };

    private static final System.Logger LOG = System.getLogger(DelimiterSniffer.class.getName());

    private DelimiterSniffer() {
    }

    /**
     * @param input the input; no bytes are released
     * @param base the dialect to derive candidates from
     * @param start offset of the first line to sample
     * @param sampleRows maximum number of rows to sample, capped at 20
     * @return the base dialect with the detected delimiter
     */
    public static Dialect sniff(ByteInput input, Dialect base, long start, int sampleRows) throws IOException {
        int rows = Math.min(sampleRows, MAX_SAMPLE_ROWS);
        Dialect sampling = base.withSkipBlankLines(true);

        Dialect best = null;
        int bestCount = 1;
        for (byte candidate : CANDIDATES) {
            Dialect dialect = sampling.withDelimiter(candidate);
            int count = consistentFieldCount(input, dialect, start, rows);
            if (count > bestCount) {
                best = dialect;
                bestCount = count;
            }
        }
        Dialect whitespace = sampling.withWhitespace();
        int count = consistentFieldCount(input, whitespace, start, rows);
        if (count > bestCount) {
            best = whitespace;
            bestCount = count;
        }

        if (best == null) {
            LOG.log(System.Logger.Level.DEBUG, "No consistent delimiter found, using ','");
            return base.withDelimiter((byte) ',');
        }
        LOG.log(System.Logger.Level.DEBUG, "Detected delimiter ''{0}'' with {1} fields per row",
                best.describeDelimiter(), bestCount);
        return best.whitespace() ? base.withWhitespace() : base.withDelimiter(best.delimiter());
    }

    /**
     * @return the field count shared by all sampled rows, or -1 if it varies or nothing was sampled
     */
    private static int consistentFieldCount(ByteInput input, Dialect dialect, long start, int rows) throws IOException {
        Tokenizer tokenizer = Tokenizer.forSampling(input, dialect, start);
        Row row = new Row();
        int count = -1;
        try {
            for (int i = 0; i < rows && tokenizer.next(row); i++) {
                if (count == -1) {
                    count = row.fieldCount();
                }
                else if (count != row.fieldCount()) {
                    return -1;
                }
            }
        }
        catch (MalformedQuotingException e) {
            // reported by the actual read
            LOG.log(System.Logger.Level.TRACE, "Candidate ''{0}'' runs into an unterminated quote", dialect.describeDelimiter());
            return count;
        }
        return count;
    }
}
