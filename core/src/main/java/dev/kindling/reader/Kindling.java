/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

import dev.kindling.internal.conversion.TypeInference;
import dev.kindling.internal.reader.ReadResult;
import dev.kindling.internal.tokenizer.Dialect;
import dev.kindling.schema.ColumnSchema;
import dev.kindling.schema.DType;
import dev.kindling.schema.TableSchema;
import dev.kindling.source.CsvSource;
import dev.kindling.table.Table;

/**
 * Entry point for reading CSV inputs with a shared thread pool.
 *
 * <p>Use this when reading several inputs, or one large input in parallel byte ranges:</p>
 * <pre>{@code
 * try (Kindling kindling = Kindling.create()) {
 *     Table table = kindling.readPartitioned(CsvSource.of(path), CsvOptions.defaults(), 64 * 1024 * 1024);
 *     // ...
 * }
 * }</pre>
 *
 * <p>For single-input usage, {@link CsvReader#read(Path, CsvOptions)} is simpler.</p>
 */
public class Kindling implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(Kindling.class.getName());

    private final KindlingContext context;

    private Kindling(KindlingContext context) {
        this.context = context;
    }

    /**
     * Create a new Kindling instance with a thread pool sized by the {@code kindling.threads}
     * system property, or to available processors.
     */
    public static Kindling create() {
        return new Kindling(KindlingContext.create());
    }

    /**
     * Create a new Kindling instance with a thread pool of the specified size.
     */
    public static Kindling create(int threads) {
        return new Kindling(KindlingContext.create(threads));
    }

    /**
     * Open a CSV file for reading.
     */
    public CsvReader open(Path path) throws IOException {
        return CsvReader.open(CsvSource.of(path), context);
    }

    /**
     * Open a CSV source for reading.
     */
    public CsvReader open(CsvSource source) throws IOException {
        return CsvReader.open(source, context);
    }

    /**
     * Read a CSV source on the calling thread.
     */
    public Table read(CsvSource source, CsvOptions options) throws IOException {
        try (CsvReader reader = open(source)) {
            return reader.read(options);
        }
    }

    /**
     * Read a CSV source as consecutive byte ranges of {@code segmentBytes} each, in parallel,
     * and concatenate the results in offset order.
     * <p>
     * The first range is read first; it handles skipped rows and the header, and fixes the
     * column names and the delimiter for the remaining ranges. Column types without an
     * explicit type are settled over all ranges, and ranges whose own inference disagrees
     * are read again with the settled types, so the result equals that of a single read.
     * Compressed and stream sources are decompressed into memory before splitting.
     * Quoted fields must not contain line breaks.
     * </p>
     *
     * @throws IllegalArgumentException if the options already hold a byte range
     * @throws ConflictingOptionsException if the options limit the number of rows or skip a footer
     */
    public Table readPartitioned(CsvSource source, CsvOptions options, long segmentBytes) throws IOException {
        if (options.byteRange() != null) {
            throw new IllegalArgumentException("Options for a partitioned read cannot have a byte range");
        }
        if (options.nrows() != CsvOptions.NO_LIMIT) {
            throw new ConflictingOptionsException("nrows", "partitioned read", "ranges are read independently");
        }
        if (options.skipFooter() > 0) {
            throw new ConflictingOptionsException("skipFooter", "partitioned read", "ranges do not see the end of the input");
        }

        try (CsvReader opened = open(source)) {
            if (!opened.isResident()) {
                LOG.log(System.Logger.Level.DEBUG, "Loading ''{0}'' into memory for a partitioned read", source.description());
                try (CsvReader resident = open(CsvSource.of(opened.readAllBytes()))) {
                    return readPartitioned(resident, options, segmentBytes);
                }
            }
            return readPartitioned(opened, options, segmentBytes);
        }
    }

    private Table readPartitioned(CsvReader reader, CsvOptions options, long segmentBytes) throws IOException {
        long size = reader.size();
        if (size == 0) {
            return reader.read(options);
        }
        List<ByteRange> ranges = ByteRange.split(size, segmentBytes);
        LOG.log(System.Logger.Level.DEBUG, "Reading ''{0}'' ({1} bytes) in {2} ranges",
                reader.source().description(), size, ranges.size());

        if (ranges.size() == 1) {
            return reader.read(options);
        }
        ReadResult first = reader.readRange(options.withByteRange(ranges.get(0)), true);

        CsvOptions remaining = pinned(options, first);
        List<CsvOptions> rangeOptions = new ArrayList<>(ranges.size() - 1);
        for (ByteRange range : ranges.subList(1, ranges.size())) {
            rangeOptions.add(remaining.withByteRange(range));
        }
        List<ReadResult> results = new ArrayList<>(ranges.size());
        results.add(first);
        results.addAll(readRanges(reader, rangeOptions));

        long totalRows = 0;
        for (ReadResult result : results) {
            totalRows += result.table().rowCount();
        }
        if (totalRows == 0) {
            // no data rows: a single read decides between an empty table and EmptyInputException
            return reader.read(options);
        }

        DType[] settled = settledTypes(results);
        if (settled != null) {
            Map<String, DType> types = new LinkedHashMap<>();
            TableSchema schema = first.table().schema();
            for (int c = 0; c < settled.length; c++) {
                ColumnSchema column = schema.getColumn(c);
                types.put(column.name(), settled[c] != null ? settled[c] : column.type());
            }

            List<Integer> stale = new ArrayList<>();
            List<CsvOptions> typedOptions = new ArrayList<>();
            for (int i = 0; i < results.size(); i++) {
                Table table = results.get(i).table();
                if (table.rowCount() > 0 && !hasTypes(table, settled)) {
                    CsvOptions base = i == 0 ? options : remaining;
                    stale.add(i);
                    typedOptions.add(base.toBuilder().dtypes(types).build().withByteRange(ranges.get(i)));
                }
            }
            if (!stale.isEmpty()) {
                LOG.log(System.Logger.Level.DEBUG, "Reading {0} of {1} ranges again with column types {2}",
                        stale.size(), ranges.size(), types);
                List<ReadResult> reread = readRanges(reader, typedOptions);
                for (int i = 0; i < stale.size(); i++) {
                    results.set(stale.get(i), reread.get(i));
                }
            }
        }

        List<Table> tables = new ArrayList<>(results.size());
        for (ReadResult result : results) {
            tables.add(result.table());
        }
        return Table.concat(tables);
    }

    private List<ReadResult> readRanges(CsvReader reader, List<CsvOptions> rangeOptions) throws IOException {
        List<CompletableFuture<ReadResult>> futures = new ArrayList<>(rangeOptions.size());
        for (CsvOptions options : rangeOptions) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return reader.readRange(options, true);
                }
                catch (IOException e) {
                    throw new UncheckedIOException("Failed to read byte range " + options.byteRange(), e);
                }
            }, context.executor()));
        }

        List<ReadResult> results = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<ReadResult> future : futures) {
                results.add(future.join());
            }
        }
        catch (CompletionException e) {
            for (CompletableFuture<ReadResult> future : futures) {
                future.cancel(true);
            }
            throw unwrap(e);
        }
        return results;
    }

    /**
     * The type of each inferred column over all ranges, null for columns with an explicit
     * type; null if no column is inferred.
     */
    private static DType[] settledTypes(List<ReadResult> results) {
        TypeInference[] merged = results.get(0).inferences();
        boolean inferred = false;
        for (int c = 0; c < merged.length; c++) {
            if (merged[c] != null) {
                inferred = true;
                for (ReadResult result : results.subList(1, results.size())) {
                    merged[c].merge(result.inferences()[c]);
                }
            }
        }
        if (!inferred) {
            return null;
        }
        DType[] types = new DType[merged.length];
        for (int c = 0; c < merged.length; c++) {
            types[c] = merged[c] != null ? merged[c].result() : null;
        }
        return types;
    }

    private static boolean hasTypes(Table table, DType[] settled) {
        for (int c = 0; c < settled.length; c++) {
            if (settled[c] != null && table.schema().getColumn(c).type() != settled[c]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Options for the ranges after the first: its column names and delimiter.
     */
    private static CsvOptions pinned(CsvOptions options, ReadResult first) {
        CsvOptions.Builder builder = options.toBuilder();
        if (options.names() == null) {
            builder.names(first.columnNames());
        }
        if (options.sniffDelimiter()) {
            Dialect dialect = first.dialect();
            builder.sniffDelimiter(false);
            if (dialect.whitespace()) {
                builder.delimWhitespace(true);
            }
            else {
                builder.delimiter((char) dialect.delimiter());
            }
        }
        return builder.build();
    }

    private static IOException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof UncheckedIOException unchecked) {
            return unchecked.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IOException(cause);
    }

    /**
     * Get the executor service used by this instance.
     */
    public ExecutorService executor() {
        return context.executor();
    }

    @Override
    public void close() {
        context.close();
    }
}
