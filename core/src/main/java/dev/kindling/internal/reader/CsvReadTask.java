/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import dev.kindling.internal.conversion.TypeInference;
import dev.kindling.internal.conversion.ValueParser;
import dev.kindling.internal.tokenizer.ByteInput;
import dev.kindling.internal.tokenizer.DelimiterSniffer;
import dev.kindling.internal.tokenizer.Dialect;
import dev.kindling.internal.tokenizer.Row;
import dev.kindling.internal.tokenizer.Tokenizer;
import dev.kindling.reader.ByteRange;
import dev.kindling.reader.CsvOptions;
import dev.kindling.reader.EmptyInputException;
import dev.kindling.schema.ColumnSchema;
import dev.kindling.schema.DType;
import dev.kindling.schema.TableSchema;
import dev.kindling.table.Column;
import dev.kindling.table.Table;

/**
 * A single-threaded read of one input, or one byte range of it, into a {@link Table}.
 * <p>
 * Tokenizes from the first row of the range, selects header and data rows, resolves the
 * schema (sampling rows where the column count is not given), and converts the fields of
 * the selected columns. Any failure aborts the read; no partial table is returned.
 * </p>
 */
public class CsvReadTask {

    private static final System.Logger LOG = System.getLogger(CsvReadTask.class.getName());

    private final ByteInput input;
    private final CsvOptions options;
    private final String sourceName;
    private final boolean partial;

    /**
     * @param input the bytes to read
     * @param options the read options, including the byte range if any
     * @param sourceName label of the input for logging and events
     * @param partial whether this read is one of several ranges of an input; an empty
     *        result then yields an empty table instead of an {@link EmptyInputException}
     */
    public CsvReadTask(ByteInput input, CsvOptions options, String sourceName, boolean partial) {
        this.input = input;
        this.options = options;
        this.sourceName = sourceName;
        ByteRange range = options.byteRange();
        this.partial = partial || (range != null && !range.isFirst());
    }

    public ReadResult read() throws IOException {
        CsvReadEvent event = new CsvReadEvent();
        event.begin();

        ByteRange range = options.byteRange();
        boolean firstRange = range == null || range.isFirst();
        long start = RowBoundaryScanner.firstRowStart(input, range);
        long windowEnd = RowBoundaryScanner.windowEnd(range, input.size());

        Dialect dialect = Dialect.of(options);
        if (options.sniffDelimiter()) {
            dialect = DelimiterSniffer.sniff(input, dialect, start, options.sampleRows());
        }
        LOG.log(System.Logger.Level.DEBUG, "Reading ''{0}'' from offset {1} with delimiter ''{2}''",
                sourceName, start, dialect.describeDelimiter());

        Tokenizer tokenizer = new Tokenizer(input, dialect, start);
        RowSelector selector = new RowSelector(tokenizer, options, firstRange, windowEnd);
        List<String> header = selector.readHeader();

        List<Row> sampled = new ArrayList<>();
        int columnCount = SchemaResolver.explicitColumnCount(options, header);
        if (columnCount == SchemaResolver.DETECT) {
            columnCount = 0;
            Row row = new Row();
            while (sampled.size() < options.sampleRows() && selector.next(row)) {
                sampled.add(row.copy());
                columnCount = Math.max(columnCount, row.fieldCount());
            }
            LOG.log(System.Logger.Level.TRACE, "Detected {0} columns from {1} sampled rows", columnCount, sampled.size());
        }

        List<String> columnNames = SchemaResolver.columnNames(options, header, columnCount);
        ReadLayout layout = SchemaResolver.resolve(options, columnNames);

        ValueParser parser = ValueParser.create(options);
        int[] selected = layout.selected();
        ColumnAccumulator[] accumulators = new ColumnAccumulator[selected.length];
        for (int i = 0; i < selected.length; i++) {
            DType type = layout.types()[i];
            accumulators[i] = type != null
                    ? ColumnBuilder.forType(type, layout.selectedName(i), selected[i], parser)
                    : new InferringColumnBuilder(layout.selectedName(i), selected[i], parser);
        }

        long rowIndex = 0;
        long lastRowEnd = start;
        for (Row row : sampled) {
            appendRow(row, accumulators, selected, rowIndex++);
            lastRowEnd = row.endOffset();
        }
        sampled.clear();
        Row row = new Row();
        while (selector.next(row)) {
            appendRow(row, accumulators, selected, rowIndex++);
            lastRowEnd = row.endOffset();
        }

        if (selected.length == 0 && rowIndex == 0 && !partial) {
            throw new EmptyInputException();
        }

        List<ColumnSchema> schemas = new ArrayList<>(selected.length);
        List<Column> columns = new ArrayList<>(selected.length);
        TypeInference[] inferences = new TypeInference[selected.length];
        for (int i = 0; i < accumulators.length; i++) {
            Column column = accumulators[i].build(partial);
            columns.add(column);
            schemas.add(column.column());
            if (accumulators[i] instanceof InferringColumnBuilder inferring) {
                inferences[i] = inferring.inference();
            }
        }
        Table table = new Table(new TableSchema(schemas, layout.indexColumn()), columns, (int) rowIndex);

        LOG.log(System.Logger.Level.DEBUG, "Read {0} rows and {1} columns from ''{2}''",
                rowIndex, columns.size(), sourceName);

        event.source = sourceName;
        event.rangeOffset = range != null ? range.offset() : 0;
        event.bytesScanned = Math.max(0, lastRowEnd - start);
        event.rows = rowIndex;
        event.columns = columns.size();
        event.delimiter = dialect.describeDelimiter();
        event.commit();

        return new ReadResult(table, columnNames, dialect, inferences);
    }

    private static void appendRow(Row row, ColumnAccumulator[] accumulators, int[] selected, long rowIndex) throws IOException {
        byte[] data = row.data();
        int fieldCount = row.fieldCount();
        for (int i = 0; i < selected.length; i++) {
            int field = selected[i];
            if (field < fieldCount) {
                accumulators[i].append(data, row.fieldStart(field), row.fieldEnd(field), row.isQuoted(field),
                        rowIndex, row.startOffset());
            }
            else {
                accumulators[i].appendNull();
            }
        }
    }
}
