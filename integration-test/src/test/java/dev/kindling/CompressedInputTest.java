/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.xerial.snappy.SnappyFramedOutputStream;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.encoder.BrotliOutputStream;
import com.github.luben.zstd.ZstdOutputStream;

import dev.kindling.reader.ColumnSelection;
import dev.kindling.reader.CsvOptions;
import dev.kindling.reader.CsvReader;
import dev.kindling.schema.DType;
import dev.kindling.source.Compression;
import dev.kindling.source.CsvSource;
import dev.kindling.table.Column;
import dev.kindling.table.Table;
import net.jpountz.lz4.LZ4FrameOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests reading compressed CSV files, with the compression derived from the
 * file name or given explicitly.
 */
class CompressedInputTest {

    private static final Path TRADES = Paths.get("src/test/resources/trades.csv");

    @TempDir
    Path tempDir;

    @Test
    void readPlainFile() throws Exception {
        assertTrades(CsvReader.read(TRADES, CsvOptions.defaults()));
    }

    @Test
    void readGzipFile() throws Exception {
        Path file = compress("trades.csv.gz", GZIPOutputStream::new);

        assertTrades(CsvReader.read(file, CsvOptions.defaults()));
    }

    @Test
    void readBzip2File() throws Exception {
        Path file = compress("trades.csv.bz2", BZip2CompressorOutputStream::new);

        assertTrades(CsvReader.read(file, CsvOptions.defaults()));
    }

    @Test
    void readZstdFile() throws Exception {
        Path file = compress("trades.csv.zst", ZstdOutputStream::new);

        assertTrades(CsvReader.read(file, CsvOptions.defaults()));
    }

    @Test
    void readSnappyFile() throws Exception {
        Path file = compress("trades.csv.snappy", SnappyFramedOutputStream::new);

        assertTrades(CsvReader.read(file, CsvOptions.defaults()));
    }

    @Test
    void readLz4File() throws Exception {
        Path file = compress("trades.csv.lz4", LZ4FrameOutputStream::new);

        assertTrades(CsvReader.read(file, CsvOptions.defaults()));
    }

    @Test
    void readWithExplicitCompression() throws Exception {
        Path file = compress("trades.data", ZstdOutputStream::new);

        Table table = CsvReader.read(CsvSource.of(file).withCompression(Compression.ZSTD), CsvOptions.defaults());

        assertTrades(table);
    }

    @Test
    void readCompressedStream() throws Exception {
        Path file = compress("trades.csv.gz", GZIPOutputStream::new);

        try (InputStream stream = Files.newInputStream(file)) {
            Table table = CsvReader.read(CsvSource.of(stream).withCompression(Compression.GZIP), CsvOptions.defaults());

            assertTrades(table);
        }
    }

    @Test
    void readCompressedFileWithRowLimit() throws Exception {
        Path file = compress("trades.csv.bz2", BZip2CompressorOutputStream::new);

        Table table = CsvReader.read(file, CsvOptions.builder()
                .nrows(10)
                .useColumns(ColumnSelection.names("trade_id", "side"))
                .build());

        assertThat(table.rowCount()).isEqualTo(10);
        assertThat(table.columnNames()).containsExactly("trade_id", "side");
        assertThat(table.getValue("side", 2)).isEqualTo("SELL");
    }

    @Test
    void readBrotliFile() throws Exception {
        Brotli4jLoader.ensureAvailability();
        Path file = compress("trades.csv.br", BrotliOutputStream::new);

        assertTrades(CsvReader.read(file, CsvOptions.defaults()));
    }

    private static void assertTrades(Table table) {
        assertThat(table.rowCount()).isEqualTo(250);
        assertThat(table.columnNames())
                .containsExactly("trade_id", "symbol", "price", "quantity", "side", "trade_date", "settled");
        assertThat(table.schema().getColumn("trade_id").type()).isEqualTo(DType.INT64);
        assertThat(table.schema().getColumn("symbol").type()).isEqualTo(DType.STR);
        assertThat(table.schema().getColumn("price").type()).isEqualTo(DType.FLOAT64);
        assertThat(table.schema().getColumn("trade_date").type()).isEqualTo(DType.DATE);
        assertThat(table.schema().getColumn("settled").type()).isEqualTo(DType.BOOL);

        Column.Int64Column quantity = (Column.Int64Column) table.column("quantity");
        long totalQuantity = 0;
        for (int row = 0; row < table.rowCount(); row++) {
            totalQuantity += quantity.get(row);
        }
        assertThat(totalQuantity).isEqualTo(117125);

        Column.Float64Column price = (Column.Float64Column) table.column("price");
        double totalPrice = 0;
        for (int row = 0; row < table.rowCount(); row++) {
            if (!price.isNull(row)) {
                totalPrice += price.get(row);
            }
        }
        assertThat(price.nullCount()).isEqualTo(5);
        assertThat(totalPrice).isEqualTo(39906.25);

        assertThat(table.column("settled").nullCount()).isZero();
        assertThat(((Column.DateColumn) table.column("trade_date")).getDateTime(0))
                .isEqualTo(LocalDateTime.of(2024, 2, 2, 0, 0));
        assertThat(table.getValue("symbol", 249)).isEqualTo("AAPL");
    }

    private Path compress(String fileName, CompressorFactory factory) throws IOException {
        Path file = tempDir.resolve(fileName);
        try (OutputStream out = factory.create(Files.newOutputStream(file))) {
            Files.copy(TRADES, out);
        }
        return file;
    }

    @FunctionalInterface
    private interface CompressorFactory {
        OutputStream create(OutputStream out) throws IOException;
    }
}
