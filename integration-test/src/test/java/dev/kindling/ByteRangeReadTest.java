/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.luben.zstd.ZstdOutputStream;

import dev.kindling.reader.ByteRange;
import dev.kindling.reader.CsvOptions;
import dev.kindling.reader.CsvReader;
import dev.kindling.reader.Kindling;
import dev.kindling.source.CsvSource;
import dev.kindling.table.Column;
import dev.kindling.table.Table;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests reading memory-mapped files in byte ranges, sequentially and in parallel.
 */
class ByteRangeReadTest {

    private static final int ROWS = 10_000;

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void writeFile() throws IOException {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < ROWS; i++) {
            text.append(i).append(", ").append(2 * i).append(" \n");
        }
        file = tempDir.resolve("ints.csv");
        Files.writeString(file, text.toString(), StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @MethodSource("segmentSizes")
    void readConsecutiveRanges(long segmentBytes) throws Exception {
        CsvOptions options = CsvOptions.builder().names(List.of("int1", "int2")).build();

        List<Table> parts = new ArrayList<>();
        try (CsvReader reader = CsvReader.open(file)) {
            for (ByteRange range : ByteRange.split(reader.size(), segmentBytes)) {
                parts.add(reader.read(options.withByteRange(range)));
            }
        }

        assertSequence(Table.concat(parts));
    }

    static Stream<Arguments> segmentSizes() {
        return Stream.of(
                Arguments.of(10_000L),
                Arguments.of(19_999L),
                Arguments.of(30_001L),
                Arguments.of(36_000L));
    }

    @Test
    void readPartitioned() throws Exception {
        try (Kindling kindling = Kindling.create(4)) {
            Table table = kindling.readPartitioned(CsvSource.of(file),
                    CsvOptions.builder().names(List.of("int1", "int2")).build(), 4096);

            assertSequence(table);
        }
    }

    @Test
    void readPartitionedCompressedFile() throws Exception {
        Path compressed = tempDir.resolve("ints.csv.zst");
        try (OutputStream out = new ZstdOutputStream(Files.newOutputStream(compressed))) {
            Files.copy(file, out);
        }

        try (Kindling kindling = Kindling.create(4)) {
            Table table = kindling.readPartitioned(CsvSource.of(compressed),
                    CsvOptions.builder().names(List.of("int1", "int2")).build(), 8192);

            assertSequence(table);
        }
    }

    @Test
    void readPartitionedWithHeader() throws Exception {
        Path trades = Paths.get("src/test/resources/trades.csv");

        try (Kindling kindling = Kindling.create(3)) {
            Table partitioned = kindling.readPartitioned(CsvSource.of(trades), CsvOptions.defaults(), 1024);
            Table full = CsvReader.read(trades, CsvOptions.defaults());

            assertThat(partitioned.rowCount()).isEqualTo(250);
            assertThat(partitioned.schema().isCompatibleWith(full.schema())).isTrue();
            assertThat(((Column.Float64Column) partitioned.column("price")).nullCount()).isEqualTo(5);
            assertThat(((Column.Int64Column) partitioned.column("trade_id")).values())
                    .isEqualTo(((Column.Int64Column) full.column("trade_id")).values());
        }
    }

    private static void assertSequence(Table table) {
        assertThat(table.rowCount()).isEqualTo(ROWS);
        Column.Int64Column int1 = (Column.Int64Column) table.column("int1");
        Column.Int64Column int2 = (Column.Int64Column) table.column("int2");
        for (int row = 0; row < ROWS; row++) {
            assertThat(int1.get(row)).isEqualTo(row);
            assertThat(int2.get(row)).isEqualTo(2L * row);
        }
    }
}
