/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import java.io.ByteArrayInputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import dev.kindling.internal.tokenizer.BufferByteInput;
import dev.kindling.internal.tokenizer.StreamByteInput;
import dev.kindling.reader.ByteRange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowBoundaryScannerTest {

    @Test
    void testFirstRowStart() throws Exception {
        BufferByteInput input = new BufferByteInput(ByteBuffer.wrap("ab\ncd\nef\n".getBytes(StandardCharsets.UTF_8)));

        assertThat(RowBoundaryScanner.firstRowStart(input, null)).isZero();
        assertThat(RowBoundaryScanner.firstRowStart(input, new ByteRange(0, 4))).isZero();
        assertThat(RowBoundaryScanner.firstRowStart(input, new ByteRange(1, 4))).isEqualTo(3);
        assertThat(RowBoundaryScanner.firstRowStart(input, new ByteRange(3, 4))).isEqualTo(3);
        assertThat(RowBoundaryScanner.firstRowStart(input, new ByteRange(4, 4))).isEqualTo(6);
        assertThat(RowBoundaryScanner.firstRowStart(input, new ByteRange(8, 4))).isEqualTo(9);
    }

    @Test
    void testStreamPrefixIsNotRetained() throws Exception {
        byte[] bytes = new byte[1_000_000];
        Arrays.fill(bytes, (byte) 'a');
        bytes[700_000] = '\n';
        StreamByteInput input = new StreamByteInput(new ByteArrayInputStream(bytes));

        long start = RowBoundaryScanner.firstRowStart(input, new ByteRange(500_000, 100));

        assertThat(start).isEqualTo(700_001);
        assertThat(input.get(start)).isEqualTo('a');
        assertThatThrownBy(() -> input.get(0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("released");
    }

    @Test
    void testWindowEnd() {
        assertThat(RowBoundaryScanner.windowEnd(null, 100)).isEqualTo(Long.MAX_VALUE);
        assertThat(RowBoundaryScanner.windowEnd(new ByteRange(10, 20), 100)).isEqualTo(30);
        assertThat(RowBoundaryScanner.windowEnd(new ByteRange(90, 20), 100)).isEqualTo(100);
        assertThat(RowBoundaryScanner.windowEnd(new ByteRange(90, 20), -1)).isEqualTo(110);
    }
}
