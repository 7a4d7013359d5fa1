/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.tokenizer;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamByteInputTest {

    @Test
    void testReadsAllBytes() throws IOException {
        byte[] bytes = sequence(200_000);
        StreamByteInput input = new StreamByteInput(new ByteArrayInputStream(bytes), 8);

        for (int i = 0; i < bytes.length; i++) {
            assertThat(input.get(i)).isEqualTo(bytes[i] & 0xFF);
        }
        assertThat(input.get(bytes.length)).isEqualTo(ByteInput.EOF);
        assertThat(input.size()).isEqualTo(bytes.length);
    }

    @Test
    void testSizeUnknownBeforeEnd() throws IOException {
        StreamByteInput input = new StreamByteInput(new ByteArrayInputStream(sequence(10)));

        input.get(0);

        assertThat(input.size()).isEqualTo(-1);
    }

    @Test
    void testLookAheadBeyondReleasedPosition() throws IOException {
        byte[] bytes = sequence(300_000);
        StreamByteInput input = new StreamByteInput(new ByteArrayInputStream(bytes), 8);

        input.release(100_000);

        assertThat(input.get(250_000)).isEqualTo(bytes[250_000] & 0xFF);
        assertThat(input.get(100_000)).isEqualTo(bytes[100_000] & 0xFF);
    }

    @Test
    void testReleasedBytesCannotBeRead() throws IOException {
        byte[] bytes = sequence(300_000);
        StreamByteInput input = new StreamByteInput(new ByteArrayInputStream(bytes), 8);

        input.get(10);
        input.release(200_000);
        input.get(299_999);

        assertThatThrownBy(() -> input.get(0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already been released");
    }

    @Test
    void testBufferInput() {
        BufferByteInput input = BufferByteInput.of(new byte[]{ 'a', (byte) 0xE2 });

        assertThat(input.size()).isEqualTo(2);
        assertThat(input.get(0)).isEqualTo('a');
        assertThat(input.get(1)).isEqualTo(0xE2);
        assertThat(input.get(2)).isEqualTo(ByteInput.EOF);
    }

    private static byte[] sequence(int length) {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = (byte) (i * 31);
        }
        return bytes;
    }
}
