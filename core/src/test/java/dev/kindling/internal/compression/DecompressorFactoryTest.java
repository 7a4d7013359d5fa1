/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.compression;

import org.junit.jupiter.api.Test;

import dev.kindling.source.Compression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecompressorFactoryTest {

    private final DecompressorFactory factory = new DecompressorFactory();

    @Test
    void testDecompressorPerCodec() {
        assertThat(factory.getDecompressor(Compression.NONE)).isInstanceOf(UncompressedDecompressor.class);
        assertThat(factory.getDecompressor(Compression.GZIP)).isInstanceOf(GzipDecompressor.class);
        assertThat(factory.getDecompressor(Compression.BZIP2)).isInstanceOf(Bzip2Decompressor.class);
        assertThat(factory.getDecompressor(Compression.ZSTD)).isInstanceOf(ZstdDecompressor.class);
        assertThat(factory.getDecompressor(Compression.SNAPPY)).isInstanceOf(SnappyDecompressor.class);
        assertThat(factory.getDecompressor(Compression.LZ4)).isInstanceOf(Lz4Decompressor.class);
        assertThat(factory.getDecompressor(Compression.BROTLI).getName()).isEqualTo("BROTLI");
    }

    @Test
    void testUnresolvedCompression() {
        assertThatThrownBy(() -> factory.getDecompressor(Compression.INFER))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testMissingCodecLibrary() {
        assertThatNoException().isThrownBy(() -> DecompressorFactory.checkClassAvailable(
                "com.aayushatharva.brotli4j.Brotli4jLoader", "BROTLI", "com.aayushatharva.brotli4j:brotli4j"));

        assertThatThrownBy(() -> DecompressorFactory.checkClassAvailable(
                "org.example.codec.Missing", "EXAMPLE", "org.example:codec"))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("EXAMPLE")
                .hasMessageContaining("org.example:codec");
    }
}
