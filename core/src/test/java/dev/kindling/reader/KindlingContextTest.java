/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import dev.kindling.internal.compression.GzipDecompressor;
import dev.kindling.internal.compression.UncompressedDecompressor;
import dev.kindling.source.Compression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KindlingContextTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(KindlingContext.THREADS_PROPERTY);
    }

    @Test
    void testCreateWithThreads() throws Exception {
        try (KindlingContext context = KindlingContext.create(3)) {
            assertThat(context.threads()).isEqualTo(3);
            assertThat(context.executor().submit(() -> Thread.currentThread().getName()).get())
                    .startsWith("kindling-");
        }
    }

    @Test
    void testInvalidThreadCount() {
        assertThatThrownBy(() -> KindlingContext.create(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be positive");
    }

    @Test
    void testThreadsFromProperty() {
        System.setProperty(KindlingContext.THREADS_PROPERTY, " 2 ");

        try (KindlingContext context = KindlingContext.create()) {
            assertThat(context.threads()).isEqualTo(2);
        }
    }

    @Test
    void testInvalidThreadsProperty() {
        System.setProperty(KindlingContext.THREADS_PROPERTY, "many");

        assertThatThrownBy(KindlingContext::create)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(KindlingContext.THREADS_PROPERTY);
    }

    @Test
    void testDefaultThreads() {
        assertThat(KindlingContext.configuredThreads()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    void testDecompressors() {
        try (KindlingContext context = KindlingContext.create(1)) {
            assertThat(context.decompressorFactory().getDecompressor(Compression.NONE))
                    .isInstanceOf(UncompressedDecompressor.class);
            assertThat(context.decompressorFactory().getDecompressor(Compression.GZIP))
                    .isInstanceOf(GzipDecompressor.class);
            assertThatThrownBy(() -> context.decompressorFactory().getDecompressor(Compression.INFER))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
