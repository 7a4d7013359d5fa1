/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.compression;

import java.io.IOException;
import java.io.InputStream;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.decoder.BrotliInputStream;

/**
 * Decompressor for Brotli streams.
 */
public class BrotliDecompressor implements Decompressor {

    private static volatile boolean initialized = false;

    private static synchronized void ensureInitialized() throws IOException {
        if (!initialized) {
            try {
                Brotli4jLoader.ensureAvailability();
                initialized = true;
            }
            catch (UnsatisfiedLinkError e) {
                throw new IOException("Failed to load Brotli native library: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public InputStream decompress(InputStream compressed) throws IOException {
        ensureInitialized();
        return new BrotliInputStream(compressed);
    }

    @Override
    public String getName() {
        return "BROTLI";
    }
}
