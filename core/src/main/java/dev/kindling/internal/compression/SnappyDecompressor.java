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

import org.xerial.snappy.SnappyFramedInputStream;

/**
 * Decompressor for the Snappy framing format (files with the {@code .sz} extension).
 */
public class SnappyDecompressor implements Decompressor {

    @Override
    public InputStream decompress(InputStream compressed) throws IOException {
        return new SnappyFramedInputStream(compressed);
    }

    @Override
    public String getName() {
        return "SNAPPY";
    }
}
