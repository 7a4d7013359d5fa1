/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.compression;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;

/**
 * Decompressor for BZIP2 files, backed by Apache Commons Compress.
 */
public class Bzip2Decompressor implements Decompressor {

    @Override
    public InputStream decompress(InputStream compressed) throws IOException {
        // concatenated streams, as written by pbzip2
        return new BZip2CompressorInputStream(new BufferedInputStream(compressed), true);
    }

    @Override
    public String getName() {
        return "BZIP2";
    }
}
