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
import java.util.zip.GZIPInputStream;

/**
 * Decompressor for GZIP files, including files of several concatenated members.
 */
public class GzipDecompressor implements Decompressor {

    private static final int BUFFER_SIZE = 64 * 1024;

    @Override
    public InputStream decompress(InputStream compressed) throws IOException {
        return new GZIPInputStream(compressed, BUFFER_SIZE);
    }

    @Override
    public String getName() {
        return "GZIP";
    }
}
