/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.compression;

import java.io.InputStream;

/**
 * Pass-through for plain sources.
 */
public class UncompressedDecompressor implements Decompressor {

    @Override
    public InputStream decompress(InputStream compressed) {
        return compressed;
    }

    @Override
    public String getName() {
        return "NONE";
    }
}
