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

import net.jpountz.lz4.LZ4FrameInputStream;

/**
 * Decompressor for the LZ4 frame format, as written by the {@code lz4} command line tool.
 */
public class Lz4Decompressor implements Decompressor {

    @Override
    public InputStream decompress(InputStream compressed) throws IOException {
        return new LZ4FrameInputStream(compressed);
    }

    @Override
    public String getName() {
        return "LZ4";
    }
}
