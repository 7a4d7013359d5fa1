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

/**
 * Decodes a compressed byte stream into the plain CSV bytes.
 */
public interface Decompressor {

    /**
     * Wrap the given compressed stream. Closing the returned stream closes the given one.
     *
     * @param compressed the compressed input
     * @return a stream of the decompressed bytes
     * @throws IOException if the stream header cannot be read
     */
    InputStream decompress(InputStream compressed) throws IOException;

    /**
     * Get the name of this decompressor.
     */
    String getName();
}
