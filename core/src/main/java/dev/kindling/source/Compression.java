/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.source;

import java.util.Locale;

/**
 * Compression of a CSV source. Compressed sources are decoded while being read, so
 * the tokenizer only ever sees plain bytes.
 */
public enum Compression {
    NONE,
    /** Derive the compression from the file name extension; plain for in-memory sources. */
    INFER,
    GZIP,
    BZIP2,
    ZSTD,
    SNAPPY,
    LZ4,
    BROTLI;

    /**
     * Returns the compression indicated by the extension of the given file name, or
     * {@link #NONE} if the extension is not a known compression suffix.
     */
    public static Compression fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        if (dot < 0) {
            return NONE;
        }
        return switch (lower.substring(dot + 1)) {
            case "gz", "gzip" -> GZIP;
            case "bz2" -> BZIP2;
            case "zst", "zstd" -> ZSTD;
            case "sz", "snappy" -> SNAPPY;
            case "lz4" -> LZ4;
            case "br" -> BROTLI;
            default -> NONE;
        };
    }

    /**
     * Resolves {@link #INFER} against the given file name; other values are returned as is.
     */
    public Compression resolve(String fileName) {
        if (this != INFER) {
            return this;
        }
        return fileName != null ? fromFileName(fileName) : NONE;
    }
}
