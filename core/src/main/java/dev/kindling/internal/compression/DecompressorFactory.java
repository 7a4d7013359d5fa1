/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.compression;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import dev.kindling.source.Compression;

/**
 * Factory for creating decompressor instances based on the source compression.
 */
public class DecompressorFactory {

    private static final Logger LOG = System.getLogger(DecompressorFactory.class.getName());

    private static volatile boolean gzipLogged = false;

    /**
     * Get a decompressor for the given compression.
     *
     * @param compression the resolved compression of a source
     * @return the appropriate decompressor
     * @throws UnsupportedOperationException if the required library is missing
     * @throws IllegalArgumentException if the compression has not been resolved
     */
    public Decompressor getDecompressor(Compression compression) {
        return switch (compression) {
            case NONE -> new UncompressedDecompressor();
            case INFER -> throw new IllegalArgumentException("Compression must be resolved before decompressing");
            case GZIP -> {
                logGzipDecompressor("java.util.zip");
                yield new GzipDecompressor();
            }
            case BZIP2 -> {
                checkClassAvailable("org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream",
                        "BZIP2",
                        "org.apache.commons:commons-compress");
                yield new Bzip2Decompressor();
            }
            case SNAPPY -> {
                checkClassAvailable("org.xerial.snappy.Snappy",
                        "SNAPPY",
                        "org.xerial.snappy:snappy-java");
                yield new SnappyDecompressor();
            }
            case ZSTD -> {
                checkClassAvailable("com.github.luben.zstd.Zstd",
                        "ZSTD",
                        "com.github.luben:zstd-jni");
                yield new ZstdDecompressor();
            }
            case LZ4 -> {
                checkClassAvailable("net.jpountz.lz4.LZ4Factory",
                        "LZ4",
                        "org.lz4:lz4-java");
                yield new Lz4Decompressor();
            }
            case BROTLI -> {
                checkClassAvailable("com.aayushatharva.brotli4j.Brotli4jLoader",
                        "BROTLI",
                        "com.aayushatharva.brotli4j:brotli4j");
                yield new BrotliDecompressor();
            }
        };
    }

    static void checkClassAvailable(String className, String codecName, String dependency) {
        try {
            Class.forName(className);
        }
        catch (ClassNotFoundException e) {
            throw new UnsupportedOperationException(
                    "Cannot read " + codecName + "-compressed CSV input: required library not found. " +
                            "Add the following dependency to your project: " + dependency);
        }
    }

    private static void logGzipDecompressor(String name) {
        if (!gzipLogged) {
            gzipLogged = true;
            LOG.log(Level.INFO, "Using GZIP decompressor: {0}", name);
        }
    }
}
