/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.source;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * A byte-producing CSV input: a local file, an in-memory buffer or a stream.
 *
 * <pre>{@code
 * CsvSource.of(Path.of("trades.csv.gz")).withCompression(Compression.INFER);
 * CsvSource.of("a,b\n1,2\n");
 * CsvSource.of(inputStream).withCompression(Compression.ZSTD);
 * }</pre>
 *
 * <p>Path sources are memory-mapped when uncompressed and support byte ranges
 * without reading the preceding bytes. Streams are consumed once.</p>
 */
public sealed interface CsvSource permits CsvSource.PathSource, CsvSource.BytesSource, CsvSource.StreamSource {

    Compression compression();

    /**
     * Returns a source reading the same bytes with the given compression.
     */
    CsvSource withCompression(Compression compression);

    /**
     * A short label used in log messages, events and exception messages.
     */
    String description();

    static CsvSource of(Path path) {
        return new PathSource(path, Compression.INFER);
    }

    static CsvSource of(byte[] bytes) {
        return new BytesSource(bytes, Compression.NONE);
    }

    /**
     * A source over the UTF-8 encoding of the given text.
     */
    static CsvSource of(String text) {
        return new BytesSource(text.getBytes(StandardCharsets.UTF_8), Compression.NONE);
    }

    static CsvSource of(InputStream stream) {
        return new StreamSource(stream, Compression.NONE);
    }

    record PathSource(Path path, Compression compression) implements CsvSource {

        public PathSource {
            if (path == null) {
                throw new IllegalArgumentException("Path cannot be null");
            }
            if (compression == null) {
                throw new IllegalArgumentException("Compression cannot be null");
            }
        }

        /**
         * The compression after resolving {@link Compression#INFER} against the file name.
         */
        public Compression effectiveCompression() {
            Path fileName = path.getFileName();
            return compression.resolve(fileName != null ? fileName.toString() : null);
        }

        @Override
        public CsvSource withCompression(Compression compression) {
            return new PathSource(path, compression);
        }

        @Override
        public String description() {
            return path.toString();
        }
    }

    record BytesSource(byte[] bytes, Compression compression) implements CsvSource {

        public BytesSource {
            if (bytes == null) {
                throw new IllegalArgumentException("Bytes cannot be null");
            }
            if (compression == null) {
                throw new IllegalArgumentException("Compression cannot be null");
            }
        }

        @Override
        public CsvSource withCompression(Compression compression) {
            return new BytesSource(bytes, compression);
        }

        @Override
        public String description() {
            return "(buffer of " + bytes.length + " bytes)";
        }
    }

    record StreamSource(InputStream stream, Compression compression) implements CsvSource {

        public StreamSource {
            if (stream == null) {
                throw new IllegalArgumentException("Stream cannot be null");
            }
            if (compression == null) {
                throw new IllegalArgumentException("Compression cannot be null");
            }
        }

        @Override
        public CsvSource withCompression(Compression compression) {
            return new StreamSource(stream, compression);
        }

        @Override
        public String description() {
            return "(stream)";
        }
    }
}
