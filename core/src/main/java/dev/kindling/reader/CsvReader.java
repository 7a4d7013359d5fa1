/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import dev.kindling.internal.reader.CsvReadTask;
import dev.kindling.internal.reader.FileMappingEvent;
import dev.kindling.internal.reader.ReadResult;
import dev.kindling.internal.tokenizer.BufferByteInput;
import dev.kindling.internal.tokenizer.StreamByteInput;
import dev.kindling.source.Compression;
import dev.kindling.source.CsvSource;
import dev.kindling.table.Table;

/**
 * Reader for individual CSV inputs.
 *
 * <p>For single-input usage:</p>
 * <pre>{@code
 * try (CsvReader reader = CsvReader.open(path)) {
 *     Table table = reader.read(CsvOptions.builder().delimiter('|').build());
 *     // ...
 * }
 * }</pre>
 *
 * <p>Uncompressed files are memory-mapped once and can be read repeatedly, e.g. in several
 * byte ranges. Compressed inputs are decompressed while reading, once per read. Stream
 * sources can be read only once and are closed by the read.</p>
 *
 * <p>For partitioned reads with a shared thread pool, use {@link Kindling}.</p>
 */
public class CsvReader implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(CsvReader.class.getName());

    private static final int STREAM_BUFFER_SIZE = 64 * 1024;

    private final CsvSource source;
    private final Compression compression;
    private final FileChannel channel;
    private final ByteBuffer buffer;
    private final KindlingContext context;
    private final boolean ownsContext;
    private boolean streamConsumed;

    private CsvReader(CsvSource source, Compression compression, FileChannel channel, ByteBuffer buffer,
                      KindlingContext context, boolean ownsContext) {
        this.source = source;
        this.compression = compression;
        this.channel = channel;
        this.buffer = buffer;
        this.context = context;
        this.ownsContext = ownsContext;
    }

    /**
     * Open a CSV file with a dedicated context; the compression is derived from the file name.
     * The context is closed when this reader is closed.
     *
     * @throws FileNotFoundException if the path does not exist or is a directory
     */
    public static CsvReader open(Path path) throws IOException {
        return open(CsvSource.of(path));
    }

    /**
     * Open a CSV source with a dedicated context.
     * The context is closed when this reader is closed.
     *
     * @throws FileNotFoundException if the source is a path that does not exist or is a directory
     */
    public static CsvReader open(CsvSource source) throws IOException {
        KindlingContext context = KindlingContext.create();
        try {
            return open(source, context, true);
        }
        catch (IOException | RuntimeException e) {
            context.close();
            throw e;
        }
    }

    /**
     * Open a CSV source with a shared context.
     * The context is NOT closed when this reader is closed.
     */
    static CsvReader open(CsvSource source, KindlingContext context) throws IOException {
        return open(source, context, false);
    }

    private static CsvReader open(CsvSource source, KindlingContext context, boolean ownsContext) throws IOException {
        if (source instanceof CsvSource.PathSource pathSource) {
            Path path = pathSource.path();
            checkReadable(path);
            Compression compression = pathSource.effectiveCompression();
            if (compression != Compression.NONE) {
                LOG.log(System.Logger.Level.DEBUG, "Reading ''{0}'' as {1}-compressed input", path, compression);
                return new CsvReader(source, compression, null, null, context, ownsContext);
            }
            return openMapped(pathSource, context, ownsContext);
        }
        if (source instanceof CsvSource.BytesSource bytesSource) {
            Compression compression = bytesSource.compression().resolve(null);
            ByteBuffer buffer = compression == Compression.NONE ? ByteBuffer.wrap(bytesSource.bytes()) : null;
            return new CsvReader(source, compression, null, buffer, context, ownsContext);
        }
        Compression compression = source.compression().resolve(null);
        return new CsvReader(source, compression, null, null, context, ownsContext);
    }

    private static CsvReader openMapped(CsvSource.PathSource source, KindlingContext context, boolean ownsContext) throws IOException {
        Path path = source.path();
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            long fileSize = channel.size();
            if (fileSize > Integer.MAX_VALUE) {
                LOG.log(System.Logger.Level.DEBUG, "File ''{0}'' exceeds the mappable size, reading it as a stream", path);
                channel.close();
                return new CsvReader(source, Compression.NONE, null, null, context, ownsContext);
            }

            FileMappingEvent event = new FileMappingEvent();
            event.begin();

            MappedByteBuffer mapping = channel.map(FileChannel.MapMode.READ_ONLY, 0, fileSize);

            event.path = path.toString();
            event.offset = 0;
            event.size = fileSize;
            event.commit();

            return new CsvReader(source, Compression.NONE, channel, mapping, context, ownsContext);
        }
        catch (Exception e) {
            // Close channel if there was an error during initialization
            try {
                channel.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    private static void checkReadable(Path path) throws FileNotFoundException {
        if (Files.isDirectory(path)) {
            throw new FileNotFoundException(path + " (Is a directory)");
        }
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException(path + " (No such file)");
        }
    }

    /**
     * Read one CSV file with the given options.
     */
    public static Table read(Path path, CsvOptions options) throws IOException {
        return read(CsvSource.of(path), options);
    }

    /**
     * Read one CSV source with the given options.
     */
    public static Table read(CsvSource source, CsvOptions options) throws IOException {
        try (CsvReader reader = open(source)) {
            return reader.read(options);
        }
    }

    /**
     * Read the input with default options.
     */
    public Table read() throws IOException {
        return read(CsvOptions.defaults());
    }

    /**
     * Read the input, or the byte range set in the options, into a table.
     *
     * @throws ConversionException if a field does not convert to its column type
     * @throws MalformedQuotingException if a quoted field is not closed
     * @throws EmptyInputException if column types are to be inferred but there are no data rows
     */
    public Table read(CsvOptions options) throws IOException {
        return readRange(options, false).table();
    }

    ReadResult readRange(CsvOptions options, boolean partial) throws IOException {
        if (buffer != null) {
            return new CsvReadTask(new BufferByteInput(buffer.duplicate()), options, source.description(), partial).read();
        }
        try (InputStream stream = openStream()) {
            return new CsvReadTask(new StreamByteInput(stream), options, source.description(), partial).read();
        }
    }

    /**
     * The size of the input in bytes if it is resident, -1 for compressed and stream inputs.
     */
    public long size() {
        return buffer != null ? buffer.limit() : -1;
    }

    /**
     * Whether the input is resident, so that byte ranges can be read without scanning the
     * bytes before them.
     */
    boolean isResident() {
        return buffer != null;
    }

    /**
     * Reads all (decompressed) bytes of a non-resident input.
     */
    byte[] readAllBytes() throws IOException {
        try (InputStream stream = openStream()) {
            return stream.readAllBytes();
        }
    }

    private InputStream openStream() throws IOException {
        InputStream raw;
        if (source instanceof CsvSource.PathSource pathSource) {
            raw = new BufferedInputStream(Files.newInputStream(pathSource.path()), STREAM_BUFFER_SIZE);
        }
        else if (source instanceof CsvSource.BytesSource bytesSource) {
            raw = new ByteArrayInputStream(bytesSource.bytes());
        }
        else {
            synchronized (this) {
                if (streamConsumed) {
                    throw new IllegalStateException("Stream source has already been read");
                }
                streamConsumed = true;
            }
            raw = ((CsvSource.StreamSource) source).stream();
        }
        try {
            return context.decompressorFactory().getDecompressor(compression).decompress(raw);
        }
        catch (IOException | RuntimeException e) {
            try {
                raw.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    public CsvSource source() {
        return source;
    }

    @Override
    public void close() throws IOException {
        // Only close context if we created it
        // When opened via Kindling, the context is closed when Kindling is closed
        if (ownsContext) {
            context.close();
        }

        if (channel != null) {
            channel.close();
        }
    }
}
