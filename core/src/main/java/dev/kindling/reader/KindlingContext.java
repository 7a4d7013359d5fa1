/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import dev.kindling.internal.compression.DecompressorFactory;

/**
 * Context object that manages shared resources for CSV reading.
 * <p>
 * Holds the thread pool for parallel byte-range reads and the decompressor factory.
 * The pool size defaults to the number of available processors and can be set with
 * the {@code kindling.threads} system property.
 * </p>
 * <p>
 * The context lifecycle is tied to either:
 * <ul>
 *   <li>{@link Kindling} instance (for reading several inputs or partitioned reads)</li>
 *   <li>{@link CsvReader} instance (for standalone single-input usage)</li>
 * </ul>
 * </p>
 */
public final class KindlingContext implements AutoCloseable {

    static final String THREADS_PROPERTY = "kindling.threads";

    private static final System.Logger LOG = System.getLogger(KindlingContext.class.getName());

    private final ExecutorService executor;
    private final DecompressorFactory decompressorFactory;
    private final int threads;

    private KindlingContext(ExecutorService executor, int threads) {
        this.executor = executor;
        this.threads = threads;
        this.decompressorFactory = new DecompressorFactory();
    }

    /**
     * Create a new context with a thread pool sized by the {@code kindling.threads} system
     * property, or to available processors if it is not set.
     */
    public static KindlingContext create() {
        return create(configuredThreads());
    }

    /**
     * Create a new context with a thread pool of the specified size.
     */
    public static KindlingContext create(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "kindling-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);
        LOG.log(System.Logger.Level.DEBUG, "Created context with {0} threads", threads);
        return new KindlingContext(executor, threads);
    }

    static int configuredThreads() {
        String value = System.getProperty(THREADS_PROPERTY);
        if (value == null || value.isBlank()) {
            return Runtime.getRuntime().availableProcessors();
        }
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for system property " + THREADS_PROPERTY + ": " + value, e);
        }
    }

    /**
     * Get the executor service for parallel operations.
     */
    public ExecutorService executor() {
        return executor;
    }

    /**
     * Get the decompressor factory.
     */
    public DecompressorFactory decompressorFactory() {
        return decompressorFactory;
    }

    public int threads() {
        return threads;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
