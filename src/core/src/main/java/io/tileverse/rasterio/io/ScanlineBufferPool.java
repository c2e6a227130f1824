/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.rasterio.io;

import static java.util.Objects.requireNonNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe pool of heap {@link ByteBuffer}s used as scanline staging areas.
 * <p>
 * Every line transferred between a backend and a caller buffer goes through a
 * staging buffer holding one line of native samples. Reusing those buffers avoids
 * one allocation per line for large windows.
 * <p>
 * Borrowed buffers are cleared, their limit is set to the requested size and their
 * byte order to the requested order. The pool keeps at most {@code maxBuffers}
 * buffers; returned buffers beyond that, or smaller than {@code minBufferSize}, are
 * discarded.
 *
 * <pre>{@code
 * ScanlineBufferPool pool = ScanlineBufferPool.getDefault();
 * ByteBuffer line = pool.borrow(width * type.size(), ByteOrder.LITTLE_ENDIAN);
 * try {
 *     // decode one line into it
 * } finally {
 *     pool.returnBuffer(line);
 * }
 * }</pre>
 */
public class ScanlineBufferPool {

    private static final Logger logger = LoggerFactory.getLogger(ScanlineBufferPool.class);

    /** Default maximum number of pooled buffers. */
    public static final int DEFAULT_MAX_BUFFERS = 64;

    /** Default minimum size of a pooled buffer (1KB). */
    public static final int DEFAULT_MIN_BUFFER_SIZE = 1024;

    private static final ScanlineBufferPool DEFAULT_INSTANCE = new ScanlineBufferPool();

    private final ConcurrentLinkedQueue<ByteBuffer> buffers = new ConcurrentLinkedQueue<>();
    private final AtomicInteger bufferCount = new AtomicInteger();

    private final int maxBuffers;
    private final int minBufferSize;

    private final AtomicLong buffersCreated = new AtomicLong();
    private final AtomicLong buffersReused = new AtomicLong();
    private final AtomicLong buffersReturned = new AtomicLong();
    private final AtomicLong buffersDiscarded = new AtomicLong();

    /**
     * Creates a pool with default limits.
     */
    public ScanlineBufferPool() {
        this(DEFAULT_MAX_BUFFERS, DEFAULT_MIN_BUFFER_SIZE);
    }

    /**
     * Creates a pool with custom limits.
     *
     * @param maxBuffers maximum number of buffers kept in the pool
     * @param minBufferSize buffers smaller than this are not pooled
     * @throws IllegalArgumentException if either argument is not positive
     */
    public ScanlineBufferPool(int maxBuffers, int minBufferSize) {
        if (maxBuffers <= 0) {
            throw new IllegalArgumentException("maxBuffers must be positive: " + maxBuffers);
        }
        if (minBufferSize <= 0) {
            throw new IllegalArgumentException("minBufferSize must be positive: " + minBufferSize);
        }
        this.maxBuffers = maxBuffers;
        this.minBufferSize = minBufferSize;
        logger.debug("Created ScanlineBufferPool: maxBuffers={}, minSize={}", maxBuffers, minBufferSize);
    }

    /**
     * @return the shared pool
     */
    public static ScanlineBufferPool getDefault() {
        return DEFAULT_INSTANCE;
    }

    /**
     * Borrows a buffer able to hold {@code size} bytes.
     *
     * @param size required size in bytes
     * @param order byte order the buffer must use
     * @return a cleared buffer with its limit set to {@code size}
     * @throws IllegalArgumentException if size is negative
     */
    public ByteBuffer borrow(int size, ByteOrder order) {
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative: " + size);
        }
        requireNonNull(order, "order");
        ByteBuffer buffer = findSuitableBuffer(size);
        if (buffer != null) {
            buffersReused.incrementAndGet();
            logger.trace("Reused scanline buffer: capacity={}", buffer.capacity());
        } else {
            buffer = ByteBuffer.allocate(Math.max(size, minBufferSize));
            buffersCreated.incrementAndGet();
            logger.trace("Created scanline buffer: requested={}, capacity={}", size, buffer.capacity());
        }
        buffer.clear().limit(size);
        return buffer.order(order);
    }

    /**
     * Returns a buffer to the pool. The caller must not use it afterwards.
     *
     * @param buffer the buffer, {@code null} is ignored
     */
    public void returnBuffer(ByteBuffer buffer) {
        if (buffer == null) {
            return;
        }
        buffer.clear();
        if (buffer.isDirect() || buffer.isReadOnly() || buffer.capacity() < minBufferSize) {
            buffersDiscarded.incrementAndGet();
            return;
        }
        if (bufferCount.get() < maxBuffers) {
            buffers.offer(buffer);
            bufferCount.incrementAndGet();
            buffersReturned.incrementAndGet();
        } else {
            buffersDiscarded.incrementAndGet();
            logger.trace("Discarded scanline buffer (pool full): capacity={}", buffer.capacity());
        }
    }

    /**
     * Drops every pooled buffer.
     */
    public void clear() {
        int cleared = 0;
        while (buffers.poll() != null) {
            cleared++;
        }
        bufferCount.set(0);
        logger.debug("Cleared scanline pool: {} buffers", cleared);
    }

    /**
     * @return a snapshot of the pool counters
     */
    public PoolStatistics getStatistics() {
        return new PoolStatistics(
                bufferCount.get(),
                maxBuffers,
                buffersCreated.get(),
                buffersReused.get(),
                buffersReturned.get(),
                buffersDiscarded.get());
    }

    /**
     * Takes the first pooled buffer of at least {@code size} bytes. Smaller buffers polled
     * on the way are offered back to the pool.
     */
    private ByteBuffer findSuitableBuffer(int size) {
        List<ByteBuffer> undersized = null;
        ByteBuffer found = null;
        ByteBuffer buffer;
        while ((buffer = buffers.poll()) != null) {
            bufferCount.decrementAndGet();
            if (buffer.capacity() >= size) {
                found = buffer;
                break;
            }
            if (undersized == null) {
                undersized = new ArrayList<>();
            }
            undersized.add(buffer);
        }
        if (undersized != null) {
            for (ByteBuffer small : undersized) {
                buffers.offer(small);
                bufferCount.incrementAndGet();
            }
        }
        return found;
    }

    @Override
    public String toString() {
        PoolStatistics stats = getStatistics();
        return String.format(
                "ScanlineBufferPool[buffers=%d/%d, created=%d, reused=%d, returned=%d, discarded=%d]",
                stats.currentBuffers(),
                stats.maxBuffers(),
                stats.buffersCreated(),
                stats.buffersReused(),
                stats.buffersReturned(),
                stats.buffersDiscarded());
    }

    /**
     * Immutable snapshot of the pool counters.
     *
     * @param currentBuffers buffers currently pooled
     * @param maxBuffers pool capacity
     * @param buffersCreated buffers allocated by {@link #borrow}
     * @param buffersReused borrows satisfied from the pool
     * @param buffersReturned buffers accepted back into the pool
     * @param buffersDiscarded buffers dropped (pool full, too small or not reusable)
     */
    public record PoolStatistics(
            int currentBuffers,
            int maxBuffers,
            long buffersCreated,
            long buffersReused,
            long buffersReturned,
            long buffersDiscarded) {

        /**
         * @return percentage of borrows satisfied from the pool
         */
        public double hitRate() {
            long total = buffersCreated + buffersReused;
            return total > 0 ? (buffersReused * 100.0) / total : 0.0;
        }
    }
}
