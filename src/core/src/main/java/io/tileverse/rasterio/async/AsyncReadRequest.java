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
package io.tileverse.rasterio.async;

import static java.util.Objects.requireNonNull;

import io.tileverse.rasterio.BandSelection;
import io.tileverse.rasterio.RasterDataset;
import io.tileverse.rasterio.RasterIOException;
import io.tileverse.rasterio.RasterTransfer;
import io.tileverse.rasterio.RasterWindow;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * An in-flight progressive read of a window into a caller owned buffer.
 * <p>
 * Requests are created by {@link ProgressiveRasterDataset#beginAsyncRead} and must be
 * released with {@link #close()}. A single {@link ReentrantLock} guards both the request
 * state and the destination buffer: the decoder writes into the buffer while holding it,
 * and the caller must hold it, through a {@link BufferGuard}, to read the buffer
 * coherently.
 * <p>
 * State transitions:
 *
 * <pre>
 * PENDING          --(data delivered)-------> UPDATE_AVAILABLE
 * UPDATE_AVAILABLE --(poll consumes)--------> PENDING, or COMPLETE if the final block was delivered
 * any              --(decode failure)-------> ERROR
 * </pre>
 *
 * {@code COMPLETE} and {@code ERROR} are terminal and entered at most once. Notifications
 * arriving afterwards, or after {@link #close()}, are ignored.
 */
@Slf4j
public final class AsyncReadRequest implements AutoCloseable {

    private final RasterDataset dataset;
    private final RasterTransfer transfer;
    private final ProgressiveDecoder decoder;
    private final Duration endTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final DestinationBuffer destination;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean cancelled;

    // guarded by lock
    private boolean updateReady;
    private boolean complete;
    private boolean ended;
    private boolean stagedPending;
    private boolean fullBufferPending;
    private BufferRegion pendingRegion;
    private RasterIOException error;

    private AsyncReadRequest(
            RasterDataset dataset, RasterTransfer transfer, ProgressiveDecoder decoder, AsyncReadOptions options) {
        this.dataset = requireNonNull(dataset, "dataset");
        this.transfer = requireNonNull(transfer, "transfer");
        this.decoder = requireNonNull(decoder, "decoder");
        this.endTimeout = requireNonNull(options, "options").endTimeout();
        this.destination = new DestinationBuffer(transfer, lock);
    }

    /**
     * Creates a request in the PENDING state and starts its decoder.
     *
     * @param dataset the dataset being read, which must outlive the request
     * @param transfer the validated transfer
     * @param decoder the backend decoder
     * @param options request options
     * @return the started request
     * @throws RasterIOException {@link RasterIOException.Kind#BACKEND} if the decoder fails to start
     */
    public static AsyncReadRequest start(
            RasterDataset dataset, RasterTransfer transfer, ProgressiveDecoder decoder, AsyncReadOptions options)
            throws RasterIOException {
        AsyncReadRequest request = new AsyncReadRequest(dataset, transfer, decoder, options);
        try {
            decoder.start(request.new Sink());
        } catch (IOException e) {
            decoder.cancel();
            throw RasterIOException.backend("Failed to start progressive decode of " + dataset.getDescription(), e, 0);
        }
        log.debug("Started async read {} on {}", transfer, dataset.getDescription());
        return request;
    }

    /**
     * Waits for the next buffer update.
     * <p>
     * Returns {@link AsyncStatus#UPDATE} as soon as the decoder delivered data since the
     * previous poll, with the union of the regions it reported (the whole buffer when
     * it reported none); {@link AsyncStatus#COMPLETE} once the final update has been
     * consumed, on every subsequent call; {@link AsyncStatus#ERROR} once a decode failure
     * was latched; {@link AsyncStatus#PENDING} if none of these happens within
     * {@code timeout}, or if the buffer lock cannot be acquired within it.
     * <p>
     * When the decoder stages its output, the staged data is converted into the
     * destination buffer by this call, while holding the buffer lock.
     *
     * @param timeout maximum time to wait; negative waits without bound, zero only checks
     * @return the poll result
     * @throws InterruptedException if the calling thread is interrupted while waiting
     * @throws IllegalStateException if the request was closed, or the calling thread holds a
     *     {@link BufferGuard} of this request
     */
    public AsyncPollResult getNextUpdatedRegion(Duration timeout) throws InterruptedException {
        requireNonNull(timeout, "timeout");
        checkOpen();
        if (lock.isHeldByCurrentThread()) {
            // waiting would release the guard and let the decoder write into the buffer
            throw new IllegalStateException("Cannot poll for updates while holding the buffer lock");
        }
        final boolean unbounded = timeout.isNegative();
        final long start = System.nanoTime();
        final long budget = unbounded ? Long.MAX_VALUE : timeout.toNanos();
        if (!acquire(timeout)) {
            log.trace("Buffer lock busy, poll pending");
            return AsyncPollResult.pending();
        }
        try {
            long remaining = unbounded ? Long.MAX_VALUE : budget - (System.nanoTime() - start);
            while (true) {
                if (ended) {
                    throw new IllegalStateException("Async read request is closed");
                }
                if (error != null) {
                    return AsyncPollResult.error(error);
                }
                if (updateReady) {
                    break;
                }
                if (complete) {
                    return AsyncPollResult.complete();
                }
                if (unbounded) {
                    changed.await();
                } else if (remaining <= 0) {
                    return AsyncPollResult.pending();
                } else {
                    remaining = changed.awaitNanos(remaining);
                }
            }
            return consumeUpdate();
        } finally {
            lock.unlock();
        }
    }

    private AsyncPollResult consumeUpdate() {
        final RasterWindow w = transfer.window();
        final BufferRegion region = fullBufferPending || pendingRegion == null
                ? BufferRegion.full(w.bufXSize(), w.bufYSize())
                : pendingRegion;
        updateReady = false;
        fullBufferPending = false;
        pendingRegion = null;
        if (stagedPending) {
            stagedPending = false;
            try {
                decoder.transferStaged(destination);
            } catch (IOException | RuntimeException e) {
                latch(e);
                return AsyncPollResult.error(error);
            }
        }
        log.debug("Update {} (complete: {})", region, complete);
        return AsyncPollResult.update(region);
    }

    /**
     * @return the current state
     */
    public AsyncReadState getState() {
        lock.lock();
        try {
            if (error != null) {
                return AsyncReadState.ERROR;
            }
            if (updateReady) {
                return AsyncReadState.UPDATE_AVAILABLE;
            }
            return complete ? AsyncReadState.COMPLETE : AsyncReadState.PENDING;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the latched decode failure, if any
     */
    public Optional<RasterIOException> getError() {
        lock.lock();
        try {
            return Optional.ofNullable(error);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Acquires exclusive access to the destination buffer, waiting as long as needed.
     *
     * @return a guard releasing the lock when closed
     * @throws IllegalStateException if the request was closed
     */
    public BufferGuard lockBuffer() {
        checkOpen();
        lock.lock();
        return new BufferGuard(transfer, lock);
    }

    /**
     * Tries to acquire exclusive access to the destination buffer.
     *
     * @param timeout maximum time to wait; negative waits without bound, zero only checks
     * @return a guard, or empty if the lock could not be acquired in time
     * @throws InterruptedException if interrupted while waiting
     * @throws IllegalStateException if the request was closed
     */
    public Optional<BufferGuard> tryLockBuffer(Duration timeout) throws InterruptedException {
        requireNonNull(timeout, "timeout");
        checkOpen();
        return acquire(timeout) ? Optional.of(new BufferGuard(transfer, lock)) : Optional.empty();
    }

    public RasterDataset getDataset() {
        return dataset;
    }

    /**
     * @return the resolved window
     */
    public RasterWindow getWindow() {
        return transfer.window();
    }

    /**
     * @return the resolved band selection
     */
    public BandSelection getBands() {
        return transfer.bands();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Ends the request: stops accepting decoder notifications, cancels the decoder and
     * waits, up to {@link AsyncReadOptions#END_TIMEOUT_MILLIS}, for it to stop writing.
     * Safe in any state and idempotent. The caller's buffer is left untouched.
     * <p>
     * Must not be called while holding a {@link BufferGuard} of this request.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        cancelled = true;
        lock.lock();
        try {
            ended = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        decoder.cancel();
        try {
            if (!decoder.awaitStopped(endTimeout)) {
                log.warn(
                        "Decoder of {} did not stop within {} ms after cancellation",
                        dataset.getDescription(),
                        endTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the decoder of {} to stop", dataset.getDescription());
        }
        log.debug("Ended async read {} on {}", transfer, dataset.getDescription());
    }

    private boolean acquire(Duration timeout) throws InterruptedException {
        if (timeout.isNegative()) {
            lock.lockInterruptibly();
            return true;
        }
        if (timeout.isZero()) {
            return lock.tryLock();
        }
        return lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Async read request is closed");
        }
    }

    // requires lock
    private boolean acceptsNotifications(String what) {
        if (ended || error != null || complete) {
            log.debug("Ignoring {} on {} request", what, ended ? "ended" : error != null ? "failed" : "completed");
            return false;
        }
        return true;
    }

    // requires lock
    private void markUpdated(BufferRegion region, boolean finalBlock) {
        updateReady = true;
        if (region == null) {
            fullBufferPending = true;
        } else {
            pendingRegion = region.union(pendingRegion);
        }
        if (finalBlock) {
            complete = true;
        }
        changed.signalAll();
    }

    // requires lock
    private void latch(Throwable cause) {
        error = cause instanceof RasterIOException rioe
                ? rioe
                : RasterIOException.backend("Progressive decode of %s failed: %s"
                        .formatted(dataset.getDescription(), cause.getMessage()), cause, -1);
        updateReady = false;
        log.debug("Async read of {} failed", dataset.getDescription(), cause);
        changed.signalAll();
    }

    private class Sink implements DecodeSink {

        @Override
        public void deliver(BufferRegion region, DecodedDataWriter writer, boolean finalBlock) {
            lock.lock();
            try {
                if (!acceptsNotifications("delivery")) {
                    return;
                }
                final RasterWindow w = transfer.window();
                if (region != null && !region.fits(w.bufXSize(), w.bufYSize())) {
                    latch(new IllegalArgumentException(
                            "Delivered region %s exceeds buffer of %dx%d".formatted(region, w.bufXSize(), w.bufYSize())));
                    return;
                }
                if (writer != null) {
                    try {
                        writer.write(destination);
                    } catch (IOException | RuntimeException e) {
                        latch(e);
                        return;
                    }
                }
                markUpdated(region, finalBlock);
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void refresh(boolean finalBlock) {
            lock.lock();
            try {
                if (acceptsNotifications("refresh")) {
                    stagedPending = true;
                    markUpdated(null, finalBlock);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void fail(Throwable cause) {
            requireNonNull(cause, "cause");
            lock.lock();
            try {
                if (acceptsNotifications("failure")) {
                    latch(cause);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
