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
package io.tileverse.rasterio.mem;

import io.tileverse.rasterio.DataType;
import io.tileverse.rasterio.RasterTransfer;
import io.tileverse.rasterio.RasterWindow;
import io.tileverse.rasterio.async.BufferRegion;
import io.tileverse.rasterio.async.DecodeSink;
import io.tileverse.rasterio.async.DestinationBuffer;
import io.tileverse.rasterio.async.ProgressiveDecoder;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Progressive decoder of a {@link MemoryRasterDataset} window.
 * <p>
 * Copies the window in bursts of {@code burstLines} lines. In direct mode each burst is
 * written into the destination buffer by the decoder thread under the buffer lock; in
 * staged mode it is copied to a native staging area and converted by the polling thread.
 */
@Slf4j
class MemoryDecoder implements ProgressiveDecoder {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final MemoryRasterDataset dataset;
    private final RasterTransfer transfer;
    private final int burstLines;
    private final int burstDelayMillis;
    private final boolean staged;
    private final boolean partialRegions;
    private final Executor executor;

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);

    /** Staged native window lines, one buffer per band slot. */
    private final ByteBuffer[] staging;

    private volatile int stagedLines;
    private int convertedLines;

    MemoryDecoder(
            MemoryRasterDataset dataset,
            RasterTransfer transfer,
            int burstLines,
            int burstDelayMillis,
            boolean staged,
            boolean partialRegions,
            Executor executor) {
        this.dataset = dataset;
        this.transfer = transfer;
        this.burstLines = burstLines;
        this.burstDelayMillis = burstDelayMillis;
        this.staged = staged;
        this.partialRegions = partialRegions;
        this.executor = executor;
        this.staging = staged ? allocateStaging() : null;
    }

    private ByteBuffer[] allocateStaging() {
        final RasterWindow w = transfer.window();
        ByteBuffer[] buffers = new ByteBuffer[transfer.bandCount()];
        for (int slot = 0; slot < buffers.length; slot++) {
            int band = transfer.bands().band(slot);
            buffers[slot] = ByteBuffer.allocate(w.xSize() * w.ySize() * dataset.getDataType(band).size())
                    .order(dataset.nativeByteOrder(band));
        }
        return buffers;
    }

    @Override
    public void start(DecodeSink sink) throws IOException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Decoder already started");
        }
        Runnable task = () -> run(sink);
        if (executor == null) {
            Thread thread = new Thread(task, "memory-raster-decoder-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            thread.start();
            return;
        }
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            stopped.countDown();
            throw new IOException("Decoder executor rejected the request", e);
        }
    }

    private void run(DecodeSink sink) {
        final int lines = transfer.window().ySize();
        try {
            for (int first = 0; first < lines; first += burstLines) {
                if (isCancelled(sink) || !pause()) {
                    log.debug("Decode of {} cancelled at line {}", dataset.getDescription(), first);
                    return;
                }
                final int end = Math.min(lines, first + burstLines);
                final boolean finalBlock = end == lines;
                if (staged) {
                    stage(first, end);
                    sink.refresh(finalBlock);
                } else {
                    final ByteBuffer[] burst = readBurst(first, end);
                    final int burstStart = first;
                    sink.deliver(
                            partialRegions ? bufferRegion(first, end) : null,
                            destination -> store(destination, burst, burstStart, end),
                            finalBlock);
                }
                log.trace("Decoded window lines [{}, {}) of {}", first, end, dataset.getDescription());
            }
        } catch (IOException | RuntimeException e) {
            sink.fail(e);
        } finally {
            stopped.countDown();
        }
    }

    private boolean isCancelled(DecodeSink sink) {
        return cancelled.get() || sink.isCancelled();
    }

    private boolean pause() {
        if (burstDelayMillis == 0) {
            return true;
        }
        try {
            Thread.sleep(burstDelayMillis);
            return !cancelled.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ByteBuffer[] readBurst(int first, int end) throws IOException {
        final RasterWindow w = transfer.window();
        ByteBuffer[] burst = new ByteBuffer[transfer.bandCount()];
        for (int slot = 0; slot < burst.length; slot++) {
            final int band = transfer.bands().band(slot);
            final int lineBytes = w.xSize() * dataset.getDataType(band).size();
            burst[slot] = ByteBuffer.allocate((end - first) * lineBytes).order(dataset.nativeByteOrder(band));
            for (int line = first; line < end; line++) {
                dataset.copyLine(band, w.yOff() + line, w.xOff(), w.xSize(), burst[slot], (line - first) * lineBytes);
            }
        }
        return burst;
    }

    private void store(DestinationBuffer destination, ByteBuffer[] burst, int first, int end) {
        final RasterWindow w = transfer.window();
        for (int slot = 0; slot < burst.length; slot++) {
            final DataType type = dataset.getDataType(transfer.bands().band(slot));
            final int lineBytes = w.xSize() * type.size();
            for (int line = first; line < end; line++) {
                destination.storeWindowLine(slot, line, burst[slot], (line - first) * lineBytes, type);
            }
        }
    }

    private void stage(int first, int end) throws IOException {
        final RasterWindow w = transfer.window();
        for (int slot = 0; slot < staging.length; slot++) {
            final int band = transfer.bands().band(slot);
            final int lineBytes = w.xSize() * dataset.getDataType(band).size();
            for (int line = first; line < end; line++) {
                dataset.copyLine(band, w.yOff() + line, w.xOff(), w.xSize(), staging[slot], line * lineBytes);
            }
        }
        stagedLines = end;
    }

    /**
     * Converts the lines staged since the previous call. Runs on the polling thread with the
     * buffer lock held.
     */
    @Override
    public void transferStaged(DestinationBuffer destination) {
        if (!staged) {
            throw new UnsupportedOperationException("Decoder is not staged");
        }
        final int available = stagedLines;
        final RasterWindow w = transfer.window();
        for (int slot = 0; slot < staging.length; slot++) {
            final DataType type = dataset.getDataType(transfer.bands().band(slot));
            final int lineBytes = w.xSize() * type.size();
            for (int line = convertedLines; line < available; line++) {
                destination.storeWindowLine(slot, line, staging[slot], line * lineBytes, type);
            }
        }
        convertedLines = available;
    }

    /**
     * @return the buffer lines fed by window lines {@code [first, end)}, or {@code null} if decimation skips them all
     */
    private BufferRegion bufferRegion(int first, int end) {
        final RasterWindow w = transfer.window();
        int bufFirst = -1;
        int bufEnd = -1;
        for (int bufLine = 0; bufLine < w.bufYSize(); bufLine++) {
            int windowLine = transfer.sourceLine(bufLine) - w.yOff();
            if (windowLine >= first && windowLine < end) {
                if (bufFirst < 0) {
                    bufFirst = bufLine;
                }
                bufEnd = bufLine + 1;
            }
        }
        return bufFirst < 0 ? null : BufferRegion.lines(w.bufXSize(), bufFirst, bufEnd - bufFirst);
    }

    @Override
    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        if (!started.get()) {
            return true;
        }
        return stopped.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
