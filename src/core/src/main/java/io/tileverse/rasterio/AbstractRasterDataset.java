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
package io.tileverse.rasterio;

import static java.util.Objects.requireNonNull;

import io.tileverse.rasterio.io.ScanlineBufferPool;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class implementing the windowed transfer contract on top of
 * single-line native access.
 * <p>
 * {@link #read(RasterWindow, BandSelection, ByteBuffer)} and
 * {@link #write(RasterWindow, BandSelection, ByteBuffer)} handle every common concern
 * (validation, default strides, band mapping, type conversion, nearest neighbour
 * resampling, partial failure reporting) and delegate the actual data access to
 * {@link #readLineNative} and {@link #writeLineNative}, which only ever see one
 * in-range line of packed native samples.
 * <p>
 * <strong>Parameter Guarantees:</strong> when the line methods are called,
 * {@code 1 <= band <= getBandCount()}, {@code 0 <= line < getHeight()},
 * {@code xOff >= 0}, {@code xSize > 0}, {@code xOff + xSize <= getWidth()} and the
 * line buffer is cleared with its limit set to {@code xSize * getDataType(band).size()}
 * and its byte order set to {@link #nativeByteOrder(int)}.
 */
@Slf4j
public abstract class AbstractRasterDataset implements RasterDataset {

    private final ScanlineBufferPool bufferPool;

    /**
     * Creates a dataset using the {@link ScanlineBufferPool#getDefault() shared} line buffer pool.
     */
    protected AbstractRasterDataset() {
        this(ScanlineBufferPool.getDefault());
    }

    /**
     * Creates a dataset using the given line buffer pool.
     *
     * @param bufferPool the pool staging lines are borrowed from
     */
    protected AbstractRasterDataset(ScanlineBufferPool bufferPool) {
        this.bufferPool = requireNonNull(bufferPool, "bufferPool");
    }

    @Override
    public final void read(RasterWindow window, BandSelection bands, ByteBuffer buffer) throws RasterIOException {
        final RasterTransfer transfer = prepareTransfer(window, bands, buffer, true);
        log.trace("read {} from {}", transfer, getDescription());

        final RasterWindow w = transfer.window();
        int completed = 0;
        for (int slot = 0; slot < transfer.bandCount(); slot++) {
            final int band = transfer.bands().band(slot);
            final DataType nativeType = getDataType(band);
            final int lineBytes = w.xSize() * nativeType.size();
            final ByteBuffer line = bufferPool.borrow(lineBytes, nativeByteOrder(band));
            try {
                int loaded = -1;
                for (int bufLine = 0; bufLine < w.bufYSize(); bufLine++) {
                    final int sourceLine = transfer.sourceLine(bufLine);
                    if (sourceLine != loaded) {
                        line.clear().limit(lineBytes);
                        try {
                            readLineNative(band, sourceLine, w.xOff(), w.xSize(), line);
                        } catch (IOException e) {
                            throw RasterIOException.backend(
                                    "Failed to read line %d of band %d from %s"
                                            .formatted(sourceLine, band, getDescription()),
                                    e,
                                    completed);
                        }
                        loaded = sourceLine;
                    }
                    transfer.storeLine(slot, bufLine, line, 0, nativeType);
                    completed++;
                }
            } finally {
                bufferPool.returnBuffer(line);
            }
        }
    }

    @Override
    public final void write(RasterWindow window, BandSelection bands, ByteBuffer buffer) throws RasterIOException {
        final RasterTransfer transfer = prepareTransfer(window, bands, buffer, false);
        if (!isWritable()) {
            throw RasterIOException.backend("Write not permitted on read-only dataset " + getDescription(), null, 0);
        }
        log.trace("write {} to {}", transfer, getDescription());

        final RasterWindow w = transfer.window();
        int completed = 0;
        for (int slot = 0; slot < transfer.bandCount(); slot++) {
            final int band = transfer.bands().band(slot);
            final DataType nativeType = getDataType(band);
            final int lineBytes = w.xSize() * nativeType.size();
            final ByteBuffer line = bufferPool.borrow(lineBytes, nativeByteOrder(band));
            try {
                for (int windowLine = 0; windowLine < w.ySize(); windowLine++) {
                    line.clear().limit(lineBytes);
                    transfer.loadLine(slot, windowLine, line, 0, nativeType);
                    try {
                        writeLineNative(band, w.yOff() + windowLine, w.xOff(), w.xSize(), line);
                    } catch (IOException e) {
                        throw RasterIOException.backend(
                                "Failed to write line %d of band %d to %s"
                                        .formatted(w.yOff() + windowLine, band, getDescription()),
                                e,
                                completed);
                    }
                    completed++;
                }
            } finally {
                bufferPool.returnBuffer(line);
            }
        }
        try {
            flushWrites();
        } catch (IOException e) {
            throw RasterIOException.backend("Failed to flush writes to " + getDescription(), e, completed);
        }
    }

    /**
     * Validates a transfer against this dataset, exactly as {@link #read} and {@link #write} do.
     * Progressive backends use it to validate asynchronous requests.
     *
     * @param window the requested window
     * @param bands the band selection
     * @param buffer the caller buffer
     * @param forRead whether samples will be stored into {@code buffer}
     * @return the validated transfer
     * @throws RasterIOException if the request is invalid or out of range
     */
    protected final RasterTransfer prepareTransfer(
            RasterWindow window, BandSelection bands, ByteBuffer buffer, boolean forRead) throws RasterIOException {
        return RasterTransfer.prepare(
                getWidth(), getHeight(), getBandCount(), window, bands, buffer, forRead, wrapsIntegerOverflow());
    }

    /**
     * Reads {@code xSize} native samples of one line into {@code target}, starting at index 0.
     *
     * @param band 1-based band number
     * @param line raster line
     * @param xOff first column
     * @param xSize number of samples
     * @param target the line buffer to fill
     * @throws IOException if the line cannot be decoded
     */
    protected abstract void readLineNative(int band, int line, int xOff, int xSize, ByteBuffer target)
            throws IOException;

    /**
     * Writes {@code xSize} native samples of one line held in {@code source} from index 0.
     * Only called when {@link #isWritable()} returns {@code true}.
     *
     * @param band 1-based band number
     * @param line raster line
     * @param xOff first column
     * @param xSize number of samples
     * @param source the line buffer
     * @throws IOException if the line cannot be encoded
     */
    protected void writeLineNative(int band, int line, int xOff, int xSize, ByteBuffer source) throws IOException {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support writing");
    }

    /**
     * Makes every line written so far durable or buffered. Called once at the end of each successful write.
     *
     * @throws IOException if pending data cannot be flushed
     */
    protected void flushWrites() throws IOException {
        // nothing buffered by default
    }

    /**
     * @param band 1-based band number
     * @return the byte order of the band's native samples, the platform order by default
     */
    protected ByteOrder nativeByteOrder(int band) {
        return ByteOrder.nativeOrder();
    }

    /**
     * Legacy backends may opt into wraparound conversion for integer narrowing.
     *
     * @return {@code true} to wrap instead of saturate, {@code false} by default
     */
    protected boolean wrapsIntegerOverflow() {
        return false;
    }

    /**
     * @return the pool line buffers are borrowed from
     */
    protected ScanlineBufferPool bufferPool() {
        return bufferPool;
    }

    /**
     * Checks a 1-based band number against {@link #getBandCount()}.
     *
     * @param band the band number
     * @throws IllegalArgumentException if the band does not exist
     */
    protected void checkBand(int band) {
        if (band < 1 || band > getBandCount()) {
            throw new IllegalArgumentException(
                    "Band %d does not exist on dataset with %d bands".formatted(band, getBandCount()));
        }
    }

    @Override
    public String toString() {
        return "%s[%s, %dx%dx%d]"
                .formatted(getClass().getSimpleName(), getDescription(), getWidth(), getHeight(), getBandCount());
    }
}
