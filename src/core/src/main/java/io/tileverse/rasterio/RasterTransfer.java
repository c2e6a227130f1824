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

import java.nio.ByteBuffer;

/**
 * A validated transfer between a raster and a caller buffer: the resolved window,
 * the resolved band selection and the buffer origin.
 * <p>
 * Instances are only obtained through {@link #prepare}, which performs every check of
 * the windowed transfer contract, so holders can move lines without further validation.
 * The caller buffer's position at preparation time is the transfer origin; its
 * position and limit are never modified afterwards.
 */
public final class RasterTransfer {

    private final RasterWindow window;
    private final BandSelection bands;
    private final ByteBuffer buffer;
    private final int origin;
    private final boolean wrap;

    private RasterTransfer(RasterWindow window, BandSelection bands, ByteBuffer buffer, boolean wrap) {
        this.window = window;
        this.bands = bands;
        this.buffer = buffer;
        this.origin = buffer.position();
        this.wrap = wrap;
    }

    /**
     * Validates a transfer request against a raster extent.
     *
     * @param rasterWidth raster width in pixels
     * @param rasterHeight raster height in lines
     * @param bandCount number of bands of the raster
     * @param window the requested window
     * @param bands the requested band selection
     * @param buffer the caller buffer
     * @param forRead whether samples will be written into {@code buffer}
     * @param wrap whether integer narrowing wraps around instead of saturating
     * @return the validated transfer
     * @throws RasterIOException {@link RasterIOException.Kind#INVALID_ARGUMENT} for malformed sizes, strides, bands
     *     or buffers, {@link RasterIOException.Kind#OUT_OF_RANGE} if the window exceeds the raster
     */
    public static RasterTransfer prepare(
            int rasterWidth,
            int rasterHeight,
            int bandCount,
            RasterWindow window,
            BandSelection bands,
            ByteBuffer buffer,
            boolean forRead,
            boolean wrap)
            throws RasterIOException {
        requireNonNull(window, "window");
        requireNonNull(bands, "bands");
        requireNonNull(buffer, "buffer");

        final RasterWindow resolved = window.resolve();
        if (resolved.xOff() < 0
                || resolved.yOff() < 0
                || resolved.xOff() > rasterWidth - resolved.xSize()
                || resolved.yOff() > rasterHeight - resolved.ySize()) {
            throw RasterIOException.outOfRange(
                    "Access window out of range. Requested (%d,%d) of size %dx%d on raster of %dx%d."
                            .formatted(
                                    resolved.xOff(),
                                    resolved.yOff(),
                                    resolved.xSize(),
                                    resolved.ySize(),
                                    rasterWidth,
                                    rasterHeight));
        }
        final BandSelection selection = bands.resolve(bandCount);
        if (forRead && buffer.isReadOnly()) {
            throw RasterIOException.invalidArgument("Cannot read into a read-only buffer");
        }
        long required = resolved.requiredBytes(selection.count());
        if (required > buffer.remaining()) {
            throw RasterIOException.invalidArgument(
                    "Buffer has insufficient remaining capacity: %d < %d".formatted(buffer.remaining(), required));
        }
        return new RasterTransfer(resolved, selection, buffer, wrap);
    }

    /**
     * @return the window, with explicit strides
     */
    public RasterWindow window() {
        return window;
    }

    /**
     * @return the explicit band selection
     */
    public BandSelection bands() {
        return bands;
    }

    /**
     * @return the number of buffer band slots
     */
    public int bandCount() {
        return bands.count();
    }

    /**
     * @return the caller buffer
     */
    public ByteBuffer buffer() {
        return buffer;
    }

    /**
     * @param slot buffer band slot
     * @param bufLine buffer line
     * @param bufPixel buffer column
     * @return the absolute byte index of the sample in the caller buffer
     */
    public int offset(int slot, int bufLine, int bufPixel) {
        return origin + slot * window.bandSpace() + bufLine * window.lineSpace() + bufPixel * window.pixelSpace();
    }

    /**
     * @param bufLine a buffer line
     * @return the source raster line that feeds it
     */
    public int sourceLine(int bufLine) {
        return window.yOff() + SampleConverter.nearest(bufLine, window.bufYSize(), window.ySize());
    }

    /**
     * @param windowLine a line of the window, relative to {@code yOff}
     * @return the buffer line that feeds it on write
     */
    public int bufferLine(int windowLine) {
        return SampleConverter.nearest(windowLine, window.ySize(), window.bufYSize());
    }

    /**
     * Stores one source line into a buffer line, converting and resampling horizontally.
     *
     * @param slot buffer band slot
     * @param bufLine buffer line
     * @param source buffer holding {@code window.xSize()} packed native samples
     * @param sourceIndex absolute index of the first native sample
     * @param nativeType native sample type
     */
    public void storeLine(int slot, int bufLine, ByteBuffer source, int sourceIndex, DataType nativeType) {
        SampleConverter.copyResampled(
                source,
                sourceIndex,
                nativeType,
                nativeType.size(),
                window.xSize(),
                buffer,
                offset(slot, bufLine, 0),
                window.bufType(),
                window.pixelSpace(),
                window.bufXSize(),
                wrap);
    }

    /**
     * Gathers the buffer samples feeding one window line into a packed native line.
     *
     * @param slot buffer band slot
     * @param windowLine window line, relative to {@code yOff}
     * @param target buffer receiving {@code window.xSize()} packed native samples
     * @param targetIndex absolute index of the first native sample
     * @param nativeType native sample type
     */
    public void loadLine(int slot, int windowLine, ByteBuffer target, int targetIndex, DataType nativeType) {
        SampleConverter.copyResampled(
                buffer,
                offset(slot, bufferLine(windowLine), 0),
                window.bufType(),
                window.pixelSpace(),
                window.bufXSize(),
                target,
                targetIndex,
                nativeType,
                nativeType.size(),
                window.xSize(),
                wrap);
    }

    @Override
    public String toString() {
        return "RasterTransfer[" + window + ", " + bands + "]";
    }
}
