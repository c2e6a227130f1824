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

import io.tileverse.rasterio.BandSelection;
import io.tileverse.rasterio.DataType;
import io.tileverse.rasterio.RasterTransfer;
import io.tileverse.rasterio.RasterWindow;
import java.nio.ByteBuffer;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decoder side view of a request's destination buffer.
 * <p>
 * Every mutating method requires the calling thread to hold the request's buffer lock,
 * which is the case inside {@link DecodedDataWriter#write(DestinationBuffer)} and
 * {@link ProgressiveDecoder#transferStaged(DestinationBuffer)}. Calls made without the
 * lock fail with {@link IllegalStateException}.
 */
public final class DestinationBuffer {

    private final RasterTransfer transfer;
    private final ReentrantLock lock;

    DestinationBuffer(RasterTransfer transfer, ReentrantLock lock) {
        this.transfer = transfer;
        this.lock = lock;
    }

    /**
     * @return the resolved window of the request
     */
    public RasterWindow window() {
        return transfer.window();
    }

    /**
     * @return the resolved band selection of the request
     */
    public BandSelection bands() {
        return transfer.bands();
    }

    public int bandCount() {
        return transfer.bandCount();
    }

    /**
     * Stores one line of packed native samples into one buffer line, converting and
     * resampling horizontally.
     *
     * @param slot buffer band slot
     * @param bufLine buffer line
     * @param source buffer holding {@code window().xSize()} packed native samples
     * @param sourceIndex absolute index of the first sample in {@code source}
     * @param nativeType type of the source samples
     */
    public void storeLine(int slot, int bufLine, ByteBuffer source, int sourceIndex, DataType nativeType) {
        checkHeld();
        transfer.storeLine(slot, bufLine, source, sourceIndex, nativeType);
    }

    /**
     * Stores one decoded window line into every buffer line it feeds.
     *
     * @param slot buffer band slot
     * @param windowLine window line, relative to {@code window().yOff()}
     * @param source buffer holding {@code window().xSize()} packed native samples
     * @param sourceIndex absolute index of the first sample in {@code source}
     * @param nativeType type of the source samples
     * @return the buffer lines written, or {@code null} if the window line is skipped by decimation
     */
    public BufferRegion storeWindowLine(
            int slot, int windowLine, ByteBuffer source, int sourceIndex, DataType nativeType) {
        checkHeld();
        final RasterWindow w = transfer.window();
        final int target = w.yOff() + windowLine;
        int bufLine = Math.max(0, (int) ((long) windowLine * w.bufYSize() / w.ySize()) - 1);
        while (bufLine < w.bufYSize() && transfer.sourceLine(bufLine) < target) {
            bufLine++;
        }
        final int first = bufLine;
        while (bufLine < w.bufYSize() && transfer.sourceLine(bufLine) == target) {
            transfer.storeLine(slot, bufLine, source, sourceIndex, nativeType);
            bufLine++;
        }
        return bufLine == first ? null : BufferRegion.lines(w.bufXSize(), first, bufLine - first);
    }

    /**
     * @return the caller's buffer; its position and limit must not be modified
     */
    public ByteBuffer buffer() {
        checkHeld();
        return transfer.buffer();
    }

    private void checkHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Destination buffer accessed without holding the buffer lock");
        }
    }
}
