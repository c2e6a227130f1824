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
import io.tileverse.rasterio.RasterDataset;
import io.tileverse.rasterio.RasterIOException;
import io.tileverse.rasterio.RasterWindow;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * A {@link RasterDataset} whose backend can decode incrementally and report progress
 * while the caller polls.
 *
 * <pre>{@code
 * try (AsyncReadRequest request = dataset.beginAsyncRead(window, BandSelection.all(), buffer)) {
 *     AsyncPollResult result;
 *     do {
 *         result = request.getNextUpdatedRegion(Duration.ofMillis(500));
 *         if (result.status() == AsyncStatus.UPDATE) {
 *             try (BufferGuard guard = request.lockBuffer()) {
 *                 // consume result.region() from guard.buffer()
 *             }
 *         }
 *     } while (result.status() != AsyncStatus.COMPLETE && result.status() != AsyncStatus.ERROR);
 * }
 * }</pre>
 *
 * @see AsyncRasterCopier
 */
public interface ProgressiveRasterDataset extends RasterDataset {

    /**
     * @return the parameters understood by {@link #beginAsyncRead(RasterWindow, BandSelection, ByteBuffer, AsyncReadOptions)}
     */
    List<RasterParameter<?>> getAsyncParameters();

    /**
     * Begins a progressive read of a window into {@code buffer}.
     * <p>
     * The request is validated exactly like
     * {@link RasterDataset#read(RasterWindow, BandSelection, ByteBuffer)} before any decode
     * starts. The caller keeps ownership of {@code buffer}, must not access it outside a
     * {@link BufferGuard} until the request is closed, and must close the request.
     *
     * @param window the window and buffer layout
     * @param bands the band selection
     * @param buffer the destination buffer
     * @param options request options
     * @return the started request, in the PENDING state
     * @throws RasterIOException {@link RasterIOException.Kind#INVALID_ARGUMENT} or
     *     {@link RasterIOException.Kind#OUT_OF_RANGE} on validation failure,
     *     {@link RasterIOException.Kind#BACKEND} if decoding cannot be started
     */
    AsyncReadRequest beginAsyncRead(RasterWindow window, BandSelection bands, ByteBuffer buffer, AsyncReadOptions options)
            throws RasterIOException;

    /**
     * Begins a progressive read using the {@link #getAsyncParameters() default options}.
     *
     * @param window the window and buffer layout
     * @param bands the band selection
     * @param buffer the destination buffer
     * @return the started request
     * @throws RasterIOException see {@link #beginAsyncRead(RasterWindow, BandSelection, ByteBuffer, AsyncReadOptions)}
     */
    default AsyncReadRequest beginAsyncRead(RasterWindow window, BandSelection bands, ByteBuffer buffer)
            throws RasterIOException {
        return beginAsyncRead(window, bands, buffer, AsyncReadOptions.withDefaults(getAsyncParameters()));
    }
}
