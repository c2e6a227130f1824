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

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Format agnostic access to a multi-band raster through windowed, strided transfers.
 * <p>
 * A transfer moves {@code bufXSize × bufYSize × bandCount} samples between the raster
 * and a caller owned {@link ByteBuffer} described by a {@link RasterWindow}, converting
 * between the raster's native sample types and the window's buffer type. The caller
 * owns the buffer; implementations never touch bytes outside the extent computed by
 * {@link RasterWindow#requiredBytes(int)} from the buffer's position.
 * <p>
 * All implementations MUST be thread-safe: independent transfers may run concurrently
 * from several threads against the same dataset.
 *
 * @see AbstractRasterDataset
 */
public interface RasterDataset extends Closeable {

    /**
     * @return the raster width in pixels
     */
    int getWidth();

    /**
     * @return the raster height in lines
     */
    int getHeight();

    /**
     * @return the number of bands
     */
    int getBandCount();

    /**
     * @param band 1-based band number
     * @return the native sample type of the band
     * @throws IllegalArgumentException if the band does not exist
     */
    DataType getDataType(int band);

    /**
     * Reads a window of the selected bands into {@code buffer}.
     * <p>
     * Bands are processed in selection order and lines top to bottom. If the backend
     * fails on a line, lines already stored remain valid and the call fails immediately
     * with {@link RasterIOException.Kind#BACKEND}.
     *
     * @param window the window and buffer layout
     * @param bands the band selection
     * @param buffer the destination buffer
     * @throws RasterIOException {@link RasterIOException.Kind#INVALID_ARGUMENT} or
     *     {@link RasterIOException.Kind#OUT_OF_RANGE} before any backend access, or
     *     {@link RasterIOException.Kind#BACKEND} on decode failure
     */
    void read(RasterWindow window, BandSelection bands, ByteBuffer buffer) throws RasterIOException;

    /**
     * Reads a window of all bands.
     *
     * @param window the window and buffer layout
     * @param buffer the destination buffer
     * @throws RasterIOException see {@link #read(RasterWindow, BandSelection, ByteBuffer)}
     */
    default void read(RasterWindow window, ByteBuffer buffer) throws RasterIOException {
        read(window, BandSelection.all(), buffer);
    }

    /**
     * Writes a window of the selected bands from {@code buffer}.
     * <p>
     * On success every written line is durable or buffered by the backend.
     *
     * @param window the window and buffer layout
     * @param bands the band selection
     * @param buffer the source buffer
     * @throws RasterIOException {@link RasterIOException.Kind#INVALID_ARGUMENT} or
     *     {@link RasterIOException.Kind#OUT_OF_RANGE} before any backend access, or
     *     {@link RasterIOException.Kind#BACKEND} on encode failure or if the dataset is read-only
     */
    void write(RasterWindow window, BandSelection bands, ByteBuffer buffer) throws RasterIOException;

    /**
     * Writes a window of all bands.
     *
     * @param window the window and buffer layout
     * @param buffer the source buffer
     * @throws RasterIOException see {@link #write(RasterWindow, BandSelection, ByteBuffer)}
     */
    default void write(RasterWindow window, ByteBuffer buffer) throws RasterIOException {
        write(window, BandSelection.all(), buffer);
    }

    /**
     * @return whether {@link #write} is supported
     */
    default boolean isWritable() {
        return false;
    }

    /**
     * Returns a handle on one band of this dataset.
     *
     * @param band 1-based band number
     * @return a band view backed by this dataset
     * @throws IllegalArgumentException if the band does not exist
     */
    default RasterBand getBand(int band) {
        if (band < 1 || band > getBandCount()) {
            throw new IllegalArgumentException(
                    "Band %d does not exist on dataset with %d bands".formatted(band, getBandCount()));
        }
        return new DatasetBand(this, band);
    }

    /**
     * Gets a description of the data source, used for logging and error messages.
     *
     * @return the description
     */
    String getDescription();

    /**
     * Releases any resource held by this dataset. Idempotent.
     */
    @Override
    void close() throws IOException;
}
