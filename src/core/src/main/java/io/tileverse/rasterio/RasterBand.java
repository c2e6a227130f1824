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

import java.nio.ByteBuffer;

/**
 * A handle on a single band of a {@link RasterDataset}.
 *
 * @see RasterDataset#getBand(int)
 */
public interface RasterBand {

    /**
     * @return the dataset this band belongs to
     */
    RasterDataset getDataset();

    /**
     * @return the 1-based band number within its dataset
     */
    int getBandNumber();

    default int getWidth() {
        return getDataset().getWidth();
    }

    default int getHeight() {
        return getDataset().getHeight();
    }

    default DataType getDataType() {
        return getDataset().getDataType(getBandNumber());
    }

    /**
     * Reads a window of this band.
     *
     * @param window the window and buffer layout
     * @param buffer the destination buffer
     * @throws RasterIOException see {@link RasterDataset#read(RasterWindow, BandSelection, ByteBuffer)}
     */
    default void read(RasterWindow window, ByteBuffer buffer) throws RasterIOException {
        getDataset().read(window, BandSelection.of(getBandNumber()), buffer);
    }

    /**
     * Writes a window of this band.
     *
     * @param window the window and buffer layout
     * @param buffer the source buffer
     * @throws RasterIOException see {@link RasterDataset#write(RasterWindow, BandSelection, ByteBuffer)}
     */
    default void write(RasterWindow window, ByteBuffer buffer) throws RasterIOException {
        getDataset().write(window, BandSelection.of(getBandNumber()), buffer);
    }
}
