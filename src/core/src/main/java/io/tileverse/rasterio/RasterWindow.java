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

/**
 * A windowed transfer request: a rectangle of the source raster, the dimensions and
 * sample type of the caller's buffer, and the byte strides describing how samples
 * are laid out in that buffer.
 * <p>
 * A stride of {@code 0} means "tightly packed": {@code pixelSpace = bufType.size()},
 * {@code lineSpace = pixelSpace * bufXSize} and {@code bandSpace = lineSpace * bufYSize}.
 * Defaults are computed once by {@link #resolve()}; an explicit non-zero stride always
 * wins over the default.
 * <p>
 * When the buffer size differs from the window size, samples are replicated or
 * decimated with nearest neighbour selection.
 *
 * @param xOff first source column
 * @param yOff first source line
 * @param xSize number of source columns
 * @param ySize number of source lines
 * @param bufXSize number of columns in the caller buffer
 * @param bufYSize number of lines in the caller buffer
 * @param bufType sample type of the caller buffer
 * @param pixelSpace byte distance between consecutive pixels of a line, 0 for default
 * @param lineSpace byte distance between consecutive lines, 0 for default
 * @param bandSpace byte distance between consecutive bands, 0 for default
 */
public record RasterWindow(
        int xOff,
        int yOff,
        int xSize,
        int ySize,
        int bufXSize,
        int bufYSize,
        DataType bufType,
        int pixelSpace,
        int lineSpace,
        int bandSpace) {

    public RasterWindow {
        requireNonNull(bufType, "bufType");
    }

    /**
     * Creates a window whose buffer has the same size as the window and packed strides.
     *
     * @param xOff first source column
     * @param yOff first source line
     * @param xSize number of columns
     * @param ySize number of lines
     * @param bufType buffer sample type
     * @return the window
     */
    public static RasterWindow of(int xOff, int yOff, int xSize, int ySize, DataType bufType) {
        return new RasterWindow(xOff, yOff, xSize, ySize, xSize, ySize, bufType, 0, 0, 0);
    }

    /**
     * Creates a window with an explicit buffer size and packed strides.
     *
     * @param xOff first source column
     * @param yOff first source line
     * @param xSize number of source columns
     * @param ySize number of source lines
     * @param bufXSize buffer columns
     * @param bufYSize buffer lines
     * @param bufType buffer sample type
     * @return the window
     */
    public static RasterWindow of(
            int xOff, int yOff, int xSize, int ySize, int bufXSize, int bufYSize, DataType bufType) {
        return new RasterWindow(xOff, yOff, xSize, ySize, bufXSize, bufYSize, bufType, 0, 0, 0);
    }

    /**
     * Returns a copy of this window with the given strides.
     *
     * @param pixelSpace pixel stride in bytes, 0 for default
     * @param lineSpace line stride in bytes, 0 for default
     * @param bandSpace band stride in bytes, 0 for default
     * @return a new window
     */
    public RasterWindow withStrides(int pixelSpace, int lineSpace, int bandSpace) {
        return new RasterWindow(
                xOff, yOff, xSize, ySize, bufXSize, bufYSize, bufType, pixelSpace, lineSpace, bandSpace);
    }

    /**
     * Returns a copy of this window moved to a different source origin.
     *
     * @param xOff the new first column
     * @param yOff the new first line
     * @return a new window
     */
    public RasterWindow withOffset(int xOff, int yOff) {
        return new RasterWindow(
                xOff, yOff, xSize, ySize, bufXSize, bufYSize, bufType, pixelSpace, lineSpace, bandSpace);
    }

    /**
     * Validates sizes and strides, and replaces zero strides with the packed defaults.
     *
     * @return a window whose strides are all explicit
     * @throws RasterIOException with {@link RasterIOException.Kind#INVALID_ARGUMENT} if a size is not positive,
     *     a stride is negative, or the pixel stride is smaller than the sample size
     */
    public RasterWindow resolve() throws RasterIOException {
        if (xSize < 1 || ySize < 1) {
            throw RasterIOException.invalidArgument(
                    "Window size must be positive, got %dx%d".formatted(xSize, ySize));
        }
        if (bufXSize < 1 || bufYSize < 1) {
            throw RasterIOException.invalidArgument(
                    "Buffer size must be positive, got %dx%d".formatted(bufXSize, bufYSize));
        }
        if (pixelSpace < 0 || lineSpace < 0 || bandSpace < 0) {
            throw RasterIOException.invalidArgument("Strides cannot be negative: pixel=%d, line=%d, band=%d"
                    .formatted(pixelSpace, lineSpace, bandSpace));
        }
        if (pixelSpace != 0 && pixelSpace < bufType.size()) {
            throw RasterIOException.invalidArgument("Pixel stride %d is smaller than the %s sample size %d"
                    .formatted(pixelSpace, bufType, bufType.size()));
        }
        long pixel = pixelSpace == 0 ? bufType.size() : pixelSpace;
        long line = lineSpace == 0 ? pixel * bufXSize : lineSpace;
        long band = bandSpace == 0 ? line * bufYSize : bandSpace;
        if (line > Integer.MAX_VALUE || band > Integer.MAX_VALUE) {
            throw RasterIOException.invalidArgument("Buffer strides overflow a 32-bit index");
        }
        return withStrides((int) pixel, (int) line, (int) band);
    }

    /**
     * @return whether all three strides are explicit
     */
    public boolean isResolved() {
        return pixelSpace != 0 && lineSpace != 0 && bandSpace != 0;
    }

    /**
     * Computes the number of bytes, from the buffer origin, this window touches.
     * Only meaningful on a {@link #resolve() resolved} window.
     *
     * @param bandCount the number of bands transferred
     * @return the byte extent of the transfer in the caller buffer
     */
    public long requiredBytes(int bandCount) {
        return (long) (bufYSize - 1) * lineSpace
                + (long) (bufXSize - 1) * pixelSpace
                + (long) (bandCount - 1) * bandSpace
                + bufType.size();
    }

    /**
     * @return whether source and buffer dimensions differ
     */
    public boolean isResampled() {
        return xSize != bufXSize || ySize != bufYSize;
    }
}
