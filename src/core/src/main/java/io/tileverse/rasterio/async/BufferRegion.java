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

/**
 * A rectangle of the destination buffer, in buffer pixel coordinates.
 *
 * @param xOff first buffer column
 * @param yOff first buffer line
 * @param xSize number of columns
 * @param ySize number of lines
 */
public record BufferRegion(int xOff, int yOff, int xSize, int ySize) {

    public BufferRegion {
        if (xOff < 0 || yOff < 0) {
            throw new IllegalArgumentException("Region offset must be non negative: (%d,%d)".formatted(xOff, yOff));
        }
        if (xSize <= 0 || ySize <= 0) {
            throw new IllegalArgumentException("Region size must be positive: %dx%d".formatted(xSize, ySize));
        }
    }

    /**
     * @param bufXSize buffer width
     * @param bufYSize buffer height
     * @return the region covering a whole buffer
     */
    public static BufferRegion full(int bufXSize, int bufYSize) {
        return new BufferRegion(0, 0, bufXSize, bufYSize);
    }

    /**
     * @return the region of buffer lines {@code [firstLine, firstLine + lineCount)} spanning the full width
     */
    public static BufferRegion lines(int bufXSize, int firstLine, int lineCount) {
        return new BufferRegion(0, firstLine, bufXSize, lineCount);
    }

    /**
     * @param other another region, may be {@code null}
     * @return the smallest region containing both
     */
    public BufferRegion union(BufferRegion other) {
        if (other == null) {
            return this;
        }
        int x0 = Math.min(xOff, other.xOff);
        int y0 = Math.min(yOff, other.yOff);
        int x1 = Math.max(xOff + xSize, other.xOff + other.xSize);
        int y1 = Math.max(yOff + ySize, other.yOff + other.ySize);
        return new BufferRegion(x0, y0, x1 - x0, y1 - y0);
    }

    /**
     * @return whether this region lies inside a buffer of the given size
     */
    public boolean fits(int bufXSize, int bufYSize) {
        return xOff + xSize <= bufXSize && yOff + ySize <= bufYSize;
    }
}
