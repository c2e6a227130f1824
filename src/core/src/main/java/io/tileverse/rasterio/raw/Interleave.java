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
package io.tileverse.rasterio.raw;

/**
 * Sample layout of a raw raster file.
 */
public enum Interleave {
    /** Band sequential: all lines of band 1, then all lines of band 2, ... */
    BSQ,
    /** Band interleaved by line: line 1 of every band, then line 2 of every band, ... */
    BIL,
    /** Band interleaved by pixel: all bands of pixel 1, then all bands of pixel 2, ... */
    BIP;

    /**
     * Computes the file offset of a sample, relative to the end of the header.
     *
     * @param width raster width
     * @param height raster height
     * @param bandCount number of bands
     * @param sampleSize bytes per sample
     * @param band 1-based band number
     * @param line raster line
     * @param x raster column
     * @return the byte offset of the sample
     */
    public long offset(int width, int height, int bandCount, int sampleSize, int band, int line, int x) {
        return switch (this) {
            case BSQ -> (((long) (band - 1) * height + line) * width + x) * sampleSize;
            case BIL -> (((long) line * bandCount + (band - 1)) * width + x) * sampleSize;
            case BIP -> (((long) line * width + x) * bandCount + (band - 1)) * sampleSize;
        };
    }
}
