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

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Read-only test dataset computing every sample from its band, line and column.
 */
public class FunctionRasterDataset extends AbstractRasterDataset {

    @FunctionalInterface
    public interface SampleFunction {
        double sample(int band, int line, int x);
    }

    private final int width;
    private final int height;
    private final int bandCount;
    private final DataType type;
    private final SampleFunction function;
    private volatile int failAtLine = -1;

    public FunctionRasterDataset(int width, int height, int bandCount, DataType type, SampleFunction function) {
        this.width = width;
        this.height = height;
        this.bandCount = bandCount;
        this.type = type;
        this.function = function;
    }

    /**
     * @return a dataset whose samples are {@code band * 10000 + line * 100 + x}
     */
    public static FunctionRasterDataset gradient(int width, int height, int bandCount, DataType type) {
        return new FunctionRasterDataset(width, height, bandCount, type, (b, l, x) -> b * 10_000 + l * 100 + x);
    }

    public static double gradientValue(int band, int line, int x) {
        return band * 10_000 + line * 100 + x;
    }

    /**
     * Makes reads of the given raster line fail.
     */
    public FunctionRasterDataset failAtLine(int line) {
        this.failAtLine = line;
        return this;
    }

    @Override
    protected void readLineNative(int band, int line, int xOff, int xSize, ByteBuffer target) throws IOException {
        if (line == failAtLine) {
            throw new IOException("simulated decode failure at line " + line);
        }
        for (int i = 0; i < xSize; i++) {
            SampleConverter.writeComponent(target, i * type.size(), type, function.sample(band, line, xOff + i), false);
        }
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int getBandCount() {
        return bandCount;
    }

    @Override
    public DataType getDataType(int band) {
        checkBand(band);
        return type;
    }

    @Override
    public String getDescription() {
        return "function:%dx%dx%d".formatted(width, height, bandCount);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
