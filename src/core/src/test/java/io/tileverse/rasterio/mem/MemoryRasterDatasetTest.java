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
package io.tileverse.rasterio.mem;

import static io.tileverse.rasterio.RasterAssertions.assertFailsWith;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tileverse.rasterio.BandSelection;
import io.tileverse.rasterio.DataType;
import io.tileverse.rasterio.RasterBand;
import io.tileverse.rasterio.RasterIOException;
import io.tileverse.rasterio.RasterIOException.Kind;
import io.tileverse.rasterio.RasterWindow;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class MemoryRasterDatasetTest {

    private static ByteBuffer nativeBuffer(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.nativeOrder());
    }

    private static MemoryRasterDataset gradient(int width, int height, DataType type) throws RasterIOException {
        MemoryRasterDataset dataset =
                MemoryRasterDataset.builder().size(width, height).band(type).build();
        ByteBuffer values = nativeBuffer(width * height * Integer.BYTES);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                values.putInt((y * width + x) * Integer.BYTES, y * 10 + x);
            }
        }
        dataset.write(RasterWindow.of(0, 0, width, height, DataType.INT32), values);
        return dataset;
    }

    @Test
    void write_thenRead_returnsSameSamples() throws Exception {
        MemoryRasterDataset dataset = gradient(3, 2, DataType.INT16);

        ByteBuffer out = nativeBuffer(3 * 2 * 2);
        dataset.read(RasterWindow.of(0, 0, 3, 2, DataType.INT16), out);

        assertThat(out.getShort(0)).isEqualTo((short) 0);
        assertThat(out.getShort(2 * 2)).isEqualTo((short) 2);
        assertThat(out.getShort((3 + 1) * 2)).isEqualTo((short) 11);
        assertThat(dataset.getSample(1, 2, 1)).isEqualTo(12d);
    }

    @Test
    void write_subWindow_leavesOtherSamplesUntouched() throws Exception {
        MemoryRasterDataset dataset = gradient(4, 4, DataType.BYTE);
        ByteBuffer patch = ByteBuffer.wrap(new byte[] {(byte) 200, (byte) 201, (byte) 202, (byte) 203});

        dataset.write(RasterWindow.of(1, 1, 2, 2, DataType.BYTE), patch);

        assertThat(dataset.getSample(1, 1, 1)).isEqualTo(200d);
        assertThat(dataset.getSample(1, 2, 2)).isEqualTo(203d);
        assertThat(dataset.getSample(1, 0, 0)).isEqualTo(0d);
        assertThat(dataset.getSample(1, 3, 3)).isEqualTo(33d);
    }

    @Test
    void write_convertsToBandTypeWithSaturation() throws Exception {
        MemoryRasterDataset dataset =
                MemoryRasterDataset.builder().size(4, 1).band(DataType.BYTE).build();
        ByteBuffer values = nativeBuffer(4 * Double.BYTES);
        values.putDouble(0, 1.6).putDouble(8, -5).putDouble(16, 300).putDouble(24, Double.NaN);

        dataset.write(RasterWindow.of(0, 0, 4, 1, DataType.FLOAT64), values);

        assertThat(dataset.getSample(1, 0, 0)).isEqualTo(2d);
        assertThat(dataset.getSample(1, 1, 0)).isEqualTo(0d);
        assertThat(dataset.getSample(1, 2, 0)).isEqualTo(255d);
        assertThat(dataset.getSample(1, 3, 0)).isEqualTo(0d);
    }

    @Test
    void write_withWrapIntegerOverflow_keepsLowOrderBits() throws Exception {
        MemoryRasterDataset dataset = MemoryRasterDataset.builder()
                .size(2, 1)
                .band(DataType.BYTE)
                .wrapIntegerOverflow(true)
                .build();
        ByteBuffer values = nativeBuffer(2 * Integer.BYTES);
        values.putInt(0, 300).putInt(4, -1);

        dataset.write(RasterWindow.of(0, 0, 2, 1, DataType.INT32), values);

        assertThat(dataset.getSample(1, 0, 0)).isEqualTo(44d);
        assertThat(dataset.getSample(1, 1, 0)).isEqualTo(255d);
    }

    @Test
    void write_onReadOnlyDataset_failsWithBackendAndKeepsData() {
        MemoryRasterDataset dataset = MemoryRasterDataset.builder()
                .size(2, 2)
                .band(DataType.BYTE)
                .writable(false)
                .build();
        dataset.fill(1, 9);

        assertFailsWith(
                Kind.BACKEND,
                () -> dataset.write(RasterWindow.of(0, 0, 2, 2, DataType.BYTE), ByteBuffer.allocate(4)));
        assertThat(dataset.isWritable()).isFalse();
        assertThat(dataset.getSample(1, 1, 1)).isEqualTo(9d);
    }

    @Test
    void read_multipleBandsOfDifferentTypes() throws Exception {
        MemoryRasterDataset dataset = MemoryRasterDataset.builder()
                .size(2, 2)
                .band(DataType.BYTE)
                .band(DataType.FLOAT32)
                .build();
        dataset.fill(1, 7);
        dataset.fill(2, 2.5);

        ByteBuffer out = nativeBuffer(2 * 2 * 2 * Double.BYTES);
        dataset.read(RasterWindow.of(0, 0, 2, 2, DataType.FLOAT64), out);

        assertThat(out.getDouble(3 * Double.BYTES)).isEqualTo(7d);
        assertThat(out.getDouble(4 * Double.BYTES)).isEqualTo(2.5d);
        assertThat(out.getDouble(7 * Double.BYTES)).isEqualTo(2.5d);
    }

    @Test
    void read_withBandMap_reordersBands() throws Exception {
        MemoryRasterDataset dataset =
                MemoryRasterDataset.builder().size(1, 1).bands(3, DataType.INT32).build();
        dataset.fill(1, 1);
        dataset.fill(2, 2);
        dataset.fill(3, 3);

        ByteBuffer out = nativeBuffer(2 * Integer.BYTES);
        dataset.read(RasterWindow.of(0, 0, 1, 1, DataType.INT32), BandSelection.of(3, 1), out);

        assertThat(out.getInt(0)).isEqualTo(3);
        assertThat(out.getInt(4)).isEqualTo(1);
    }

    @Test
    void fill_complexBand_setsRealPartAndZeroesImaginary() throws Exception {
        MemoryRasterDataset dataset =
                MemoryRasterDataset.builder().size(2, 1).band(DataType.CINT16).build();

        dataset.fill(1, -12);

        ByteBuffer out = nativeBuffer(2 * DataType.CFLOAT64.size());
        dataset.read(RasterWindow.of(0, 0, 2, 1, DataType.CFLOAT64), out);
        assertThat(out.getDouble(16)).isEqualTo(-12d);
        assertThat(out.getDouble(24)).isEqualTo(0d);
        assertThat(dataset.getSample(1, 0, 0)).isEqualTo(-12d);
    }

    @Test
    void getSample_outsideRaster_throws() {
        MemoryRasterDataset dataset =
                MemoryRasterDataset.builder().size(2, 2).band(DataType.BYTE).build();

        assertThatThrownBy(() -> dataset.getSample(1, 2, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> dataset.getSample(2, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bigEndianStorage_isTransparentToCallers() throws Exception {
        MemoryRasterDataset dataset = MemoryRasterDataset.builder()
                .size(2, 1)
                .band(DataType.UINT16)
                .byteOrder(ByteOrder.BIG_ENDIAN)
                .build();
        ByteBuffer values = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        values.putShort(0, (short) 0x1234).putShort(2, (short) 0xFFFE);

        dataset.write(RasterWindow.of(0, 0, 2, 1, DataType.UINT16), values);

        assertThat(dataset.getSample(1, 0, 0)).isEqualTo(0x1234);
        assertThat(dataset.getSample(1, 1, 0)).isEqualTo(0xFFFE);
        ByteBuffer out = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN);
        dataset.read(RasterWindow.of(0, 0, 2, 1, DataType.INT32), out);
        assertThat(out.getInt(4)).isEqualTo(0xFFFE);
    }

    @Test
    void bandView_readsAndWritesItsBandOnly() throws Exception {
        MemoryRasterDataset dataset =
                MemoryRasterDataset.builder().size(2, 1).bands(2, DataType.INT16).build();
        RasterBand second = dataset.getBand(2);
        ByteBuffer values = nativeBuffer(4);
        values.putShort(0, (short) -3).putShort(2, (short) 4);

        second.write(RasterWindow.of(0, 0, 2, 1, DataType.INT16), values);

        assertThat(second.getDataType()).isEqualTo(DataType.INT16);
        assertThat(dataset.getSample(2, 0, 0)).isEqualTo(-3d);
        assertThat(dataset.getSample(1, 0, 0)).isEqualTo(0d);
    }

    @Test
    void close_makesTransfersFailWithBackend() throws Exception {
        MemoryRasterDataset dataset = gradient(2, 2, DataType.BYTE);

        dataset.close();

        RasterIOException e =
                assertFailsWith(Kind.BACKEND, () -> dataset.read(RasterWindow.of(0, 0, 2, 2, DataType.BYTE), ByteBuffer.allocate(4)));
        assertThat(e.getCompletedLines()).isZero();
        assertThat(e).hasRootCauseMessage("memory:2x2x1 is closed");
    }

    @Test
    void concurrentReads_seeConsistentData() throws Exception {
        final int size = 64;
        MemoryRasterDataset dataset = gradient(size, size, DataType.INT32);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<ByteBuffer>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                final int yOff = i % size;
                results.add(executor.submit(() -> {
                    ByteBuffer out = nativeBuffer(size * Integer.BYTES);
                    dataset.read(RasterWindow.of(0, yOff, size, 1, DataType.INT32), out);
                    return out;
                }));
            }
            for (int i = 0; i < results.size(); i++) {
                ByteBuffer out = results.get(i).get();
                assertThat(out.getInt(5 * Integer.BYTES)).isEqualTo(i * 10 + 5);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void builder_validatesArguments() {
        assertThatThrownBy(() -> MemoryRasterDataset.builder().size(0, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MemoryRasterDataset.builder().band(DataType.BYTE).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("size must be set");
        assertThatThrownBy(() -> MemoryRasterDataset.builder().size(1, 1).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("at least one band is required");
        assertThat(MemoryRasterDataset.builder()
                        .size(3, 2)
                        .bands(2, DataType.BYTE)
                        .build()
                        .getDescription())
                .isEqualTo("memory:3x2x2");
    }
}
