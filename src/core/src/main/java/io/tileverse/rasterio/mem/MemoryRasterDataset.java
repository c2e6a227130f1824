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

import static java.util.Objects.requireNonNull;

import io.tileverse.rasterio.AbstractRasterDataset;
import io.tileverse.rasterio.BandSelection;
import io.tileverse.rasterio.DataType;
import io.tileverse.rasterio.RasterIOException;
import io.tileverse.rasterio.RasterTransfer;
import io.tileverse.rasterio.RasterWindow;
import io.tileverse.rasterio.SampleConverter;
import io.tileverse.rasterio.async.AsyncReadOptions;
import io.tileverse.rasterio.async.AsyncReadRequest;
import io.tileverse.rasterio.async.ProgressiveRasterDataset;
import io.tileverse.rasterio.async.RasterParameter;
import io.tileverse.rasterio.io.ScanlineBufferPool;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * A raster held in heap memory, one byte array per band.
 * <p>
 * Supports synchronous reads and writes as well as progressive reads, where a decoder
 * thread copies the requested window in bursts of lines, optionally pausing between
 * bursts, to emulate a backend that delivers data incrementally. The burst behaviour is
 * controlled per request through the {@link #getAsyncParameters() async parameters}.
 *
 * <pre>{@code
 * MemoryRasterDataset dataset = MemoryRasterDataset.builder()
 *         .size(256, 256)
 *         .bands(3, DataType.BYTE)
 *         .build();
 * }</pre>
 */
@Slf4j
public class MemoryRasterDataset extends AbstractRasterDataset implements ProgressiveRasterDataset {

    /** Parameter group of the memory backend. */
    public static final String GROUP_MEMORY = "memory";

    /** Number of window lines delivered per burst, 0 delivers the whole window at once. */
    public static final RasterParameter<Integer> BURST_LINES = RasterParameter.builder()
            .key("io.tileverse.rasterio.memory.burstLines")
            .title("Burst lines")
            .description("Number of window lines decoded per progressive update, 0 for a single update")
            .type(Integer.class)
            .group(GROUP_MEMORY)
            .defaultValue(0)
            .options(0, 1, 16, 256)
            .build();

    /** Pause before each burst, in milliseconds. */
    public static final RasterParameter<Integer> BURST_DELAY_MILLIS = RasterParameter.builder()
            .key("io.tileverse.rasterio.memory.burstDelayMillis")
            .title("Burst delay")
            .description("Milliseconds the decoder waits before each burst")
            .type(Integer.class)
            .group(GROUP_MEMORY)
            .defaultValue(0)
            .build();

    /** Whether bursts are staged and converted by the polling thread. */
    public static final RasterParameter<Boolean> STAGED = RasterParameter.builder()
            .key("io.tileverse.rasterio.memory.staged")
            .title("Staged decode")
            .description("Decode into a native staging area converted into the caller buffer when polled")
            .type(Boolean.class)
            .group(GROUP_MEMORY)
            .subgroup("advanced")
            .defaultValue(false)
            .build();

    /** Whether updates report the buffer lines of each burst instead of the whole buffer. */
    public static final RasterParameter<Boolean> PARTIAL_REGIONS = RasterParameter.builder()
            .key("io.tileverse.rasterio.memory.partialRegions")
            .title("Partial regions")
            .description("Report the buffer lines of each burst instead of the whole buffer")
            .type(Boolean.class)
            .group(GROUP_MEMORY)
            .subgroup("advanced")
            .defaultValue(false)
            .build();

    private static final List<RasterParameter<?>> ASYNC_PARAMETERS = List.of(
            AsyncReadOptions.END_TIMEOUT_MILLIS, BURST_LINES, BURST_DELAY_MILLIS, STAGED, PARTIAL_REGIONS);

    private final int width;
    private final int height;
    private final List<DataType> types;
    private final byte[][] storage;
    private final ByteOrder byteOrder;
    private final boolean writable;
    private final boolean wrapIntegerOverflow;
    private final String description;
    private final Executor decoderExecutor;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean closed;

    private MemoryRasterDataset(Builder builder) {
        super(builder.bufferPool);
        this.width = builder.width;
        this.height = builder.height;
        this.types = List.copyOf(builder.types);
        this.byteOrder = builder.byteOrder;
        this.writable = builder.writable;
        this.wrapIntegerOverflow = builder.wrapIntegerOverflow;
        this.description = builder.description != null
                ? builder.description
                : "memory:%dx%dx%d".formatted(width, height, types.size());
        this.decoderExecutor = builder.executor;
        this.storage = new byte[types.size()][];
        for (int b = 0; b < types.size(); b++) {
            long size = (long) width * height * types.get(b).size();
            if (size > Integer.MAX_VALUE - 8) {
                throw new IllegalArgumentException("Band %d too large for a memory raster: %d bytes".formatted(b + 1, size));
            }
            storage[b] = new byte[(int) size];
        }
    }

    public static Builder builder() {
        return new Builder();
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
        return types.size();
    }

    @Override
    public DataType getDataType(int band) {
        checkBand(band);
        return types.get(band - 1);
    }

    @Override
    public boolean isWritable() {
        return writable;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    protected ByteOrder nativeByteOrder(int band) {
        return byteOrder;
    }

    @Override
    protected boolean wrapsIntegerOverflow() {
        return wrapIntegerOverflow;
    }

    @Override
    protected void readLineNative(int band, int line, int xOff, int xSize, ByteBuffer target) throws IOException {
        copyLine(band, line, xOff, xSize, target, 0);
    }

    @Override
    protected void writeLineNative(int band, int line, int xOff, int xSize, ByteBuffer source) throws IOException {
        ensureOpen();
        final int size = types.get(band - 1).size();
        lock.writeLock().lock();
        try {
            source.get(0, storage[band - 1], lineOffset(band, line, xOff), xSize * size);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Copies {@code xSize} native samples of a line into {@code target} at {@code index}.
     */
    void copyLine(int band, int line, int xOff, int xSize, ByteBuffer target, int index) throws IOException {
        ensureOpen();
        final int size = types.get(band - 1).size();
        lock.readLock().lock();
        try {
            target.put(index, storage[band - 1], lineOffset(band, line, xOff), xSize * size);
        } finally {
            lock.readLock().unlock();
        }
    }

    private int lineOffset(int band, int line, int xOff) {
        return (line * width + xOff) * types.get(band - 1).size();
    }

    /**
     * Sets every sample of a band to {@code value}, converted to the band type. The imaginary
     * part of complex samples is set to zero.
     *
     * @param band 1-based band number
     * @param value the value
     */
    public void fill(int band, double value) {
        checkBand(band);
        final DataType type = types.get(band - 1);
        final ByteBuffer buffer = ByteBuffer.wrap(storage[band - 1]).order(byteOrder);
        lock.writeLock().lock();
        try {
            for (int i = 0; i < storage[band - 1].length; i += type.size()) {
                SampleConverter.writeComponent(buffer, i, type, value, wrapIntegerOverflow);
                if (type.isComplex()) {
                    SampleConverter.writeComponent(buffer, i + type.componentSize(), type, 0, false);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @param band 1-based band number
     * @param x column
     * @param y line
     * @return the sample, or its real part for complex bands
     */
    public double getSample(int band, int x, int y) {
        checkBand(band);
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (%d,%d) outside of %dx%d".formatted(x, y, width, height));
        }
        final DataType type = types.get(band - 1);
        lock.readLock().lock();
        try {
            return SampleConverter.readComponent(
                    ByteBuffer.wrap(storage[band - 1]).order(byteOrder), lineOffset(band, y, x), type);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RasterParameter<?>> getAsyncParameters() {
        return ASYNC_PARAMETERS;
    }

    @Override
    public AsyncReadRequest beginAsyncRead(
            RasterWindow window, BandSelection bands, ByteBuffer buffer, AsyncReadOptions options)
            throws RasterIOException {
        requireNonNull(options, "options");
        final RasterTransfer transfer = prepareTransfer(window, bands, buffer, true);
        final int windowLines = transfer.window().ySize();
        final int burst = options.getParameter(BURST_LINES).orElse(0);
        final int delay = options.getParameter(BURST_DELAY_MILLIS).orElse(0);
        if (burst < 0 || delay < 0) {
            throw RasterIOException.invalidArgument(
                    "Burst lines and delay cannot be negative: %d, %d".formatted(burst, delay));
        }
        MemoryDecoder decoder = new MemoryDecoder(
                this,
                transfer,
                burst == 0 ? windowLines : Math.min(burst, windowLines),
                delay,
                options.getParameter(STAGED).orElse(false),
                options.getParameter(PARTIAL_REGIONS).orElse(false),
                decoderExecutor);
        return AsyncReadRequest.start(this, transfer, decoder, options);
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException(description + " is closed");
        }
    }

    /**
     * Marks the dataset closed. Subsequent transfers fail with {@link RasterIOException.Kind#BACKEND}.
     */
    @Override
    public void close() {
        closed = true;
    }

    /**
     * Builder for {@link MemoryRasterDataset}.
     */
    public static class Builder {
        private int width;
        private int height;
        private final List<DataType> types = new ArrayList<>();
        private ByteOrder byteOrder = ByteOrder.nativeOrder();
        private boolean writable = true;
        private boolean wrapIntegerOverflow;
        private String description;
        private Executor executor;
        private ScanlineBufferPool bufferPool = ScanlineBufferPool.getDefault();

        private Builder() {}

        /**
         * Sets the raster size.
         *
         * @param width raster width, positive
         * @param height raster height, positive
         * @return this builder
         */
        public Builder size(int width, int height) {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Raster size must be positive: %dx%d".formatted(width, height));
            }
            this.width = width;
            this.height = height;
            return this;
        }

        /**
         * Appends a band.
         *
         * @param type the band's sample type
         * @return this builder
         */
        public Builder band(@NonNull DataType type) {
            types.add(type);
            return this;
        }

        /**
         * Appends {@code count} bands of the same type.
         *
         * @param count number of bands
         * @param type the sample type
         * @return this builder
         */
        public Builder bands(int count, @NonNull DataType type) {
            for (int i = 0; i < count; i++) {
                types.add(type);
            }
            return this;
        }

        /**
         * Sets the byte order of the stored samples. Defaults to the platform order.
         *
         * @param byteOrder the byte order
         * @return this builder
         */
        public Builder byteOrder(@NonNull ByteOrder byteOrder) {
            this.byteOrder = byteOrder;
            return this;
        }

        public Builder writable(boolean writable) {
            this.writable = writable;
            return this;
        }

        /**
         * Makes integer narrowing wrap around instead of saturating.
         *
         * @param wrap whether to wrap
         * @return this builder
         */
        public Builder wrapIntegerOverflow(boolean wrap) {
            this.wrapIntegerOverflow = wrap;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * Sets the executor running progressive decoders. By default each request gets a
         * daemon thread of its own.
         *
         * @param executor the executor
         * @return this builder
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder bufferPool(@NonNull ScanlineBufferPool bufferPool) {
            this.bufferPool = bufferPool;
            return this;
        }

        public MemoryRasterDataset build() {
            if (width == 0 || height == 0) {
                throw new IllegalStateException("size must be set");
            }
            if (types.isEmpty()) {
                throw new IllegalStateException("at least one band is required");
            }
            return new MemoryRasterDataset(this);
        }
    }
}
