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

import io.tileverse.rasterio.AbstractRasterDataset;
import io.tileverse.rasterio.DataType;
import io.tileverse.rasterio.RasterDataset;
import io.tileverse.rasterio.io.ScanlineBufferPool;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link RasterDataset} over a headerless (or fixed size header) binary file of
 * uncompressed samples.
 *
 * <p>All bands share one {@link DataType} and one byte order. Samples are laid out
 * according to an {@link Interleave} after {@code headerOffset} bytes.
 *
 * <h2>Thread Safety</h2>
 * <p>Lines are read and written with position-based {@link FileChannel} operations
 * ({@link FileChannel#read(ByteBuffer, long)}, {@link FileChannel#write(ByteBuffer, long)}),
 * so concurrent transfers do not interfere through the channel position. Writes to
 * {@link Interleave#BIP} files read, patch and rewrite pixel spans, and are serialized.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (RawRasterDataset dem = RawRasterDataset.builder()
 *         .path(Path.of("dem.bil"))
 *         .size(1201, 1201)
 *         .bands(1, DataType.INT16)
 *         .byteOrder(ByteOrder.BIG_ENDIAN)
 *         .interleave(Interleave.BIL)
 *         .build()) {
 *     ByteBuffer buffer = ByteBuffer.allocate(1201 * 1201 * 4).order(ByteOrder.nativeOrder());
 *     dem.read(RasterWindow.of(0, 0, 1201, 1201, DataType.FLOAT32), buffer);
 * }
 * }</pre>
 */
@Slf4j
public class RawRasterDataset extends AbstractRasterDataset {

    private final Path path;
    private final FileChannel channel;
    private final int width;
    private final int height;
    private final int bandCount;
    private final DataType dataType;
    private final ByteOrder byteOrder;
    private final Interleave interleave;
    private final long headerOffset;
    private final boolean writable;
    private final boolean forceOnFlush;

    private final ReentrantLock spanLock = new ReentrantLock();

    private RawRasterDataset(Builder builder, FileChannel channel) {
        super(builder.bufferPool);
        this.path = builder.path;
        this.channel = channel;
        this.width = builder.width;
        this.height = builder.height;
        this.bandCount = builder.bandCount;
        this.dataType = builder.dataType;
        this.byteOrder = builder.byteOrder;
        this.interleave = builder.interleave;
        this.headerOffset = builder.headerOffset;
        this.writable = builder.writable;
        this.forceOnFlush = builder.forceOnFlush;
    }

    /**
     * @return the number of bytes the samples of this raster occupy after the header
     */
    public long dataSize() {
        return (long) width * height * bandCount * dataType.size();
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
        return dataType;
    }

    public Interleave getInterleave() {
        return interleave;
    }

    @Override
    public boolean isWritable() {
        return writable;
    }

    @Override
    public String getDescription() {
        return path.toAbsolutePath().toString();
    }

    @Override
    protected ByteOrder nativeByteOrder(int band) {
        return byteOrder;
    }

    /**
     * Reads one line of one band.
     *
     * <p>For {@link Interleave#BSQ} and {@link Interleave#BIL} the line is contiguous and read
     * directly into {@code target}; for {@link Interleave#BIP} the pixel span is read into a
     * pooled buffer and the band's samples are gathered from it.
     */
    @Override
    protected void readLineNative(int band, int line, int xOff, int xSize, ByteBuffer target) throws IOException {
        final int size = dataType.size();
        if (interleave != Interleave.BIP || bandCount == 1) {
            readFully(target, samplePosition(band, line, xOff));
            return;
        }
        final int spanBytes = xSize * bandCount * size;
        final ByteBuffer span = bufferPool().borrow(spanBytes, byteOrder);
        try {
            readFully(span, samplePosition(1, line, xOff));
            for (int i = 0; i < xSize; i++) {
                target.put(i * size, span, (i * bandCount + band - 1) * size, size);
            }
        } finally {
            bufferPool().returnBuffer(span);
        }
    }

    @Override
    protected void writeLineNative(int band, int line, int xOff, int xSize, ByteBuffer source) throws IOException {
        final int size = dataType.size();
        if (interleave != Interleave.BIP || bandCount == 1) {
            writeFully(source, samplePosition(band, line, xOff));
            return;
        }
        // the span starts at the first band of pixel xOff
        final long position = samplePosition(1, line, xOff);
        final int spanBytes = xSize * bandCount * size;
        final ByteBuffer span = bufferPool().borrow(spanBytes, byteOrder);
        spanLock.lock();
        try {
            readFully(span, position);
            for (int i = 0; i < xSize; i++) {
                span.put((i * bandCount + band - 1) * size, source, i * size, size);
            }
            span.flip();
            writeFully(span, position);
        } finally {
            spanLock.unlock();
            bufferPool().returnBuffer(span);
        }
    }

    private long samplePosition(int band, int line, int x) {
        return headerOffset + interleave.offset(width, height, bandCount, dataType.size(), band, line, x);
    }

    @Override
    protected void flushWrites() throws IOException {
        if (forceOnFlush) {
            channel.force(false);
        }
    }

    private void readFully(ByteBuffer target, long position) throws IOException {
        long current = position;
        while (target.hasRemaining()) {
            int read = channel.read(target, current);
            if (read == -1) {
                throw new EOFException("Unexpected end of file at offset %d of %s (size %d)"
                        .formatted(current, getDescription(), channel.size()));
            }
            current += read;
        }
    }

    private void writeFully(ByteBuffer source, long position) throws IOException {
        long current = position;
        while (source.hasRemaining()) {
            current += channel.write(source, current);
        }
    }

    /**
     * Closes the underlying file channel. Idempotent.
     *
     * @throws IOException if an I/O error occurs while closing the channel
     */
    @Override
    public void close() throws IOException {
        channel.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for RawRasterDataset.
     */
    public static class Builder {
        private Path path;
        private int width;
        private int height;
        private int bandCount = 1;
        private DataType dataType = DataType.BYTE;
        private ByteOrder byteOrder = ByteOrder.nativeOrder();
        private Interleave interleave = Interleave.BSQ;
        private long headerOffset;
        private boolean writable;
        private boolean create;
        private boolean forceOnFlush;
        private ScanlineBufferPool bufferPool = ScanlineBufferPool.getDefault();

        private Builder() {}

        /**
         * Sets the file path.
         *
         * @param path the file path
         * @return this builder
         */
        public Builder path(Path path) {
            this.path = Objects.requireNonNull(path, "Path cannot be null");
            return this;
        }

        public Builder size(int width, int height) {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Raster size must be positive: %dx%d".formatted(width, height));
            }
            this.width = width;
            this.height = height;
            return this;
        }

        public Builder bands(int count, DataType type) {
            if (count <= 0) {
                throw new IllegalArgumentException("Band count must be positive: " + count);
            }
            this.bandCount = count;
            this.dataType = Objects.requireNonNull(type, "DataType cannot be null");
            return this;
        }

        public Builder byteOrder(ByteOrder byteOrder) {
            this.byteOrder = Objects.requireNonNull(byteOrder, "ByteOrder cannot be null");
            return this;
        }

        public Builder interleave(Interleave interleave) {
            this.interleave = Objects.requireNonNull(interleave, "Interleave cannot be null");
            return this;
        }

        /**
         * Sets the number of bytes preceding the first sample.
         *
         * @param headerOffset the header size
         * @return this builder
         */
        public Builder headerOffset(long headerOffset) {
            if (headerOffset < 0) {
                throw new IllegalArgumentException("Header offset cannot be negative: " + headerOffset);
            }
            this.headerOffset = headerOffset;
            return this;
        }

        /**
         * Opens the file for writing as well as reading.
         *
         * @param writable whether writes are allowed
         * @return this builder
         */
        public Builder writable(boolean writable) {
            this.writable = writable;
            return this;
        }

        /**
         * Creates the file if missing and extends it to hold every sample. Implies {@link #writable(boolean)}.
         *
         * @param create whether to create the file
         * @return this builder
         */
        public Builder create(boolean create) {
            this.create = create;
            if (create) {
                this.writable = true;
            }
            return this;
        }

        /**
         * Forces written data to the storage device at the end of each write.
         *
         * @param force whether to call {@link FileChannel#force(boolean)} on flush
         * @return this builder
         */
        public Builder forceOnFlush(boolean force) {
            this.forceOnFlush = force;
            return this;
        }

        public Builder bufferPool(ScanlineBufferPool bufferPool) {
            this.bufferPool = Objects.requireNonNull(bufferPool, "bufferPool cannot be null");
            return this;
        }

        /**
         * Opens the dataset.
         *
         * @return a new RawRasterDataset
         * @throws IOException if the file cannot be opened or created
         */
        public RawRasterDataset build() throws IOException {
            if (path == null) {
                throw new IllegalStateException("Path must be set");
            }
            if (width == 0 || height == 0) {
                throw new IllegalStateException("Size must be set");
            }
            Set<StandardOpenOption> options = EnumSet.of(StandardOpenOption.READ);
            if (writable) {
                options.add(StandardOpenOption.WRITE);
            }
            if (create) {
                options.add(StandardOpenOption.CREATE);
            }
            FileChannel channel = FileChannel.open(path, options);
            RawRasterDataset dataset = new RawRasterDataset(this, channel);
            try {
                long expected = headerOffset + dataset.dataSize();
                long actual = channel.size();
                if (create && actual < expected) {
                    channel.write(ByteBuffer.wrap(new byte[1]), expected - 1);
                } else if (actual < expected) {
                    log.warn("{} holds {} bytes, {} expected: reads past the end will fail", path, actual, expected);
                }
            } catch (IOException e) {
                channel.close();
                throw e;
            }
            return dataset;
        }
    }
}
