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

import static java.util.Objects.requireNonNull;

import io.tileverse.rasterio.BandSelection;
import io.tileverse.rasterio.RasterDataset;
import io.tileverse.rasterio.RasterIOException;
import io.tileverse.rasterio.RasterWindow;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Copies a window of a {@link ProgressiveRasterDataset} into another dataset as the data
 * is decoded.
 * <p>
 * The copier begins an asynchronous read into a buffer of its own and, for every
 * {@link AsyncStatus#UPDATE}, writes the updated region from the locked buffer into the
 * destination, at the destination offset plus the region offset. It stops on
 * {@link AsyncStatus#COMPLETE} or {@link AsyncStatus#ERROR} and always ends the request.
 * <p>
 * With a {@link DestinationFactory} instead of a single destination, every update is
 * written to a fresh dataset, which is closed once its region has been written. This
 * keeps each intermediate state of a progressive decode as a separate snapshot.
 *
 * <pre>{@code
 * int updates = AsyncRasterCopier.builder()
 *         .source(progressive)
 *         .destination(target)
 *         .window(RasterWindow.of(0, 0, 512, 512, DataType.BYTE))
 *         .pollTimeout(Duration.ofSeconds(1))
 *         .build()
 *         .copy();
 * }</pre>
 */
@Slf4j
public class AsyncRasterCopier {

    private final ProgressiveRasterDataset source;
    private final RasterDataset destination;
    private final DestinationFactory destinationFactory;
    private final RasterWindow window;
    private final BandSelection bands;
    private final AsyncReadOptions options;
    private final Duration pollTimeout;
    private final int dstXOff;
    private final int dstYOff;

    private AsyncRasterCopier(Builder builder) {
        this.source = builder.source;
        this.destination = builder.destination;
        this.destinationFactory = builder.destinationFactory;
        this.window = builder.window;
        this.bands = builder.bands;
        this.options = builder.options != null
                ? builder.options
                : AsyncReadOptions.withDefaults(builder.source.getAsyncParameters());
        this.pollTimeout = builder.pollTimeout;
        this.dstXOff = builder.dstXOff;
        this.dstYOff = builder.dstYOff;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the copy to completion.
     *
     * @return the number of updates written to the destination
     * @throws RasterIOException if the request is invalid, the decode fails, or writing to the destination fails
     * @throws InterruptedException if interrupted while polling
     */
    public int copy() throws RasterIOException, InterruptedException {
        final RasterWindow resolved = window.resolve();
        final int bandCount = bands.resolve(source.getBandCount()).count();
        final long size = resolved.requiredBytes(bandCount);
        if (size > Integer.MAX_VALUE) {
            throw RasterIOException.invalidArgument("Window too large to buffer: %d bytes".formatted(size));
        }
        final ByteBuffer buffer = ByteBuffer.allocate((int) size).order(ByteOrder.nativeOrder());

        int updates = 0;
        try (AsyncReadRequest request = source.beginAsyncRead(resolved, bands, buffer, options)) {
            while (true) {
                AsyncPollResult result = request.getNextUpdatedRegion(pollTimeout);
                AsyncStatus status = result.status();
                if (status == AsyncStatus.ERROR) {
                    throw result.error().orElseThrow();
                }
                if (status == AsyncStatus.COMPLETE) {
                    log.debug("Copied {} from {} in {} updates", resolved, source.getDescription(), updates);
                    return updates;
                }
                if (status == AsyncStatus.UPDATE) {
                    BufferRegion region = result.region().orElseThrow();
                    if (destinationFactory == null) {
                        writeRegion(request, region, bandCount, destination);
                    } else {
                        writeSnapshot(request, region, bandCount, updates);
                    }
                    updates++;
                }
            }
        }
    }

    private void writeSnapshot(AsyncReadRequest request, BufferRegion region, int bandCount, int index)
            throws RasterIOException {
        final RasterDataset snapshot;
        try {
            snapshot = requireNonNull(destinationFactory.create(index), "destination factory returned null");
        } catch (RasterIOException e) {
            throw e;
        } catch (IOException e) {
            throw RasterIOException.backend("Failed to create destination for update " + index, e, -1);
        }
        try (snapshot) {
            writeRegion(request, region, bandCount, snapshot);
        } catch (RasterIOException e) {
            throw e;
        } catch (IOException e) {
            throw RasterIOException.backend("Failed to close " + snapshot.getDescription(), e, -1);
        }
    }

    private void writeRegion(AsyncReadRequest request, BufferRegion region, int bandCount, RasterDataset dataset)
            throws RasterIOException {
        final RasterWindow w = request.getWindow();
        final RasterWindow target = RasterWindow.of(
                        dstXOff + region.xOff(),
                        dstYOff + region.yOff(),
                        region.xSize(),
                        region.ySize(),
                        w.bufType())
                .withStrides(w.pixelSpace(), w.lineSpace(), w.bandSpace());
        try (BufferGuard guard = request.lockBuffer()) {
            ByteBuffer data = guard.buffer().duplicate().order(guard.buffer().order());
            data.position(guard.offset(0, region.yOff(), region.xOff()));
            log.trace("Writing {} to {}", region, dataset.getDescription());
            dataset.write(target, BandSelection.identity(bandCount), data);
        }
    }

    /**
     * Creates the destination of one update.
     */
    @FunctionalInterface
    public interface DestinationFactory {

        /**
         * @param index zero-based number of the update
         * @return a new dataset covering the destination offset plus the buffer size
         * @throws IOException if the dataset cannot be created
         */
        RasterDataset create(int index) throws IOException;
    }

    /**
     * Builder for {@link AsyncRasterCopier}.
     */
    public static class Builder {
        private ProgressiveRasterDataset source;
        private RasterDataset destination;
        private DestinationFactory destinationFactory;
        private RasterWindow window;
        private BandSelection bands = BandSelection.all();
        private AsyncReadOptions options;
        private Duration pollTimeout = Duration.ofSeconds(1);
        private int dstXOff;
        private int dstYOff;

        private Builder() {}

        public Builder source(ProgressiveRasterDataset source) {
            this.source = requireNonNull(source, "source cannot be null");
            return this;
        }

        public Builder destination(RasterDataset destination) {
            this.destination = requireNonNull(destination, "destination cannot be null");
            this.destinationFactory = null;
            return this;
        }

        /**
         * Writes every update to its own dataset instead of a single destination.
         *
         * @param destinationFactory creates the dataset of each update
         * @return this builder
         */
        public Builder destinationPerUpdate(DestinationFactory destinationFactory) {
            this.destinationFactory = requireNonNull(destinationFactory, "destinationFactory cannot be null");
            this.destination = null;
            return this;
        }

        /**
         * Sets the source window and buffer layout. The buffer size of the window is the
         * size of the region written to the destination.
         *
         * @param window the window
         * @return this builder
         */
        public Builder window(RasterWindow window) {
            this.window = requireNonNull(window, "window cannot be null");
            return this;
        }

        public Builder bands(BandSelection bands) {
            this.bands = requireNonNull(bands, "bands cannot be null");
            return this;
        }

        public Builder options(AsyncReadOptions options) {
            this.options = requireNonNull(options, "options cannot be null");
            return this;
        }

        /**
         * Sets the timeout of each poll. Defaults to one second.
         *
         * @param pollTimeout the poll timeout
         * @return this builder
         */
        public Builder pollTimeout(Duration pollTimeout) {
            this.pollTimeout = requireNonNull(pollTimeout, "pollTimeout cannot be null");
            return this;
        }

        /**
         * Sets where the buffer origin lands in the destination. Defaults to {@code (0,0)}.
         *
         * @param xOff destination column
         * @param yOff destination line
         * @return this builder
         */
        public Builder destinationOffset(int xOff, int yOff) {
            if (xOff < 0 || yOff < 0) {
                throw new IllegalArgumentException("Destination offset cannot be negative: (%d,%d)".formatted(xOff, yOff));
            }
            this.dstXOff = xOff;
            this.dstYOff = yOff;
            return this;
        }

        public AsyncRasterCopier build() {
            if (source == null) {
                throw new IllegalStateException("source must be set");
            }
            if (destination == null && destinationFactory == null) {
                throw new IllegalStateException("destination must be set");
            }
            if (window == null) {
                throw new IllegalStateException("window must be set");
            }
            return new AsyncRasterCopier(this);
        }
    }
}
