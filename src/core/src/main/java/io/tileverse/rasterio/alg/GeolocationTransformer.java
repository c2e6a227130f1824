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
package io.tileverse.rasterio.alg;

import static java.util.Objects.requireNonNull;

import io.tileverse.rasterio.DataType;
import io.tileverse.rasterio.RasterBand;
import io.tileverse.rasterio.RasterIOException;
import io.tileverse.rasterio.RasterWindow;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transforms geolocation arrays in place: bands holding the X, Y and optionally Z
 * coordinate of every pixel are streamed row by row through a {@link CoordinateTransform}
 * and written back.
 * <p>
 * Rows are processed top to bottom. A row is read from each band as {@link DataType#FLOAT64},
 * transformed with a single callback invocation and written back before the next row is
 * read. Rows already written stay transformed when the operation fails or is cancelled.
 */
public final class GeolocationTransformer {

    private static final Logger logger = LoggerFactory.getLogger(GeolocationTransformer.class);

    private GeolocationTransformer() {
        // utility class
    }

    /**
     * Transforms the coordinates held by the given bands in place.
     *
     * @param x band holding X coordinates
     * @param y band holding Y coordinates
     * @param z band holding Z coordinates, or {@code null} to transform with zero elevation
     * @param transform the coordinate transform
     * @param progress notified after each row with {@code (row + 1) / height}, may be {@code null}
     * @return the number of points the transform reported as failed
     * @throws RasterIOException {@link RasterIOException.Kind#INVALID_ARGUMENT} if band sizes differ,
     *     {@link RasterIOException.Kind#CANCELLED} if {@code progress} returns {@code false},
     *     or the failure of a row read or write; {@link RasterIOException#getCompletedLines()}
     *     reports the number of rows written back
     */
    public static long transform(
            RasterBand x, RasterBand y, RasterBand z, CoordinateTransform transform, ProgressListener progress)
            throws RasterIOException {
        requireNonNull(x, "x");
        requireNonNull(y, "y");
        requireNonNull(transform, "transform");

        final int width = x.getWidth();
        final int height = x.getHeight();
        checkSize(y, width, height, "Y");
        if (z != null) {
            checkSize(z, width, height, "Z");
        }

        final double[] xs = new double[width];
        final double[] ys = new double[width];
        final double[] zs = new double[width];
        final ByteBuffer row = ByteBuffer.allocate(width * DataType.FLOAT64.size()).order(ByteOrder.nativeOrder());

        long failed = 0;
        for (int line = 0; line < height; line++) {
            final RasterWindow window = RasterWindow.of(0, line, width, 1, DataType.FLOAT64);
            try {
                readRow(x, window, row, xs);
                readRow(y, window, row, ys);
                if (z == null) {
                    Arrays.fill(zs, 0d);
                } else {
                    readRow(z, window, row, zs);
                }

                boolean[] success = transform.transform(width, xs, ys, zs);
                failed += countFailures(success, width);

                writeRow(x, window, row, xs);
                writeRow(y, window, row, ys);
                if (z != null) {
                    writeRow(z, window, row, zs);
                }
            } catch (RasterIOException e) {
                throw new RasterIOException(
                        e.getKind(), "Geolocation transform failed at row %d: %s".formatted(line, e.getMessage()), e, line);
            }

            if (progress != null && !progress.onProgress((line + 1) / (double) height, "")) {
                throw RasterIOException.cancelled("Geolocation transform cancelled after row " + line, line + 1);
            }
        }
        if (failed > 0) {
            logger.debug("Geolocation transform left {} of {} points untransformed", failed, (long) width * height);
        }
        return failed;
    }

    private static void checkSize(RasterBand band, int width, int height, String axis) throws RasterIOException {
        if (band.getWidth() != width || band.getHeight() != height) {
            throw RasterIOException.invalidArgument("%s band is %dx%d, expected %dx%d"
                    .formatted(axis, band.getWidth(), band.getHeight(), width, height));
        }
    }

    private static void readRow(RasterBand band, RasterWindow window, ByteBuffer row, double[] values)
            throws RasterIOException {
        row.clear();
        band.read(window, row);
        for (int i = 0; i < values.length; i++) {
            values[i] = row.getDouble(i * Double.BYTES);
        }
    }

    private static void writeRow(RasterBand band, RasterWindow window, ByteBuffer row, double[] values)
            throws RasterIOException {
        row.clear();
        for (int i = 0; i < values.length; i++) {
            row.putDouble(i * Double.BYTES, values[i]);
        }
        band.write(window, row);
    }

    private static int countFailures(boolean[] success, int count) {
        if (success == null) {
            return 0;
        }
        int failures = 0;
        for (int i = 0; i < Math.min(count, success.length); i++) {
            if (!success[i]) {
                failures++;
            }
        }
        return failures;
    }
}
