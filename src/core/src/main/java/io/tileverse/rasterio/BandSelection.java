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

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Maps buffer band slots to 1-based physical band numbers.
 * <p>
 * Slot {@code i} of the caller buffer receives physical band {@link #band(int) band(i)}.
 * The same physical band may appear more than once. The {@link #all() all} selection
 * resolves to the identity mapping over every band of the dataset it is applied to.
 */
public final class BandSelection {

    private static final BandSelection ALL = new BandSelection(null);

    private final int[] bands;

    private BandSelection(int[] bands) {
        this.bands = bands;
    }

    /**
     * @return the identity selection over all bands of the target dataset
     */
    public static BandSelection all() {
        return ALL;
    }

    /**
     * @param bands 1-based physical band numbers, one per buffer band slot
     * @return a new explicit selection
     */
    public static BandSelection of(int... bands) {
        requireNonNull(bands, "bands");
        return new BandSelection(bands.clone());
    }

    /**
     * @param count number of bands
     * @return the explicit selection {@code 1..count}
     */
    public static BandSelection identity(int count) {
        return new BandSelection(IntStream.rangeClosed(1, count).toArray());
    }

    /**
     * @return whether this selection defaults to all bands
     */
    public boolean isAll() {
        return bands == null;
    }

    /**
     * Applies this selection to a dataset with {@code bandCount} bands, checking every index.
     *
     * @param bandCount the number of bands of the dataset
     * @return an explicit selection
     * @throws RasterIOException with {@link RasterIOException.Kind#INVALID_ARGUMENT} if the selection is empty
     *     or references a band that does not exist
     */
    public BandSelection resolve(int bandCount) throws RasterIOException {
        if (bands == null) {
            if (bandCount < 1) {
                throw RasterIOException.invalidArgument("Dataset has no bands");
            }
            return identity(bandCount);
        }
        if (bands.length == 0) {
            throw RasterIOException.invalidArgument("Band selection is empty");
        }
        for (int i = 0; i < bands.length; i++) {
            if (bands[i] < 1 || bands[i] > bandCount) {
                throw RasterIOException.invalidArgument(
                        "bands[%d] = %d, this band does not exist on dataset with %d bands"
                                .formatted(i, bands[i], bandCount));
            }
        }
        return this;
    }

    /**
     * @return the number of buffer band slots; only defined for explicit selections
     * @throws IllegalStateException if this is the {@link #all()} selection
     */
    public int count() {
        if (bands == null) {
            throw new IllegalStateException("selection of all bands has no count until resolved");
        }
        return bands.length;
    }

    /**
     * @param slot 0-based buffer band slot
     * @return the 1-based physical band number for the slot
     */
    public int band(int slot) {
        if (bands == null) {
            return slot + 1;
        }
        return bands[slot];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BandSelection other && Arrays.equals(bands, other.bands);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bands);
    }

    @Override
    public String toString() {
        return bands == null ? "BandSelection[all]" : "BandSelection" + Arrays.toString(bands);
    }
}
