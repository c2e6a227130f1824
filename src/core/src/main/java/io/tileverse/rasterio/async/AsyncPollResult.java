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

import io.tileverse.rasterio.RasterIOException;
import java.util.Optional;

/**
 * Result of polling an {@link AsyncReadRequest}.
 *
 * @param status the poll outcome
 * @param region the updated buffer region, present only for {@link AsyncStatus#UPDATE}
 * @param error the latched failure, present only for {@link AsyncStatus#ERROR}
 */
public record AsyncPollResult(AsyncStatus status, Optional<BufferRegion> region, Optional<RasterIOException> error) {

    private static final AsyncPollResult PENDING = new AsyncPollResult(AsyncStatus.PENDING, Optional.empty(), Optional.empty());
    private static final AsyncPollResult COMPLETE =
            new AsyncPollResult(AsyncStatus.COMPLETE, Optional.empty(), Optional.empty());

    public AsyncPollResult {
        requireNonNull(status, "status");
        requireNonNull(region, "region");
        requireNonNull(error, "error");
        if (region.isPresent() != (status == AsyncStatus.UPDATE)) {
            throw new IllegalArgumentException("A region is required for UPDATE and only for UPDATE");
        }
        if (error.isPresent() != (status == AsyncStatus.ERROR)) {
            throw new IllegalArgumentException("An error is required for ERROR and only for ERROR");
        }
    }

    public static AsyncPollResult pending() {
        return PENDING;
    }

    public static AsyncPollResult complete() {
        return COMPLETE;
    }

    public static AsyncPollResult update(BufferRegion region) {
        return new AsyncPollResult(AsyncStatus.UPDATE, Optional.of(region), Optional.empty());
    }

    public static AsyncPollResult error(RasterIOException error) {
        return new AsyncPollResult(AsyncStatus.ERROR, Optional.empty(), Optional.of(error));
    }
}
