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
 * Outcome of {@link AsyncReadRequest#getNextUpdatedRegion(java.time.Duration)}.
 */
public enum AsyncStatus {
    /** Nothing new within the timeout, or the buffer lock could not be acquired in time. */
    PENDING,
    /** A region of the buffer holds newly decoded data. */
    UPDATE,
    /** No further updates will occur and the buffer is final. */
    COMPLETE,
    /** Decoding failed; the request may only be closed. */
    ERROR
}
