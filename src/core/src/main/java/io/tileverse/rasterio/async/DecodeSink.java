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
 * Receives decode progress from a {@link ProgressiveDecoder}, usually on a thread owned
 * by the decoder.
 * <p>
 * Calls never block on the polling thread for longer than it holds the buffer lock.
 * Calls made after the request reached a terminal state, or after it was closed, are ignored.
 */
public interface DecodeSink {

    /**
     * Delivers decoded data. Under the buffer lock, runs {@code writer}, marks the request
     * UPDATE_AVAILABLE unless already complete and marks it complete if {@code finalBlock}.
     * A writer failure latches the request into the ERROR state.
     *
     * @param region the buffer region written, or {@code null} for the whole buffer
     * @param writer writes the data into the destination buffer, may be {@code null} if already staged
     * @param finalBlock whether every block of the request has now been delivered
     */
    void deliver(BufferRegion region, DecodedDataWriter writer, boolean finalBlock);

    /**
     * Signals that new data is available in the decoder's staging area. The polling thread
     * converts it into the destination buffer through {@link ProgressiveDecoder#transferStaged}.
     *
     * @param finalBlock whether every block of the request has now been staged
     */
    void refresh(boolean finalBlock);

    /**
     * Latches a decode failure. The next poll reports {@link AsyncStatus#ERROR}.
     *
     * @param cause the failure
     */
    void fail(Throwable cause);

    /**
     * @return whether the request was closed, in which case the decoder should stop as soon as possible
     */
    boolean isCancelled();
}
