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

import java.io.IOException;
import java.time.Duration;

/**
 * Backend private decode state of an {@link AsyncReadRequest}.
 * <p>
 * A decoder produces data incrementally, typically on a thread of its own, and reports it
 * through the {@link DecodeSink} given to {@link #start(DecodeSink)}.
 */
public interface ProgressiveDecoder {

    /**
     * Starts decoding. Must return promptly; decoding proceeds in the background.
     *
     * @param sink receives progress notifications
     * @throws IOException if decoding cannot be started
     */
    void start(DecodeSink sink) throws IOException;

    /**
     * Requests the decoder to stop. Must not block.
     */
    void cancel();

    /**
     * Waits until the decoder has stopped and will make no further calls on its sink.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if stopped, {@code false} if the timeout elapsed first
     * @throws InterruptedException if the calling thread is interrupted
     */
    boolean awaitStopped(Duration timeout) throws InterruptedException;

    /**
     * Converts the staging area into the destination buffer. Only called, on the polling
     * thread and with the buffer lock held, by decoders that report with
     * {@link DecodeSink#refresh(boolean)}.
     *
     * @param destination the destination buffer
     * @throws IOException if conversion fails
     */
    default void transferStaged(DestinationBuffer destination) throws IOException {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not stage decoded data");
    }
}
