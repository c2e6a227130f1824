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

import io.tileverse.rasterio.RasterTransfer;
import io.tileverse.rasterio.RasterWindow;
import java.nio.ByteBuffer;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive access to the destination buffer of an {@link AsyncReadRequest}, obtained from
 * {@link AsyncReadRequest#lockBuffer()}. Closing the guard releases the buffer lock.
 *
 * <pre>{@code
 * try (BufferGuard guard = request.lockBuffer()) {
 *     ByteBuffer data = guard.buffer();
 *     // copy the updated region
 * }
 * }</pre>
 *
 * A guard is bound to the thread that acquired it.
 */
public final class BufferGuard implements AutoCloseable {

    private final RasterTransfer transfer;
    private final ReentrantLock lock;
    private boolean released;

    BufferGuard(RasterTransfer transfer, ReentrantLock lock) {
        this.transfer = transfer;
        this.lock = lock;
    }

    /**
     * @return the caller's buffer; its contents are coherent while this guard is held
     * @throws IllegalStateException if the guard was released
     */
    public ByteBuffer buffer() {
        checkHeld();
        return transfer.buffer();
    }

    /**
     * @return the resolved window of the request
     */
    public RasterWindow window() {
        return transfer.window();
    }

    /**
     * @param slot buffer band slot
     * @param bufLine buffer line
     * @param bufPixel buffer column
     * @return the absolute byte index of the sample in {@link #buffer()}
     */
    public int offset(int slot, int bufLine, int bufPixel) {
        return transfer.offset(slot, bufLine, bufPixel);
    }

    public boolean isHeld() {
        return !released && lock.isHeldByCurrentThread();
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            lock.unlock();
        }
    }

    private void checkHeld() {
        if (!isHeld()) {
            throw new IllegalStateException("Buffer guard is no longer held");
        }
    }
}
