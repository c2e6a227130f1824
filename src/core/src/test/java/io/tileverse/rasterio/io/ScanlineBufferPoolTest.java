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
package io.tileverse.rasterio.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScanlineBufferPoolTest {

    private ScanlineBufferPool pool;

    @BeforeEach
    void setUp() {
        pool = new ScanlineBufferPool(2, 64); // Small limits for testing
    }

    @Test
    void constructor_withInvalidParameters_throwsException() {
        assertThatThrownBy(() -> new ScanlineBufferPool(0, 64))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxBuffers must be positive");

        assertThatThrownBy(() -> new ScanlineBufferPool(2, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minBufferSize must be positive");
    }

    @Test
    void getDefault_returnsSameInstance() {
        assertThat(ScanlineBufferPool.getDefault()).isSameAs(ScanlineBufferPool.getDefault());
    }

    @Test
    void borrow_setsLimitAndByteOrder() {
        ByteBuffer buffer = pool.borrow(10, ByteOrder.LITTLE_ENDIAN);

        assertThat(buffer.isDirect()).isFalse();
        assertThat(buffer.capacity()).isEqualTo(64);
        assertThat(buffer.position()).isZero();
        assertThat(buffer.limit()).isEqualTo(10);
        assertThat(buffer.order()).isEqualTo(ByteOrder.LITTLE_ENDIAN);
    }

    @Test
    void borrow_withNegativeSize_throwsException() {
        assertThatThrownBy(() -> pool.borrow(-1, ByteOrder.BIG_ENDIAN))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("size cannot be negative");
    }

    @Test
    void returnBuffer_thenBorrow_reusesBufferWithNewOrder() {
        ByteBuffer first = pool.borrow(32, ByteOrder.LITTLE_ENDIAN);
        first.putInt(12345);
        pool.returnBuffer(first);

        ByteBuffer second = pool.borrow(16, ByteOrder.BIG_ENDIAN);

        assertThat(second).isSameAs(first);
        assertThat(second.position()).isZero();
        assertThat(second.limit()).isEqualTo(16);
        assertThat(second.order()).isEqualTo(ByteOrder.BIG_ENDIAN);
        assertThat(pool.getStatistics().buffersReused()).isEqualTo(1);
        assertThat(pool.getStatistics().hitRate()).isEqualTo(50.0);
    }

    @Test
    void returnBuffer_withUnsuitableBuffers_discardsThem() {
        pool.returnBuffer(null);
        pool.returnBuffer(ByteBuffer.allocateDirect(128));
        pool.returnBuffer(ByteBuffer.allocate(128).asReadOnlyBuffer());
        pool.returnBuffer(ByteBuffer.allocate(8));

        ScanlineBufferPool.PoolStatistics stats = pool.getStatistics();
        assertThat(stats.currentBuffers()).isZero();
        assertThat(stats.buffersDiscarded()).isEqualTo(3);
    }

    @Test
    void returnBuffer_whenFull_discardsExtraBuffers() {
        pool.returnBuffer(ByteBuffer.allocate(64));
        pool.returnBuffer(ByteBuffer.allocate(64));
        pool.returnBuffer(ByteBuffer.allocate(64));

        assertThat(pool.getStatistics().currentBuffers()).isEqualTo(2);
        assertThat(pool.getStatistics().buffersDiscarded()).isEqualTo(1);
        assertThat(pool.toString()).contains("buffers=2/2");

        pool.clear();
        assertThat(pool.getStatistics().currentBuffers()).isZero();
    }

    @Test
    void borrow_largerThanPooled_allocatesNewBuffer() {
        pool.returnBuffer(ByteBuffer.allocate(64));

        ByteBuffer buffer = pool.borrow(100, ByteOrder.BIG_ENDIAN);

        assertThat(buffer.capacity()).isEqualTo(100);
        assertThat(pool.getStatistics().buffersCreated()).isEqualTo(1);
    }

    @Test
    void borrow_largerThanPooled_keepsSmallerBuffersPooled() {
        ByteBuffer small = ByteBuffer.allocate(64);
        ByteBuffer medium = ByteBuffer.allocate(80);
        pool.returnBuffer(small);
        pool.returnBuffer(medium);

        ByteBuffer large = pool.borrow(200, ByteOrder.nativeOrder());

        ScanlineBufferPool.PoolStatistics stats = pool.getStatistics();
        assertThat(large).isNotSameAs(small).isNotSameAs(medium);
        assertThat(stats.currentBuffers()).isEqualTo(2);
        assertThat(stats.buffersDiscarded()).isZero();

        ByteBuffer reused = pool.borrow(70, ByteOrder.nativeOrder());
        assertThat(reused).isSameAs(medium);
        assertThat(pool.getStatistics().currentBuffers()).isEqualTo(1);
    }

    @Test
    void concurrentBorrowAndReturn_accountsForEveryBorrow() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        ByteBuffer buffer = pool.borrow(48, ByteOrder.nativeOrder());
                        buffer.putInt(0, i);
                        pool.returnBuffer(buffer);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }
        ScanlineBufferPool.PoolStatistics stats = pool.getStatistics();
        assertThat(stats.buffersCreated() + stats.buffersReused()).isEqualTo(8 * 200);
    }
}
