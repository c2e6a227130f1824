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

import static io.tileverse.rasterio.RasterAssertions.assertFailsWith;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.tileverse.rasterio.BandSelection;
import io.tileverse.rasterio.DataType;
import io.tileverse.rasterio.FunctionRasterDataset;
import io.tileverse.rasterio.RasterIOException;
import io.tileverse.rasterio.RasterIOException.Kind;
import io.tileverse.rasterio.RasterTransfer;
import io.tileverse.rasterio.RasterWindow;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AsyncReadRequestTest {

    private static final int WIDTH = 4;
    private static final int HEIGHT = 10;

    private FunctionRasterDataset dataset;
    private ByteBuffer buffer;
    private ManualDecoder decoder;
    private AsyncReadRequest request;

    @BeforeEach
    void setUp() throws Exception {
        dataset = FunctionRasterDataset.gradient(WIDTH, HEIGHT, 1, DataType.BYTE);
        buffer = ByteBuffer.allocate(WIDTH * HEIGHT);
        decoder = new ManualDecoder();
        request = start(new AsyncReadOptions());
    }

    @AfterEach
    void tearDown() {
        request.close();
    }

    private AsyncReadRequest start(AsyncReadOptions options) throws RasterIOException {
        RasterTransfer transfer = RasterTransfer.prepare(
                WIDTH,
                HEIGHT,
                1,
                RasterWindow.of(0, 0, WIDTH, HEIGHT, DataType.BYTE),
                BandSelection.all(),
                buffer,
                true,
                false);
        return AsyncReadRequest.start(dataset, transfer, decoder, options);
    }

    /**
     * @return a writer storing {@code value} into window lines {@code [first, end)}
     */
    private static DecodedDataWriter lines(int first, int end, int value) {
        return destination -> {
            ByteBuffer line = ByteBuffer.allocate(WIDTH);
            for (int i = 0; i < WIDTH; i++) {
                line.put(i, (byte) value);
            }
            for (int l = first; l < end; l++) {
                destination.storeWindowLine(0, l, line, 0, DataType.BYTE);
            }
        };
    }

    private byte sampleAt(int x, int y) {
        try (BufferGuard guard = request.lockBuffer()) {
            return guard.buffer().get(guard.offset(0, y, x));
        }
    }

    @Test
    void twoBursts_reportUpdatesThenComplete() throws Exception {
        BufferRegion whole = new BufferRegion(0, 0, WIDTH, HEIGHT);
        assertThat(request.getState()).isEqualTo(AsyncReadState.PENDING);
        assertThat(request.getNextUpdatedRegion(Duration.ZERO).status()).isEqualTo(AsyncStatus.PENDING);

        decoder.sink.deliver(null, lines(0, 5, 1), false);
        assertThat(request.getState()).isEqualTo(AsyncReadState.UPDATE_AVAILABLE);

        AsyncPollResult first = request.getNextUpdatedRegion(Duration.ZERO);
        assertThat(first.status()).isEqualTo(AsyncStatus.UPDATE);
        assertThat(first.region()).contains(whole);
        assertThat(request.getState()).isEqualTo(AsyncReadState.PENDING);
        assertThat(sampleAt(3, 4)).isEqualTo((byte) 1);
        assertThat(sampleAt(0, 5)).isZero();

        decoder.sink.deliver(null, lines(5, 10, 2), true);
        assertThat(request.getState()).isEqualTo(AsyncReadState.UPDATE_AVAILABLE);

        AsyncPollResult second = request.getNextUpdatedRegion(Duration.ZERO);
        assertThat(second.status()).isEqualTo(AsyncStatus.UPDATE);
        assertThat(second.region()).contains(whole);
        assertThat(request.getState()).isEqualTo(AsyncReadState.COMPLETE);
        assertThat(sampleAt(0, 9)).isEqualTo((byte) 2);

        AsyncPollResult third = request.getNextUpdatedRegion(Duration.ZERO);
        assertThat(third.status()).isEqualTo(AsyncStatus.COMPLETE);
        assertThat(third.region()).isEmpty();
    }

    @Test
    void complete_isIdempotent() throws Exception {
        decoder.sink.deliver(null, lines(0, HEIGHT, 3), true);
        assertThat(request.getNextUpdatedRegion(Duration.ZERO).status()).isEqualTo(AsyncStatus.UPDATE);

        for (int i = 0; i < 5; i++) {
            AsyncPollResult result = request.getNextUpdatedRegion(Duration.ofMillis(10));
            assertThat(result.status()).isEqualTo(AsyncStatus.COMPLETE);
            assertThat(result.region()).isEmpty();
        }
    }

    @Test
    void deliveriesAfterComplete_areIgnored() throws Exception {
        decoder.sink.deliver(null, lines(0, HEIGHT, 3), true);
        request.getNextUpdatedRegion(Duration.ZERO);

        AtomicBoolean invoked = new AtomicBoolean();
        decoder.sink.deliver(null, destination -> invoked.set(true), false);
        decoder.sink.fail(new IOException("late failure"));

        assertThat(invoked).isFalse();
        assertThat(request.getState()).isEqualTo(AsyncReadState.COMPLETE);
        assertThat(request.getNextUpdatedRegion(Duration.ZERO).status()).isEqualTo(AsyncStatus.COMPLETE);
    }

    @Test
    void poll_withoutData_returnsPendingWithinTimeout() throws Exception {
        long start = System.nanoTime();

        AsyncPollResult result = request.getNextUpdatedRegion(Duration.ofMillis(100));

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(result.status()).isEqualTo(AsyncStatus.PENDING);
        assertThat(result.region()).isEmpty();
        assertThat(elapsedMillis).isBetween(90L, 2_000L);
    }

    @Test
    void poll_wakesUpOnDeliveryFromDecoderThread() throws Exception {
        Thread decoderThread = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            decoder.sink.deliver(null, lines(0, 2, 9), false);
        });
        decoderThread.start();

        long start = System.nanoTime();
        AsyncPollResult result = request.getNextUpdatedRegion(Duration.ofSeconds(10));

        assertThat(result.status()).isEqualTo(AsyncStatus.UPDATE);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(5_000L);
        assertThat(sampleAt(1, 1)).isEqualTo((byte) 9);
        decoderThread.join();
    }

    @Test
    void poll_withNegativeTimeout_waitsForData() throws Exception {
        Thread decoderThread = new Thread(() -> decoder.sink.deliver(null, lines(0, HEIGHT, 4), true));
        decoderThread.start();

        AsyncPollResult result = request.getNextUpdatedRegion(Duration.ofMillis(-1));

        assertThat(result.status()).isEqualTo(AsyncStatus.UPDATE);
        decoderThread.join();
    }

    @Test
    void poll_whileBufferLockedElsewhere_returnsPending() throws Exception {
        decoder.sink.deliver(null, lines(0, 1, 5), false);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try (BufferGuard guard = request.lockBuffer()) {
                locked.countDown();
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        holder.start();
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

        AsyncPollResult contended = request.getNextUpdatedRegion(Duration.ofMillis(50));
        assertThat(contended.status()).isEqualTo(AsyncStatus.PENDING);
        assertThat(request.tryLockBuffer(Duration.ZERO)).isEmpty();

        release.countDown();
        holder.join();
        assertThat(request.getNextUpdatedRegion(Duration.ofSeconds(1)).status()).isEqualTo(AsyncStatus.UPDATE);
    }

    @Test
    void poll_whileHoldingBufferGuard_failsAndKeepsBufferStable() throws Exception {
        Thread deliverer = new Thread(() -> decoder.sink.deliver(null, lines(0, HEIGHT, 9), false));
        try (BufferGuard guard = request.lockBuffer()) {
            deliverer.start();
            await().atMost(5, TimeUnit.SECONDS).until(() -> deliverer.getState() == Thread.State.WAITING);

            assertThatThrownBy(() -> request.getNextUpdatedRegion(Duration.ofMillis(200)))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> request.getNextUpdatedRegion(Duration.ofMillis(-1)))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(guard.isHeld()).isTrue();
            assertThat(guard.buffer().get(guard.offset(0, 3, 1))).isZero();
            assertThat(deliverer.isAlive()).isTrue();
        }
        deliverer.join();

        assertThat(request.getNextUpdatedRegion(Duration.ofSeconds(1)).status()).isEqualTo(AsyncStatus.UPDATE);
        assertThat(sampleAt(1, 3)).isEqualTo((byte) 9);
    }

    @Test
    void partialRegions_areMergedUntilPolled() throws Exception {
        decoder.sink.deliver(BufferRegion.lines(WIDTH, 0, 2), lines(0, 2, 1), false);
        decoder.sink.deliver(new BufferRegion(1, 5, 2, 2), lines(5, 7, 1), false);

        AsyncPollResult result = request.getNextUpdatedRegion(Duration.ZERO);

        assertThat(result.region()).contains(new BufferRegion(0, 0, WIDTH, 7));
    }

    @Test
    void regionOutsideBuffer_latchesError() throws Exception {
        decoder.sink.deliver(new BufferRegion(0, 8, WIDTH, 5), null, false);

        AsyncPollResult result = request.getNextUpdatedRegion(Duration.ZERO);

        assertThat(result.status()).isEqualTo(AsyncStatus.ERROR);
    }

    @Test
    void decodeFailure_isLatchedAndTerminal() throws Exception {
        decoder.sink.deliver(null, lines(0, 3, 1), false);
        decoder.sink.fail(new IOException("corrupt block"));

        AsyncPollResult result = request.getNextUpdatedRegion(Duration.ZERO);
        assertThat(result.status()).isEqualTo(AsyncStatus.ERROR);
        assertThat(result.error()).hasValueSatisfying(e -> {
            assertThat(e.getKind()).isEqualTo(Kind.BACKEND);
            assertThat(e).hasRootCauseMessage("corrupt block");
        });
        assertThat(request.getState()).isEqualTo(AsyncReadState.ERROR);

        AtomicBoolean invoked = new AtomicBoolean();
        decoder.sink.deliver(null, destination -> invoked.set(true), true);
        assertThat(invoked).isFalse();
        assertThat(request.getNextUpdatedRegion(Duration.ZERO).status()).isEqualTo(AsyncStatus.ERROR);
        assertThat(request.getError()).isPresent();
    }

    @Test
    void writerFailure_latchesError() throws Exception {
        decoder.sink.deliver(null, destination -> {
            throw new IOException("cannot decode");
        }, false);

        assertThat(request.getNextUpdatedRegion(Duration.ZERO).status()).isEqualTo(AsyncStatus.ERROR);
    }

    @Test
    void stagedData_isConvertedByPollingThreadUnderLock() throws Exception {
        AtomicBoolean heldDuringTransfer = new AtomicBoolean();
        decoder.stagedWriter = destination -> {
            heldDuringTransfer.set(destination.buffer() != null);
            lines(0, HEIGHT, 6).write(destination);
        };

        decoder.sink.refresh(true);
        assertThat(decoder.transferStagedCalls).hasValue(0);

        AsyncPollResult result = request.getNextUpdatedRegion(Duration.ZERO);

        assertThat(result.status()).isEqualTo(AsyncStatus.UPDATE);
        assertThat(decoder.transferStagedCalls).hasValue(1);
        assertThat(decoder.stagedThread).isSameAs(Thread.currentThread());
        assertThat(heldDuringTransfer).isTrue();
        assertThat(sampleAt(2, 7)).isEqualTo((byte) 6);
        assertThat(request.getNextUpdatedRegion(Duration.ZERO).status()).isEqualTo(AsyncStatus.COMPLETE);
    }

    @Test
    void stagedConversionFailure_reportsError() throws Exception {
        decoder.stagedWriter = destination -> {
            throw new IOException("staging corrupted");
        };
        decoder.sink.refresh(false);

        AsyncPollResult result = request.getNextUpdatedRegion(Duration.ZERO);

        assertThat(result.status()).isEqualTo(AsyncStatus.ERROR);
        assertThat(request.getState()).isEqualTo(AsyncReadState.ERROR);
    }

    @Test
    void destinationBuffer_outsideLock_isRejected() throws Exception {
        AtomicReference<DestinationBuffer> captured = new AtomicReference<>();
        decoder.sink.deliver(null, captured::set, false);

        assertThatThrownBy(() -> captured.get().buffer()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> captured.get().storeLine(0, 0, ByteBuffer.allocate(WIDTH), 0, DataType.BYTE))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void close_rightAfterStart_cancelsDecoder() {
        request.close();

        assertThat(decoder.cancelled).isTrue();
        assertThat(decoder.sink.isCancelled()).isTrue();
        assertThat(request.isClosed()).isTrue();
        assertThat(decoder.awaitedTimeout).isEqualTo(Duration.ofMillis(30_000));
    }

    @Test
    void close_isIdempotentAndSafeAfterError() {
        decoder.sink.fail(new IOException("boom"));

        request.close();
        request.close();

        assertThat(decoder.cancelled).isTrue();
    }

    @Test
    void close_usesConfiguredEndTimeoutAndToleratesStuckDecoder() throws Exception {
        request.close();
        decoder = new ManualDecoder();
        decoder.stops = false;
        request = start(new AsyncReadOptions().setParameter(AsyncReadOptions.END_TIMEOUT_MILLIS, 250));

        request.close();

        assertThat(decoder.awaitedTimeout).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void afterClose_deliveriesAreDroppedAndPollingFails() {
        request.close();

        AtomicBoolean invoked = new AtomicBoolean();
        decoder.sink.deliver(null, destination -> invoked.set(true), true);

        assertThat(invoked).isFalse();
        assertThatThrownBy(() -> request.getNextUpdatedRegion(Duration.ZERO))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> request.lockBuffer()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void bufferGuard_exposesBufferOnlyWhileHeld() {
        BufferGuard guard = request.lockBuffer();
        assertThat(guard.isHeld()).isTrue();
        assertThat(guard.buffer()).isSameAs(buffer);

        guard.close();
        guard.close();

        assertThat(guard.isHeld()).isFalse();
        assertThatThrownBy(guard::buffer).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void start_whenDecoderFails_reportsBackendError() {
        ManualDecoder failing = new ManualDecoder();
        failing.startFailure = new IOException("no decoder available");
        decoder = failing;

        assertFailsWith(Kind.BACKEND, () -> start(new AsyncReadOptions()));
        assertThat(failing.cancelled).isTrue();
    }
}
