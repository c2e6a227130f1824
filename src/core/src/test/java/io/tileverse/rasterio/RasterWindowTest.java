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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RasterWindowTest {

    @Test
    void resolve_withZeroStrides_appliesPackedDefaults() throws Exception {
        RasterWindow window = RasterWindow.of(0, 0, 4, 3, DataType.INT16).resolve();

        assertThat(window.pixelSpace()).isEqualTo(2);
        assertThat(window.lineSpace()).isEqualTo(8);
        assertThat(window.bandSpace()).isEqualTo(24);
        assertThat(window.isResolved()).isTrue();
    }

    @Test
    void resolve_withExplicitStrides_keepsThem() throws Exception {
        RasterWindow window =
                RasterWindow.of(0, 0, 4, 3, DataType.BYTE).withStrides(3, 100, 1).resolve();

        assertThat(window.pixelSpace()).isEqualTo(3);
        assertThat(window.lineSpace()).isEqualTo(100);
        assertThat(window.bandSpace()).isEqualTo(1);
    }

    @Test
    void resolve_defaultsUseBufferSize() throws Exception {
        RasterWindow window = RasterWindow.of(0, 0, 10, 10, 5, 2, DataType.FLOAT32).resolve();

        assertThat(window.lineSpace()).isEqualTo(20);
        assertThat(window.bandSpace()).isEqualTo(40);
        assertThat(window.isResampled()).isTrue();
    }

    @Test
    void resolve_isIdempotent() throws Exception {
        RasterWindow once = RasterWindow.of(1, 2, 4, 3, DataType.INT32).resolve();
        assertThat(once.resolve()).isEqualTo(once);
    }

    @Test
    void resolve_withNonPositiveSizes_failsWithInvalidArgument() {
        assertInvalid(RasterWindow.of(0, 0, 0, 3, DataType.BYTE));
        assertInvalid(RasterWindow.of(0, 0, 3, -1, DataType.BYTE));
        assertInvalid(RasterWindow.of(0, 0, 3, 3, 0, 3, DataType.BYTE));
    }

    @Test
    void resolve_withBadStrides_failsWithInvalidArgument() {
        assertInvalid(RasterWindow.of(0, 0, 3, 3, DataType.BYTE).withStrides(-1, 0, 0));
        assertInvalid(RasterWindow.of(0, 0, 3, 3, DataType.INT32).withStrides(2, 0, 0));
    }

    @Test
    void requiredBytes_coversLastSampleOfLastBand() throws Exception {
        RasterWindow window = RasterWindow.of(0, 0, 4, 3, DataType.INT16).resolve();

        assertThat(window.requiredBytes(1)).isEqualTo(24);
        assertThat(window.requiredBytes(2)).isEqualTo(48);

        RasterWindow interleaved =
                RasterWindow.of(0, 0, 4, 3, DataType.INT16).withStrides(4, 16, 2).resolve();
        assertThat(interleaved.requiredBytes(2)).isEqualTo(2 * 16 + 3 * 4 + 2 + 2);
    }

    private static void assertInvalid(RasterWindow window) {
        RasterAssertions.assertFailsWith(RasterIOException.Kind.INVALID_ARGUMENT, window::resolve);
    }
}
