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

import java.nio.ByteBuffer;

/**
 * Strided copy and numeric conversion of samples between {@link ByteBuffer}s.
 * <p>
 * All accesses use absolute indices, so neither buffer's position nor limit is
 * modified, and values are read and written in each buffer's own
 * {@link ByteBuffer#order() byte order}.
 * <p>
 * <strong>Conversion rules:</strong>
 * <ul>
 * <li>Integer widening is exact.</li>
 * <li>Narrowing saturates to the target range, unless {@code wrap} is requested, in which case the
 *     value is rounded and its low order bits are kept.</li>
 * <li>Floating point to integer rounds half away from zero; NaN becomes 0.</li>
 * <li>Finite values too large for {@link DataType#FLOAT32} saturate to {@code ±Float.MAX_VALUE}.</li>
 * <li>Complex to real keeps the real part; real to complex sets the imaginary part to 0.</li>
 * </ul>
 */
public final class SampleConverter {

    private SampleConverter() {
        // utility class
    }

    /**
     * Copies {@code count} samples, converting from {@code srcType} to {@code dstType}.
     *
     * @param src source buffer
     * @param srcIndex absolute byte index of the first source sample
     * @param srcType source sample type
     * @param srcStride byte distance between consecutive source samples
     * @param dst destination buffer
     * @param dstIndex absolute byte index of the first destination sample
     * @param dstType destination sample type
     * @param dstStride byte distance between consecutive destination samples
     * @param count number of samples to copy
     * @param wrap whether integer narrowing wraps around instead of saturating
     */
    public static void copy(
            ByteBuffer src,
            int srcIndex,
            DataType srcType,
            int srcStride,
            ByteBuffer dst,
            int dstIndex,
            DataType dstType,
            int dstStride,
            int count,
            boolean wrap) {
        for (int i = 0; i < count; i++) {
            copySample(src, srcIndex + i * srcStride, srcType, dst, dstIndex + i * dstStride, dstType, wrap);
        }
    }

    /**
     * Copies a line of {@code srcCount} samples into a line of {@code dstCount} samples, replicating
     * or decimating with nearest neighbour selection when the counts differ.
     *
     * @param src source buffer
     * @param srcIndex absolute byte index of the first source sample
     * @param srcType source sample type
     * @param srcStride byte distance between consecutive source samples
     * @param srcCount number of samples in the source line
     * @param dst destination buffer
     * @param dstIndex absolute byte index of the first destination sample
     * @param dstType destination sample type
     * @param dstStride byte distance between consecutive destination samples
     * @param dstCount number of samples in the destination line
     * @param wrap whether integer narrowing wraps around instead of saturating
     */
    public static void copyResampled(
            ByteBuffer src,
            int srcIndex,
            DataType srcType,
            int srcStride,
            int srcCount,
            ByteBuffer dst,
            int dstIndex,
            DataType dstType,
            int dstStride,
            int dstCount,
            boolean wrap) {
        if (srcCount == dstCount) {
            copy(src, srcIndex, srcType, srcStride, dst, dstIndex, dstType, dstStride, dstCount, wrap);
            return;
        }
        for (int i = 0; i < dstCount; i++) {
            int s = nearest(i, dstCount, srcCount);
            copySample(src, srcIndex + s * srcStride, srcType, dst, dstIndex + i * dstStride, dstType, wrap);
        }
    }

    /**
     * Maps an index in a grid of {@code dstCount} cells to the nearest cell of a grid of
     * {@code srcCount} cells covering the same extent.
     *
     * @param dstIndex index in the destination grid
     * @param dstCount destination grid size
     * @param srcCount source grid size
     * @return the source index, in {@code [0, srcCount)}
     */
    public static int nearest(int dstIndex, int dstCount, int srcCount) {
        if (dstCount == srcCount) {
            return dstIndex;
        }
        int s = (int) Math.floor((dstIndex + 0.5) * srcCount / dstCount);
        return Math.min(Math.max(s, 0), srcCount - 1);
    }

    /**
     * Copies one sample, converting it if needed.
     */
    static void copySample(
            ByteBuffer src, int srcIndex, DataType srcType, ByteBuffer dst, int dstIndex, DataType dstType, boolean wrap) {
        if (srcType == dstType && src.order() == dst.order()) {
            dst.put(dstIndex, src, srcIndex, srcType.size());
            return;
        }
        double real = readComponent(src, srcIndex, srcType);
        double imaginary = srcType.isComplex() ? readComponent(src, srcIndex + srcType.componentSize(), srcType) : 0d;
        writeComponent(dst, dstIndex, dstType, real, wrap);
        if (dstType.isComplex()) {
            writeComponent(dst, dstIndex + dstType.componentSize(), dstType, imaginary, wrap);
        }
    }

    /**
     * Reads one component (the real part for complex types) of a sample.
     *
     * @param buffer the buffer to read from
     * @param index absolute byte index of the component
     * @param type the sample type
     * @return the component value
     */
    public static double readComponent(ByteBuffer buffer, int index, DataType type) {
        return switch (type) {
            case BYTE -> buffer.get(index) & 0xFF;
            case INT8 -> buffer.get(index);
            case UINT16 -> buffer.getShort(index) & 0xFFFF;
            case INT16, CINT16 -> buffer.getShort(index);
            case UINT32 -> buffer.getInt(index) & 0xFFFFFFFFL;
            case INT32, CINT32 -> buffer.getInt(index);
            case FLOAT32, CFLOAT32 -> buffer.getFloat(index);
            case FLOAT64, CFLOAT64 -> buffer.getDouble(index);
        };
    }

    /**
     * Writes one component (the real part for complex types) of a sample, converting
     * {@code value} according to the class level conversion rules.
     *
     * @param buffer the buffer to write to
     * @param index absolute byte index of the component
     * @param type the sample type
     * @param value the value to store
     * @param wrap whether integer narrowing wraps around instead of saturating
     */
    public static void writeComponent(ByteBuffer buffer, int index, DataType type, double value, boolean wrap) {
        if (type.isInteger()) {
            long v = wrap ? wrapToLong(value) : saturate(value, type);
            switch (type) {
                case BYTE, INT8 -> buffer.put(index, (byte) v);
                case UINT16, INT16, CINT16 -> buffer.putShort(index, (short) v);
                case UINT32, INT32, CINT32 -> buffer.putInt(index, (int) v);
                default -> throw new IllegalStateException("not an integer type: " + type);
            }
        } else if (type == DataType.FLOAT32 || type == DataType.CFLOAT32) {
            double v = value;
            if (Double.isFinite(v)) {
                v = Math.max(-Float.MAX_VALUE, Math.min(Float.MAX_VALUE, v));
            }
            buffer.putFloat(index, (float) v);
        } else {
            buffer.putDouble(index, value);
        }
    }

    private static long saturate(double value, DataType type) {
        if (Double.isNaN(value)) {
            return 0L;
        }
        double clamped = Math.max(type.minValue(), Math.min(type.maxValue(), round(value)));
        return (long) clamped;
    }

    private static long wrapToLong(double value) {
        if (Double.isNaN(value)) {
            return 0L;
        }
        return (long) round(value);
    }

    private static double round(double value) {
        return Math.signum(value) * Math.floor(Math.abs(value) + 0.5);
    }
}
