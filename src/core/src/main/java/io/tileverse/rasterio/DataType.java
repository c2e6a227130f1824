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

/**
 * The closed set of sample value types a raster band or a caller buffer can hold.
 * <p>
 * Complex types store two consecutive components (real, imaginary) of the
 * corresponding base type, so their {@link #size() size} is twice the size of
 * one component.
 */
public enum DataType {
    /** Unsigned 8-bit integer. */
    BYTE(1, true, false, false, 0, 255),
    /** Signed 8-bit integer. */
    INT8(1, true, true, false, Byte.MIN_VALUE, Byte.MAX_VALUE),
    /** Unsigned 16-bit integer. */
    UINT16(2, true, false, false, 0, 65_535),
    /** Signed 16-bit integer. */
    INT16(2, true, true, false, Short.MIN_VALUE, Short.MAX_VALUE),
    /** Unsigned 32-bit integer. */
    UINT32(4, true, false, false, 0, 4_294_967_295d),
    /** Signed 32-bit integer. */
    INT32(4, true, true, false, Integer.MIN_VALUE, Integer.MAX_VALUE),
    /** IEEE 754 single precision. */
    FLOAT32(4, false, true, false, -Float.MAX_VALUE, Float.MAX_VALUE),
    /** IEEE 754 double precision. */
    FLOAT64(8, false, true, false, -Double.MAX_VALUE, Double.MAX_VALUE),
    /** Complex of two signed 16-bit integers. */
    CINT16(4, true, true, true, Short.MIN_VALUE, Short.MAX_VALUE),
    /** Complex of two signed 32-bit integers. */
    CINT32(8, true, true, true, Integer.MIN_VALUE, Integer.MAX_VALUE),
    /** Complex of two single precision floats. */
    CFLOAT32(8, false, true, true, -Float.MAX_VALUE, Float.MAX_VALUE),
    /** Complex of two double precision floats. */
    CFLOAT64(16, false, true, true, -Double.MAX_VALUE, Double.MAX_VALUE);

    private final int size;
    private final boolean integer;
    private final boolean signed;
    private final boolean complex;
    private final double minValue;
    private final double maxValue;

    DataType(int size, boolean integer, boolean signed, boolean complex, double minValue, double maxValue) {
        this.size = size;
        this.integer = integer;
        this.signed = signed;
        this.complex = complex;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    /**
     * @return the number of bytes one sample of this type occupies
     */
    public int size() {
        return size;
    }

    /**
     * @return the number of bytes of one component; equals {@link #size()} for non complex types
     */
    public int componentSize() {
        return complex ? size / 2 : size;
    }

    public boolean isInteger() {
        return integer;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isComplex() {
        return complex;
    }

    /**
     * @return the smallest value a component of this type can hold
     */
    public double minValue() {
        return minValue;
    }

    /**
     * @return the largest value a component of this type can hold
     */
    public double maxValue() {
        return maxValue;
    }
}
