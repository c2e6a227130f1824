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

import static java.util.Objects.requireNonNull;

import java.io.IOException;

/**
 * Signals a failed raster transfer.
 * <p>
 * Every failure carries a {@link Kind} and, when the failure happened part way
 * through a transfer, the number of lines (or rows) that were completed before it.
 * Completed lines are left in place; nothing is rolled back.
 */
public class RasterIOException extends IOException {

    private static final long serialVersionUID = 1L;

    /** The closed set of failure kinds. */
    public enum Kind {
        /** Malformed window, stride, buffer or band selection, detected before any I/O. */
        INVALID_ARGUMENT,
        /** The window exceeds the raster extent. */
        OUT_OF_RANGE,
        /** The backend failed to decode or encode data. */
        BACKEND,
        /** The caller or a progress listener requested an abort. */
        CANCELLED
    }

    private final Kind kind;
    private final int completedLines;

    /**
     * Creates a new exception.
     *
     * @param kind the failure kind
     * @param message the detail message
     * @param cause the underlying cause, may be {@code null}
     * @param completedLines lines transferred before the failure, or {@code -1} if not applicable
     */
    public RasterIOException(Kind kind, String message, Throwable cause, int completedLines) {
        super(message, cause);
        this.kind = requireNonNull(kind, "kind");
        this.completedLines = completedLines;
    }

    public static RasterIOException invalidArgument(String message) {
        return new RasterIOException(Kind.INVALID_ARGUMENT, message, null, -1);
    }

    public static RasterIOException outOfRange(String message) {
        return new RasterIOException(Kind.OUT_OF_RANGE, message, null, -1);
    }

    public static RasterIOException backend(String message, Throwable cause, int completedLines) {
        return new RasterIOException(Kind.BACKEND, message, cause, completedLines);
    }

    public static RasterIOException cancelled(String message, int completedLines) {
        return new RasterIOException(Kind.CANCELLED, message, null, completedLines);
    }

    /**
     * @return the failure kind
     */
    public Kind getKind() {
        return kind;
    }

    /**
     * @return the number of lines or rows completed before the failure, {@code -1} if not applicable
     */
    public int getCompletedLines() {
        return completedLines;
    }
}
