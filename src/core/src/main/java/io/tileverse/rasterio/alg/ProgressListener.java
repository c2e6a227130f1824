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
package io.tileverse.rasterio.alg;

/**
 * Receives progress of a long running operation.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param complete completed fraction, in {@code (0, 1]}
     * @param message a short description of the current step, may be empty
     * @return {@code true} to continue, {@code false} to cancel the operation
     */
    boolean onProgress(double complete, String message);
}
