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
 * Transforms coordinates in place.
 */
@FunctionalInterface
public interface CoordinateTransform {

    /**
     * Transforms the first {@code count} coordinates of the arrays in place.
     *
     * @param count number of points
     * @param xs x coordinates
     * @param ys y coordinates
     * @param zs z coordinates, all zero when no elevation is available
     * @return per point success flags; failed points keep whatever values the transform left
     */
    boolean[] transform(int count, double[] xs, double[] ys, double[] zs);
}
