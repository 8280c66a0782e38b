/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.ets;

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Restricts a value to a closed interval.
     *
     * @param value the value
     * @param lower lower end of the interval
     * @param upper upper end of the interval, assumed to be at least lower
     * @return the nearest point of [lower, upper] to value
     */
    public static double clamp(double value, double lower, double upper) {
        return Math.max(lower, Math.min(upper, value));
    }

    /**
     * @param values an array of observations
     * @return true if any value is zero or negative
     */
    public static boolean hasNonPositive(double[] values) {
        for (double value : values) {
            if (value <= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Arithmetic mean of values[from, to).
     *
     * @param values the array
     * @param from   first index, inclusive
     * @param to     last index, exclusive
     * @return the mean, or 0 for an empty range
     */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return 0;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    public static boolean isFinite(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }
}
