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

package com.amazon.ets.optimization;

import static com.amazon.ets.CommonUtils.checkArgument;
import static com.amazon.ets.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Coordinatewise box constraints.
 */
public class Bounds {

    private final double[] lower;
    private final double[] upper;

    public Bounds(double[] lower, double[] upper) {
        checkNotNull(lower, "lower bounds cannot be null");
        checkNotNull(upper, "upper bounds cannot be null");
        checkArgument(lower.length == upper.length, "bounds must have the same length");
        for (int i = 0; i < lower.length; i++) {
            checkArgument(lower[i] <= upper[i], "lower bound exceeds upper bound at " + i);
        }
        this.lower = Arrays.copyOf(lower, lower.length);
        this.upper = Arrays.copyOf(upper, upper.length);
    }

    public static Bounds unbounded(int dimension) {
        double[] lower = new double[dimension];
        double[] upper = new double[dimension];
        Arrays.fill(lower, Double.NEGATIVE_INFINITY);
        Arrays.fill(upper, Double.POSITIVE_INFINITY);
        return new Bounds(lower, upper);
    }

    public int getDimension() {
        return lower.length;
    }

    public double lower(int i) {
        return lower[i];
    }

    public double upper(int i) {
        return upper[i];
    }

    /**
     * @return a copy of point moved into the box
     */
    public double[] project(double[] point) {
        double[] result = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            result[i] = Math.max(lower[i], Math.min(upper[i], point[i]));
        }
        return result;
    }
}
