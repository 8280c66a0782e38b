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

package com.amazon.ets.model;

import static com.amazon.ets.CommonUtils.checkArgument;

import java.util.Arrays;

import lombok.Getter;
import lombok.Setter;

/**
 * The mutable state vector of the recursion. Seasonal factors are ordered
 * newest first: index 0 holds the factor just written and index m-1 the factor
 * that applies to the next observation.
 */
@Getter
@Setter
public class RecursionState {

    private double level;
    private double trend;
    private final double[] seasonal;

    public RecursionState(double level, double trend, double[] seasonal) {
        this.level = level;
        this.trend = trend;
        this.seasonal = Arrays.copyOf(seasonal, seasonal.length);
    }

    public RecursionState copy() {
        return new RecursionState(level, trend, seasonal);
    }

    public int getSeasonLength() {
        return seasonal.length;
    }

    public double[] getSeasonal() {
        return Arrays.copyOf(seasonal, seasonal.length);
    }

    public double seasonalAt(int index) {
        return seasonal[index];
    }

    /**
     * The factor used to forecast the next observation.
     */
    public double oldestSeasonal() {
        return seasonal[seasonal.length - 1];
    }

    /**
     * Drops the oldest factor and writes the newest at index 0.
     */
    public void rotate(double newest) {
        if (seasonal.length == 0) {
            return;
        }
        System.arraycopy(seasonal, 0, seasonal, 1, seasonal.length - 1);
        seasonal[0] = newest;
    }

    void setSeasonal(double[] values) {
        checkArgument(values.length == seasonal.length, "incorrect seasonal length");
        System.arraycopy(values, 0, seasonal, 0, values.length);
    }
}
