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

package com.amazon.ets.testutils;

import java.util.Random;

/**
 * Series used by tests, examples and benchmarks. Generated series are
 * deterministic for a given seed.
 */
public class ExampleDataSets {

    private static final double[] AIR_PASSENGERS = { 112, 118, 132, 129, 121, 135, 148, 148, 136, 119, 104, 118, 115,
            126, 141, 135, 125, 149, 170, 170, 158, 133, 114, 140, 145, 150, 178, 163, 172, 178, 199, 199, 184, 162,
            146, 166, 171, 180, 193, 181, 183, 218, 230, 242, 209, 191, 172, 194, 196, 196, 236, 235, 229, 243, 264,
            272, 237, 211, 180, 201, 204, 188, 235, 227, 234, 264, 302, 293, 259, 229, 203, 229, 242, 233, 267, 269,
            270, 315, 364, 347, 312, 274, 237, 278, 284, 277, 317, 313, 318, 374, 413, 405, 355, 306, 271, 306, 315,
            301, 356, 348, 355, 422, 465, 467, 404, 347, 305, 336, 340, 318, 362, 348, 363, 435, 491, 505, 404, 359,
            310, 337, 360, 342, 406, 396, 420, 472, 548, 559, 463, 407, 362, 405, 417, 391, 419, 461, 472, 535, 622,
            606, 508, 461, 390, 432 };

    private ExampleDataSets() {
    }

    /**
     * Monthly international airline passengers in thousands, 1949 to 1960.
     */
    public static double[] airPassengers() {
        return AIR_PASSENGERS.clone();
    }

    /**
     * @return the seasonal factor 1 + amplitude * sin(2 pi phase / period)
     */
    public static double seasonalFactor(int phase, int period, double amplitude) {
        return 1 + amplitude * Math.sin(2 * Math.PI * phase / period);
    }

    /**
     * level * factor * (1 + noise * N(0,1)) with a sinusoidal factor.
     */
    public static double[] multiplicativeSeasonal(int length, int period, double level, double amplitude,
            double noise, long seed) {
        Random random = new Random(seed);
        double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = level * seasonalFactor(i % period, period, amplitude) * (1 + noise * random.nextGaussian());
        }
        return result;
    }

    /**
     * level + slope * i + amplitude * sin(2 pi i / period) + noise * N(0,1).
     */
    public static double[] additiveSeasonal(int length, int period, double level, double slope, double amplitude,
            double noise, long seed) {
        Random random = new Random(seed);
        double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = level + slope * i + amplitude * Math.sin(2 * Math.PI * i / period)
                    + noise * random.nextGaussian();
        }
        return result;
    }

    /**
     * start + slope * i + noise * N(0,1).
     */
    public static double[] linearTrend(int length, double start, double slope, double noise, long seed) {
        Random random = new Random(seed);
        double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = start + slope * i + noise * random.nextGaussian();
        }
        return result;
    }

    /**
     * A random walk around a level: level + cumulative N(0, step^2).
     */
    public static double[] randomWalk(int length, double level, double step, long seed) {
        Random random = new Random(seed);
        double[] result = new double[length];
        double current = level;
        for (int i = 0; i < length; i++) {
            current += step * random.nextGaussian();
            result[i] = current;
        }
        return result;
    }
}
