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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.ets.config.ErrorType;
import com.amazon.ets.config.SeasonType;
import com.amazon.ets.config.TrendType;
import com.amazon.ets.testutils.ExampleDataSets;

public class StateInitializerTest {

    @Test
    public void testLevelIsLeadingMean() {
        double[] values = new double[20];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        RecursionState state = StateInitializer.initialize(values, SmoothingConfig.builder().build());
        // mean of the first ten
        assertEquals(4.5, state.getLevel(), 1e-12);
        assertEquals(0, state.getSeasonLength());
    }

    @Test
    public void testAdditiveTrendFromLeastSquares() {
        double[] values = new double[12];
        for (int i = 0; i < values.length; i++) {
            values[i] = 7 + 2 * i;
        }
        SmoothingConfig config = SmoothingConfig.builder().trend(TrendType.ADDITIVE).beta(0.1).build();
        RecursionState state = StateInitializer.initialize(values, config);
        assertEquals(5, state.getLevel(), 1e-9);
        assertEquals(2, state.getTrend(), 1e-9);
    }

    @Test
    public void testMultiplicativeTrendFromLeastSquares() {
        double[] values = new double[12];
        for (int i = 0; i < values.length; i++) {
            values[i] = 7 + 2 * i;
        }
        SmoothingConfig config = SmoothingConfig.builder().error(ErrorType.MULTIPLICATIVE)
                .trend(TrendType.MULTIPLICATIVE).beta(0.1).build();
        RecursionState state = StateInitializer.initialize(values, config);
        assertEquals(9.0 / 7.0, state.getTrend(), 1e-9);
        assertEquals(49.0 / 9.0, state.getLevel(), 1e-9);
    }

    @Test
    public void testDecomposedAdditiveSeason() {
        double[] pattern = { 3, -1, -2, 0 };
        double[] values = new double[20];
        for (int i = 0; i < values.length; i++) {
            values[i] = 50 + pattern[i % 4];
        }
        SmoothingConfig config = SmoothingConfig.builder().season(SeasonType.ADDITIVE).seasonLength(4)
                .gamma(0.1).build();
        RecursionState state = StateInitializer.initialize(values, config);
        assertArrayEquals(new double[] { 0, -2, -1, 3 }, state.getSeasonal(), 1e-9);
        assertEquals(50, state.getLevel(), 1e-9);
    }

    @Test
    public void testShortMultiplicativeSeasonAveragesToOne() {
        double[] values = ExampleDataSets.multiplicativeSeasonal(24, 12, 100, 0.6, 0.02, 17);
        SmoothingConfig config = SmoothingConfig.builder().error(ErrorType.MULTIPLICATIVE)
                .season(SeasonType.MULTIPLICATIVE).seasonLength(12).gamma(0.1).build();
        RecursionState state = StateInitializer.initialize(values, config);
        double mean = Arrays.stream(state.getSeasonal()).average().getAsDouble();
        assertEquals(1.0, mean, 1e-9);
    }

    @Test
    public void testShortAdditiveSeasonSumsToZero() {
        double[] values = ExampleDataSets.additiveSeasonal(16, 8, 20, 0, 5, 0.1, 3);
        SmoothingConfig config = SmoothingConfig.builder().season(SeasonType.ADDITIVE).seasonLength(8)
                .gamma(0.1).build();
        RecursionState state = StateInitializer.initialize(values, config);
        assertEquals(0.0, Arrays.stream(state.getSeasonal()).sum(), 1e-9);
    }

    @Test
    public void testOverrides() {
        double[] values = ExampleDataSets.linearTrend(30, 10, 1, 0.1, 5);
        SmoothingConfig config = SmoothingConfig.builder().error(ErrorType.MULTIPLICATIVE)
                .trend(TrendType.MULTIPLICATIVE).beta(0.1).build();
        RecursionState state = StateInitializer.initialize(values, config, -3.0, 50.0, null);
        assertEquals(StateInitializer.MIN_POSITIVE_LEVEL, state.getLevel());
        assertEquals(StateInitializer.MAX_TREND_RATIO, state.getTrend());

        SmoothingConfig seasonal = SmoothingConfig.builder().season(SeasonType.ADDITIVE).seasonLength(4)
                .gamma(0.1).build();
        RecursionState withSeason = StateInitializer.initialize(values, seasonal, null, null,
                new double[] { 1, 2, 3, 4 });
        assertArrayEquals(new double[] { 1, 2, 3, 4 }, withSeason.getSeasonal());
        assertThrows(IllegalArgumentException.class,
                () -> StateInitializer.initialize(values, seasonal, null, null, new double[] { 1, 2 }));
    }

    @Test
    public void testLeastSquares() {
        double[] values = { 3, 5, 7, 9, 100 };
        assertArrayEquals(new double[] { 1, 2 }, StateInitializer.leastSquares(values, 4), 1e-12);
        assertArrayEquals(new double[] { 3, 0 }, StateInitializer.leastSquares(values, 1), 1e-12);
    }
}
