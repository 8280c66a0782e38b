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

package com.amazon.ets.inputtypes;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class TimeSeriesTest {

    @Test
    public void testUnivariate() {
        double[] values = { 1, 2, 3 };
        TimeSeries series = TimeSeries.univariate(values);
        values[0] = 99;
        assertEquals(1, series.getDimensions());
        assertEquals(3, series.getLength());
        assertFalse(series.isEmpty());
        assertArrayEquals(new double[] { 1, 2, 3 }, series.getValues());

        series.getValues()[1] = 42;
        assertEquals(2, series.getValues()[1]);
    }

    @Test
    public void testMultivariate() {
        TimeSeries series = new TimeSeries(new double[][] { { 1, 2 }, { 3, 4 } });
        assertEquals(2, series.getDimensions());
        assertArrayEquals(new double[] { 3, 4 }, series.getColumn(1));
        assertThrows(IllegalArgumentException.class, series::getValues);
        assertThrows(IllegalArgumentException.class, () -> series.getColumn(2));
    }

    @Test
    public void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new TimeSeries(new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> new TimeSeries(new double[][] { { 1, 2 }, { 3 } }));
        assertThrows(NullPointerException.class, () -> TimeSeries.univariate((double[]) null));
        assertTrue(TimeSeries.univariate().isEmpty());
    }
}
