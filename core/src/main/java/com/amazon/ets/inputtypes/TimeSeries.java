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

import static com.amazon.ets.CommonUtils.checkArgument;
import static com.amazon.ets.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * An ordered collection of observations stored column-major, one array per
 * dimension. The forecasting models accept only univariate series.
 */
public class TimeSeries {

    private final double[][] columns;

    /**
     * @param columns one array of observations per dimension; all of equal length
     */
    public TimeSeries(double[][] columns) {
        checkNotNull(columns, "columns cannot be null");
        checkArgument(columns.length > 0, "a time series needs at least one dimension");
        int length = checkNotNull(columns[0], "column cannot be null").length;
        this.columns = new double[columns.length][];
        for (int i = 0; i < columns.length; i++) {
            checkNotNull(columns[i], "column cannot be null");
            checkArgument(columns[i].length == length, "all dimensions must have the same length");
            this.columns[i] = Arrays.copyOf(columns[i], length);
        }
    }

    public static TimeSeries univariate(double... values) {
        checkNotNull(values, "values cannot be null");
        return new TimeSeries(new double[][] { values });
    }

    public int getDimensions() {
        return columns.length;
    }

    public int getLength() {
        return columns[0].length;
    }

    public boolean isEmpty() {
        return getLength() == 0;
    }

    /**
     * @return a copy of the observations of a univariate series
     * @throws IllegalArgumentException if the series has more than one dimension
     */
    public double[] getValues() {
        checkArgument(columns.length == 1, "values are only defined for a univariate series");
        return Arrays.copyOf(columns[0], columns[0].length);
    }

    public double[] getColumn(int dimension) {
        checkArgument(dimension >= 0 && dimension < columns.length, "incorrect dimension");
        return Arrays.copyOf(columns[dimension], columns[dimension].length);
    }
}
