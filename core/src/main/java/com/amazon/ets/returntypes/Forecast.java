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

package com.amazon.ets.returntypes;

import static com.amazon.ets.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Point forecasts for horizons 1 through h. The i-th entry is the forecast i+1
 * steps past the end of the training data.
 */
public class Forecast {

    public final double[] point;

    public Forecast(double[] point) {
        checkNotNull(point, "point cannot be null");
        this.point = Arrays.copyOf(point, point.length);
    }

    public int getHorizon() {
        return point.length;
    }

    @Override
    public String toString() {
        return "Forecast" + Arrays.toString(point);
    }
}
