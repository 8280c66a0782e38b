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

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Goodness of fit summary of a fitted model. Information criteria are
 * +infinity when they are not defined.
 */
@Getter
@ToString
@AllArgsConstructor
public class AutoETSMetrics {

    private final double aic;
    private final double aicc;
    private final double bic;
    private final double mse;
    private final double amse;
    private final double sigma;
    private final double logLikelihood;

    /**
     * metrics for a candidate that could not be fit
     */
    public static AutoETSMetrics invalid() {
        double inf = Double.POSITIVE_INFINITY;
        return new AutoETSMetrics(inf, inf, inf, inf, inf, inf, Double.NEGATIVE_INFINITY);
    }
}
