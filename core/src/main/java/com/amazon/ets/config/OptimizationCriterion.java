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

package com.amazon.ets.config;

/**
 * The quantity minimized when refining the smoothing parameters of a
 * candidate. Candidates are always compared by AICc regardless of this choice.
 */
public enum OptimizationCriterion {
    /**
     * negative log likelihood
     */
    LIKELIHOOD,
    /**
     * in-sample one step mean squared error
     */
    MSE,
    /**
     * mean squared error averaged over forecast horizons 1 to nmse
     */
    AMSE,
    /**
     * square root of the one step mean squared error
     */
    SIGMA
}
