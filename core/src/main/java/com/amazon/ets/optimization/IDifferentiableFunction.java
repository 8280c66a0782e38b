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

/**
 * A scalar function that reports its gradient alongside its value.
 */
@FunctionalInterface
public interface IDifferentiableFunction {

    /**
     * @param point    the argument; must not be modified
     * @param gradient output array of the same length as point, overwritten with
     *                 the gradient
     * @return the function value, or +infinity where the function is undefined
     */
    double evaluate(double[] point, double[] gradient);
}
