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
 * Smoothing parameters of the selected model. Beta and gamma are NaN when the
 * model has no trend or no season respectively; phi is 1 for undamped models.
 */
@Getter
@ToString
@AllArgsConstructor
public class AutoETSParameters {

    private final double alpha;
    private final double beta;
    private final double gamma;
    private final double phi;
}
