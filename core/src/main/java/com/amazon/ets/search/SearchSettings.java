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

package com.amazon.ets.search;

import com.amazon.ets.config.OptimizationCriterion;

import lombok.Builder;
import lombok.Getter;

/**
 * The per-candidate evaluation options of a search. Pinned parameters are
 * null when free.
 */
@Getter
@Builder
public class SearchSettings {

    private final Double pinnedAlpha;
    private final Double pinnedBeta;
    private final Double pinnedGamma;
    private final Double pinnedPhi;
    @Builder.Default
    private final OptimizationCriterion criterion = OptimizationCriterion.LIKELIHOOD;
    @Builder.Default
    private final int maxIterations = 300;
    @Builder.Default
    private final int nmse = 3;
    @Builder.Default
    private final boolean stateSearchEnabled = false;
}
