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

import static com.amazon.ets.CommonUtils.isFinite;

import com.amazon.ets.model.SmoothingConfig;
import com.amazon.ets.returntypes.AutoETSMetrics;

import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of evaluating one candidate structure. A failed evaluation has no
 * config, infinite metrics and a failure reason.
 */
@Getter
@Builder
public class CandidateResult {

    private final CandidateConfig candidate;
    private final SmoothingConfig config;
    private final AutoETSMetrics metrics;
    // explicit starting state, null when the heuristic initialization won
    private final Double level0;
    private final Double trend0;
    private final int optimizerIterations;
    private final boolean optimizerConverged;
    private final double optimizerObjective;
    private final String failure;
    private final boolean skipped;

    public boolean isValid() {
        return config != null && metrics != null && isFinite(metrics.getAicc());
    }

    public boolean hasStateOverride() {
        return level0 != null;
    }

    static CandidateResult failed(CandidateConfig candidate, String reason) {
        return CandidateResult.builder().candidate(candidate).metrics(AutoETSMetrics.invalid()).failure(reason)
                .optimizerObjective(Double.NaN).build();
    }

    static CandidateResult skipped(CandidateConfig candidate) {
        return CandidateResult.builder().candidate(candidate).metrics(AutoETSMetrics.invalid())
                .failure("time budget exhausted").optimizerObjective(Double.NaN).skipped(true).build();
    }
}
