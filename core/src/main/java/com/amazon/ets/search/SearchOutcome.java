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

import lombok.Getter;

/**
 * Running result of a candidate scan.
 */
@Getter
public class SearchOutcome {

    private CandidateResult best;
    private int modelsEvaluated;
    private int modelsFailed;
    private int modelsSkipped;
    private boolean earlyTerminated;

    /**
     * Folds one evaluated candidate into the outcome.
     *
     * @return the AICc improvement over the previous best, +infinity for the
     *         first valid candidate and 0 when the best did not change
     */
    double accept(CandidateResult result) {
        if (result.isSkipped()) {
            modelsSkipped++;
            return 0;
        }
        modelsEvaluated++;
        if (!result.isValid()) {
            modelsFailed++;
            return 0;
        }
        if (best == null) {
            best = result;
            return Double.POSITIVE_INFINITY;
        }
        if (AutoETS.betterMetrics(result.getMetrics(), best.getMetrics())) {
            double improvement = best.getMetrics().getAicc() - result.getMetrics().getAicc();
            best = result;
            return improvement;
        }
        return 0;
    }

    void skip(int count) {
        modelsSkipped += count;
    }

    void markEarlyTerminated() {
        earlyTerminated = true;
    }
}
