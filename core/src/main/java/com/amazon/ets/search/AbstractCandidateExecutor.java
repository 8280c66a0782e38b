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

import java.util.List;

/**
 * Runs a candidate evaluator over the enumerated structures and selects the
 * best result.
 */
public abstract class AbstractCandidateExecutor {

    protected final CandidateEvaluator evaluator;

    protected AbstractCandidateExecutor(CandidateEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * @param candidates     structures in enumeration order
     * @param deadlineNanos  value of {@link System#nanoTime()} after which no new
     *                       candidate is started, or {@link Long#MAX_VALUE}
     * @return the selection with scan statistics
     */
    public abstract SearchOutcome execute(List<CandidateConfig> candidates, long deadlineNanos);

    protected CandidateResult evaluate(CandidateConfig candidate, long deadlineNanos) {
        if (deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos > 0) {
            return CandidateResult.skipped(candidate);
        }
        return evaluator.evaluate(candidate);
    }
}
