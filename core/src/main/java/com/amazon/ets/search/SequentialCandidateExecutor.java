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

import lombok.extern.slf4j.Slf4j;

/**
 * Evaluates candidates one at a time in enumeration order. Once a valid model
 * exists, the scan stops after a run of {@code patience} evaluations that do
 * not lower the best AICc by more than {@code minImprovement}; failed
 * evaluations count toward the run.
 */
@Slf4j
public class SequentialCandidateExecutor extends AbstractCandidateExecutor {

    private final boolean earlyTermination;
    private final int patience;
    private final double minImprovement;

    public SequentialCandidateExecutor(CandidateEvaluator evaluator, boolean earlyTermination, int patience,
            double minImprovement) {
        super(evaluator);
        this.earlyTermination = earlyTermination;
        this.patience = patience;
        this.minImprovement = minImprovement;
    }

    @Override
    public SearchOutcome execute(List<CandidateConfig> candidates, long deadlineNanos) {
        SearchOutcome outcome = new SearchOutcome();
        int sinceImprovement = 0;
        for (int i = 0; i < candidates.size(); i++) {
            CandidateResult result = evaluate(candidates.get(i), deadlineNanos);
            if (result.isSkipped()) {
                log.debug("time budget exhausted after {} candidates", i);
                outcome.skip(candidates.size() - i);
                break;
            }
            double improvement = outcome.accept(result);
            sinceImprovement = (improvement > minImprovement) ? 0 : sinceImprovement + 1;
            if (earlyTermination && outcome.getBest() != null && sinceImprovement >= patience) {
                if (i < candidates.size() - 1) {
                    log.debug("stopping after {} candidates without improvement", sinceImprovement);
                    outcome.markEarlyTerminated();
                }
                break;
            }
        }
        return outcome;
    }
}
