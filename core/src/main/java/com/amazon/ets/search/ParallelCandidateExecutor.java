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
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

/**
 * Evaluates all candidates on a private thread pool and folds the results in
 * enumeration order, so the selection does not depend on scheduling. There is
 * no early termination in this mode.
 */
public class ParallelCandidateExecutor extends AbstractCandidateExecutor {

    private final int threadPoolSize;
    private ForkJoinPool forkJoinPool;

    public ParallelCandidateExecutor(CandidateEvaluator evaluator, int threadPoolSize) {
        super(evaluator);
        this.threadPoolSize = threadPoolSize;
    }

    @Override
    public SearchOutcome execute(List<CandidateConfig> candidates, long deadlineNanos) {
        List<CandidateResult> results = submitAndJoin(() -> candidates.parallelStream()
                .map(candidate -> evaluate(candidate, deadlineNanos)).collect(Collectors.toList()));
        SearchOutcome outcome = new SearchOutcome();
        for (CandidateResult result : results) {
            outcome.accept(result);
        }
        return outcome;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        try {
            return forkJoinPool.submit(callable).join();
        } finally {
            forkJoinPool.shutdown();
            forkJoinPool = null;
        }
    }
}
