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

package com.amazon.ets;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.ets.config.ErrorType;
import com.amazon.ets.config.OptimizationCriterion;
import com.amazon.ets.config.SeasonType;
import com.amazon.ets.config.TrendType;
import com.amazon.ets.model.ETS;
import com.amazon.ets.model.ETSGradients;
import com.amazon.ets.model.SmoothingConfig;
import com.amazon.ets.testutils.ExampleDataSets;

/**
 * Cost of a single model fit compared with the differentiated pass used by the
 * gradient based refinement.
 */
@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class ETSBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "1000", "10000" })
        int dataSize;

        @Param({ "1", "3" })
        int nmse;

        double[] data;
        SmoothingConfig config;

        @Setup(Level.Trial)
        public void setUpData() {
            data = ExampleDataSets.multiplicativeSeasonal(dataSize, 24, 500, 0.3, 0.05, 5);
            config = SmoothingConfig.builder().error(ErrorType.MULTIPLICATIVE).trend(TrendType.DAMPED_ADDITIVE)
                    .season(SeasonType.MULTIPLICATIVE).seasonLength(24).alpha(0.2).beta(0.02).phi(0.95).gamma(0.05)
                    .build();
        }
    }

    @Benchmark
    public double fit(BenchmarkState state) {
        ETS model = new ETS(state.config, state.nmse);
        model.fit(state.data);
        return model.logLikelihood();
    }

    @Benchmark
    public void gradients(BenchmarkState state, Blackhole blackhole) {
        ETSGradients pass = ETSGradients.compute(state.config, state.data, null, null, state.nmse);
        blackhole.consume(pass.gradient(OptimizationCriterion.LIKELIHOOD));
    }
}
