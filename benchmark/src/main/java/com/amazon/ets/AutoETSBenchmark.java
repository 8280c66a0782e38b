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

import com.amazon.ets.search.AutoETS;
import com.amazon.ets.testutils.ExampleDataSets;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class AutoETSBenchmark {

    public final static int DATA_SIZE = 144;
    public final static int SEASON_LENGTH = 12;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "ZZZ", "AAdA", "MNM" })
        String spec;

        @Param({ "false", "true" })
        boolean earlyTermination;

        @Param({ "1", "4" })
        int threads;

        double[] data;

        @Setup(Level.Trial)
        public void setUpData() {
            data = ExampleDataSets.multiplicativeSeasonal(DATA_SIZE, SEASON_LENGTH, 300, 0.35, 0.04, 11);
        }
    }

    @Benchmark
    public AutoETS fit(BenchmarkState state, Blackhole blackhole) {
        AutoETS auto = new AutoETS(SEASON_LENGTH, state.spec).setParallelism(state.threads);
        if (!state.earlyTermination) {
            auto.disableEarlyTermination();
        }
        auto.fit(state.data);
        blackhole.consume(auto.predict(SEASON_LENGTH).point);
        return auto;
    }
}
