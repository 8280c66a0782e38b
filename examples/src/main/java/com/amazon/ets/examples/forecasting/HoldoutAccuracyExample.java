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

package com.amazon.ets.examples.forecasting;

import java.util.Arrays;

import com.amazon.ets.examples.Example;
import com.amazon.ets.search.AutoETS;
import com.amazon.ets.testutils.ExampleDataSets;

/**
 * Trains on all but the last year of a synthetic seasonal series and reports
 * the forecast error on the held out year.
 */
public class HoldoutAccuracyExample implements Example {

    public static void main(String[] args) throws Exception {
        new HoldoutAccuracyExample().run();
    }

    @Override
    public String command() {
        return "holdout_accuracy";
    }

    @Override
    public String description() {
        return "measure forecast error on a held out season of synthetic data";
    }

    @Override
    public void run() throws Exception {
        int period = 12;
        double[] series = ExampleDataSets.multiplicativeSeasonal(120, period, 200, 0.4, 0.03, 42);
        double[] training = Arrays.copyOf(series, series.length - period);
        double[] holdout = Arrays.copyOfRange(series, series.length - period, series.length);

        for (boolean exhaustive : new boolean[] { false, true }) {
            AutoETS auto = new AutoETS(period);
            if (exhaustive) {
                auto.disableEarlyTermination();
            }
            long start = System.nanoTime();
            auto.fit(training);
            long elapsed = System.nanoTime() - start;

            double[] forecast = auto.predict(period).point;
            double absolutePercentage = 0;
            for (int i = 0; i < period; i++) {
                absolutePercentage += Math.abs(holdout[i] - forecast[i]) / Math.abs(holdout[i]);
            }
            System.out.printf("%-10s model %-5s evaluated %2d  mape %.2f%%  %d ms%n",
                    exhaustive ? "exhaustive" : "early stop", auto.components().code(),
                    auto.diagnostics().getModelsEvaluated(), 100 * absolutePercentage / period, elapsed / 1_000_000);
        }
    }
}
