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

import com.amazon.ets.examples.Example;
import com.amazon.ets.inputtypes.TimeSeries;
import com.amazon.ets.returntypes.AutoETSDiagnostics;
import com.amazon.ets.returntypes.AutoETSMetrics;
import com.amazon.ets.returntypes.AutoETSParameters;
import com.amazon.ets.returntypes.Forecast;
import com.amazon.ets.search.AutoETS;
import com.amazon.ets.testutils.ExampleDataSets;

public class AirPassengersExample implements Example {

    public static void main(String[] args) throws Exception {
        new AirPassengersExample().run();
    }

    @Override
    public String command() {
        return "air_passengers";
    }

    @Override
    public String description() {
        return "select a model for the monthly airline passenger series and forecast two years";
    }

    @Override
    public void run() throws Exception {
        int seasonLength = 12;
        int horizon = 24;
        double[] values = ExampleDataSets.airPassengers();

        AutoETS auto = new AutoETS(seasonLength).setAllowMultiplicativeTrend(true);
        auto.fit(TimeSeries.univariate(values));

        AutoETSParameters parameters = auto.parameters();
        AutoETSMetrics metrics = auto.metrics();
        AutoETSDiagnostics diagnostics = auto.diagnostics();
        System.out.printf("selected model     : %s%n", auto.components().code());
        System.out.printf("alpha beta gamma phi: %.4f %.4f %.4f %.4f%n", parameters.getAlpha(),
                parameters.getBeta(), parameters.getGamma(), parameters.getPhi());
        System.out.printf("aicc %.2f  sigma %.3f  log likelihood %.2f%n", metrics.getAicc(), metrics.getSigma(),
                metrics.getLogLikelihood());
        System.out.printf("candidates evaluated %d, failed %d, stopped early %b%n",
                diagnostics.getModelsEvaluated(), diagnostics.getModelsFailed(), diagnostics.isEarlyTerminated());

        Forecast forecast = auto.predict(horizon);
        System.out.println("step forecast");
        for (int i = 0; i < forecast.getHorizon(); i++) {
            System.out.printf("%4d %8.2f%n", i + 1, forecast.point[i]);
        }
    }
}
