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

package com.amazon.ets.examples.selection;

import com.amazon.ets.config.OptimizationCriterion;
import com.amazon.ets.examples.Example;
import com.amazon.ets.returntypes.AutoETSParameters;
import com.amazon.ets.search.AutoETS;
import com.amazon.ets.testutils.ExampleDataSets;

public class CriterionComparisonExample implements Example {

    public static void main(String[] args) throws Exception {
        new CriterionComparisonExample().run();
    }

    @Override
    public String command() {
        return "criterion_comparison";
    }

    @Override
    public String description() {
        return "compare the smoothing parameters estimated under each optimization criterion";
    }

    @Override
    public void run() throws Exception {
        double[] values = ExampleDataSets.linearTrend(60, 100, 1.5, 4.0, 3);

        System.out.println("criterion   model alpha  beta   phi");
        for (OptimizationCriterion criterion : OptimizationCriterion.values()) {
            AutoETS auto = new AutoETS(1, "AZN").setOptimizationCriterion(criterion).setNmse(6);
            auto.fit(values);
            AutoETSParameters parameters = auto.parameters();
            System.out.printf("%-11s %-5s %.3f  %.3f  %.3f%n", criterion, auto.components().code(),
                    parameters.getAlpha(), parameters.getBeta(), parameters.getPhi());
        }
    }
}
