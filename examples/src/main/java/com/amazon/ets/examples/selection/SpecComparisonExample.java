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

import com.amazon.ets.examples.Example;
import com.amazon.ets.search.AutoETS;
import com.amazon.ets.search.ModelSelectionException;
import com.amazon.ets.testutils.ExampleDataSets;

public class SpecComparisonExample implements Example {

    public static void main(String[] args) throws Exception {
        new SpecComparisonExample().run();
    }

    @Override
    public String command() {
        return "spec_comparison";
    }

    @Override
    public String description() {
        return "fit fixed and partially automatic specifications to the same series";
    }

    @Override
    public void run() throws Exception {
        int period = 4;
        double[] values = ExampleDataSets.additiveSeasonal(80, period, 50, 0.4, 6, 1.0, 7);
        String[] specs = { "ZZZ", "ANN", "AAN", "AAdN", "AAA", "AZA", "MZM", "ZNZ" };

        System.out.println("spec  selected  aicc");
        for (String spec : specs) {
            AutoETS auto = new AutoETS(period, spec);
            try {
                auto.fit(values);
                System.out.printf("%-5s %-9s %.2f%n", spec, auto.components().code(), auto.metrics().getAicc());
            } catch (ModelSelectionException e) {
                System.out.printf("%-5s none      %s%n", spec, e.getMessage());
            }
        }
    }
}
