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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.ets.config.DampedPolicy;
import com.amazon.ets.config.ErrorType;
import com.amazon.ets.config.OptimizationCriterion;
import com.amazon.ets.config.SeasonType;
import com.amazon.ets.config.TrendType;
import com.amazon.ets.inputtypes.TimeSeries;
import com.amazon.ets.returntypes.AutoETSComponents;
import com.amazon.ets.returntypes.AutoETSDiagnostics;
import com.amazon.ets.returntypes.AutoETSMetrics;
import com.amazon.ets.returntypes.AutoETSParameters;
import com.amazon.ets.returntypes.Forecast;
import com.amazon.ets.testutils.ExampleDataSets;

public class AutoETSTest {

    private static final double[] SHORT = { 10, 12, 11, 13, 12, 14, 13, 15 };

    private static AutoETSMetrics aicc(double aic, double aicc) {
        return new AutoETSMetrics(aic, aicc, aic, 1, 1, 1, -1);
    }

    @Test
    public void testSimpleExponentialSmoothing() {
        AutoETS auto = new AutoETS(1, "ANN");
        auto.fit(TimeSeries.univariate(SHORT));

        AutoETSComponents components = auto.components();
        assertEquals("ANN", components.code());
        assertEquals(ErrorType.ADDITIVE, components.getError());
        assertEquals(TrendType.NONE, components.getTrend());
        assertEquals(SeasonType.NONE, components.getSeason());

        Forecast forecast = auto.predict(3);
        assertEquals(3, forecast.getHorizon());
        for (double value : forecast.point) {
            assertEquals(forecast.point[0], value);
            assertTrue(value >= 10 && value <= 15);
        }

        AutoETSParameters parameters = auto.parameters();
        assertTrue(parameters.getAlpha() >= 1e-4 && parameters.getAlpha() <= 0.9999);
        assertTrue(Double.isNaN(parameters.getBeta()));
        assertTrue(Double.isNaN(parameters.getGamma()));

        AutoETSDiagnostics diagnostics = auto.diagnostics();
        assertEquals(1, diagnostics.getModelsEvaluated());
        assertEquals(SHORT.length, diagnostics.getTrainingDataSize());
        assertTrue(Double.isFinite(auto.metrics().getAicc()));
    }

    @Test
    public void testSeasonalSelection() {
        double[] values = ExampleDataSets.multiplicativeSeasonal(24, 12, 100, 0.6, 0.02, 17);
        AutoETS auto = new AutoETS(12);
        auto.fit(values);

        assertEquals(SeasonType.MULTIPLICATIVE, auto.components().getSeason());
        assertEquals(12, auto.components().getSeasonLength());
        double[] seasonal = auto.model().initialState().getSeasonal();
        assertEquals(1.0, Arrays.stream(seasonal).average().getAsDouble(), 1e-6);

        double[] forecast = auto.predict(12).point;
        for (int i = 0; i < 12; i++) {
            assertTrue(forecast[i] > 0);
        }
        // one full cycle ahead tracks the last observed cycle
        assertTrue(forecast[2] > forecast[8]);
    }

    @Test
    public void testDampedTrendSelection() {
        double[] values = ExampleDataSets.linearTrend(30, 10, 0.5, 0.1, 3);
        AutoETS auto = new AutoETS(1, "AAdN");
        auto.fit(values);

        assertTrue(auto.components().isDamped());
        assertEquals("AAdN", auto.components().code());
        double phi = auto.parameters().getPhi();
        assertTrue(phi >= 0.8 && phi <= 0.98);

        double[] forecast = auto.predict(3).point;
        assertEquals(phi, (forecast[2] - forecast[1]) / (forecast[1] - forecast[0]), 1e-6);
    }

    @Test
    public void testNotFitted() {
        AutoETS auto = new AutoETS(1);
        assertFalse(auto.isFitted());
        assertThrows(IllegalStateException.class, () -> auto.predict(1));
        assertThrows(IllegalStateException.class, auto::components);
        assertThrows(IllegalStateException.class, auto::diagnostics);
    }

    @Test
    public void testInvalidInput() {
        AutoETS auto = new AutoETS(1);
        assertThrows(IllegalArgumentException.class, () -> auto.fit(new double[] { 1, 2, 3 }));
        assertThrows(IllegalArgumentException.class,
                () -> auto.fit(new TimeSeries(new double[][] { SHORT, SHORT })));
        assertThrows(IllegalArgumentException.class, () -> new AutoETS(0));
        assertThrows(IllegalArgumentException.class, () -> new AutoETS(4, "AMN"));
        assertThrows(IllegalArgumentException.class, () -> auto.setPinnedAlpha(1.5));
        assertThrows(IllegalArgumentException.class, () -> auto.setPinnedPhi(0.5));
        assertThrows(IllegalArgumentException.class, () -> auto.setNmse(0));
        assertThrows(IllegalArgumentException.class, () -> auto.setTimeBudget(Duration.ZERO));
    }

    @Test
    public void testPredictRejectsNonPositiveHorizon() {
        AutoETS auto = new AutoETS(1, "ANN");
        auto.fit(SHORT);
        assertThrows(IllegalArgumentException.class, () -> auto.predict(0));
    }

    @Test
    public void testBetterMetrics() {
        assertTrue(AutoETS.betterMetrics(aicc(5, 10), aicc(1, 11)));
        assertFalse(AutoETS.betterMetrics(aicc(5, 10), aicc(5, 10)));
        assertTrue(AutoETS.betterMetrics(aicc(50, 10), aicc(1, Double.POSITIVE_INFINITY)));
        assertFalse(AutoETS.betterMetrics(aicc(1, Double.POSITIVE_INFINITY), aicc(50, 10)));
        assertTrue(AutoETS.betterMetrics(aicc(1, Double.POSITIVE_INFINITY), aicc(2, Double.POSITIVE_INFINITY)));
        assertFalse(AutoETS.betterMetrics(AutoETSMetrics.invalid(), AutoETSMetrics.invalid()));
    }

    @Test
    public void testPinnedParameters() {
        double[] values = ExampleDataSets.linearTrend(30, 10, 0.5, 0.3, 8);
        AutoETS auto = new AutoETS(1, "AAN").setPinnedAlpha(0.3).setPinnedBeta(0.05);
        auto.fit(values);
        assertEquals(0.3, auto.parameters().getAlpha());
        assertEquals(0.05, auto.parameters().getBeta());

        AutoETS cleared = new AutoETS(1, "AAN").setPinnedAlpha(0.3).clearPinnedAlpha();
        assertTrue(cleared.settings().getPinnedAlpha() == null);
    }

    @Test
    public void testExhaustiveScanEvaluatesEveryCandidate() {
        double[] values = ExampleDataSets.multiplicativeSeasonal(32, 4, 50, 0.3, 0.03, 21);
        AutoETS auto = new AutoETS(4).disableEarlyTermination();
        auto.fit(values);
        AutoETSDiagnostics diagnostics = auto.diagnostics();
        assertEquals(12, diagnostics.getModelsEvaluated());
        assertEquals(0, diagnostics.getModelsSkipped());
        assertFalse(diagnostics.isEarlyTerminated());
    }

    @Test
    public void testParallelMatchesExhaustiveSequential() {
        double[] values = ExampleDataSets.additiveSeasonal(32, 4, 20, 0.3, 3, 0.5, 4);
        AutoETS sequential = new AutoETS(4).disableEarlyTermination();
        AutoETS parallel = new AutoETS(4).setParallelism(3);
        sequential.fit(values);
        parallel.fit(values);
        assertEquals(sequential.components().code(), parallel.components().code());
        assertEquals(sequential.metrics().getAicc(), parallel.metrics().getAicc());
        assertEquals(sequential.predict(4).point[3], parallel.predict(4).point[3]);
    }

    @Test
    public void testExhaustedTimeBudget() {
        AutoETS auto = new AutoETS(1).setTimeBudget(Duration.ofNanos(1));
        assertThrows(ModelSelectionException.class, () -> auto.fit(SHORT));
        assertFalse(auto.isFitted());
    }

    @Test
    public void testNonPositiveDataUsesAdditiveModels() {
        double[] values = ExampleDataSets.additiveSeasonal(24, 4, 0, 0.1, 2, 0.3, 12);
        values[0] = -1;
        AutoETS auto = new AutoETS(4).setAllowMultiplicativeTrend(true);
        auto.fit(values);
        assertEquals(ErrorType.ADDITIVE, auto.components().getError());
        assertFalse(auto.components().getSeason().isMultiplicative());
    }

    @Test
    public void testSettings() {
        AutoETS auto = new AutoETS(12, "ZZZ").setOptimizationCriterion(OptimizationCriterion.AMSE).setNmse(50)
                .setMaxIterations(40).setStateSearchEnabled(true).setDampedPolicy(DampedPolicy.NEVER)
                .setPinnedGamma(0.2);
        SearchSettings settings = auto.settings();
        assertEquals(OptimizationCriterion.AMSE, settings.getCriterion());
        assertEquals(30, settings.getNmse());
        assertEquals(40, settings.getMaxIterations());
        assertTrue(settings.isStateSearchEnabled());
        assertFalse(new AutoETS(1).settings().isStateSearchEnabled());
        assertEquals(0.2, settings.getPinnedGamma().doubleValue());
        assertEquals(DampedPolicy.NEVER, auto.getDampedPolicy());
    }

    @Test
    public void testStateSearch() {
        double[] values = ExampleDataSets.linearTrend(30, 10, 0.5, 0.3, 8);
        AutoETS auto = new AutoETS(1, "AZN").setStateSearchEnabled(true);
        auto.fit(values);
        assertTrue(Double.isFinite(auto.metrics().getAicc()));
        assertEquals(values.length, auto.fittedValues().length);
        double[] fitted = auto.fittedValues();
        double[] residuals = auto.residuals();
        for (int i = 0; i < values.length; i++) {
            assertEquals(values[i], fitted[i] + residuals[i], 1e-9);
        }
    }

    @Test
    public void testRandomWalkForecastIsFinite() {
        double[] values = ExampleDataSets.randomWalk(60, 100, 1.0, 13);
        AutoETS auto = new AutoETS(1);
        auto.fit(values);
        assertFalse(auto.components().getSeason().isPresent());
        for (double value : auto.predict(10).point) {
            assertTrue(Double.isFinite(value));
        }
    }

    @Test
    public void testAmseCriterion() {
        double[] values = ExampleDataSets.linearTrend(30, 10, 0.5, 0.3, 8);
        AutoETS auto = new AutoETS(1, "AZN").setOptimizationCriterion(OptimizationCriterion.AMSE);
        auto.fit(values);
        assertEquals(AutoETS.DEFAULT_NMSE, auto.model().getNmse());
        assertTrue(auto.metrics().getAmse() > 0);
    }
}
