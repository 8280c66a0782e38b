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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.ets.config.ErrorType;
import com.amazon.ets.config.OptimizationCriterion;
import com.amazon.ets.config.SeasonType;
import com.amazon.ets.config.TrendType;
import com.amazon.ets.model.SmoothingConfig;
import com.amazon.ets.returntypes.AutoETSMetrics;
import com.amazon.ets.testutils.ExampleDataSets;

public class CandidateEvaluatorTest {

    private static final double[] SERIES = ExampleDataSets.linearTrend(24, 20, 0.8, 0.5, 5);

    private static AutoETSMetrics metrics(double aicc, double mse, double logLikelihood) {
        return new AutoETSMetrics(aicc - 1, aicc, aicc + 1, mse, 2 * mse, Math.sqrt(mse), logLikelihood);
    }

    @Test
    public void testDegenerateMetrics() {
        assertFalse(CandidateEvaluator.isDegenerate(metrics(10, 1, -3)));
        assertTrue(CandidateEvaluator.isDegenerate(metrics(Double.POSITIVE_INFINITY, 1, -3)));
        assertTrue(CandidateEvaluator.isDegenerate(metrics(10, 0, -3)));
        assertTrue(CandidateEvaluator.isDegenerate(metrics(10, 1, 0)));
        assertTrue(CandidateEvaluator.isDegenerate(metrics(10, Double.NaN, -3)));
    }

    @Test
    public void testObjective() {
        AutoETSMetrics metrics = metrics(10, 4, -3);
        assertEquals(3, CandidateEvaluator.objective(metrics, OptimizationCriterion.LIKELIHOOD));
        assertEquals(4, CandidateEvaluator.objective(metrics, OptimizationCriterion.MSE));
        assertEquals(8, CandidateEvaluator.objective(metrics, OptimizationCriterion.AMSE));
        assertEquals(2, CandidateEvaluator.objective(metrics, OptimizationCriterion.SIGMA));
    }

    @Test
    public void testRefinementMethod() {
        SmoothingConfig.Builder builder = SmoothingConfig.builder().seasonLength(4);
        assertTrue(CandidateEvaluator.usesGradients(builder.error(ErrorType.MULTIPLICATIVE)
                .season(SeasonType.MULTIPLICATIVE).gamma(0.1).build()));
        assertTrue(CandidateEvaluator.usesGradients(SmoothingConfig.builder().trend(TrendType.DAMPED_ADDITIVE)
                .beta(0.1).season(SeasonType.ADDITIVE).seasonLength(4).gamma(0.1).build()));
        assertFalse(CandidateEvaluator.usesGradients(SmoothingConfig.builder().trend(TrendType.ADDITIVE).beta(0.1)
                .season(SeasonType.ADDITIVE).seasonLength(4).gamma(0.1).build()));
        assertFalse(CandidateEvaluator.usesGradients(
                SmoothingConfig.builder().trend(TrendType.DAMPED_ADDITIVE).beta(0.1).build()));
    }

    @Test
    public void testGrids() {
        CandidateEvaluator evaluator = new CandidateEvaluator(SERIES, 4, SearchSettings.builder().build());
        assertArrayEquals(new double[] { 1e-4, 0.15, 0.35 }, evaluator.betaGrid(0.5), 1e-12);
        CandidateConfig multiplicative = new CandidateConfig(ErrorType.MULTIPLICATIVE, TrendType.NONE,
                SeasonType.MULTIPLICATIVE, false);
        assertArrayEquals(CandidateEvaluator.MULTIPLICATIVE_GAMMA_GRID, evaluator.gammaGrid(multiplicative, 0.5, 1));
        assertArrayEquals(new double[] { 0.3 }, CandidateEvaluator.grid(0.3, CandidateEvaluator.ALPHA_GRID));

        CandidateEvaluator pinned = new CandidateEvaluator(SERIES, 4,
                SearchSettings.builder().pinnedBeta(0.2).build());
        assertEquals(0, pinned.betaGrid(0.1).length);
        assertArrayEquals(new double[] { 0.2 }, pinned.betaGrid(0.3));
    }

    @Test
    public void testAveragedHorizonsOnlyForAmse() {
        assertEquals(1, new CandidateEvaluator(SERIES, 1, SearchSettings.builder().build()).nmse());
        assertEquals(5, new CandidateEvaluator(SERIES, 1,
                SearchSettings.builder().criterion(OptimizationCriterion.AMSE).nmse(5).build()).nmse());
    }

    @Test
    public void testEvaluateTrendedCandidate() {
        CandidateEvaluator evaluator = new CandidateEvaluator(SERIES, 1, SearchSettings.builder().build());
        CandidateResult result = evaluator
                .evaluate(new CandidateConfig(ErrorType.ADDITIVE, TrendType.ADDITIVE, SeasonType.NONE, false));
        assertTrue(result.isValid());
        assertNotNull(result.getConfig());
        SmoothingConfig config = result.getConfig();
        assertTrue(config.getAlpha() >= ParameterMapping.ALPHA_LOWER && config.getAlpha() <= 1);
        assertTrue(config.getBeta() <= config.getAlpha());
        assertFalse(CandidateEvaluator.isDegenerate(result.getMetrics()));

        // the reported metrics belong to the reported configuration and start
        AutoETSMetrics refit = evaluator.fitModel(config, result.getLevel0(), result.getTrend0()).metrics();
        assertEquals(result.getMetrics().getAicc(), refit.getAicc(), 1e-9);
    }

    @Test
    public void testStateSearch() {
        CandidateEvaluator evaluator = new CandidateEvaluator(SERIES, 1,
                SearchSettings.builder().stateSearchEnabled(true).build());
        CandidateResult result = evaluator
                .evaluate(new CandidateConfig(ErrorType.ADDITIVE, TrendType.ADDITIVE, SeasonType.NONE, true));
        assertTrue(result.isValid());
        assertTrue(result.getConfig().isDamped());
        AutoETSMetrics refit = evaluator.fitModel(result.getConfig(), result.getLevel0(), result.getTrend0())
                .metrics();
        assertEquals(result.getMetrics().getAicc(), refit.getAicc(), 1e-9);
    }

    @Test
    public void testFailuresAreReported() {
        CandidateEvaluator evaluator = new CandidateEvaluator(Arrays.copyOf(SERIES, 8), 12,
                SearchSettings.builder().build());
        CandidateResult tooShort = evaluator.evaluate(
                new CandidateConfig(ErrorType.MULTIPLICATIVE, TrendType.NONE, SeasonType.MULTIPLICATIVE, false));
        assertFalse(tooShort.isValid());
        assertNotNull(tooShort.getFailure());

        CandidateEvaluator impossibleBeta = new CandidateEvaluator(SERIES, 1,
                SearchSettings.builder().pinnedBeta(0.95).build());
        CandidateResult noGrid = impossibleBeta
                .evaluate(new CandidateConfig(ErrorType.ADDITIVE, TrendType.ADDITIVE, SeasonType.NONE, false));
        assertFalse(noGrid.isValid());
        assertFalse(noGrid.isSkipped());
    }

    @Test
    public void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class,
                () -> new CandidateEvaluator(new double[] { 1 }, 1, SearchSettings.builder().build()));
        assertThrows(IllegalArgumentException.class,
                () -> new CandidateEvaluator(SERIES, 0, SearchSettings.builder().build()));
    }
}
