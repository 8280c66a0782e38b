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

package com.amazon.ets.model;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.ets.config.ErrorType;
import com.amazon.ets.config.SeasonType;
import com.amazon.ets.config.TrendType;
import com.amazon.ets.inputtypes.TimeSeries;
import com.amazon.ets.returntypes.AutoETSMetrics;
import com.amazon.ets.returntypes.Forecast;
import com.amazon.ets.testutils.ExampleDataSets;

public class ETSTest {

    private static final double[] SERIES = { 10, 12, 11, 13, 12, 14, 13, 15 };

    @Test
    public void testPredictBeforeFit() {
        ETS model = new ETS(SmoothingConfig.builder().build());
        assertThrows(IllegalStateException.class, () -> model.predict(3));
        assertThrows(IllegalStateException.class, model::logLikelihood);
        assertThrows(IllegalStateException.class, model::fittedValues);
    }

    @Test
    public void testRefitIsRejected() {
        ETS model = new ETS(SmoothingConfig.builder().build());
        model.fit(SERIES);
        assertThrows(IllegalStateException.class, () -> model.fit(SERIES));
    }

    @Test
    public void testInvalidInput() {
        ETS model = new ETS(SmoothingConfig.builder().build());
        assertThrows(IllegalArgumentException.class, () -> model.fit(new double[0]));
        assertThrows(IllegalArgumentException.class, () -> new ETS(SmoothingConfig.builder().build(), 0));

        ETS seasonal = new ETS(
                SmoothingConfig.builder().season(SeasonType.ADDITIVE).seasonLength(12).gamma(0.1).build());
        assertThrows(IllegalArgumentException.class, () -> seasonal.fit(SERIES));
    }

    static Stream<Arguments> positiveDataModels() {
        SmoothingConfig error = SmoothingConfig.builder().error(ErrorType.MULTIPLICATIVE).build();
        SmoothingConfig trend = SmoothingConfig.builder().error(ErrorType.MULTIPLICATIVE)
                .trend(TrendType.MULTIPLICATIVE).beta(0.1).build();
        SmoothingConfig dampedTrend = SmoothingConfig.builder().error(ErrorType.MULTIPLICATIVE)
                .trend(TrendType.DAMPED_MULTIPLICATIVE).beta(0.1).phi(0.9).build();
        SmoothingConfig season = SmoothingConfig.builder().error(ErrorType.MULTIPLICATIVE)
                .season(SeasonType.MULTIPLICATIVE).seasonLength(4).gamma(0.1).build();
        return Stream.of(error, trend, dampedTrend, season)
                .flatMap(config -> Stream.of(Arguments.of(config, 0.0), Arguments.of(config, -2.5)));
    }

    @ParameterizedTest
    @MethodSource("positiveDataModels")
    public void testNonPositiveValueRejectedBeforeFitting(SmoothingConfig config, double bad) {
        double[] values = { 10, 12, 11, 13, 12, 14, 13, 15, 14, 16, 15, 17 };
        values[6] = bad;
        ETS model = new ETS(config);
        assertThrows(IllegalArgumentException.class, () -> model.fit(values));
        assertFalse(model.isFitted());
        assertThrows(IllegalStateException.class, model::fittedValues);
    }

    @Test
    public void testMultivariateSeriesIsRejectedBeforeReadingValues() {
        TimeSeries series = mock(TimeSeries.class);
        when(series.getDimensions()).thenReturn(2);
        ETS model = new ETS(SmoothingConfig.builder().build());
        assertThrows(IllegalArgumentException.class, () -> model.fit(series));
        verify(series, never()).getValues();
    }

    @Test
    public void testConstantForecastWithoutTrendOrSeason() {
        ETS model = new ETS(SmoothingConfig.builder().alpha(0.4).build());
        model.fit(TimeSeries.univariate(SERIES));
        Forecast forecast = model.predict(5);
        double level = model.finalState().getLevel();
        assertEquals(5, forecast.getHorizon());
        for (double value : forecast.point) {
            assertEquals(level, value);
        }
        // predict reads the state without changing it
        assertArrayEquals(forecast.point, model.predict(5).point);
    }

    @Test
    public void testDiagnostics() {
        ETS model = new ETS(SmoothingConfig.builder().alpha(0.4).build());
        model.fit(SERIES);
        double[] fitted = model.fittedValues();
        double[] residuals = model.residuals();
        assertEquals(SERIES.length, fitted.length);
        assertEquals(SERIES.length, model.sampleSize());

        double sse = 0;
        for (int i = 0; i < SERIES.length; i++) {
            assertEquals(SERIES[i] - fitted[i], residuals[i], 1e-12);
            sse += residuals[i] * residuals[i];
        }
        assertEquals(sse / SERIES.length, model.mse(), 1e-12);
        assertEquals(-0.5 * SERIES.length * Math.log(sse), model.logLikelihood(), 1e-9);

        int k = model.parameterCount();
        assertEquals(3, k);
        assertEquals(-2 * model.logLikelihood() + 2 * k, model.aic(k), 1e-9);
        assertEquals(model.aic(k) + 2.0 * k * (k + 1) / (SERIES.length - k - 1), model.aicc(k), 1e-9);
        assertEquals(Double.POSITIVE_INFINITY, model.aicc(SERIES.length - 1));

        AutoETSMetrics metrics = model.metrics();
        assertEquals(model.aicc(k), metrics.getAicc());
        assertEquals(Math.sqrt(model.mse()), metrics.getSigma(), 1e-12);
        assertEquals(model.mse(), metrics.getAmse());
    }

    @Test
    public void testFirstFittedValueIsInitialLevel() {
        ETS model = new ETS(SmoothingConfig.builder().alpha(0.4).build());
        model.fitWithInitialState(SERIES, 9.0, null);
        assertEquals(9.0, model.initialState().getLevel());
        assertEquals(9.0, model.fittedValues()[0]);
        assertEquals(9.0 + 0.4 * (SERIES[0] - 9.0), model.fittedValues()[1], 1e-12);
    }

    @Test
    public void testParameterCount() {
        SmoothingConfig config = SmoothingConfig.builder().error(ErrorType.MULTIPLICATIVE)
                .trend(TrendType.DAMPED_ADDITIVE).season(SeasonType.MULTIPLICATIVE).seasonLength(12).beta(0.05)
                .gamma(0.1).build();
        // level, trend and 12 seasonal states plus alpha, beta, phi and gamma
        assertEquals(18, ETS.parameterCount(config));
    }

    @Test
    public void testAveragedMultiStepError() {
        double[] values = ExampleDataSets.linearTrend(40, 10, 0.5, 0.3, 11);
        SmoothingConfig config = SmoothingConfig.builder().alpha(0.3).build();
        ETS oneStep = new ETS(config, 1);
        ETS threeStep = new ETS(config, 3);
        oneStep.fit(values);
        threeStep.fit(values);
        assertEquals(oneStep.mse(), oneStep.amse());
        assertEquals(oneStep.mse(), threeStep.mse(), 1e-12);
        // a level-only model falls further behind a trend at longer horizons
        assertTrue(threeStep.amse() > threeStep.mse());
    }

    @ParameterizedTest
    @EnumSource(value = TrendType.class)
    public void testFitIsDeterministic(TrendType trend) {
        double[] values = ExampleDataSets.airPassengers();
        SmoothingConfig config = SmoothingConfig.builder().error(ErrorType.MULTIPLICATIVE).trend(trend)
                .season(trend.isMultiplicative() ? SeasonType.NONE : SeasonType.MULTIPLICATIVE).seasonLength(12)
                .alpha(0.3).beta(trend.isPresent() ? 0.05 : null).gamma(trend.isMultiplicative() ? null : 0.1)
                .phi(trend.isDamped() ? 0.9 : null).build();
        ETS first = new ETS(config);
        ETS second = new ETS(config);
        first.fit(values);
        second.fit(values);
        assertArrayEquals(first.fittedValues(), second.fittedValues());
        assertArrayEquals(first.predict(12).point, second.predict(12).point);
        assertEquals(first.logLikelihood(), second.logLikelihood());
    }

    @Test
    public void testDampedRecurrenceAfterFit() {
        double[] values = ExampleDataSets.linearTrend(30, 5, 1, 0.2, 2);
        double phi = 0.85;
        ETS model = new ETS(
                SmoothingConfig.builder().trend(TrendType.DAMPED_ADDITIVE).alpha(0.5).beta(0.1).phi(phi).build());
        model.fit(values);
        double trend = model.finalState().getTrend();
        double[] forecast = model.predict(10).point;
        for (int h = 1; h < forecast.length; h++) {
            assertEquals(Math.pow(phi, h + 1) * trend, forecast[h] - forecast[h - 1], 1e-9);
        }
    }
}
