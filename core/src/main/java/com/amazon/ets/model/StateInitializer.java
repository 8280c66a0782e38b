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

import static com.amazon.ets.CommonUtils.checkArgument;
import static com.amazon.ets.CommonUtils.clamp;
import static com.amazon.ets.CommonUtils.mean;

import org.apache.commons.math3.stat.regression.SimpleRegression;

import com.amazon.ets.config.SeasonType;

/**
 * Heuristic starting state for the recursion, computed from the leading part
 * of the training data.
 */
public class StateInitializer {

    public static final double MIN_SEASONAL_FACTOR = 0.01;
    public static final double MIN_POSITIVE_LEVEL = 1e-6;
    public static final double MIN_TREND_RATIO = 0.01;
    public static final double MAX_TREND_RATIO = 10.0;

    private static final double EPSILON = 1e-8;

    private StateInitializer() {
    }

    /**
     * Builds the initial state with optional overrides. An overridden level is
     * kept positive when the model requires positive data and an overridden
     * multiplicative trend is clamped to [0.01, 10].
     *
     * @param values   the training data
     * @param config   the model
     * @param level0   initial level, or null for the heuristic
     * @param trend0   initial trend, or null for the heuristic; ignored without a
     *                 trend
     * @param seasonal initial seasonal factors newest first, or null for the
     *                 heuristic; ignored without a season
     * @return the state before the first observation
     */
    public static RecursionState initialize(double[] values, SmoothingConfig config, Double level0, Double trend0,
            double[] seasonal) {
        RecursionState state = initialize(values, config);
        if (level0 != null) {
            state.setLevel(config.requiresPositiveData() ? Math.max(level0, MIN_POSITIVE_LEVEL) : level0);
        }
        if (trend0 != null && config.hasTrend()) {
            state.setTrend(config.getTrend().isMultiplicative() ? clamp(trend0, MIN_TREND_RATIO, MAX_TREND_RATIO)
                    : trend0);
        }
        if (seasonal != null && config.hasSeason()) {
            checkArgument(seasonal.length == config.getSeasonLength(),
                    "initial seasonal factors must have one entry per season");
            state.setSeasonal(seasonal);
        }
        return state;
    }

    public static RecursionState initialize(double[] values, SmoothingConfig config) {
        int n = values.length;
        checkArgument(n > 0, "cannot initialize from an empty series");
        SeasonType season = config.getSeason();
        int m = config.getSeasonLength();

        double[] seasonal = new double[season.isPresent() ? m : 0];
        double[] adjusted = values;
        if (season.isPresent()) {
            double[] phase = (n < 3 * m) ? phaseAverages(values, m) : decomposedPhaseAverages(values, m, season);
            normalize(phase, season);
            // seasonal[m - 1] applies to the first observation
            for (int j = 0; j < m; j++) {
                seasonal[m - 1 - j] = phase[j];
            }
            adjusted = new double[n];
            for (int i = 0; i < n; i++) {
                double factor = phase[i % m];
                adjusted[i] = season.isMultiplicative() ? values[i] / Math.max(factor, MIN_SEASONAL_FACTOR)
                        : values[i] - factor;
            }
        }

        int period = season.isPresent() ? m : 1;
        int window = Math.min(Math.max(10, 2 * period), n);
        double level;
        double trend = 0;
        if (!config.hasTrend()) {
            level = mean(adjusted, 0, window);
        } else {
            double[] fit = leastSquares(adjusted, window);
            double intercept = fit[0];
            double slope = fit[1];
            if (config.getTrend().isMultiplicative()) {
                level = intercept + slope;
                if (Math.abs(level) < EPSILON) {
                    level = 1e-7;
                }
                trend = (intercept + 2 * slope) / level;
                level /= (Math.abs(trend) > EPSILON) ? trend : EPSILON;
                trend = clamp(trend, -StateRecursion.HUGE, StateRecursion.HUGE);
                if (level < EPSILON || trend < EPSILON) {
                    level = Math.max(adjusted[0], 1e-3);
                    trend = (n > 1) ? Math.max(adjusted[1] / Math.max(adjusted[0], EPSILON), 1e-3) : 1.0;
                }
            } else {
                level = intercept;
                trend = slope;
                if (Math.abs(level + trend) < EPSILON) {
                    level *= (1 + 1e-3);
                    trend *= (1 - 1e-3);
                }
            }
        }
        return new RecursionState(level, trend, seasonal);
    }

    /**
     * Raw per-phase means; phase j collects observations i with i % m == j.
     */
    static double[] phaseAverages(double[] values, int m) {
        double[] sum = new double[m];
        int[] count = new int[m];
        for (int i = 0; i < values.length; i++) {
            sum[i % m] += values[i];
            count[i % m]++;
        }
        double[] result = new double[m];
        double overall = mean(values, 0, values.length);
        for (int j = 0; j < m; j++) {
            result[j] = (count[j] > 0) ? sum[j] / count[j] : overall;
        }
        return result;
    }

    /**
     * Per-phase means of the detrended series, using a centered moving average
     * (2 x m when m is even) as the trend estimate.
     */
    static double[] decomposedPhaseAverages(double[] values, int m, SeasonType season) {
        int n = values.length;
        int half = m / 2;
        double[] sum = new double[m];
        int[] count = new int[m];
        for (int i = m; i < n - m; i++) {
            double average;
            if (m % 2 == 0) {
                average = 0.5 * values[i - half] + 0.5 * values[i + half];
                for (int j = 1 - half; j < half; j++) {
                    average += values[i + j];
                }
            } else {
                average = 0;
                for (int j = -half; j <= half; j++) {
                    average += values[i + j];
                }
            }
            average /= m;
            if (season.isMultiplicative()) {
                if (average > StateRecursion.TOLERANCE) {
                    sum[i % m] += values[i] / average;
                    count[i % m]++;
                }
            } else {
                sum[i % m] += values[i] - average;
                count[i % m]++;
            }
        }
        double fallback = season.isMultiplicative() ? 1.0 : 0.0;
        double[] result = new double[m];
        for (int j = 0; j < m; j++) {
            result[j] = (count[j] > 0) ? sum[j] / count[j] : fallback;
        }
        return result;
    }

    /**
     * Makes additive factors sum to zero and multiplicative factors average to
     * one.
     */
    static void normalize(double[] factors, SeasonType season) {
        double average = mean(factors, 0, factors.length);
        for (int j = 0; j < factors.length; j++) {
            if (season.isMultiplicative()) {
                if (average > StateRecursion.TOLERANCE) {
                    factors[j] /= average;
                }
                factors[j] = Math.max(factors[j], MIN_SEASONAL_FACTOR);
            } else {
                factors[j] -= average;
            }
        }
    }

    /**
     * Ordinary least squares of values[0, window) against x = 1..window.
     *
     * @return intercept and slope; a degenerate design gives the mean and zero
     */
    static double[] leastSquares(double[] values, int window) {
        if (window < 2) {
            return new double[] { mean(values, 0, window), 0 };
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < window; i++) {
            regression.addData(i + 1, values[i]);
        }
        return new double[] { regression.getIntercept(), regression.getSlope() };
    }
}
