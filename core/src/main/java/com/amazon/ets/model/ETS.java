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
import static com.amazon.ets.CommonUtils.checkNotNull;
import static com.amazon.ets.CommonUtils.checkState;
import static com.amazon.ets.CommonUtils.hasNonPositive;
import static com.amazon.ets.CommonUtils.isFinite;

import java.util.Arrays;

import com.amazon.ets.inputtypes.TimeSeries;
import com.amazon.ets.returntypes.AutoETSMetrics;
import com.amazon.ets.returntypes.Forecast;

import lombok.Getter;

/**
 * A single exponential smoothing state-space model. The model is fit exactly
 * once; afterwards all diagnostics are fixed and {@link #predict(int)} reads the
 * final state without changing it.
 */
public class ETS {

    public static final int MAX_NMSE = 30;

    /**
     * Substituted for a zero innovation sum of squares in the likelihood.
     */
    public static final double SSE_FLOOR = 1e-8;

    @Getter
    private final SmoothingConfig config;

    /**
     * number of horizons averaged by {@link #amse()}
     */
    @Getter
    private final int nmse;

    private final StateRecursion recursion;

    private boolean fitted;
    private RecursionState initialState;
    private RecursionState state;
    private double[] fittedValues;
    private double[] residuals;
    private double logLikelihood;
    private double mse;
    private double amse;
    private int sampleSize;

    public ETS(SmoothingConfig config) {
        this(config, 1);
    }

    public ETS(SmoothingConfig config, int nmse) {
        checkNotNull(config, "config cannot be null");
        checkArgument(nmse >= 1 && nmse <= MAX_NMSE, "nmse must be between 1 and " + MAX_NMSE);
        this.config = config;
        this.nmse = nmse;
        this.recursion = new StateRecursion(config);
    }

    public void fit(TimeSeries series) {
        checkNotNull(series, "series cannot be null");
        checkArgument(series.getDimensions() == 1, "only univariate series are supported");
        fit(series.getValues());
    }

    public void fit(double[] values) {
        fitWithFullState(values, null, null, null);
    }

    public void fitWithInitialState(double[] values, double level0, Double trend0) {
        fitWithFullState(values, level0, trend0, null);
    }

    /**
     * Fits the model with explicit starting values. Any null override falls back
     * to the heuristic initialization.
     *
     * @param values    the training data
     * @param level0    initial level or null
     * @param trend0    initial trend or null
     * @param seasonal0 initial seasonal factors newest first, or null
     */
    public void fitWithFullState(double[] values, Double level0, Double trend0, double[] seasonal0) {
        checkState(!fitted, "model is already fitted");
        checkNotNull(values, "values cannot be null");
        checkArgument(values.length > 0, "cannot fit an empty series");
        if (config.requiresPositiveData()) {
            checkArgument(!hasNonPositive(values), "model requires strictly positive data");
        }
        if (config.hasSeason()) {
            checkArgument(values.length >= Math.max(4, config.getSeasonLength()),
                    "series too short for season length " + config.getSeasonLength());
        }

        int n = values.length;
        initialState = StateInitializer.initialize(values, config, level0, trend0, seasonal0);
        RecursionState current = initialState.copy();
        fittedValues = new double[n];
        residuals = new double[n];

        double innovationSse = 0;
        double sse = 0;
        double sumLogForecast = 0;
        double[] horizonSse = new double[nmse];
        int[] horizonCount = new int[nmse];
        boolean multiplicativeError = config.getError().isMultiplicative();

        for (int t = 0; t < n; t++) {
            if (nmse > 1) {
                double[] ahead = recursion.forecast(current, nmse);
                for (int j = 0; j < nmse && t + j < n; j++) {
                    double error = values[t + j] - ahead[j];
                    horizonSse[j] += error * error;
                    horizonCount[j]++;
                }
            }
            double y = values[t];
            double forecast = recursion.update(current, y);
            fittedValues[t] = forecast;
            residuals[t] = y - forecast;

            double innovation;
            if (multiplicativeError) {
                innovation = (forecast > StateRecursion.TOLERANCE) ? y / forecast - 1 : 0;
                sumLogForecast += Math.log(Math.max(Math.abs(forecast), StateRecursion.TOLERANCE));
            } else {
                innovation = residuals[t];
            }
            innovationSse += innovation * innovation;
            sse += residuals[t] * residuals[t];
        }

        state = current;
        sampleSize = n;
        logLikelihood = logLikelihood(innovationSse, sumLogForecast, n, multiplicativeError);
        mse = sse / n;
        amse = (nmse > 1) ? averageHorizonMse(horizonSse, horizonCount) : mse;
        fitted = true;
    }

    static double logLikelihood(double innovationSse, double sumLogForecast, int n, boolean multiplicativeError) {
        double value = n * Math.log((innovationSse > 0) ? innovationSse : SSE_FLOOR);
        if (multiplicativeError) {
            value += 2 * sumLogForecast;
        }
        return -0.5 * value;
    }

    static double averageHorizonMse(double[] horizonSse, int[] horizonCount) {
        double total = 0;
        int horizons = 0;
        for (int j = 0; j < horizonSse.length; j++) {
            if (horizonCount[j] > 0) {
                total += horizonSse[j] / horizonCount[j];
                horizons++;
            }
        }
        return total / horizons;
    }

    public Forecast predict(int horizon) {
        checkState(fitted, "model must be fitted before predict");
        checkArgument(horizon > 0, "horizon must be positive");
        return new Forecast(recursion.forecast(state, horizon));
    }

    public boolean isFitted() {
        return fitted;
    }

    public double logLikelihood() {
        checkState(fitted, "model is not fitted");
        return logLikelihood;
    }

    public double mse() {
        checkState(fitted, "model is not fitted");
        return mse;
    }

    public double amse() {
        checkState(fitted, "model is not fitted");
        return amse;
    }

    public double sigma() {
        return Math.sqrt(mse());
    }

    public int sampleSize() {
        checkState(fitted, "model is not fitted");
        return sampleSize;
    }

    public double[] fittedValues() {
        checkState(fitted, "model is not fitted");
        return Arrays.copyOf(fittedValues, fittedValues.length);
    }

    public double[] residuals() {
        checkState(fitted, "model is not fitted");
        return Arrays.copyOf(residuals, residuals.length);
    }

    /**
     * @return a copy of the state the recursion started from
     */
    public RecursionState initialState() {
        checkState(fitted, "model is not fitted");
        return initialState.copy();
    }

    /**
     * @return a copy of the state after the last observation
     */
    public RecursionState finalState() {
        checkState(fitted, "model is not fitted");
        return state.copy();
    }

    public double aic(int k) {
        return aic(logLikelihood(), k);
    }

    public double aicc(int k) {
        return aicc(logLikelihood(), k, sampleSize());
    }

    public double bic(int k) {
        return bic(logLikelihood(), k, sampleSize());
    }

    public static double aic(double logLikelihood, int k) {
        double value = -2 * logLikelihood + 2 * k;
        return isFinite(value) ? value : Double.POSITIVE_INFINITY;
    }

    public static double aicc(double logLikelihood, int k, int n) {
        if (n <= k + 1) {
            return Double.POSITIVE_INFINITY;
        }
        double value = aic(logLikelihood, k) + 2.0 * k * (k + 1) / (n - k - 1);
        return isFinite(value) ? value : Double.POSITIVE_INFINITY;
    }

    public static double bic(double logLikelihood, int k, int n) {
        double value = -2 * logLikelihood + k * Math.log(n);
        return isFinite(value) ? value : Double.POSITIVE_INFINITY;
    }

    /**
     * Number of estimated quantities: initial states plus smoothing parameters.
     */
    public static int parameterCount(SmoothingConfig config) {
        int states = 1 + (config.hasTrend() ? 1 : 0) + (config.hasSeason() ? config.getSeasonLength() : 0);
        int smoothing = 1 + (config.hasTrend() ? 1 : 0) + (config.isDamped() ? 1 : 0) + (config.hasSeason() ? 1 : 0);
        return states + smoothing;
    }

    public int parameterCount() {
        return parameterCount(config);
    }

    public AutoETSMetrics metrics() {
        int k = parameterCount();
        double mseValue = mse();
        return new AutoETSMetrics(aic(k), aicc(k), bic(k), mseValue, amse(), Math.sqrt(mseValue), logLikelihood());
    }
}
