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
import static com.amazon.ets.model.StateRecursion.HUGE;
import static com.amazon.ets.model.StateRecursion.TOLERANCE;

import java.util.Arrays;

import com.amazon.ets.config.OptimizationCriterion;
import com.amazon.ets.config.SeasonType;

import lombok.Getter;

/**
 * Forward mode derivatives of the fit statistics of a model with respect to
 * alpha, beta, phi, gamma, the initial level and the initial trend. Every state
 * quantity of the recursion carries a tangent vector indexed by
 * {@link SmoothingParameter}, so the pass costs a constant multiple of a plain
 * fit. The primal values repeat {@link StateRecursion} and
 * {@link ETS#fitWithFullState} operation for operation, including the sentinel
 * branches which contribute zero derivative.
 */
@Getter
public class ETSGradients {

    private static final int D = SmoothingParameter.COUNT;
    private static final int ALPHA = SmoothingParameter.ALPHA.ordinal();
    private static final int BETA = SmoothingParameter.BETA.ordinal();
    private static final int PHI = SmoothingParameter.PHI.ordinal();
    private static final int GAMMA = SmoothingParameter.GAMMA.ordinal();
    private static final int LEVEL = SmoothingParameter.LEVEL.ordinal();
    private static final int TREND = SmoothingParameter.TREND.ordinal();

    private final double logLikelihood;
    private final double mse;
    private final double amse;
    private final int sampleSize;
    private final double[] negativeLogLikelihoodGradient;
    private final double[] mseGradient;
    private final double[] amseGradient;

    private ETSGradients(double logLikelihood, double mse, double amse, int sampleSize, double[] nll,
            double[] mseGradient, double[] amseGradient) {
        this.logLikelihood = logLikelihood;
        this.mse = mse;
        this.amse = amse;
        this.sampleSize = sampleSize;
        this.negativeLogLikelihoodGradient = nll;
        this.mseGradient = mseGradient;
        this.amseGradient = amseGradient;
    }

    public double getSigma() {
        return Math.sqrt(mse);
    }

    /**
     * @return the value the optimizer minimizes for the criterion
     */
    public double objective(OptimizationCriterion criterion) {
        switch (criterion) {
        case MSE:
            return mse;
        case AMSE:
            return amse;
        case SIGMA:
            return getSigma();
        default:
            return -logLikelihood;
        }
    }

    /**
     * @return derivatives of {@link #objective} indexed by
     *         {@link SmoothingParameter}
     */
    public double[] gradient(OptimizationCriterion criterion) {
        switch (criterion) {
        case MSE:
            return Arrays.copyOf(mseGradient, D);
        case AMSE:
            return Arrays.copyOf(amseGradient, D);
        case SIGMA:
            double sigma = getSigma();
            double[] result = new double[D];
            if (sigma > 0) {
                for (int k = 0; k < D; k++) {
                    result[k] = mseGradient[k] / (2 * sigma);
                }
            }
            return result;
        default:
            return Arrays.copyOf(negativeLogLikelihoodGradient, D);
        }
    }

    /**
     * Runs the recursion over the series with tangents attached.
     *
     * @param config the model
     * @param values training data, positive when the model requires it
     * @param level0 initial level override or null
     * @param trend0 initial trend override or null
     * @param nmse   number of horizons for the averaged mse
     * @return values and derivatives of the fit statistics
     */
    public static ETSGradients compute(SmoothingConfig config, double[] values, Double level0, Double trend0,
            int nmse) {
        checkArgument(values.length > 0, "cannot differentiate over an empty series");
        RecursionState start = StateInitializer.initialize(values, config, level0, trend0, null);
        int n = values.length;
        boolean hasTrend = config.hasTrend();
        boolean multiplicativeTrend = config.getTrend().isMultiplicative();
        boolean damped = config.isDamped();
        SeasonType season = config.getSeason();
        boolean multiplicativeError = config.getError().isMultiplicative();
        double alpha = config.getAlpha();
        double beta = hasTrend ? config.getBeta() : 0;
        double gamma = season.isPresent() ? config.getGamma() : 0;
        double phi = config.getPhi();

        double level = start.getLevel();
        double trend = start.getTrend();
        double[] seasonal = start.getSeasonal();
        int m = seasonal.length;

        double[] dLevel = new double[D];
        double[] dTrend = new double[D];
        double[][] dSeasonal = new double[m][D];
        if (level0 != null && (!config.requiresPositiveData() || level0 > StateInitializer.MIN_POSITIVE_LEVEL)) {
            dLevel[LEVEL] = 1;
        }
        if (trend0 != null && hasTrend && (!multiplicativeTrend
                || (trend0 > StateInitializer.MIN_TREND_RATIO && trend0 < StateInitializer.MAX_TREND_RATIO))) {
            dTrend[TREND] = 1;
        }

        double innovationSse = 0;
        double sse = 0;
        double sumLogForecast = 0;
        double[] dInnovationSse = new double[D];
        double[] dSse = new double[D];
        double[] dSumLog = new double[D];
        double[] horizonSse = new double[nmse];
        int[] horizonCount = new int[nmse];
        double[][] dHorizonSse = new double[nmse][D];

        double[] zero = new double[D];
        double[] dPhiTrend = new double[D];
        double[] dq = new double[D];
        double[] dForecast = new double[D];
        double[] dp = new double[D];
        double[] dNewLevel = new double[D];
        double[] dr = new double[D];
        double[] dNewTrend = new double[D];
        double[] dt = new double[D];

        for (int time = 0; time < n; time++) {
            double y = values[time];
            if (nmse > 1) {
                accumulateHorizons(values, time, level, trend, seasonal, dLevel, dTrend, dSeasonal, config,
                        horizonSse, horizonCount, dHorizonSse);
            }

            double phiTrend;
            double q;
            if (!hasTrend) {
                phiTrend = 0;
                q = level;
                Arrays.fill(dPhiTrend, 0);
                System.arraycopy(dLevel, 0, dq, 0, D);
            } else if (multiplicativeTrend) {
                if (Math.abs(phi - 1.0) < TOLERANCE) {
                    phiTrend = trend;
                    System.arraycopy(dTrend, 0, dPhiTrend, 0, D);
                } else {
                    phiTrend = Math.pow(trend, phi);
                    double slope = phi * Math.pow(trend, phi - 1);
                    for (int k = 0; k < D; k++) {
                        dPhiTrend[k] = slope * dTrend[k];
                    }
                    if (damped) {
                        dPhiTrend[PHI] += phiTrend * Math.log(trend);
                    }
                }
                q = level * phiTrend;
                for (int k = 0; k < D; k++) {
                    dq[k] = dLevel[k] * phiTrend + level * dPhiTrend[k];
                }
            } else {
                phiTrend = phi * trend;
                for (int k = 0; k < D; k++) {
                    dPhiTrend[k] = phi * dTrend[k];
                }
                if (damped) {
                    dPhiTrend[PHI] += trend;
                }
                q = level + phiTrend;
                for (int k = 0; k < D; k++) {
                    dq[k] = dLevel[k] + dPhiTrend[k];
                }
            }

            double oldSeason = season.isPresent() ? seasonal[m - 1] : 0;
            double[] dOldSeason = season.isPresent() ? dSeasonal[m - 1] : zero;
            double forecast;
            double p;
            if (season == SeasonType.ADDITIVE) {
                forecast = q + oldSeason;
                p = y - oldSeason;
                for (int k = 0; k < D; k++) {
                    dForecast[k] = dq[k] + dOldSeason[k];
                    dp[k] = -dOldSeason[k];
                }
            } else if (season == SeasonType.MULTIPLICATIVE) {
                forecast = q * oldSeason;
                for (int k = 0; k < D; k++) {
                    dForecast[k] = dq[k] * oldSeason + q * dOldSeason[k];
                }
                if (Math.abs(oldSeason) < TOLERANCE) {
                    p = HUGE;
                    Arrays.fill(dp, 0);
                } else {
                    p = y / oldSeason;
                    double factor = -y / (oldSeason * oldSeason);
                    for (int k = 0; k < D; k++) {
                        dp[k] = factor * dOldSeason[k];
                    }
                }
            } else {
                forecast = q;
                p = y;
                System.arraycopy(dq, 0, dForecast, 0, D);
                Arrays.fill(dp, 0);
            }

            double newLevel = q + alpha * (p - q);
            for (int k = 0; k < D; k++) {
                dNewLevel[k] = dq[k] + alpha * (dp[k] - dq[k]);
            }
            dNewLevel[ALPHA] += p - q;

            if (hasTrend) {
                double r;
                if (multiplicativeTrend) {
                    if (Math.abs(level) < TOLERANCE) {
                        r = HUGE;
                        Arrays.fill(dr, 0);
                    } else {
                        r = newLevel / level;
                        for (int k = 0; k < D; k++) {
                            dr[k] = (dNewLevel[k] * level - newLevel * dLevel[k]) / (level * level);
                        }
                    }
                } else {
                    r = newLevel - level;
                    for (int k = 0; k < D; k++) {
                        dr[k] = dNewLevel[k] - dLevel[k];
                    }
                }
                double ratio = beta / alpha;
                double newTrend = phiTrend + ratio * (r - phiTrend);
                for (int k = 0; k < D; k++) {
                    dNewTrend[k] = dPhiTrend[k] + ratio * (dr[k] - dPhiTrend[k]);
                }
                dNewTrend[BETA] += (r - phiTrend) / alpha;
                dNewTrend[ALPHA] -= beta / (alpha * alpha) * (r - phiTrend);
                trend = newTrend;
                System.arraycopy(dNewTrend, 0, dTrend, 0, D);
            }

            if (season.isPresent()) {
                double target;
                if (season.isMultiplicative()) {
                    if (Math.abs(q) < TOLERANCE) {
                        target = HUGE;
                        Arrays.fill(dt, 0);
                    } else {
                        target = y / q;
                        double factor = -y / (q * q);
                        for (int k = 0; k < D; k++) {
                            dt[k] = factor * dq[k];
                        }
                    }
                } else {
                    target = y - q;
                    for (int k = 0; k < D; k++) {
                        dt[k] = -dq[k];
                    }
                }
                double newSeason = oldSeason + gamma * (target - oldSeason);
                double[] dNewSeason = new double[D];
                for (int k = 0; k < D; k++) {
                    dNewSeason[k] = dOldSeason[k] + gamma * (dt[k] - dOldSeason[k]);
                }
                dNewSeason[GAMMA] += target - oldSeason;
                System.arraycopy(seasonal, 0, seasonal, 1, m - 1);
                seasonal[0] = newSeason;
                System.arraycopy(dSeasonal, 0, dSeasonal, 1, m - 1);
                dSeasonal[0] = dNewSeason;
            }

            level = newLevel;
            System.arraycopy(dNewLevel, 0, dLevel, 0, D);

            double residual = y - forecast;
            sse += residual * residual;
            for (int k = 0; k < D; k++) {
                dSse[k] -= 2 * residual * dForecast[k];
            }
            if (multiplicativeError) {
                if (forecast > TOLERANCE) {
                    double innovation = y / forecast - 1;
                    innovationSse += innovation * innovation;
                    double factor = -2 * innovation * y / (forecast * forecast);
                    for (int k = 0; k < D; k++) {
                        dInnovationSse[k] += factor * dForecast[k];
                    }
                }
                double magnitude = Math.abs(forecast);
                sumLogForecast += Math.log(Math.max(magnitude, TOLERANCE));
                if (magnitude > TOLERANCE) {
                    for (int k = 0; k < D; k++) {
                        dSumLog[k] += dForecast[k] / forecast;
                    }
                }
            } else {
                innovationSse += residual * residual;
                for (int k = 0; k < D; k++) {
                    dInnovationSse[k] -= 2 * residual * dForecast[k];
                }
            }
        }

        double logLikelihood = ETS.logLikelihood(innovationSse, sumLogForecast, n, multiplicativeError);
        double[] nll = new double[D];
        double[] mseGradient = new double[D];
        for (int k = 0; k < D; k++) {
            nll[k] = (innovationSse > 0) ? 0.5 * n * dInnovationSse[k] / innovationSse : 0;
            if (multiplicativeError) {
                nll[k] += dSumLog[k];
            }
            mseGradient[k] = dSse[k] / n;
        }

        double mse = sse / n;
        double amse = mse;
        double[] amseGradient = Arrays.copyOf(mseGradient, D);
        if (nmse > 1) {
            amse = ETS.averageHorizonMse(horizonSse, horizonCount);
            Arrays.fill(amseGradient, 0);
            int horizons = 0;
            for (int j = 0; j < nmse; j++) {
                if (horizonCount[j] > 0) {
                    horizons++;
                    for (int k = 0; k < D; k++) {
                        amseGradient[k] += dHorizonSse[j][k] / horizonCount[j];
                    }
                }
            }
            for (int k = 0; k < D; k++) {
                amseGradient[k] /= horizons;
            }
        }
        return new ETSGradients(logLikelihood, mse, amse, n, nll, mseGradient, amseGradient);
    }

    /**
     * Multi-step forecasts from the current state, mirroring
     * {@link StateRecursion#forecast}, with squared errors and their tangents
     * added per horizon.
     */
    private static void accumulateHorizons(double[] values, int time, double level, double trend, double[] seasonal,
            double[] dLevel, double[] dTrend, double[][] dSeasonal, SmoothingConfig config, double[] horizonSse,
            int[] horizonCount, double[][] dHorizonSse) {
        int m = seasonal.length;
        double phi = config.getPhi();
        boolean damped = config.isDamped();
        SeasonType season = config.getSeason();
        double phiStar = phi;
        double dPhiStar = 1;
        double[] dValue = new double[D];
        for (int j = 0; j < horizonSse.length && time + j < values.length; j++) {
            double value;
            if (!config.hasTrend()) {
                value = level;
                System.arraycopy(dLevel, 0, dValue, 0, D);
            } else if (config.getTrend().isMultiplicative()) {
                if (trend < 0) {
                    value = Double.NaN;
                    Arrays.fill(dValue, 0);
                } else {
                    double power = Math.pow(trend, phiStar);
                    value = level * power;
                    double slope = (trend > 0) ? level * phiStar * Math.pow(trend, phiStar - 1) : 0;
                    for (int k = 0; k < D; k++) {
                        dValue[k] = dLevel[k] * power + slope * dTrend[k];
                    }
                    if (damped && trend > 0) {
                        dValue[PHI] += value * Math.log(trend) * dPhiStar;
                    }
                }
            } else {
                value = level + phiStar * trend;
                for (int k = 0; k < D; k++) {
                    dValue[k] = dLevel[k] + phiStar * dTrend[k];
                }
                if (damped) {
                    dValue[PHI] += trend * dPhiStar;
                }
            }

            if (season.isPresent()) {
                int index = ((m - 1 - j) % m + m) % m;
                if (season.isMultiplicative()) {
                    for (int k = 0; k < D; k++) {
                        dValue[k] = dValue[k] * seasonal[index] + value * dSeasonal[index][k];
                    }
                    value *= seasonal[index];
                } else {
                    for (int k = 0; k < D; k++) {
                        dValue[k] += dSeasonal[index][k];
                    }
                    value += seasonal[index];
                }
            }

            double error = values[time + j] - value;
            horizonSse[j] += error * error;
            horizonCount[j]++;
            for (int k = 0; k < D; k++) {
                dHorizonSse[j][k] -= 2 * error * dValue[k];
            }

            if (Math.abs(phi - 1.0) < TOLERANCE) {
                phiStar += 1.0;
            } else {
                phiStar += Math.pow(phi, j + 1);
                dPhiStar += (j + 1) * Math.pow(phi, j);
            }
        }
    }
}
