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

import com.amazon.ets.config.SeasonType;
import com.amazon.ets.config.TrendType;

/**
 * One step of the exponential smoothing state recursion together with the
 * multi-step forecast from a state. The arithmetic here is mirrored term by
 * term in {@link ETSGradients}; the two must be changed together.
 */
public class StateRecursion {

    /**
     * Values closer to zero than this are treated as zero in divisions.
     */
    public static final double TOLERANCE = 1e-10;

    /**
     * Stand-in for a ratio with a vanishing denominator.
     */
    public static final double HUGE = 1e10;

    private final TrendType trend;
    private final SeasonType season;
    private final double alpha;
    private final double beta;
    private final double gamma;
    private final double phi;

    public StateRecursion(SmoothingConfig config) {
        this.trend = config.getTrend();
        this.season = config.getSeason();
        this.alpha = config.getAlpha();
        this.beta = config.getBeta();
        this.gamma = config.getGamma();
        this.phi = config.getPhi();
    }

    /**
     * Advances the state by one observation.
     *
     * @param state the state before observing y; updated in place
     * @param y     the observation
     * @return the one step forecast of y made from the state before the update
     */
    public double update(RecursionState state, double y) {
        double level = state.getLevel();
        double oldTrend = state.getTrend();

        double phiTrend;
        double q;
        if (!trend.isPresent()) {
            phiTrend = 0;
            q = level;
        } else if (trend.isMultiplicative()) {
            phiTrend = (Math.abs(phi - 1.0) < TOLERANCE) ? oldTrend : Math.pow(oldTrend, phi);
            q = level * phiTrend;
        } else {
            phiTrend = phi * oldTrend;
            q = level + phiTrend;
        }

        double oldSeason = season.isPresent() ? state.oldestSeasonal() : 0;
        double forecast;
        double p;
        if (season == SeasonType.ADDITIVE) {
            forecast = q + oldSeason;
            p = y - oldSeason;
        } else if (season == SeasonType.MULTIPLICATIVE) {
            forecast = q * oldSeason;
            p = (Math.abs(oldSeason) < TOLERANCE) ? HUGE : y / oldSeason;
        } else {
            forecast = q;
            p = y;
        }

        double newLevel = q + alpha * (p - q);
        state.setLevel(newLevel);

        if (trend.isPresent()) {
            double r;
            if (trend.isMultiplicative()) {
                r = (Math.abs(level) < TOLERANCE) ? HUGE : newLevel / level;
            } else {
                r = newLevel - level;
            }
            state.setTrend(phiTrend + (beta / alpha) * (r - phiTrend));
        }

        if (season.isPresent()) {
            double t;
            if (season.isMultiplicative()) {
                t = (Math.abs(q) < TOLERANCE) ? HUGE : y / q;
            } else {
                t = y - q;
            }
            state.rotate(oldSeason + gamma * (t - oldSeason));
        }
        return forecast;
    }

    /**
     * Point forecasts for horizons 1 through h from a state. The state is not
     * modified.
     *
     * @param state   the state after the last observation
     * @param horizon number of steps, at least 1
     * @return the forecasts
     */
    public double[] forecast(RecursionState state, int horizon) {
        checkArgument(horizon > 0, "horizon must be positive");
        double[] result = new double[horizon];
        double level = state.getLevel();
        double trendValue = state.getTrend();
        int m = state.getSeasonLength();
        double phiStar = phi;
        for (int i = 0; i < horizon; i++) {
            double value;
            if (!trend.isPresent()) {
                value = level;
            } else if (trend.isMultiplicative()) {
                value = (trendValue < 0) ? Double.NaN : level * Math.pow(trendValue, phiStar);
            } else {
                value = level + phiStar * trendValue;
            }

            if (season.isPresent()) {
                int j = ((m - 1 - i) % m + m) % m;
                value = season.isMultiplicative() ? value * state.seasonalAt(j) : value + state.seasonalAt(j);
            }
            result[i] = value;

            if (i < horizon - 1) {
                phiStar += (Math.abs(phi - 1.0) < TOLERANCE) ? 1.0 : Math.pow(phi, i + 1);
            }
        }
        return result;
    }
}
