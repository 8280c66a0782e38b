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

import com.amazon.ets.config.ErrorType;
import com.amazon.ets.config.SeasonType;
import com.amazon.ets.config.TrendType;

import lombok.Getter;
import lombok.ToString;

/**
 * The structure and smoothing parameters of a single exponential smoothing
 * model. Instances are immutable and validated on construction; use
 * {@link #toBuilder()} to derive variants. A trended model must be given beta
 * and a seasonal model gamma; only alpha and phi have defaults.
 */
@Getter
@ToString
public class SmoothingConfig {

    public static final double DEFAULT_ALPHA = 0.2;
    public static final double DEFAULT_PHI = 0.98;

    private final ErrorType error;
    private final TrendType trend;
    private final SeasonType season;
    private final int seasonLength;
    private final double alpha;
    // NaN when absent
    private final double beta;
    private final double gamma;
    private final double phi;

    protected SmoothingConfig(Builder builder) {
        checkNotNull(builder.error, "error type cannot be null");
        checkNotNull(builder.trend, "trend type cannot be null");
        checkNotNull(builder.season, "season type cannot be null");
        checkArgument(isSupported(builder.error, builder.trend, builder.season),
                "unsupported combination of error, trend and season");
        checkArgument(builder.seasonLength >= 1, "season length must be at least 1");
        checkArgument(!builder.season.isPresent() || builder.seasonLength >= 2,
                "a seasonal model needs a season length of at least 2");
        checkArgument(builder.alpha > 0 && builder.alpha <= 1, "alpha must be in (0, 1]");

        error = builder.error;
        trend = builder.trend;
        season = builder.season;
        seasonLength = season.isPresent() ? builder.seasonLength : 1;
        alpha = builder.alpha;

        if (trend.isPresent()) {
            checkArgument(builder.beta != null, "a trended model requires beta");
            checkArgument(builder.beta > 0 && builder.beta <= 1, "beta must be in (0, 1]");
            beta = builder.beta;
        } else {
            checkArgument(builder.beta == null, "beta is only defined for a trended model");
            beta = Double.NaN;
        }

        if (season.isPresent()) {
            checkArgument(builder.gamma != null, "a seasonal model requires gamma");
            checkArgument(builder.gamma > 0 && builder.gamma <= 1, "gamma must be in (0, 1]");
            gamma = builder.gamma;
        } else {
            checkArgument(builder.gamma == null, "gamma is only defined for a seasonal model");
            gamma = Double.NaN;
        }

        if (trend.isDamped()) {
            double value = (builder.phi == null) ? DEFAULT_PHI : builder.phi;
            checkArgument(value > 0 && value < 1, "phi must be in (0, 1) for a damped trend");
            phi = value;
        } else {
            checkArgument(builder.phi == null || builder.phi == 1.0, "phi must be 1 for an undamped model");
            phi = 1.0;
        }
    }

    /**
     * Additive errors cannot drive multiplicative components, multiplicative
     * errors do not combine with additive seasonality, and the fully
     * multiplicative model with a multiplicative trend is numerically unstable.
     *
     * @return true if the recursion supports the combination
     */
    public static boolean isSupported(ErrorType error, TrendType trend, SeasonType season) {
        if (error == ErrorType.ADDITIVE) {
            return !trend.isMultiplicative() && !season.isMultiplicative();
        }
        if (season == SeasonType.ADDITIVE) {
            return false;
        }
        return !(trend.isMultiplicative() && season.isMultiplicative());
    }

    public boolean hasTrend() {
        return trend.isPresent();
    }

    public boolean hasSeason() {
        return season.isPresent();
    }

    public boolean isDamped() {
        return trend.isDamped();
    }

    /**
     * @return true when every observation must be strictly positive
     */
    public boolean requiresPositiveData() {
        return error.isMultiplicative() || trend.isMultiplicative() || season.isMultiplicative();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().error(error).trend(trend).season(season).seasonLength(seasonLength).alpha(alpha)
                .beta(trend.isPresent() ? beta : null).gamma(season.isPresent() ? gamma : null)
                .phi(trend.isDamped() ? phi : null);
    }

    public static class Builder {
        private ErrorType error = ErrorType.ADDITIVE;
        private TrendType trend = TrendType.NONE;
        private SeasonType season = SeasonType.NONE;
        private int seasonLength = 1;
        private double alpha = DEFAULT_ALPHA;
        private Double beta;
        private Double gamma;
        private Double phi;

        public Builder error(ErrorType error) {
            this.error = error;
            return this;
        }

        public Builder trend(TrendType trend) {
            this.trend = trend;
            return this;
        }

        public Builder season(SeasonType season) {
            this.season = season;
            return this;
        }

        public Builder seasonLength(int seasonLength) {
            this.seasonLength = seasonLength;
            return this;
        }

        public Builder alpha(double alpha) {
            this.alpha = alpha;
            return this;
        }

        public Builder beta(Double beta) {
            this.beta = beta;
            return this;
        }

        public Builder gamma(Double gamma) {
            this.gamma = gamma;
            return this;
        }

        public Builder phi(Double phi) {
            this.phi = phi;
            return this;
        }

        public SmoothingConfig build() {
            return new SmoothingConfig(this);
        }
    }
}
