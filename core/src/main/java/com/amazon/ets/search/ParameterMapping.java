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

import static com.amazon.ets.CommonUtils.clamp;

import java.util.ArrayList;
import java.util.List;

import com.amazon.ets.model.SmoothingConfig;
import com.amazon.ets.model.SmoothingParameter;
import com.amazon.ets.optimization.Bounds;

/**
 * Translates between the optimizer's vector of free quantities and a model
 * with starting state. Mapping clamps beta to at most alpha and gamma into the
 * admissible band for the current alpha and phi; the Jacobian of the mapping is
 * reported so gradients can be chained through the clamps.
 */
class ParameterMapping {

    static final double ALPHA_LOWER = 1e-4;
    static final double ALPHA_UPPER = 0.9999;
    static final double MULTIPLICATIVE_SEASON_ALPHA_UPPER = 0.6;
    static final double BETA_LOWER = 1e-4;
    static final double BETA_UPPER = 0.9999;
    static final double PHI_LOWER = 0.80;
    static final double PHI_UPPER = 0.98;
    static final double GAMMA_LOWER = 1e-4;
    static final double GAMMA_UPPER = 0.9999;
    static final double MULTIPLICATIVE_SEASON_GAMMA_UPPER = 0.2;

    static class Mapped {
        final SmoothingConfig config;
        final double level0;
        final Double trend0;
        // [vector index][SmoothingParameter ordinal]
        final double[][] jacobian;

        Mapped(SmoothingConfig config, double level0, Double trend0, double[][] jacobian) {
            this.config = config;
            this.level0 = level0;
            this.trend0 = trend0;
            this.jacobian = jacobian;
        }

        double[] chain(double[] gradient) {
            double[] result = new double[jacobian.length];
            for (int i = 0; i < jacobian.length; i++) {
                for (int k = 0; k < gradient.length; k++) {
                    result[i] += jacobian[i][k] * gradient[k];
                }
            }
            return result;
        }
    }

    private final SmoothingConfig base;
    private final List<SmoothingParameter> slots;
    private final double[] lower;
    private final double[] upper;
    private final double gammaUpper;

    ParameterMapping(SmoothingConfig base, SearchSettings settings, double levelLower, double levelUpper,
            double trendLower, double trendUpper) {
        this.base = base;
        boolean multiplicativeSeason = base.getSeason().isMultiplicative();
        this.gammaUpper = multiplicativeSeason ? MULTIPLICATIVE_SEASON_GAMMA_UPPER : GAMMA_UPPER;
        slots = new ArrayList<>();
        List<double[]> ranges = new ArrayList<>();
        if (settings.getPinnedAlpha() == null) {
            slots.add(SmoothingParameter.ALPHA);
            ranges.add(new double[] { ALPHA_LOWER,
                    multiplicativeSeason ? MULTIPLICATIVE_SEASON_ALPHA_UPPER : ALPHA_UPPER });
        }
        if (base.hasTrend() && settings.getPinnedBeta() == null) {
            slots.add(SmoothingParameter.BETA);
            ranges.add(new double[] { BETA_LOWER, BETA_UPPER });
        }
        if (base.isDamped() && settings.getPinnedPhi() == null) {
            slots.add(SmoothingParameter.PHI);
            ranges.add(new double[] { PHI_LOWER, PHI_UPPER });
        }
        if (base.hasSeason() && settings.getPinnedGamma() == null) {
            slots.add(SmoothingParameter.GAMMA);
            ranges.add(new double[] { GAMMA_LOWER, gammaUpper });
        }
        slots.add(SmoothingParameter.LEVEL);
        ranges.add(new double[] { levelLower, levelUpper });
        if (base.hasTrend()) {
            slots.add(SmoothingParameter.TREND);
            ranges.add(new double[] { trendLower, trendUpper });
        }
        lower = new double[slots.size()];
        upper = new double[slots.size()];
        for (int i = 0; i < slots.size(); i++) {
            lower[i] = ranges.get(i)[0];
            upper[i] = ranges.get(i)[1];
        }
    }

    int getDimension() {
        return slots.size();
    }

    List<SmoothingParameter> getSlots() {
        return slots;
    }

    Bounds bounds() {
        return new Bounds(lower, upper);
    }

    /**
     * @return the vector for a model and starting state, moved into the bounds
     */
    double[] start(SmoothingConfig config, double level0, double trend0) {
        double[] result = new double[slots.size()];
        for (int i = 0; i < slots.size(); i++) {
            double value;
            switch (slots.get(i)) {
            case ALPHA:
                value = config.getAlpha();
                break;
            case BETA:
                value = config.getBeta();
                break;
            case PHI:
                value = config.getPhi();
                break;
            case GAMMA:
                value = config.getGamma();
                break;
            case LEVEL:
                value = level0;
                break;
            default:
                value = trend0;
            }
            result[i] = clamp(value, lower[i], upper[i]);
        }
        return result;
    }

    Mapped map(double[] vector) {
        int alphaIndex = slots.indexOf(SmoothingParameter.ALPHA);
        int betaIndex = slots.indexOf(SmoothingParameter.BETA);
        int phiIndex = slots.indexOf(SmoothingParameter.PHI);
        int gammaIndex = slots.indexOf(SmoothingParameter.GAMMA);
        int levelIndex = slots.indexOf(SmoothingParameter.LEVEL);
        int trendIndex = slots.indexOf(SmoothingParameter.TREND);
        double[][] jacobian = new double[slots.size()][SmoothingParameter.COUNT];

        double alpha = base.getAlpha();
        if (alphaIndex >= 0) {
            alpha = clamp(vector[alphaIndex], lower[alphaIndex], upper[alphaIndex]);
            jacobian[alphaIndex][SmoothingParameter.ALPHA.ordinal()] = 1;
        }

        SmoothingConfig.Builder builder = base.toBuilder().alpha(alpha);
        if (base.hasTrend()) {
            double beta = base.getBeta();
            if (betaIndex >= 0) {
                double raw = clamp(vector[betaIndex], lower[betaIndex], upper[betaIndex]);
                if (raw > alpha) {
                    beta = alpha;
                    if (alphaIndex >= 0) {
                        jacobian[alphaIndex][SmoothingParameter.BETA.ordinal()] = 1;
                    }
                } else {
                    beta = raw;
                    jacobian[betaIndex][SmoothingParameter.BETA.ordinal()] = 1;
                }
            }
            builder.beta(beta);
        }

        double phi = base.getPhi();
        if (phiIndex >= 0) {
            phi = clamp(vector[phiIndex], lower[phiIndex], upper[phiIndex]);
            jacobian[phiIndex][SmoothingParameter.PHI.ordinal()] = 1;
            builder.phi(phi);
        }

        if (base.hasSeason() && gammaIndex >= 0) {
            double raw = clamp(vector[gammaIndex], lower[gammaIndex], upper[gammaIndex]);
            double value = clamp(raw, gammaBandLower(alpha, phi), gammaBandUpper(alpha, phi));
            jacobian[gammaIndex][SmoothingParameter.GAMMA.ordinal()] = (value == raw) ? 1 : 0;
            builder.gamma(value);
        }

        double level0 = clamp(vector[levelIndex], lower[levelIndex], upper[levelIndex]);
        jacobian[levelIndex][SmoothingParameter.LEVEL.ordinal()] = 1;
        Double trend0 = null;
        if (trendIndex >= 0) {
            trend0 = clamp(vector[trendIndex], lower[trendIndex], upper[trendIndex]);
            jacobian[trendIndex][SmoothingParameter.TREND.ordinal()] = 1;
        }
        return new Mapped(builder.build(), level0, trend0, jacobian);
    }

    /**
     * Lower edge of the admissible gamma band, max(1 - 1/phi - alpha, 0), kept
     * above the hard lower bound. Since phi never exceeds 1 the band edge is at
     * most 0, so only the hard bound is active.
     */
    static double gammaBandLower(double alpha, double phi) {
        return Math.max(Math.max(1 - 1 / phi - alpha, 0), GAMMA_LOWER);
    }

    /**
     * Upper edge of the admissible gamma band, 1 + 1/phi - alpha, capped by the
     * hard upper bound. Since phi never exceeds 1 and alpha never exceeds 1 the
     * band edge is at least 1, so only the hard bound is active.
     */
    double gammaBandUpper(double alpha, double phi) {
        return Math.min(1 + 1 / phi - alpha, gammaUpper);
    }
}
