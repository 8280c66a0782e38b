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

import static com.amazon.ets.CommonUtils.checkArgument;
import static com.amazon.ets.CommonUtils.checkNotNull;
import static com.amazon.ets.CommonUtils.clamp;
import static com.amazon.ets.CommonUtils.isFinite;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.amazon.ets.config.OptimizationCriterion;
import com.amazon.ets.config.SeasonType;
import com.amazon.ets.model.ETS;
import com.amazon.ets.model.ETSGradients;
import com.amazon.ets.model.RecursionState;
import com.amazon.ets.model.SmoothingConfig;
import com.amazon.ets.model.StateInitializer;
import com.amazon.ets.optimization.LBFGSOptimizer;
import com.amazon.ets.optimization.NelderMeadOptimizer;
import com.amazon.ets.optimization.OptimizerResult;
import com.amazon.ets.returntypes.AutoETSMetrics;

import lombok.extern.slf4j.Slf4j;

/**
 * Fits one candidate structure to the training data. Evaluation runs in three
 * stages: a coarse grid over the smoothing parameters, an optional scan over
 * starting level and trend, and a bounded continuous refinement of all free
 * quantities. Each later stage only replaces the running result when it is
 * strictly better by {@link AutoETS#betterMetrics}.
 */
@Slf4j
public class CandidateEvaluator {

    static final double[] ALPHA_GRID = { 0.1, 0.3, 0.5, 0.7, 0.9 };
    static final double[] BETA_FRACTIONS = { 0, 0.3, 0.7 };
    static final double[] PHI_GRID = { 0.80, 0.85, 0.90, 0.95, 0.98 };
    static final double[] MULTIPLICATIVE_GAMMA_GRID = { 0.01, 0.05, 0.10 };
    static final double[] ADDITIVE_GAMMA_GRID = { 0.05, 0.2, 0.5, 0.8 };
    static final double[] STATE_OFFSETS = { -0.2, -0.1, 0, 0.1, 0.2 };
    static final double[] RATIO_FACTORS = { 0.85, 0.95, 1.0, 1.05, 1.15 };

    static final double POSITIVE_LEVEL_FLOOR = 1e-3;

    private final double[] values;
    private final int seasonLength;
    private final SearchSettings settings;
    private final NelderMeadOptimizer nelderMead;
    private final LBFGSOptimizer lbfgs;

    // data summaries shared by every candidate
    private final double minimum;
    private final double maximum;
    private final double range;
    private final double trendBound;
    private final double trendBase;
    private final double ratioBase;

    public CandidateEvaluator(double[] values, int seasonLength, SearchSettings settings) {
        checkNotNull(values, "values cannot be null");
        checkArgument(values.length > 1, "need at least two observations");
        checkArgument(seasonLength > 0, "season length must be positive");
        this.values = Arrays.copyOf(values, values.length);
        this.seasonLength = seasonLength;
        this.settings = checkNotNull(settings, "settings cannot be null");
        this.nelderMead = NelderMeadOptimizer.builder().maxIterations(settings.getMaxIterations()).build();
        this.lbfgs = LBFGSOptimizer.builder().maxIterations(settings.getMaxIterations()).build();

        int n = values.length;
        minimum = Arrays.stream(values).min().getAsDouble();
        maximum = Arrays.stream(values).max().getAsDouble();
        range = Math.max(1.0, maximum - minimum);
        trendBound = Math.max(1.0, 1.5 * range);
        trendBase = values[1] - values[0];
        if (values[0] > 0 && values[n - 1] > 0) {
            ratioBase = clamp(Math.pow(values[n - 1] / values[0], 1.0 / (n - 1)), StateInitializer.MIN_TREND_RATIO,
                    StateInitializer.MAX_TREND_RATIO);
        } else {
            ratioBase = 1.0;
        }
    }

    /**
     * Evaluates a candidate. Failures are reported through the result rather
     * than thrown.
     */
    public CandidateResult evaluate(CandidateConfig candidate) {
        try {
            CandidateResult result = doEvaluate(candidate);
            log.debug("candidate {} aicc {}", candidate, result.getMetrics().getAicc());
            return result;
        } catch (IllegalArgumentException | IllegalStateException | ArithmeticException e) {
            log.debug("candidate {} failed: {}", candidate, e.getMessage());
            return CandidateResult.failed(candidate, e.getMessage());
        }
    }

    private static class Fit {
        SmoothingConfig config;
        AutoETSMetrics metrics;
        RecursionState initial;
        Double level0;
        Double trend0;
        int iterations;
        boolean converged;
        double objective = Double.NaN;
    }

    private CandidateResult doEvaluate(CandidateConfig candidate) {
        Fit best = coarseSearch(candidate);
        if (best == null) {
            return CandidateResult.failed(candidate, "no grid point produced a finite AICc");
        }
        if (settings.isStateSearchEnabled()) {
            stateSearch(best);
        }
        refine(best);
        return CandidateResult.builder().candidate(candidate).config(best.config).metrics(best.metrics)
                .level0(best.level0).trend0(best.trend0).optimizerIterations(best.iterations)
                .optimizerConverged(best.converged).optimizerObjective(best.objective).build();
    }

    int nmse() {
        return (settings.getCriterion() == OptimizationCriterion.AMSE) ? settings.getNmse() : 1;
    }

    ETS fitModel(SmoothingConfig config, Double level0, Double trend0) {
        ETS model = new ETS(config, nmse());
        model.fitWithFullState(values, level0, trend0, null);
        return model;
    }

    static boolean isDegenerate(AutoETSMetrics metrics) {
        return !isFinite(metrics.getAicc()) || !(metrics.getMse() > 0) || !(metrics.getLogLikelihood() < 0);
    }

    Fit coarseSearch(CandidateConfig candidate) {
        boolean trend = candidate.getTrend().isPresent();
        boolean season = candidate.getSeason().isPresent();
        boolean damped = candidate.isDamped();
        SmoothingConfig.Builder builder = SmoothingConfig.builder().error(candidate.getError())
                .trend(candidate.getTrendType()).season(candidate.getSeason()).seasonLength(seasonLength);

        Fit best = null;
        for (double alpha : grid(settings.getPinnedAlpha(), ALPHA_GRID)) {
            builder.alpha(alpha);
            for (double beta : trend ? betaGrid(alpha) : new double[] { Double.NaN }) {
                builder.beta(trend ? beta : null);
                for (double phi : damped ? grid(settings.getPinnedPhi(), PHI_GRID) : new double[] { 1.0 }) {
                    builder.phi(damped ? phi : null);
                    for (double gamma : season ? gammaGrid(candidate, alpha, phi) : new double[] { Double.NaN }) {
                        builder.gamma(season ? gamma : null);
                        ETS model = fitModel(builder.build(), null, null);
                        AutoETSMetrics metrics = model.metrics();
                        if (isFinite(metrics.getAicc())
                                && (best == null || AutoETS.betterMetrics(metrics, best.metrics))) {
                            best = new Fit();
                            best.config = model.getConfig();
                            best.metrics = metrics;
                            best.initial = model.initialState();
                        }
                    }
                }
            }
        }
        return best;
    }

    static double[] grid(Double pinned, double[] grid) {
        return (pinned != null) ? new double[] { pinned } : grid;
    }

    double[] betaGrid(double alpha) {
        Double pinned = settings.getPinnedBeta();
        if (pinned != null) {
            return (pinned > alpha) ? new double[0] : new double[] { pinned };
        }
        double[] result = new double[BETA_FRACTIONS.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = clamp(Math.min(BETA_FRACTIONS[i] * alpha, ParameterMapping.BETA_UPPER),
                    ParameterMapping.BETA_LOWER, alpha);
        }
        return result;
    }

    double[] gammaGrid(CandidateConfig candidate, double alpha, double phi) {
        Double pinned = settings.getPinnedGamma();
        if (pinned != null) {
            return new double[] { pinned };
        }
        double[] base = candidate.getSeason().isMultiplicative() ? MULTIPLICATIVE_GAMMA_GRID : ADDITIVE_GAMMA_GRID;
        double lower = ParameterMapping.gammaBandLower(alpha, phi);
        double upper = Math.min(1 + 1 / phi - alpha, ParameterMapping.GAMMA_UPPER);
        double[] result = new double[base.length];
        for (int i = 0; i < base.length; i++) {
            result[i] = clamp(base[i], lower, upper);
        }
        return result;
    }

    double levelLower(SmoothingConfig config) {
        double lower = config.getSeason().isMultiplicative() ? 0.1 * minimum : minimum - 2 * range;
        return config.requiresPositiveData() ? Math.max(lower, POSITIVE_LEVEL_FLOOR) : lower;
    }

    double levelUpper(SmoothingConfig config) {
        return config.getSeason().isMultiplicative() ? 10 * maximum : maximum + 2 * range;
    }

    double trendLower(SmoothingConfig config) {
        return config.getTrend().isMultiplicative() ? StateInitializer.MIN_TREND_RATIO : -trendBound;
    }

    double trendUpper(SmoothingConfig config) {
        return config.getTrend().isMultiplicative() ? StateInitializer.MAX_TREND_RATIO : trendBound;
    }

    void stateSearch(Fit best) {
        SmoothingConfig config = best.config;
        double levelLower = levelLower(config);
        double levelUpper = Math.max(levelLower, levelUpper(config));
        List<Double> trendSeeds = Collections.singletonList(null);
        if (config.hasTrend()) {
            Double[] seeds = new Double[STATE_OFFSETS.length];
            for (int i = 0; i < seeds.length; i++) {
                seeds[i] = config.getTrend().isMultiplicative()
                        ? clamp(ratioBase * RATIO_FACTORS[i], trendLower(config), trendUpper(config))
                        : clamp(trendBase + STATE_OFFSETS[i] * range, trendLower(config), trendUpper(config));
            }
            trendSeeds = Arrays.asList(seeds);
        }
        double center = best.initial.getLevel();
        for (double offset : STATE_OFFSETS) {
            double level0 = clamp(center + offset * range, levelLower, levelUpper);
            for (Double trend0 : trendSeeds) {
                AutoETSMetrics metrics = fitModel(config, level0, trend0).metrics();
                if (!isDegenerate(metrics) && AutoETS.betterMetrics(metrics, best.metrics)) {
                    best.metrics = metrics;
                    best.level0 = level0;
                    best.trend0 = trend0;
                }
            }
        }
    }

    /**
     * Whether the candidate is refined with gradients rather than the simplex.
     */
    static boolean usesGradients(SmoothingConfig config) {
        return config.getSeason().isMultiplicative()
                || (config.isDamped() && config.getSeason() == SeasonType.ADDITIVE);
    }

    void refine(Fit best) {
        SmoothingConfig config = best.config;
        double levelLower = levelLower(config);
        ParameterMapping mapping = new ParameterMapping(config, settings, levelLower,
                Math.max(levelLower, levelUpper(config)), trendLower(config), trendUpper(config));
        double startLevel = (best.level0 != null) ? best.level0 : best.initial.getLevel();
        double startTrend = (best.trend0 != null) ? best.trend0 : best.initial.getTrend();
        double[] start = mapping.start(config, startLevel, startTrend);
        OptimizationCriterion criterion = settings.getCriterion();
        int k = ETS.parameterCount(config);

        OptimizerResult result;
        if (usesGradients(config)) {
            result = lbfgs.minimize((point, gradient) -> {
                Arrays.fill(gradient, 0);
                try {
                    ParameterMapping.Mapped mapped = mapping.map(point);
                    ETSGradients pass = ETSGradients.compute(mapped.config, values, mapped.level0, mapped.trend0,
                            nmse());
                    double logLikelihood = pass.getLogLikelihood();
                    if (!isFinite(ETS.aicc(logLikelihood, k, values.length)) || !(pass.getMse() > 0)
                            || !(logLikelihood < 0)) {
                        return Double.POSITIVE_INFINITY;
                    }
                    double[] chained = mapped.chain(pass.gradient(criterion));
                    System.arraycopy(chained, 0, gradient, 0, gradient.length);
                    return pass.objective(criterion);
                } catch (IllegalArgumentException e) {
                    return Double.POSITIVE_INFINITY;
                }
            }, start, mapping.bounds());
        } else {
            result = nelderMead.minimize(point -> {
                try {
                    ParameterMapping.Mapped mapped = mapping.map(point);
                    AutoETSMetrics metrics = fitModel(mapped.config, mapped.level0, mapped.trend0).metrics();
                    return isDegenerate(metrics) ? Double.POSITIVE_INFINITY : objective(metrics, criterion);
                } catch (IllegalArgumentException e) {
                    return Double.POSITIVE_INFINITY;
                }
            }, start, mapping.bounds());
        }

        best.iterations = result.getIterations();
        best.converged = result.isConverged();
        best.objective = result.getValue();
        if (!result.isFinite()) {
            return;
        }
        ParameterMapping.Mapped mapped = mapping.map(result.getPoint());
        ETS model = fitModel(mapped.config, mapped.level0, mapped.trend0);
        AutoETSMetrics metrics = model.metrics();
        if (!isDegenerate(metrics) && AutoETS.betterMetrics(metrics, best.metrics)) {
            best.config = mapped.config;
            best.metrics = metrics;
            best.level0 = mapped.level0;
            best.trend0 = mapped.trend0;
        }
    }

    static double objective(AutoETSMetrics metrics, OptimizationCriterion criterion) {
        switch (criterion) {
        case MSE:
            return metrics.getMse();
        case AMSE:
            return metrics.getAmse();
        case SIGMA:
            return metrics.getSigma();
        default:
            return -metrics.getLogLikelihood();
        }
    }
}
