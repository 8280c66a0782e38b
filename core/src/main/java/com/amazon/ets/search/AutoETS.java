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
import static com.amazon.ets.CommonUtils.checkState;
import static com.amazon.ets.CommonUtils.isFinite;

import java.time.Duration;
import java.util.List;

import com.amazon.ets.config.DampedPolicy;
import com.amazon.ets.config.OptimizationCriterion;
import com.amazon.ets.inputtypes.TimeSeries;
import com.amazon.ets.model.ETS;
import com.amazon.ets.model.SmoothingConfig;
import com.amazon.ets.returntypes.AutoETSComponents;
import com.amazon.ets.returntypes.AutoETSDiagnostics;
import com.amazon.ets.returntypes.AutoETSMetrics;
import com.amazon.ets.returntypes.AutoETSParameters;
import com.amazon.ets.returntypes.Forecast;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Automatic exponential smoothing. The search enumerates the model structures
 * admitted by a specification, fits each one, and keeps the model with the
 * lowest AICc. The winner is refit on the whole series and used for
 * forecasting.
 *
 * <pre>
 * AutoETS auto = new AutoETS(12).setAllowMultiplicativeTrend(true);
 * auto.fit(TimeSeries.univariate(values));
 * Forecast forecast = auto.predict(12);
 * </pre>
 */
@Slf4j
public class AutoETS {

    public static final String DEFAULT_SPEC = "ZZZ";
    public static final int MIN_OBSERVATIONS = 4;

    /**
     * Number of consecutive non-improving candidates after which the scan stops.
     */
    public static final int DEFAULT_EARLY_TERMINATION_PATIENCE = 8;

    /**
     * AICc decrease that counts as an improvement for early termination.
     */
    public static final double DEFAULT_EARLY_TERMINATION_MIN_IMPROVEMENT = 0.01;

    public static final double SMOOTHING_LOWER = 1e-4;
    public static final double SMOOTHING_UPPER = 0.9999;
    public static final double PHI_LOWER = 0.8;
    public static final double PHI_UPPER = 0.98;
    public static final int DEFAULT_NMSE = 3;
    public static final int DEFAULT_MAX_ITERATIONS = 300;

    @Getter
    private final int seasonLength;
    private final CandidateSearchSpace searchSpace;

    private Double pinnedAlpha;
    private Double pinnedBeta;
    private Double pinnedGamma;
    private Double pinnedPhi;
    @Getter
    private OptimizationCriterion optimizationCriterion = OptimizationCriterion.LIKELIHOOD;
    @Getter
    private int maxIterations = DEFAULT_MAX_ITERATIONS;
    @Getter
    private int nmse = DEFAULT_NMSE;
    @Getter
    private boolean stateSearchEnabled = false;
    @Getter
    private boolean earlyTerminationEnabled = true;
    private int earlyTerminationPatience = DEFAULT_EARLY_TERMINATION_PATIENCE;
    private double earlyTerminationMinImprovement = DEFAULT_EARLY_TERMINATION_MIN_IMPROVEMENT;
    @Getter
    private int parallelism = 1;
    private Duration timeBudget;

    private ETS model;
    private CandidateResult selected;
    private AutoETSDiagnostics diagnostics;

    public AutoETS(int seasonLength) {
        this(seasonLength, DEFAULT_SPEC);
    }

    public AutoETS(int seasonLength, String spec) {
        checkArgument(seasonLength > 0, "season length must be positive");
        this.seasonLength = seasonLength;
        this.searchSpace = new CandidateSearchSpace(seasonLength, spec);
    }

    /**
     * Ranks two metric sets: a finite AICc beats an infinite one, two finite
     * AICc values compare directly, and two infinite AICc values fall back to
     * AIC.
     *
     * @return true if lhs is strictly better than rhs
     */
    public static boolean betterMetrics(AutoETSMetrics lhs, AutoETSMetrics rhs) {
        boolean leftFinite = isFinite(lhs.getAicc());
        boolean rightFinite = isFinite(rhs.getAicc());
        if (leftFinite && rightFinite) {
            return lhs.getAicc() < rhs.getAicc();
        }
        if (leftFinite != rightFinite) {
            return leftFinite;
        }
        return lhs.getAic() < rhs.getAic();
    }

    public String getSpec() {
        return searchSpace.getSpec();
    }

    public AutoETS setAllowMultiplicativeTrend(boolean allow) {
        searchSpace.setAllowMultiplicativeTrend(allow);
        return this;
    }

    public boolean isAllowMultiplicativeTrend() {
        return searchSpace.isAllowMultiplicativeTrend();
    }

    public AutoETS setDampedPolicy(DampedPolicy policy) {
        searchSpace.setDampedPolicy(policy);
        return this;
    }

    public DampedPolicy getDampedPolicy() {
        return searchSpace.getDampedPolicy();
    }

    public AutoETS setOptimizationCriterion(OptimizationCriterion criterion) {
        this.optimizationCriterion = checkNotNull(criterion, "criterion cannot be null");
        return this;
    }

    public AutoETS setMaxIterations(int maxIterations) {
        checkArgument(maxIterations > 0, "maxIterations must be positive");
        this.maxIterations = maxIterations;
        return this;
    }

    /**
     * @param nmse number of horizons averaged by the AMSE criterion; values above
     *             {@link ETS#MAX_NMSE} are reduced to it
     */
    public AutoETS setNmse(int nmse) {
        checkArgument(nmse > 0, "nmse must be positive");
        this.nmse = Math.min(nmse, ETS.MAX_NMSE);
        return this;
    }

    /**
     * Enables the scan over starting level and trend that runs between the grid
     * and the continuous refinement. Off by default.
     */
    public AutoETS setStateSearchEnabled(boolean enabled) {
        this.stateSearchEnabled = enabled;
        return this;
    }

    public AutoETS setEarlyTermination(int patience, double minImprovement) {
        checkArgument(patience > 0, "patience must be positive");
        checkArgument(minImprovement >= 0, "minImprovement cannot be negative");
        this.earlyTerminationEnabled = true;
        this.earlyTerminationPatience = patience;
        this.earlyTerminationMinImprovement = minImprovement;
        return this;
    }

    /**
     * Makes the scan exhaustive. The selected model can differ from the one
     * chosen with early termination.
     */
    public AutoETS disableEarlyTermination() {
        this.earlyTerminationEnabled = false;
        return this;
    }

    /**
     * @param threads number of worker threads; more than one evaluates all
     *                candidates concurrently without early termination
     */
    public AutoETS setParallelism(int threads) {
        checkArgument(threads > 0, "parallelism must be positive");
        this.parallelism = threads;
        return this;
    }

    /**
     * Candidates not started before the budget elapses are skipped. A null
     * budget removes the limit.
     */
    public AutoETS setTimeBudget(Duration budget) {
        checkArgument(budget == null || (!budget.isNegative() && !budget.isZero()), "time budget must be positive");
        this.timeBudget = budget;
        return this;
    }

    public AutoETS setPinnedAlpha(double alpha) {
        checkArgument(alpha >= SMOOTHING_LOWER && alpha <= SMOOTHING_UPPER, "alpha must be in [1e-4, 0.9999]");
        this.pinnedAlpha = alpha;
        return this;
    }

    public AutoETS setPinnedBeta(double beta) {
        checkArgument(beta >= SMOOTHING_LOWER && beta <= SMOOTHING_UPPER, "beta must be in [1e-4, 0.9999]");
        this.pinnedBeta = beta;
        return this;
    }

    public AutoETS setPinnedGamma(double gamma) {
        checkArgument(gamma >= SMOOTHING_LOWER && gamma <= SMOOTHING_UPPER, "gamma must be in [1e-4, 0.9999]");
        this.pinnedGamma = gamma;
        return this;
    }

    public AutoETS setPinnedPhi(double phi) {
        checkArgument(phi >= PHI_LOWER && phi <= PHI_UPPER, "phi must be in [0.8, 0.98]");
        this.pinnedPhi = phi;
        return this;
    }

    public AutoETS clearPinnedAlpha() {
        this.pinnedAlpha = null;
        return this;
    }

    public AutoETS clearPinnedBeta() {
        this.pinnedBeta = null;
        return this;
    }

    public AutoETS clearPinnedGamma() {
        this.pinnedGamma = null;
        return this;
    }

    public AutoETS clearPinnedPhi() {
        this.pinnedPhi = null;
        return this;
    }

    SearchSettings settings() {
        return SearchSettings.builder().pinnedAlpha(pinnedAlpha).pinnedBeta(pinnedBeta).pinnedGamma(pinnedGamma)
                .pinnedPhi(pinnedPhi).criterion(optimizationCriterion).maxIterations(maxIterations).nmse(nmse)
                .stateSearchEnabled(stateSearchEnabled).build();
    }

    public void fit(TimeSeries series) {
        checkNotNull(series, "series cannot be null");
        checkArgument(series.getDimensions() == 1, "only univariate series are supported");
        fit(series.getValues());
    }

    /**
     * Runs the model search and materializes the winner.
     *
     * @param values the training data
     * @throws ModelSelectionException if no candidate can be fit
     */
    public void fit(double[] values) {
        checkNotNull(values, "values cannot be null");
        checkArgument(values.length >= MIN_OBSERVATIONS,
                "need at least " + MIN_OBSERVATIONS + " observations, got " + values.length);
        model = null;
        selected = null;
        diagnostics = null;

        List<CandidateConfig> candidates = searchSpace.enumerateCandidates(values);
        if (candidates.isEmpty()) {
            throw new ModelSelectionException("no candidate model is admissible for spec " + getSpec());
        }
        CandidateEvaluator evaluator = new CandidateEvaluator(values, seasonLength, settings());
        AbstractCandidateExecutor executor = (parallelism > 1) ? new ParallelCandidateExecutor(evaluator, parallelism)
                : new SequentialCandidateExecutor(evaluator, earlyTerminationEnabled, earlyTerminationPatience,
                        earlyTerminationMinImprovement);
        long deadline = (timeBudget == null) ? Long.MAX_VALUE : System.nanoTime() + timeBudget.toNanos();
        SearchOutcome outcome = executor.execute(candidates, deadline);

        CandidateResult best = outcome.getBest();
        if (best == null) {
            throw new ModelSelectionException("no valid model among " + outcome.getModelsEvaluated()
                    + " evaluated candidates for spec " + getSpec());
        }

        SmoothingConfig config = best.getConfig();
        ETS winner = new ETS(config, evaluator.nmse());
        winner.fitWithFullState(values, best.getLevel0(), best.getTrend0(), null);
        model = winner;
        selected = best;
        diagnostics = AutoETSDiagnostics.builder().optimizerIterations(best.getOptimizerIterations())
                .optimizerConverged(best.isOptimizerConverged()).optimizerObjective(best.getOptimizerObjective())
                .trainingDataSize(values.length).modelsEvaluated(outcome.getModelsEvaluated())
                .modelsFailed(outcome.getModelsFailed()).modelsSkipped(outcome.getModelsSkipped())
                .earlyTerminated(outcome.isEarlyTerminated()).build();
        log.info("selected {} with aicc {} after {} candidates ({} failed)", best.getCandidate(),
                winner.metrics().getAicc(), outcome.getModelsEvaluated(), outcome.getModelsFailed());
    }

    public boolean isFitted() {
        return model != null;
    }

    private void checkFitted() {
        checkState(model != null, "AutoETS must be fitted first");
    }

    public Forecast predict(int horizon) {
        checkFitted();
        return model.predict(horizon);
    }

    public AutoETSComponents components() {
        checkFitted();
        SmoothingConfig config = model.getConfig();
        return new AutoETSComponents(config.getError(), config.getTrend().base(), config.getSeason(),
                config.isDamped(), config.getSeasonLength());
    }

    public AutoETSParameters parameters() {
        checkFitted();
        SmoothingConfig config = model.getConfig();
        return new AutoETSParameters(config.getAlpha(), config.getBeta(), config.getGamma(), config.getPhi());
    }

    public AutoETSMetrics metrics() {
        checkFitted();
        return model.metrics();
    }

    public AutoETSDiagnostics diagnostics() {
        checkFitted();
        return diagnostics;
    }

    public double[] fittedValues() {
        checkFitted();
        return model.fittedValues();
    }

    public double[] residuals() {
        checkFitted();
        return model.residuals();
    }

    /**
     * @return the refit winning model
     */
    public ETS model() {
        checkFitted();
        return model;
    }

    /**
     * @return true when the winner starts from an optimized level and trend
     *         rather than the heuristic initialization
     */
    public boolean hasStateOverride() {
        checkFitted();
        return selected.hasStateOverride();
    }
}
