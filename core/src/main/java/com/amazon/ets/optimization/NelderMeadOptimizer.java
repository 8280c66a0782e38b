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

package com.amazon.ets.optimization;

import static com.amazon.ets.CommonUtils.checkArgument;
import static com.amazon.ets.CommonUtils.checkNotNull;
import static com.amazon.ets.CommonUtils.isFinite;

import java.util.Arrays;
import java.util.function.ToDoubleFunction;

import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.MultivariateFunctionMappingAdapter;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;

import lombok.Getter;

/**
 * Derivative free simplex minimization with box constraints. The simplex runs
 * in unbounded coordinates that a {@link MultivariateFunctionMappingAdapter}
 * maps back into the box, so every evaluated point is feasible. Non-finite
 * objective values are treated as +infinity so that the simplex moves away from
 * them. The best point evaluated is reported, also when the iteration or
 * evaluation limit cuts the search short.
 */
@Getter
public class NelderMeadOptimizer {

    public static final int DEFAULT_MAX_ITERATIONS = 300;
    public static final int DEFAULT_MAX_EVALUATIONS = 10000;
    public static final double DEFAULT_STEP = 0.5;
    public static final double DEFAULT_TOLERANCE = 1e-10;
    public static final double DEFAULT_REFLECTION = 1.0;
    public static final double DEFAULT_EXPANSION = 2.0;
    public static final double DEFAULT_CONTRACTION = 0.5;
    public static final double DEFAULT_SHRINK = 0.5;

    // relative distance kept from a finite bound when mapping the start point
    static final double INTERIOR_MARGIN = 1e-6;

    private final int maxIterations;
    private final int maxEvaluations;
    private final double step;
    private final double tolerance;
    private final double reflection;
    private final double expansion;
    private final double contraction;
    private final double shrink;

    protected NelderMeadOptimizer(Builder builder) {
        checkArgument(builder.maxIterations > 0, "maxIterations must be positive");
        checkArgument(builder.maxEvaluations > 0, "maxEvaluations must be positive");
        checkArgument(builder.step > 0, "step must be positive");
        checkArgument(builder.tolerance >= 0, "tolerance cannot be negative");
        checkArgument(builder.reflection > 0, "reflection must be positive");
        checkArgument(builder.expansion > 1, "expansion must exceed 1");
        checkArgument(builder.contraction > 0 && builder.contraction < 1, "contraction must be in (0, 1)");
        checkArgument(builder.shrink > 0 && builder.shrink < 1, "shrink must be in (0, 1)");
        maxIterations = builder.maxIterations;
        maxEvaluations = builder.maxEvaluations;
        step = builder.step;
        tolerance = builder.tolerance;
        reflection = builder.reflection;
        expansion = builder.expansion;
        contraction = builder.contraction;
        shrink = builder.shrink;
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptimizerResult minimize(ToDoubleFunction<double[]> function, double[] start, Bounds bounds) {
        checkNotNull(function, "function cannot be null");
        checkNotNull(start, "start cannot be null");
        checkArgument(bounds.getDimension() == start.length, "bounds do not match the start point");
        int dimension = start.length;
        if (dimension == 0) {
            double value = evaluate(function, start);
            return new OptimizerResult(start, value, 0, true, "nothing to optimize");
        }

        double[] lower = new double[dimension];
        double[] upper = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            lower[i] = bounds.lower(i);
            upper[i] = bounds.upper(i);
        }
        BestPoint best = new BestPoint();
        MultivariateFunctionMappingAdapter adapter = new MultivariateFunctionMappingAdapter(point -> {
            double value = evaluate(function, point);
            best.offer(point, value);
            return value;
        }, lower, upper);

        double[] initial = adapter.boundedToUnbounded(interior(start, bounds));
        double[] steps = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            // a degenerate interval has no unbounded image
            if (Double.isNaN(initial[i])) {
                initial[i] = 0;
            }
            boolean free = Double.isInfinite(lower[i]) && Double.isInfinite(upper[i]);
            steps[i] = free ? step * Math.max(1.0, Math.abs(initial[i])) : step;
        }

        SimplexOptimizer optimizer = new SimplexOptimizer(new SimpleValueChecker(tolerance, tolerance));
        boolean converged = false;
        int iterations;
        String message;
        try {
            optimizer.optimize(new MaxEval(maxEvaluations), new MaxIter(maxIterations),
                    new ObjectiveFunction(adapter), GoalType.MINIMIZE, new InitialGuess(initial),
                    new NelderMeadSimplex(steps, reflection, expansion, contraction, shrink));
            converged = true;
            iterations = optimizer.getIterations();
            message = "simplex values changed less than the tolerance";
        } catch (TooManyIterationsException e) {
            iterations = maxIterations;
            message = "iteration limit reached";
        } catch (TooManyEvaluationsException e) {
            iterations = optimizer.getIterations();
            message = "evaluation limit reached";
        }
        return new OptimizerResult(best.point, best.value, iterations, converged, message);
    }

    /**
     * @return a copy of point moved strictly inside every finite bound of a
     *         non-degenerate interval
     */
    static double[] interior(double[] point, Bounds bounds) {
        double[] result = bounds.project(point);
        for (int i = 0; i < result.length; i++) {
            double lower = bounds.lower(i);
            double upper = bounds.upper(i);
            if (lower == upper) {
                continue;
            }
            double margin = (isFinite(lower) && isFinite(upper)) ? INTERIOR_MARGIN * (upper - lower)
                    : INTERIOR_MARGIN * Math.max(1.0, Math.abs(result[i]));
            if (isFinite(lower)) {
                result[i] = Math.max(result[i], lower + margin);
            }
            if (isFinite(upper)) {
                result[i] = Math.min(result[i], upper - margin);
            }
        }
        return result;
    }

    private static double evaluate(ToDoubleFunction<double[]> function, double[] point) {
        double value = function.applyAsDouble(Arrays.copyOf(point, point.length));
        return isFinite(value) ? value : Double.POSITIVE_INFINITY;
    }

    private static class BestPoint {
        double[] point;
        double value = Double.POSITIVE_INFINITY;

        void offer(double[] candidate, double candidateValue) {
            if (point == null || candidateValue < value) {
                point = Arrays.copyOf(candidate, candidate.length);
                value = candidateValue;
            }
        }
    }

    public static class Builder {
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private int maxEvaluations = DEFAULT_MAX_EVALUATIONS;
        private double step = DEFAULT_STEP;
        private double tolerance = DEFAULT_TOLERANCE;
        private double reflection = DEFAULT_REFLECTION;
        private double expansion = DEFAULT_EXPANSION;
        private double contraction = DEFAULT_CONTRACTION;
        private double shrink = DEFAULT_SHRINK;

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder maxEvaluations(int maxEvaluations) {
            this.maxEvaluations = maxEvaluations;
            return this;
        }

        public Builder step(double step) {
            this.step = step;
            return this;
        }

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Builder reflection(double reflection) {
            this.reflection = reflection;
            return this;
        }

        public Builder expansion(double expansion) {
            this.expansion = expansion;
            return this;
        }

        public Builder contraction(double contraction) {
            this.contraction = contraction;
            return this;
        }

        public Builder shrink(double shrink) {
            this.shrink = shrink;
            return this;
        }

        public NelderMeadOptimizer build() {
            return new NelderMeadOptimizer(this);
        }
    }
}
