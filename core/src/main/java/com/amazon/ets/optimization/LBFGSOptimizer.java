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

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;

import lombok.Getter;

/**
 * Limited memory BFGS with box constraints handled by gradient projection.
 * Coordinates sitting on a bound with the gradient pushing outward are frozen
 * for the step; the quasi-Newton direction is computed over the remaining free
 * coordinates and the trial points of the backtracking line search are
 * projected back into the box.
 */
@Getter
public class LBFGSOptimizer {

    public static final int DEFAULT_MAX_ITERATIONS = 300;
    public static final int DEFAULT_MEMORY = 6;
    public static final double DEFAULT_GRADIENT_TOLERANCE = 1e-6;
    public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-10;
    public static final int DEFAULT_MAX_LINE_SEARCH = 30;

    private static final double ARMIJO = 1e-4;
    private static final double CURVATURE_EPSILON = 1e-12;

    private final int maxIterations;
    private final int memory;
    private final double gradientTolerance;
    private final double relativeTolerance;
    private final int maxLineSearch;

    protected LBFGSOptimizer(Builder builder) {
        checkArgument(builder.maxIterations > 0, "maxIterations must be positive");
        checkArgument(builder.memory > 0, "memory must be positive");
        checkArgument(builder.gradientTolerance >= 0, "gradientTolerance cannot be negative");
        checkArgument(builder.relativeTolerance >= 0, "relativeTolerance cannot be negative");
        checkArgument(builder.maxLineSearch > 0, "maxLineSearch must be positive");
        maxIterations = builder.maxIterations;
        memory = builder.memory;
        gradientTolerance = builder.gradientTolerance;
        relativeTolerance = builder.relativeTolerance;
        maxLineSearch = builder.maxLineSearch;
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptimizerResult minimize(IDifferentiableFunction function, double[] start, Bounds bounds) {
        checkNotNull(function, "function cannot be null");
        checkNotNull(start, "start cannot be null");
        checkArgument(bounds.getDimension() == start.length, "bounds do not match the start point");
        int dimension = start.length;
        double[] x = bounds.project(start);
        double[] gradient = new double[dimension];
        double value = function.evaluate(Arrays.copyOf(x, dimension), gradient);
        if (dimension == 0) {
            return new OptimizerResult(x, value, 0, true, "nothing to optimize");
        }
        if (!isFinite(value) || !allFinite(gradient)) {
            return new OptimizerResult(x, Double.POSITIVE_INFINITY, 0, false, "start point is not feasible");
        }

        Deque<double[][]> history = new ArrayDeque<>();
        int iterations = 0;
        boolean converged = false;
        String message = "iteration limit reached";
        while (iterations < maxIterations) {
            boolean[] free = new boolean[dimension];
            double projectedNorm = 0;
            for (int i = 0; i < dimension; i++) {
                boolean atLower = x[i] <= bounds.lower(i) && gradient[i] > 0;
                boolean atUpper = x[i] >= bounds.upper(i) && gradient[i] < 0;
                free[i] = !atLower && !atUpper;
                if (free[i]) {
                    projectedNorm = Math.max(projectedNorm, Math.abs(gradient[i]));
                }
            }
            if (projectedNorm <= gradientTolerance) {
                converged = true;
                message = "projected gradient below tolerance";
                break;
            }
            ++iterations;

            double[] direction = direction(gradient, free, history);
            double slope = dot(gradient, direction);
            if (slope >= 0) {
                history.clear();
                for (int i = 0; i < dimension; i++) {
                    direction[i] = free[i] ? -gradient[i] : 0;
                }
                slope = dot(gradient, direction);
            }

            double stepLength = history.isEmpty() ? Math.min(1.0, 1.0 / norm(direction)) : 1.0;
            double[] candidate = null;
            double[] candidateGradient = new double[dimension];
            double candidateValue = Double.POSITIVE_INFINITY;
            boolean accepted = false;
            for (int trial = 0; trial < maxLineSearch; trial++) {
                candidate = new double[dimension];
                for (int i = 0; i < dimension; i++) {
                    candidate[i] = x[i] + stepLength * direction[i];
                }
                candidate = bounds.project(candidate);
                candidateValue = function.evaluate(Arrays.copyOf(candidate, dimension), candidateGradient);
                double decrease = 0;
                for (int i = 0; i < dimension; i++) {
                    decrease += gradient[i] * (candidate[i] - x[i]);
                }
                if (isFinite(candidateValue) && allFinite(candidateGradient)
                        && candidateValue <= value + ARMIJO * decrease) {
                    accepted = true;
                    break;
                }
                stepLength *= 0.5;
            }
            if (!accepted) {
                message = "line search failed";
                break;
            }

            double[] s = new double[dimension];
            double[] y = new double[dimension];
            for (int i = 0; i < dimension; i++) {
                s[i] = candidate[i] - x[i];
                y[i] = candidateGradient[i] - gradient[i];
            }
            if (dot(s, y) > CURVATURE_EPSILON) {
                history.addLast(new double[][] { s, y });
                if (history.size() > memory) {
                    history.removeFirst();
                }
            }

            double previous = value;
            x = candidate;
            value = candidateValue;
            System.arraycopy(candidateGradient, 0, gradient, 0, dimension);
            if (Math.abs(previous - value) <= relativeTolerance
                    * Math.max(1.0, Math.max(Math.abs(previous), Math.abs(value)))) {
                converged = true;
                message = "relative reduction below tolerance";
                break;
            }
        }
        return new OptimizerResult(x, value, iterations, converged, message);
    }

    /**
     * Two loop recursion restricted to the free coordinates.
     */
    private static double[] direction(double[] gradient, boolean[] free, Deque<double[][]> history) {
        int dimension = gradient.length;
        double[] q = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            q[i] = free[i] ? gradient[i] : 0;
        }
        int size = history.size();
        double[] rho = new double[size];
        double[] coefficients = new double[size];
        double[][][] pairs = history.toArray(new double[0][][]);
        for (int k = size - 1; k >= 0; k--) {
            double[] s = pairs[k][0];
            double[] y = pairs[k][1];
            double sy = maskedDot(s, y, free);
            if (sy <= CURVATURE_EPSILON) {
                continue;
            }
            rho[k] = 1.0 / sy;
            coefficients[k] = rho[k] * maskedDot(s, q, free);
            for (int i = 0; i < dimension; i++) {
                if (free[i]) {
                    q[i] -= coefficients[k] * y[i];
                }
            }
        }
        double scale = 1.0;
        Iterator<double[][]> newest = history.descendingIterator();
        if (newest.hasNext()) {
            double[][] last = newest.next();
            double sy = maskedDot(last[0], last[1], free);
            double yy = maskedDot(last[1], last[1], free);
            if (sy > CURVATURE_EPSILON && yy > 0) {
                scale = sy / yy;
            }
        }
        for (int i = 0; i < dimension; i++) {
            q[i] *= scale;
        }
        for (int k = 0; k < size; k++) {
            if (rho[k] == 0) {
                continue;
            }
            double[] s = pairs[k][0];
            double[] y = pairs[k][1];
            double beta = rho[k] * maskedDot(y, q, free);
            for (int i = 0; i < dimension; i++) {
                if (free[i]) {
                    q[i] += s[i] * (coefficients[k] - beta);
                }
            }
        }
        for (int i = 0; i < dimension; i++) {
            q[i] = -q[i];
        }
        return q;
    }

    private static double maskedDot(double[] a, double[] b, boolean[] mask) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            if (mask[i]) {
                sum += a[i] * b[i];
            }
        }
        return sum;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static double norm(double[] a) {
        return Math.sqrt(dot(a, a));
    }

    private static boolean allFinite(double[] values) {
        for (double value : values) {
            if (!isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    public static class Builder {
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private int memory = DEFAULT_MEMORY;
        private double gradientTolerance = DEFAULT_GRADIENT_TOLERANCE;
        private double relativeTolerance = DEFAULT_RELATIVE_TOLERANCE;
        private int maxLineSearch = DEFAULT_MAX_LINE_SEARCH;

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder memory(int memory) {
            this.memory = memory;
            return this;
        }

        public Builder gradientTolerance(double gradientTolerance) {
            this.gradientTolerance = gradientTolerance;
            return this;
        }

        public Builder relativeTolerance(double relativeTolerance) {
            this.relativeTolerance = relativeTolerance;
            return this;
        }

        public Builder maxLineSearch(int maxLineSearch) {
            this.maxLineSearch = maxLineSearch;
            return this;
        }

        public LBFGSOptimizer build() {
            return new LBFGSOptimizer(this);
        }
    }
}
