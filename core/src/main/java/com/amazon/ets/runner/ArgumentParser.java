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

package com.amazon.ets.runner;

import static com.amazon.ets.CommonUtils.checkArgument;
import static com.amazon.ets.CommonUtils.checkNotNull;

import java.io.PrintStream;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.ets.config.DampedPolicy;
import com.amazon.ets.config.OptimizationCriterion;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "ets-forecast-1.0.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final IntegerArgument seasonLength;
    private final StringArgument spec;
    private final IntegerArgument horizon;
    private final Argument<DampedPolicy> damped;
    private final Argument<OptimizationCriterion> criterion;
    private final IntegerArgument maxIterations;
    private final BooleanArgument allowMultiplicativeTrend;
    private final IntegerArgument threads;
    private final IntegerArgument column;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;
    private boolean helpRequested;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        seasonLength = new IntegerArgument("-m", "--season-length", "Number of observations in one season.", 1,
                n -> checkArgument(n > 0, "season length should be greater than 0"));
        addArgument(seasonLength);

        spec = new StringArgument("-s", "--spec",
                "Model specification: error, trend and season letters from A, M, N, Z with an optional d for damping.",
                "ZZZ", s -> checkArgument(s.length() == 3 || s.length() == 4, "spec should have 3 or 4 letters"));
        addArgument(spec);

        horizon = new IntegerArgument("-f", "--horizon", "Number of steps to forecast.", 1,
                n -> checkArgument(n > 0, "horizon should be greater than 0"));
        addArgument(horizon);

        damped = new Argument<>(null, "--damped", "Damping policy: auto, always or never.", DampedPolicy.AUTO,
                s -> DampedPolicy.valueOf(s.toUpperCase(Locale.ROOT)));
        addArgument(damped);

        criterion = new Argument<>(null, "--criterion",
                "Optimization criterion: likelihood, mse, amse or sigma.", OptimizationCriterion.LIKELIHOOD,
                s -> OptimizationCriterion.valueOf(s.toUpperCase(Locale.ROOT)));
        addArgument(criterion);

        maxIterations = new IntegerArgument(null, "--max-iterations", "Iteration limit of the optimizer.", 300,
                n -> checkArgument(n > 0, "max iterations should be greater than 0"));
        addArgument(maxIterations);

        allowMultiplicativeTrend = new BooleanArgument(null, "--allow-multiplicative-trend",
                "Set to 'true' to consider multiplicative trends for a Z trend letter.", false);
        addArgument(allowMultiplicativeTrend);

        threads = new IntegerArgument("-t", "--threads", "Number of threads used to evaluate candidates.", 1,
                n -> checkArgument(n > 0, "threads should be greater than 0"));
        addArgument(threads);

        column = new IntegerArgument("-c", "--column", "Zero based index of the field holding the observation.", 0,
                n -> checkArgument(n >= 0, "column should be non-negative"));
        addArgument(column);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",");
        addArgument(delimiter);

        headerRow = new BooleanArgument(null, "--header-row", "Set to 'true' if the data contains a header row.",
                false);
        addArgument(headerRow);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that
     *                 should be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     * @throws IllegalArgumentException for an unknown flag, a missing value or a
     *                                  value that fails validation
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];
            if ("-h".equals(flag) || "--help".equals(flag)) {
                helpRequested = true;
                i++;
                continue;
            }
            Argument<?> argument = shortFlags.containsKey(flag) ? shortFlags.get(flag) : longFlags.get(flag);
            checkArgument(argument != null, "Unknown argument: " + flag);
            checkArgument(i + 1 < arguments.length, "Missing value for " + flag);
            try {
                argument.parse(arguments[++i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + arguments[i], e);
            }
            i++;
        }
    }

    /**
     * Print a usage message.
     */
    public void printUsage(PrintStream out) {
        out.println(String.format("Usage: java -cp %s %s [options] < input_file > output_file", ARCHIVE_NAME,
                runnerClass));
        out.println();
        out.println(runnerDescription);
        out.println();
        out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted().forEach(msg -> out.println("\t" + msg));

        out.println();
        out.println("\t--help, -h: Print this help message and exit.");
    }

    public boolean isHelpRequested() {
        return helpRequested;
    }

    public int getSeasonLength() {
        return seasonLength.getValue();
    }

    public String getSpec() {
        return spec.getValue();
    }

    public int getHorizon() {
        return horizon.getValue();
    }

    public DampedPolicy getDampedPolicy() {
        return damped.getValue();
    }

    public OptimizationCriterion getCriterion() {
        return criterion.getValue();
    }

    public int getMaxIterations() {
        return maxIterations.getValue();
    }

    public boolean getAllowMultiplicativeTrend() {
        return allowMultiplicativeTrend.getValue();
    }

    public int getThreads() {
        return threads.getValue();
    }

    public int getColumn() {
        return column.getValue();
    }

    public String getDelimiter() {
        return delimiter.getValue();
    }

    public boolean getHeaderRow() {
        return headerRow.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }
}
