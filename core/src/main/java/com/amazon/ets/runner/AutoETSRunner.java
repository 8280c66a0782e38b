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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.amazon.ets.config.DampedPolicy;
import com.amazon.ets.returntypes.AutoETSComponents;
import com.amazon.ets.returntypes.Forecast;
import com.amazon.ets.search.AutoETS;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads a univariate series from STDIN, one observation per line, selects a
 * model with {@link AutoETS} and writes the forecast to STDOUT as
 * {@code step,forecast} rows.
 */
@Slf4j
public class AutoETSRunner {

    private final ArgumentParser argumentParser;

    public AutoETSRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        ArgumentParser argumentParser = new ArgumentParser(AutoETSRunner.class.getName(),
                "Fit an automatic exponential smoothing model and forecast the series.");
        try {
            argumentParser.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            argumentParser.printUsage(System.err);
            System.exit(1);
        }
        if (argumentParser.isHelpRequested()) {
            argumentParser.printUsage(System.out);
            return;
        }
        AutoETSRunner runner = new AutoETSRunner(argumentParser);
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)),
                        true));
    }

    /**
     * Reads all observations, fits and writes the forecast.
     */
    public void run(Reader input, Writer output) throws IOException {
        double[] values = readValues(input);
        AutoETS autoETS = createModel();
        autoETS.fit(values);
        AutoETSComponents components = autoETS.components();
        log.info("model {} selected for {} observations", components.code(), values.length);

        Forecast forecast = autoETS.predict(argumentParser.getHorizon());
        PrintWriter writer = (output instanceof PrintWriter) ? (PrintWriter) output : new PrintWriter(output);
        writer.println("# model " + components.code());
        writer.println("step" + argumentParser.getDelimiter() + "forecast");
        for (int i = 0; i < forecast.getHorizon(); i++) {
            writer.println((i + 1) + argumentParser.getDelimiter() + forecast.point[i]);
        }
        writer.flush();
    }

    AutoETS createModel() {
        AutoETS autoETS = new AutoETS(argumentParser.getSeasonLength(), argumentParser.getSpec())
                .setAllowMultiplicativeTrend(argumentParser.getAllowMultiplicativeTrend())
                .setOptimizationCriterion(argumentParser.getCriterion())
                .setMaxIterations(argumentParser.getMaxIterations()).setParallelism(argumentParser.getThreads());
        // AUTO keeps whatever damping the spec itself asked for
        if (argumentParser.getDampedPolicy() != DampedPolicy.AUTO) {
            autoETS.setDampedPolicy(argumentParser.getDampedPolicy());
        }
        return autoETS;
    }

    double[] readValues(Reader input) throws IOException {
        BufferedReader reader = (input instanceof BufferedReader) ? (BufferedReader) input : new BufferedReader(input);
        String delimiter = Pattern.quote(argumentParser.getDelimiter());
        int column = argumentParser.getColumn();
        List<Double> values = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                continue;
            }
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] fields = line.split(delimiter);
            if (column >= fields.length) {
                throw new IllegalArgumentException("line " + lineNumber + " has no field " + column);
            }
            try {
                values.add(Double.parseDouble(fields[column].trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("line " + lineNumber + " is not numeric: " + line, e);
            }
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
