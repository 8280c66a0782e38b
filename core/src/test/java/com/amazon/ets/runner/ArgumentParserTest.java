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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.ets.config.DampedPolicy;
import com.amazon.ets.config.OptimizationCriterion;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(1, parser.getSeasonLength());
        assertEquals("ZZZ", parser.getSpec());
        assertEquals(1, parser.getHorizon());
        assertEquals(DampedPolicy.AUTO, parser.getDampedPolicy());
        assertEquals(OptimizationCriterion.LIKELIHOOD, parser.getCriterion());
        assertEquals(300, parser.getMaxIterations());
        assertFalse(parser.getAllowMultiplicativeTrend());
        assertEquals(1, parser.getThreads());
        assertEquals(0, parser.getColumn());
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
        assertFalse(parser.isHelpRequested());
    }

    @Test
    public void testParse() {
        parser.parse("--season-length", "12", "--spec", "MAdM", "--horizon", "24", "--damped", "always",
                "--criterion", "amse", "--max-iterations", "50", "--allow-multiplicative-trend", "true", "--threads",
                "4", "--column", "2", "--delimiter", "\t", "--header-row", "true");

        assertEquals(12, parser.getSeasonLength());
        assertEquals("MAdM", parser.getSpec());
        assertEquals(24, parser.getHorizon());
        assertEquals(DampedPolicy.ALWAYS, parser.getDampedPolicy());
        assertEquals(OptimizationCriterion.AMSE, parser.getCriterion());
        assertEquals(50, parser.getMaxIterations());
        assertTrue(parser.getAllowMultiplicativeTrend());
        assertEquals(4, parser.getThreads());
        assertEquals(2, parser.getColumn());
        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-m", "7", "-s", "ANN", "-f", "3", "-t", "2", "-c", "1", "-d", ";");

        assertEquals(7, parser.getSeasonLength());
        assertEquals("ANN", parser.getSpec());
        assertEquals(3, parser.getHorizon());
        assertEquals(2, parser.getThreads());
        assertEquals(1, parser.getColumn());
        assertEquals(";", parser.getDelimiter());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--unknown", "1"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--horizon"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--horizon", "0"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--horizon", "many"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--spec", "ZZ"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--damped", "sometimes"));
    }

    @Test
    public void testHelp() {
        parser.parse("--help");
        assertTrue(parser.isHelpRequested());

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        parser.printUsage(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        String usage = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(usage.contains("runner-class"));
        assertTrue(usage.contains("--season-length, -m"));
        assertTrue(usage.contains("--help, -h"));
    }
}
