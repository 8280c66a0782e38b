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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.ets.config.DampedPolicy;
import com.amazon.ets.search.AutoETS;

public class AutoETSRunnerTest {

    private ArgumentParser parser;
    private AutoETSRunner runner;

    private BufferedReader in;
    private PrintWriter out;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
        runner = new AutoETSRunner(parser);
        in = mock(BufferedReader.class);
        out = mock(PrintWriter.class);
    }

    @Test
    public void testRun() throws IOException {
        parser.parse("--spec", "ANN", "--horizon", "2", "--header-row", "true");
        when(in.readLine()).thenReturn("value").thenReturn("10").thenReturn("12").thenReturn("11").thenReturn("13")
                .thenReturn("").thenReturn("12").thenReturn("14").thenReturn(null);
        runner.run(in, out);
        verify(out).println("# model ANN");
        verify(out).println("step,forecast");
        verify(out).println(startsWith("1,"));
        verify(out).println(startsWith("2,"));
    }

    @Test
    public void testRunWithColumnAndDelimiter() throws IOException {
        parser.parse("--spec", "ANN", "--column", "1", "--delimiter", ";", "--horizon", "3");
        StringWriter output = new StringWriter();
        runner.run(new StringReader("a;10\nb;12\nc;11\nd;13\ne;12\nf;14\n"), output);
        String[] lines = output.toString().split("\\R");
        assertEquals(5, lines.length);
        assertEquals("# model ANN", lines[0]);
        assertEquals("step;forecast", lines[1]);
        // a level-only model forecasts a flat line
        assertEquals(lines[2].split(";")[1], lines[4].split(";")[1]);
    }

    @Test
    public void testReadValues() throws IOException {
        parser.parse("--header-row", "true");
        assertArrayEquals(new double[] { 1.5, -2, 3 }, runner.readValues(new StringReader("x\n1.5\n\n-2\n 3 \n")));
    }

    @Test
    public void testMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> runner.readValues(new StringReader("1\ntwo\n3\n")));
        parser.parse("--column", "2");
        assertThrows(IllegalArgumentException.class, () -> runner.readValues(new StringReader("1,2\n")));
    }

    @Test
    public void testCreateModel() {
        parser.parse("--season-length", "4", "--spec", "AAdN", "--allow-multiplicative-trend", "true");
        AutoETS model = runner.createModel();
        assertEquals(4, model.getSeasonLength());
        assertEquals("AAdN", model.getSpec());
        // the default damping policy keeps the damping requested by the model letters
        assertEquals(DampedPolicy.ALWAYS, model.getDampedPolicy());
        assertTrue(model.isAllowMultiplicativeTrend());

        parser.parse("--damped", "never");
        assertEquals(DampedPolicy.NEVER, runner.createModel().getDampedPolicy());
    }
}
