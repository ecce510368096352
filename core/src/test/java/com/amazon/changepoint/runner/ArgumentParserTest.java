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

package com.amazon.changepoint.runner;

import static com.amazon.changepoint.CommonUtils.checkArgument;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.changepoint.config.CostFunctionType;
import com.amazon.changepoint.config.PenaltySelectionMethod;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(CostFunctionType.L2, parser.getCostFunction());
        assertEquals(10.0, parser.getPenalty());
        assertEquals(1, parser.getMinSize());
        assertEquals(1, parser.getJump());
        assertEquals(Optional.empty(), parser.getGamma());
        assertEquals(Optional.empty(), parser.getOrder());
        assertEquals(Optional.empty(), parser.getSelectionMethod());
        assertEquals(Optional.empty(), parser.getMinPenalty());
        assertEquals(Optional.empty(), parser.getMaxPenalty());
        assertEquals(50, parser.getPenaltySteps());
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
    }

    @Test
    public void testParse() {
        parser.parse("--cost", "rbf", "--penalty", "2.5", "--min-size", "4", "--jump", "2", "--gamma", "0.5",
                "--delimiter", "\t", "--header-row", "true");

        assertEquals(CostFunctionType.RBF, parser.getCostFunction());
        assertEquals(2.5, parser.getPenalty());
        assertEquals(4, parser.getMinSize());
        assertEquals(2, parser.getJump());
        assertEquals(Optional.of(0.5), parser.getGamma());
        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-c", "POISSON", "-p", "7", "-m", "3", "-j", "5", "-d", ";");

        assertEquals(CostFunctionType.POISSON, parser.getCostFunction());
        assertEquals(7.0, parser.getPenalty());
        assertEquals(3, parser.getMinSize());
        assertEquals(5, parser.getJump());
        assertEquals(";", parser.getDelimiter());
    }

    @Test
    public void testParseSelection() {
        parser.parse("--cost", "gaussian", "--selection-method", "aicc", "--min-penalty", "1", "--max-penalty",
                "100", "--penalty-steps", "12");

        assertEquals(CostFunctionType.GAUSSIAN, parser.getCostFunction());
        assertEquals(Optional.of(PenaltySelectionMethod.AICC), parser.getSelectionMethod());
        assertEquals(Optional.of(1.0), parser.getMinPenalty());
        assertEquals(Optional.of(100.0), parser.getMaxPenalty());
        assertEquals(12, parser.getPenaltySteps());
    }

    @Test
    public void testParseAutoregressive() {
        parser.parse("--cost", "ar", "--order", "3", "--min-size", "7");

        assertEquals(CostFunctionType.AR, parser.getCostFunction());
        assertEquals(Optional.of(3), parser.getOrder());
        assertEquals(7, parser.getMinSize());
    }

    @Test
    public void testParseBinomial() {
        parser.parse("-c", "Binomial");
        assertEquals(CostFunctionType.BINOMIAL, parser.getCostFunction());
    }

    @Test
    public void testParseNoSelection() {
        parser.parse("--selection-method", "NONE");
        assertEquals(Optional.empty(), parser.getSelectionMethod());
    }

    @Test
    public void testEnumArgument() {
        ArgumentParser.EnumArgument<CostFunctionType> argument = new ArgumentParser.EnumArgument<>("-c", "--cost",
                "Cost.", CostFunctionType.class, CostFunctionType.L2);
        assertEquals("--cost, -c: Cost. One of l1, l2, rbf, gaussian, poisson, bernoulli, binomial, ar. (default: l2)",
                argument.getHelpMessage());
        argument.parse("Bernoulli");
        assertEquals(CostFunctionType.BERNOULLI, argument.getValue());
        assertThrows(IllegalArgumentException.class, () -> argument.parse("mahalanobis"));
        assertEquals(CostFunctionType.BERNOULLI, argument.getValue());
    }

    @Test
    public void testOptionalArgumentKeepsValueOnFailedValidation() {
        ArgumentParser.OptionalDoubleArgument argument = new ArgumentParser.OptionalDoubleArgument("--gamma",
                "Bandwidth.", "estimated", x -> checkArgument(x > 0, "gamma should be greater than 0"));
        assertEquals("--gamma: Bandwidth. (default: estimated)", argument.getHelpMessage());
        assertThrows(IllegalArgumentException.class, () -> argument.parse("-1"));
        assertEquals(Optional.empty(), argument.getValue());
        argument.parse("0.5");
        assertEquals(Optional.of(0.5), argument.getValue());
    }
}
