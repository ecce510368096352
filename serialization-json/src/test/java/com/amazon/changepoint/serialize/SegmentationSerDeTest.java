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

package com.amazon.changepoint.serialize;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.changepoint.config.CostFunctionType;
import com.amazon.changepoint.config.PenaltySelectionMethod;
import com.amazon.changepoint.cost.ARCostFunction;
import com.amazon.changepoint.cost.RBFCostFunction;
import com.amazon.changepoint.pelt.PeltAlgorithm;
import com.amazon.changepoint.pelt.PeltOptions;
import com.amazon.changepoint.returntypes.PenaltyDiagnostic;
import com.amazon.changepoint.returntypes.PenaltySelectionResult;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

public class SegmentationSerDeTest {

    private static final double[] STEP = new double[] { 1, 1, 1, 5, 5, 5, 1, 1, 1 };

    private SegmentationSerDe serDe;

    @BeforeEach
    public void setUp() {
        serDe = new SegmentationSerDe();
    }

    @ParameterizedTest
    @EnumSource(CostFunctionType.class)
    public void testOptionsRoundTrip(CostFunctionType type) {
        PeltOptions options = PeltOptions.builder().costFunction(type.newInstance()).minSize(2).jump(3).build();
        PeltOptions copy = serDe.optionsFromJson(serDe.toJson(options));
        assertEquals(type, CostFunctionType.of(copy.getCostFunction()));
        assertEquals(2, copy.getMinSize());
        assertEquals(3, copy.getJump());
    }

    @Test
    public void testAutoregressiveOptionsRoundTrip() {
        PeltOptions options = PeltOptions.builder().costFunction(new ARCostFunction(2, false)).minSize(4).build();
        String json = serDe.toJson(options);
        assertTrue(json.contains("\"order\":2"));
        ARCostFunction copy = (ARCostFunction) serDe.optionsFromJson(json).getCostFunction();
        assertEquals(2, copy.getOrder());
        assertFalse(copy.isIncludeIntercept());
    }

    @Test
    public void testOptionsJsonLayout() {
        PeltOptions options = PeltOptions.builder().costFunction(new RBFCostFunction(0.5)).minSize(4).build();
        JsonObject json = JsonParser.parseString(serDe.toJson(options)).getAsJsonObject();
        assertEquals("1.0", json.get("version").getAsString());
        assertEquals("RBF", json.get("costFunctionType").getAsString());
        assertEquals(0.5, json.get("gamma").getAsDouble());
        assertEquals(4, json.get("minSize").getAsInt());
        assertEquals(1, json.get("jump").getAsInt());
    }

    @Test
    public void testRestoredOptionsSegmentTheSame() {
        PeltOptions options = PeltOptions.builder().costFunction(new RBFCostFunction(0.125)).build();
        PeltOptions copy = serDe.optionsFromJson(serDe.toJson(options));
        assertEquals(Optional.of(0.125), ((RBFCostFunction) copy.getCostFunction()).getGamma());
        assertArrayEquals(new PeltAlgorithm(options).fitAndDetect(STEP, 0.1),
                new PeltAlgorithm(copy).fitAndDetect(STEP, 0.1));
    }

    @Test
    public void testResultRoundTripWithFailedCandidate() {
        PenaltySelectionResult result = new PenaltySelectionResult(4.0, -12.25, new int[] { 30, 61 },
                PenaltySelectionMethod.BIC, Arrays.asList(new PenaltyDiagnostic(1.0, -3.5, 7),
                        new PenaltyDiagnostic(2.0, Double.NaN, -1), new PenaltyDiagnostic(4.0, -12.25, 2)));

        String json = serDe.toJson(result);
        assertThat(json, containsString("NaN"));

        PenaltySelectionResult copy = serDe.resultFromJson(json);
        assertEquals(4.0, copy.getSelectedPenalty());
        assertEquals(-12.25, copy.getSelectedScore());
        assertArrayEquals(new int[] { 30, 61 }, copy.getOptimalBreakpoints());
        assertEquals(PenaltySelectionMethod.BIC, copy.getMethod());
        assertEquals(3, copy.getDiagnostics().size());
        assertTrue(copy.getDiagnostics().get(1).isFailed());
        assertTrue(Double.isNaN(copy.getDiagnostics().get(1).getScore()));
        assertEquals(7, copy.getDiagnostics().get(0).getChangePointCount());
    }

    @Test
    public void testCustomGson() {
        SegmentationSerDe pretty = new SegmentationSerDe(
                new GsonBuilder().serializeSpecialFloatingPointValues().setPrettyPrinting().create());
        String json = pretty.toJson(PeltOptions.builder().build());
        assertThat(json, containsString("\n"));
        assertEquals(CostFunctionType.L2, CostFunctionType.of(pretty.optionsFromJson(json).getCostFunction()));
    }

    @Test
    public void testInvalidJson() {
        assertThrows(NullPointerException.class, () -> new SegmentationSerDe(null));
        assertThrows(IllegalArgumentException.class,
                () -> serDe.optionsFromJson("{\"costFunctionType\":\"MAHALANOBIS\",\"minSize\":1,\"jump\":1}"));
        assertThrows(IllegalArgumentException.class,
                () -> serDe.optionsFromJson("{\"costFunctionType\":\"L2\",\"minSize\":0,\"jump\":1}"));
    }
}
