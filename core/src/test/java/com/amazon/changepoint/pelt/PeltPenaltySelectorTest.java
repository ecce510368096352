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

package com.amazon.changepoint.pelt;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.function.DoubleFunction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.changepoint.config.PenaltySelectionMethod;
import com.amazon.changepoint.cost.GaussianLikelihoodCostFunction;
import com.amazon.changepoint.cost.ILikelihoodCostFunction;
import com.amazon.changepoint.cost.L2CostFunction;
import com.amazon.changepoint.returntypes.PenaltyDiagnostic;
import com.amazon.changepoint.returntypes.PenaltySelectionResult;
import com.amazon.changepoint.testutils.PiecewiseSignalTestData;
import com.amazon.changepoint.testutils.SignalWithChangePoints;

public class PeltPenaltySelectorTest {

    private static final double EPSILON = 1e-9;

    private ILikelihoodCostFunction likelihood;
    private IPeltAlgorithm engine;

    @BeforeEach
    public void setUp() {
        likelihood = mock(ILikelihoodCostFunction.class);
        when(likelihood.supportsInformationCriteria()).thenReturn(true);
        engine = mock(IPeltAlgorithm.class);
        useMinSize(1);
    }

    private void useMinSize(int minSize) {
        when(engine.getOptions()).thenReturn(PeltOptions.builder().costFunction(likelihood).minSize(minSize).build());
    }

    private void stubDetect(DoubleFunction<int[]> segmentation) {
        when(engine.detect(anyDouble()))
                .thenAnswer(invocation -> segmentation.apply(invocation.getArgument(0, Double.class)));
    }

    private void stubMetrics(Map<String, Double> metrics) {
        when(likelihood.computeLikelihoodMetric(anyInt(), anyInt())).thenAnswer(invocation -> {
            String key = invocation.getArgument(0) + "," + invocation.getArgument(1);
            Double metric = metrics.get(key);
            if (metric == null) {
                throw new AssertionError("unexpected segment " + key);
            }
            return metric;
        });
    }

    private static PenaltySelectionOptions sweep(PenaltySelectionMethod method, double min, double max, int steps) {
        return PenaltySelectionOptions.builder().method(method).minPenalty(min).maxPenalty(max).numPenaltySteps(steps)
                .build();
    }

    @Test
    public void testBicPrefersFewerParameters() {
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(2);
        stubMetrics(Map.of("0,100", 100.0, "0,50", 50.0, "50,100", 50.0));
        stubDetect(penalty -> penalty < 15 ? new int[] { 50 } : new int[0]);

        PeltPenaltySelector selector = new PeltPenaltySelector(engine);
        PenaltySelectionResult result = selector.fitAndSelect(new double[100],
                sweep(PenaltySelectionMethod.BIC, 10, 20, 2));

        assertEquals(20.0, result.getSelectedPenalty(), EPSILON);
        assertEquals(100 + 2 * Math.log(100), result.getSelectedScore(), EPSILON);
        assertArrayEquals(new int[0], result.getOptimalBreakpoints());
        assertEquals(PenaltySelectionMethod.BIC, result.getMethod());

        List<PenaltyDiagnostic> diagnostics = result.getDiagnostics();
        assertEquals(2, diagnostics.size());
        assertEquals(10.0, diagnostics.get(0).getPenalty(), EPSILON);
        assertEquals(100 + 5 * Math.log(100), diagnostics.get(0).getScore(), EPSILON);
        assertEquals(1, diagnostics.get(0).getChangePointCount());
        assertEquals(0, diagnostics.get(1).getChangePointCount());

        verify(engine, times(1)).fit(any(double[][].class));
        verify(engine, times(2)).detect(anyDouble());
    }

    @Test
    public void testAicPrefersBetterFit() {
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(1);
        when(likelihood.computeLikelihoodMetric(anyInt(), anyInt())).thenReturn(10.0);
        stubDetect(penalty -> penalty < 2 ? new int[] { 20, 40, 60, 80 } : new int[] { 50 });

        PenaltySelectionResult result = new PeltPenaltySelector(engine).fitAndSelect(new double[100],
                sweep(PenaltySelectionMethod.AIC, 1, 5, 2));

        // 50 + 2 * 9 against 20 + 2 * 3
        assertEquals(5.0, result.getSelectedPenalty(), EPSILON);
        assertEquals(26.0, result.getSelectedScore(), EPSILON);
        assertEquals(68.0, result.getDiagnostics().get(0).getScore(), EPSILON);
        assertArrayEquals(new int[] { 50 }, result.getOptimalBreakpoints());
    }

    @Test
    public void testAiccCorrection() {
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(2);
        stubMetrics(Map.of("0,15", 7.5, "0,8", 3.0, "8,15", 3.0));
        stubDetect(penalty -> penalty < 2 ? new int[] { 8 } : new int[0]);

        PenaltySelectionResult result = new PeltPenaltySelector(engine).fitAndSelect(new double[15],
                sweep(PenaltySelectionMethod.AICC, 1, 3, 2));

        assertEquals(6 + 10 + 60.0 / 9, result.getDiagnostics().get(0).getScore(), EPSILON);
        assertEquals(12.5, result.getSelectedScore(), EPSILON);
        assertEquals(3.0, result.getSelectedPenalty(), EPSILON);
    }

    @Test
    public void testFailedSegmentationIsRecorded() {
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(2);
        stubMetrics(Map.of("0,100", 100.0, "0,50", 10.0, "50,100", 10.0));
        stubDetect(penalty -> {
            if (penalty == 10.0) {
                return new int[] { 50 };
            } else if (penalty == 30.0) {
                return new int[0];
            }
            throw new IllegalStateException("segmentation failed");
        });

        PenaltySelectionResult result = new PeltPenaltySelector(engine).fitAndSelect(new double[100],
                sweep(PenaltySelectionMethod.BIC, 10, 30, 3));

        assertEquals(10.0, result.getSelectedPenalty(), EPSILON);
        assertArrayEquals(new int[] { 50 }, result.getOptimalBreakpoints());
        PenaltyDiagnostic failed = result.getDiagnostics().get(1);
        assertTrue(failed.isFailed());
        assertTrue(Double.isNaN(failed.getScore()));
        assertEquals(-1, failed.getChangePointCount());
        assertFalse(result.getDiagnostics().get(0).isFailed());
    }

    @Test
    public void testTiePrefersFewerChangePoints() {
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(1);
        stubMetrics(Map.of("0,100", 14.0, "0,50", 5.0, "50,100", 5.0));
        stubDetect(penalty -> penalty < 1.5 ? new int[] { 50 } : new int[0]);

        PenaltySelectionResult result = new PeltPenaltySelector(engine).fitAndSelect(new double[100],
                sweep(PenaltySelectionMethod.AIC, 1, 2, 2));

        assertEquals(16.0, result.getDiagnostics().get(0).getScore(), EPSILON);
        assertEquals(16.0, result.getDiagnostics().get(1).getScore(), EPSILON);
        assertEquals(2.0, result.getSelectedPenalty(), EPSILON);
        assertArrayEquals(new int[0], result.getOptimalBreakpoints());
    }

    @Test
    public void testTiePrefersEarlierCandidate() {
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(1);
        stubMetrics(Map.of("0,100", 14.0));
        stubDetect(penalty -> new int[0]);

        PenaltySelectionResult result = new PeltPenaltySelector(engine).fitAndSelect(new double[100],
                sweep(PenaltySelectionMethod.AIC, 1, 4, 3));

        assertEquals(1.0, result.getSelectedPenalty(), EPSILON);
    }

    @Test
    public void testNoFiniteScore() {
        useMinSize(2);
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(2);
        stubDetect(penalty -> penalty < 1.5 ? new int[] { 3 } : new int[] { 2, 4 });

        NoSuitablePenaltyException exception = assertThrows(NoSuitablePenaltyException.class,
                () -> new PeltPenaltySelector(engine).fitAndSelect(new double[5],
                        sweep(PenaltySelectionMethod.AICC, 1, 2, 2)));
        assertThat(exception.getMessage(), containsString("infinite/NaN"));
    }

    @Test
    public void testNonFiniteMetricIsRejected() {
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(1);
        stubMetrics(Map.of("0,10", Double.NaN, "0,5", 1.0, "5,10", Double.POSITIVE_INFINITY));
        stubDetect(penalty -> penalty < 1.5 ? new int[] { 5 } : new int[0]);

        assertThrows(NoSuitablePenaltyException.class, () -> new PeltPenaltySelector(engine)
                .fitAndSelect(new double[10], sweep(PenaltySelectionMethod.BIC, 1, 2, 2)));
    }

    @Test
    public void testCostFunctionWithoutLikelihood() {
        when(engine.getOptions()).thenReturn(PeltOptions.builder().costFunction(new L2CostFunction()).build());
        PeltPenaltySelector selector = new PeltPenaltySelector(engine);
        assertThrows(UnsupportedOperationException.class,
                () -> selector.fitAndSelect(new double[10], PenaltySelectionOptions.builder().build()));
        verify(engine, never()).fit(any(double[][].class));
    }

    @Test
    public void testLikelihoodWithoutInformationCriteria() {
        when(likelihood.supportsInformationCriteria()).thenReturn(false);
        PeltPenaltySelector selector = new PeltPenaltySelector(engine);
        assertThrows(UnsupportedOperationException.class,
                () -> selector.fitAndSelect(new double[10], PenaltySelectionOptions.builder().build()));
        verify(engine, never()).fit(any(double[][].class));
        verify(engine, never()).detect(anyDouble());
    }

    @Test
    public void testNullArguments() {
        assertThrows(NullPointerException.class, () -> new PeltPenaltySelector(null));
        PeltPenaltySelector selector = new PeltPenaltySelector(engine);
        PenaltySelectionOptions options = PenaltySelectionOptions.builder().build();
        assertThrows(NullPointerException.class, () -> selector.fitAndSelect((double[]) null, options));
        assertThrows(NullPointerException.class, () -> selector.fitAndSelect((double[][]) null, options));
        assertThrows(NullPointerException.class, () -> selector.fitAndSelect(new double[10], null));
    }

    @Test
    public void testEstimatedMinimumPenalty() {
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(2);
        when(likelihood.computeLikelihoodMetric(anyInt(), anyInt())).thenReturn(1.0);
        stubDetect(penalty -> new int[0]);

        PenaltySelectionResult result = new PeltPenaltySelector(engine).fitAndSelect(new double[100],
                PenaltySelectionOptions.builder().numPenaltySteps(1).build());

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(2 * Math.log(100), result.getSelectedPenalty(), EPSILON);
    }

    @Test
    public void testEstimatedMaximumPenalty() {
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(2);
        when(likelihood.computeLikelihoodMetric(anyInt(), anyInt())).thenReturn(1.0);
        stubDetect(penalty -> new int[0]);

        PenaltySelectionResult result = new PeltPenaltySelector(engine).fitAndSelect(new double[100],
                PenaltySelectionOptions.builder().numPenaltySteps(2).build());

        List<PenaltyDiagnostic> diagnostics = result.getDiagnostics();
        assertEquals(2 * Math.log(100), diagnostics.get(0).getPenalty(), EPSILON);
        assertEquals(100 * Math.log(100), diagnostics.get(1).getPenalty(), 1e-6);
    }

    @Test
    public void testEqualPenaltyBounds() {
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(1);
        when(likelihood.computeLikelihoodMetric(anyInt(), anyInt())).thenReturn(1.0);
        stubDetect(penalty -> new int[0]);

        PenaltySelectionResult result = new PeltPenaltySelector(engine).fitAndSelect(new double[100],
                PenaltySelectionOptions.builder().minPenalty(50).maxPenalty(50).numPenaltySteps(4).build());

        for (PenaltyDiagnostic diagnostic : result.getDiagnostics()) {
            assertEquals(50.0, diagnostic.getPenalty(), EPSILON);
        }
    }

    @Test
    public void testParallelMatchesSequential() {
        when(likelihood.getSegmentParameterCount(anyInt())).thenReturn(2);
        when(likelihood.computeLikelihoodMetric(anyInt(), anyInt()))
                .thenAnswer(invocation -> 0.1
                        * (invocation.getArgument(1, Integer.class) - invocation.getArgument(0, Integer.class)));
        stubDetect(penalty -> {
            if (penalty > 15 && penalty < 20) {
                throw new IllegalStateException("segmentation failed");
            }
            return penalty < 10 ? new int[] { 25, 50, 75 } : penalty < 100 ? new int[] { 50 } : new int[0];
        });

        PeltPenaltySelector selector = new PeltPenaltySelector(engine);
        PenaltySelectionResult sequential = selector.fitAndSelect(new double[100],
                sweep(PenaltySelectionMethod.BIC, 1, 1000, 20));
        PenaltySelectionResult parallel = selector.fitAndSelect(new double[100],
                PenaltySelectionOptions.builder().minPenalty(1).maxPenalty(1000).numPenaltySteps(20)
                        .parallelExecutionEnabled(true).threadPoolSize(3).build());

        assertEquals(sequential.getSelectedPenalty(), parallel.getSelectedPenalty(), EPSILON);
        assertArrayEquals(sequential.getOptimalBreakpoints(), parallel.getOptimalBreakpoints());
        assertEquals(sequential.getDiagnostics().size(), parallel.getDiagnostics().size());
        for (int i = 0; i < sequential.getDiagnostics().size(); i++) {
            PenaltyDiagnostic expected = sequential.getDiagnostics().get(i);
            PenaltyDiagnostic actual = parallel.getDiagnostics().get(i);
            assertEquals(expected.getPenalty(), actual.getPenalty(), EPSILON);
            assertEquals(expected.getChangePointCount(), actual.getChangePointCount());
            assertEquals(expected.isFailed(), actual.isFailed());
        }
    }

    @Test
    public void testGeneratePenalties() {
        double[] penalties = PeltPenaltySelector.generatePenalties(1, 100, 3);
        assertEquals(3, penalties.length);
        assertEquals(1.0, penalties[0], EPSILON);
        assertEquals(10.0, penalties[1], 1e-9);
        assertEquals(100.0, penalties[2], 0.0);

        assertArrayEquals(new double[] { 2.5 }, PeltPenaltySelector.generatePenalties(2.5, 7, 1));
        assertArrayEquals(new double[] { 3, 3 }, PeltPenaltySelector.generatePenalties(3, 3, 2));
    }

    @Test
    public void testGeneratePenaltiesValidation() {
        assertThrows(IllegalArgumentException.class, () -> PeltPenaltySelector.generatePenalties(0, 10, 3));
        assertThrows(IllegalArgumentException.class, () -> PeltPenaltySelector.generatePenalties(5, 1, 3));
        assertThrows(IllegalArgumentException.class, () -> PeltPenaltySelector.generatePenalties(1, 10, 0));
        assertThrows(IllegalArgumentException.class,
                () -> PeltPenaltySelector.generatePenalties(1, Double.POSITIVE_INFINITY, 3));
    }

    @Test
    public void testSelectsTrueChangePointWithGaussianLikelihood() {
        SignalWithChangePoints data = new PiecewiseSignalTestData(100, 100).generateNormal(new double[] { 0, 10 },
                1.0, 1, 42L);
        PeltAlgorithm pelt = new PeltAlgorithm(
                PeltOptions.builder().costFunction(new GaussianLikelihoodCostFunction()).minSize(5).build());

        PenaltySelectionResult result = new PeltPenaltySelector(pelt).fitAndSelect(data.univariate(),
                PenaltySelectionOptions.builder().build());

        int[] changePoints = result.getOptimalBreakpoints();
        assertEquals(1, changePoints.length);
        assertTrue(Math.abs(changePoints[0] - 100) <= 2);
        assertEquals(PenaltySelectionOptions.DEFAULT_NUMBER_OF_PENALTY_STEPS, result.getDiagnostics().size());
        assertTrue(Double.isFinite(result.getSelectedScore()));
    }

    @Test
    public void testL2EngineCannotSelect() {
        PeltPenaltySelector selector = new PeltPenaltySelector(new PeltAlgorithm());
        assertThrows(UnsupportedOperationException.class,
                () -> selector.fitAndSelect(new double[] { 1, 2, 3, 4 }, PenaltySelectionOptions.builder().build()));
    }
}
