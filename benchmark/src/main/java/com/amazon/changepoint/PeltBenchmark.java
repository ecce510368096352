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

package com.amazon.changepoint;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.changepoint.config.CostFunctionType;
import com.amazon.changepoint.config.PenaltySelectionMethod;
import com.amazon.changepoint.pelt.PeltAlgorithm;
import com.amazon.changepoint.pelt.PeltOptions;
import com.amazon.changepoint.pelt.PeltPenaltySelector;
import com.amazon.changepoint.pelt.PenaltySelectionOptions;
import com.amazon.changepoint.returntypes.PenaltySelectionResult;
import com.amazon.changepoint.testutils.PiecewiseSignalTestData;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class PeltBenchmark {

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "L1", "L2", "RBF", "GAUSSIAN" })
        String costFunction;

        @Param({ "1000" })
        int signalLength;

        @Param({ "1", "5" })
        int jump;

        double[] signal;
        PeltAlgorithm fitted;

        @Setup(Level.Trial)
        public void setUpData() {
            int quarter = signalLength / 4;
            signal = new PiecewiseSignalTestData(quarter, quarter, quarter, signalLength - 3 * quarter)
                    .generateNormal(new double[] { 0, 3, 1, 4 }, 1.0, 1, 0L).univariate();
        }

        @Setup(Level.Invocation)
        public void setUpAlgorithm() {
            PeltOptions options = PeltOptions.builder()
                    .costFunction(CostFunctionType.valueOf(costFunction).newInstance()).minSize(2).jump(jump)
                    .build();
            fitted = new PeltAlgorithm(options);
            fitted.fit(signal);
        }
    }

    @Benchmark
    public int[] detect(BenchmarkState state, Blackhole blackhole) {
        int[] changePoints = state.fitted.detect(10.0);
        blackhole.consume(changePoints.length);
        return changePoints;
    }

    @Benchmark
    public PenaltySelectionResult selectPenalty(BenchmarkState state) {
        if (!"GAUSSIAN".equals(state.costFunction)) {
            return null;
        }
        PenaltySelectionOptions options = PenaltySelectionOptions.builder().method(PenaltySelectionMethod.BIC)
                .numPenaltySteps(10).build();
        return new PeltPenaltySelector(state.fitted).fitAndSelect(state.signal, options);
    }
}
