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

package com.amazon.changepoint.cost;

/**
 * Least squares cost: the sum of squared deviations of a segment from its
 * mean. Prefix sums of the values and of their squares are built on fit, so a
 * query is {@code O(1)} per dimension.
 */
public class L2CostFunction extends AbstractCostFunction {

    private double[][] prefixSum;

    private double[][] prefixSumOfSquares;

    @Override
    protected void initialize(double[][] signal) {
        prefixSum = new double[signal.length][];
        prefixSumOfSquares = new double[signal.length][];
        for (int d = 0; d < signal.length; d++) {
            double[] series = signal[d];
            prefixSum[d] = new double[series.length + 1];
            prefixSumOfSquares[d] = new double[series.length + 1];
            for (int i = 0; i < series.length; i++) {
                prefixSum[d][i + 1] = prefixSum[d][i] + series[i];
                prefixSumOfSquares[d][i + 1] = prefixSumOfSquares[d][i] + series[i] * series[i];
            }
        }
    }

    @Override
    protected double segmentCost(int start, int end) {
        int length = end - start;
        double cost = 0;
        for (int d = 0; d < numberOfDimensions; d++) {
            // rounding in the prefix sums must not leak into constant segments
            if (isConstant(d, start, end)) {
                continue;
            }
            double sum = prefixSum[d][end] - prefixSum[d][start];
            double sumOfSquares = prefixSumOfSquares[d][end] - prefixSumOfSquares[d][start];
            cost += Math.max(0, sumOfSquares - sum * sum / length);
        }
        return cost;
    }
}
