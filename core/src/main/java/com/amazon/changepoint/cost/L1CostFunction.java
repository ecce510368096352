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

import com.amazon.changepoint.statistics.Quantiles;

/**
 * Least absolute deviation cost: the sum of the absolute deviations of a
 * segment from its median. The median is recomputed for every query, so a
 * query costs {@code O(n log n)} in the length of the segment.
 */
public class L1CostFunction extends AbstractCostFunction {

    private double[][] signal;

    @Override
    protected void initialize(double[][] signal) {
        this.signal = signal;
    }

    @Override
    protected double segmentCost(int start, int end) {
        double cost = 0;
        for (int d = 0; d < numberOfDimensions; d++) {
            if (isConstant(d, start, end)) {
                continue;
            }
            double[] series = signal[d];
            double median = Quantiles.median(series, start, end);
            for (int i = start; i < end; i++) {
                cost += Math.abs(series[i] - median);
            }
        }
        return cost;
    }
}
