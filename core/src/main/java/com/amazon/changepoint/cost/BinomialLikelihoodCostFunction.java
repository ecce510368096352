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

import static com.amazon.changepoint.CommonUtils.checkArgument;

/**
 * Binomial likelihood with one success probability per segment. The signal has
 * exactly two rows: row {@code 0} holds the successes {@code k} and row
 * {@code 1} the trials {@code n} of every observation. With {@code K} and
 * {@code N} the totals of a segment the metric is
 *
 * <pre>
 * -2 * (K log K + (N - K) log(N - K) - N log N)
 * </pre>
 *
 * which is zero when every trial of the segment succeeded or every trial
 * failed. Counts must be integers within {@code TOLERANCE}, with
 * {@code 0 <= k <= n} and {@code n >= 1}.
 */
public class BinomialLikelihoodCostFunction extends AbstractCostFunction implements ILikelihoodCostFunction {

    public static final double TOLERANCE = 1e-9;

    private double[] prefixSuccesses;

    private double[] prefixTrials;

    @Override
    protected void initialize(double[][] signal) {
        checkArgument(signal.length == 2,
                "binomial data needs two rows, successes and trials, found " + signal.length + " row(s)");
        double[] successes = signal[0];
        double[] trials = signal[1];
        prefixSuccesses = new double[successes.length + 1];
        prefixTrials = new double[trials.length + 1];
        for (int i = 0; i < successes.length; i++) {
            double k = toCount(successes[i], "successes", i);
            double n = toCount(trials[i], "trials", i);
            checkArgument(k >= 0, "successes must be non-negative, found " + k + " at index " + i);
            checkArgument(n >= 1, "trials must be at least 1, found " + n + " at index " + i);
            checkArgument(k <= n, "successes " + k + " exceed trials " + n + " at index " + i);
            prefixSuccesses[i + 1] = prefixSuccesses[i] + k;
            prefixTrials[i + 1] = prefixTrials[i] + n;
        }
    }

    private static double toCount(double value, String name, int index) {
        double rounded = Math.rint(value);
        checkArgument(Double.isFinite(value) && Math.abs(value - rounded) <= TOLERANCE,
                name + " must be whole numbers, found " + value + " at index " + index);
        return rounded;
    }

    @Override
    protected double segmentCost(int start, int end) {
        return computeLikelihoodMetric(start, end);
    }

    @Override
    public double computeLikelihoodMetric(int start, int end) {
        checkSegment(start, end);
        double successes = prefixSuccesses[end] - prefixSuccesses[start];
        double trials = prefixTrials[end] - prefixTrials[start];
        if (trials <= TOLERANCE || successes <= TOLERANCE || successes >= trials - TOLERANCE) {
            return 0;
        }
        double failures = trials - successes;
        double logLikelihood = successes * Math.log(successes) + failures * Math.log(failures)
                - trials * Math.log(trials);
        double metric = Math.max(0, -2 * logLikelihood);
        return Double.isFinite(metric) ? metric : Double.POSITIVE_INFINITY;
    }

    /**
     * The success probability; the two rows describe a single series.
     */
    @Override
    public int getSegmentParameterCount(int segmentLength) {
        return 1;
    }

    @Override
    public boolean supportsInformationCriteria() {
        return true;
    }
}
