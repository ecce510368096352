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
 * Base class of the likelihood cost functions. Prefix sums of the values and
 * of their squares are kept per dimension; subclasses turn the sufficient
 * statistics of a segment into {@code -2 log L}. The cost of a segment is its
 * likelihood metric.
 */
public abstract class AbstractLikelihoodCostFunction extends AbstractCostFunction implements ILikelihoodCostFunction {

    private double[][] prefixSum;

    private double[][] prefixSumOfSquares;

    @Override
    protected void initialize(double[][] signal) {
        prefixSum = new double[signal.length][];
        prefixSumOfSquares = new double[signal.length][];
        for (int d = 0; d < signal.length; d++) {
            double[] series = signal[d];
            for (int i = 0; i < series.length; i++) {
                series[i] = validate(series[i], d, i);
            }
            prefixSum[d] = new double[series.length + 1];
            prefixSumOfSquares[d] = new double[series.length + 1];
            for (int i = 0; i < series.length; i++) {
                prefixSum[d][i + 1] = prefixSum[d][i] + series[i];
                prefixSumOfSquares[d][i + 1] = prefixSumOfSquares[d][i] + series[i] * series[i];
            }
        }
    }

    /**
     * Checks a sample before it enters the prefix sums.
     *
     * @param value     the sample
     * @param dimension dimension of the sample
     * @param index     time index of the sample
     * @return the value to use, possibly snapped to the support of the model
     * @throws IllegalArgumentException if the sample is outside of the support
     */
    protected double validate(double value, int dimension, int index) {
        return value;
    }

    /**
     * {@code -2 log L} of one dimension of a segment.
     *
     * @param length       number of samples
     * @param sum          sum of the samples
     * @param sumOfSquares sum of the squared samples
     * @param constant     true if all the samples are equal
     * @return the likelihood metric of that dimension
     */
    protected abstract double dimensionMetric(int length, double sum, double sumOfSquares, boolean constant);

    /**
     * @return the number of parameters fitted for each dimension of a segment
     */
    protected abstract int getParametersPerDimension();

    @Override
    public double computeLikelihoodMetric(int start, int end) {
        checkSegment(start, end);
        double metric = 0;
        for (int d = 0; d < numberOfDimensions; d++) {
            double sum = prefixSum[d][end] - prefixSum[d][start];
            double sumOfSquares = prefixSumOfSquares[d][end] - prefixSumOfSquares[d][start];
            metric += dimensionMetric(end - start, sum, sumOfSquares, isConstant(d, start, end));
        }
        return Double.isFinite(metric) ? metric : Double.POSITIVE_INFINITY;
    }

    @Override
    protected double segmentCost(int start, int end) {
        return computeLikelihoodMetric(start, end);
    }

    @Override
    public int getSegmentParameterCount(int segmentLength) {
        return getParametersPerDimension() * Math.max(1, numberOfDimensions);
    }

    @Override
    public boolean supportsInformationCriteria() {
        return true;
    }
}
