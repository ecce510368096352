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

import java.util.Arrays;
import java.util.Optional;

import lombok.Getter;

import com.amazon.changepoint.statistics.Quantiles;

/**
 * Kernel cost with a Gaussian radial basis function. For a segment of length
 * {@code n} the cost is {@code n - (1/n) * sum K(x_i, x_j)} over all pairs of
 * the segment, where {@code K(a, b) = exp(-gamma * (a - b)^2)}.
 *
 * On fit the Gram matrix of every dimension is accumulated into an integral
 * image, so a query is {@code O(1)} per dimension while memory is
 * {@code O(N^2)} per dimension.
 *
 * When no bandwidth is configured it is estimated separately for every
 * dimension with the median heuristic {@code 1 / median(|x_i - x_j|^2)}.
 */
public class RBFCostFunction extends AbstractCostFunction {

    /**
     * lower clamp of the exponent of the kernel for distinct values
     */
    public static final double MIN_EXPONENT = 1e-2;

    /**
     * upper clamp of the exponent of the kernel
     */
    public static final double MAX_EXPONENT = 1e2;

    /**
     * bandwidth used when the median heuristic has nothing to work with
     */
    public static final double DEFAULT_GAMMA = 1.0;

    @Getter
    private final Optional<Double> gamma;

    private double[] fittedGammas;

    private double[][][] gramIntegral;

    /**
     * Creates a cost function that estimates its bandwidth from the data.
     */
    public RBFCostFunction() {
        this.gamma = Optional.empty();
    }

    /**
     * Creates a cost function with a fixed bandwidth.
     *
     * @param gamma the bandwidth, positive and finite
     */
    public RBFCostFunction(double gamma) {
        checkArgument(gamma > 0 && Double.isFinite(gamma), "gamma must be positive and finite");
        this.gamma = Optional.of(gamma);
    }

    /**
     * @return the bandwidth used for each dimension of the fitted signal
     */
    public double[] getFittedGammas() {
        checkFitted();
        return Arrays.copyOf(fittedGammas, fittedGammas.length);
    }

    @Override
    protected void initialize(double[][] signal) {
        fittedGammas = new double[signal.length];
        gramIntegral = new double[signal.length][][];
        for (int d = 0; d < signal.length; d++) {
            double[] series = signal[d];
            fittedGammas[d] = gamma.orElseGet(() -> estimateGamma(series));
            gramIntegral[d] = integrate(series, fittedGammas[d]);
        }
    }

    @Override
    protected double segmentCost(int start, int end) {
        int length = end - start;
        if (length == 1) {
            return 0;
        }
        double cost = 0;
        for (int d = 0; d < numberOfDimensions; d++) {
            if (isConstant(d, start, end)) {
                continue;
            }
            double[][] integral = gramIntegral[d];
            double kernelSum = integral[end][end] - integral[start][end] - integral[end][start]
                    + integral[start][start];
            cost += Math.max(0, length - kernelSum / length);
        }
        return cost;
    }

    /**
     * The kernel value for two samples.
     *
     * @param a     first sample
     * @param b     second sample
     * @param gamma the bandwidth
     * @return 1 for equal samples, otherwise {@code exp(-v)} where {@code v} is
     *         {@code gamma * (a - b)^2} clamped to
     *         {@code [MIN_EXPONENT, MAX_EXPONENT]}
     */
    static double kernel(double a, double b, double gamma) {
        if (a == b) {
            return 1.0;
        }
        double exponent = gamma * (a - b) * (a - b);
        exponent = Math.min(MAX_EXPONENT, Math.max(MIN_EXPONENT, exponent));
        return Math.exp(-exponent);
    }

    /**
     * The median heuristic for the bandwidth of one dimension.
     *
     * @param series the samples of the dimension
     * @return the inverse of the median squared distance between distinct
     *         pairs, or {@code DEFAULT_GAMMA} when that is undefined
     */
    static double estimateGamma(double[] series) {
        int n = series.length;
        if (n < 2) {
            return DEFAULT_GAMMA;
        }
        double[] distances = new double[n * (n - 1) / 2];
        int index = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double difference = series[i] - series[j];
                distances[index++] = difference * difference;
            }
        }
        double median = Quantiles.median(distances);
        if (median <= 0 || !Double.isFinite(median)) {
            return DEFAULT_GAMMA;
        }
        return 1.0 / median;
    }

    // integral[i][j] holds the sum of K(x_a, x_b) over a < i and b < j
    private static double[][] integrate(double[] series, double gamma) {
        int n = series.length;
        double[][] integral = new double[n + 1][n + 1];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                integral[i + 1][j + 1] = kernel(series[i], series[j], gamma) + integral[i][j + 1]
                        + integral[i + 1][j] - integral[i][j];
            }
        }
        return integral;
    }
}
