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

package com.amazon.changepoint.testutils;

import java.util.Random;

/**
 * This class generates piecewise stationary signals. Every segment draws its
 * samples independently from one distribution (normal, Poisson or Bernoulli)
 * whose parameter changes from one segment to the next; the boundaries between
 * segments are the true change points.
 */
public class PiecewiseSignalTestData {

    private final int[] segmentLengths;

    /**
     * @param segmentLengths the number of samples of each segment, in order
     */
    public PiecewiseSignalTestData(int... segmentLengths) {
        if (segmentLengths.length == 0) {
            throw new IllegalArgumentException("at least one segment is required");
        }
        for (int length : segmentLengths) {
            if (length <= 0) {
                throw new IllegalArgumentException("segment lengths must be positive");
            }
        }
        this.segmentLengths = segmentLengths.clone();
    }

    /**
     * Normal samples with a mean per segment and a common standard deviation, in
     * every dimension.
     *
     * @param means      the mean of each segment
     * @param sigma      the standard deviation
     * @param dimensions the number of dimensions
     * @param seed       the seed of the generator
     * @return the signal and its change points
     */
    public SignalWithChangePoints generateNormal(double[] means, double sigma, int dimensions, long seed) {
        checkParameters(means);
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[][] signal = new double[dimensions][totalLength()];
        for (int d = 0; d < dimensions; d++) {
            int t = 0;
            for (int s = 0; s < segmentLengths.length; s++) {
                for (int i = 0; i < segmentLengths[s]; i++) {
                    signal[d][t++] = dist.nextDouble(means[s], sigma);
                }
            }
        }
        return new SignalWithChangePoints(signal, changePoints());
    }

    /**
     * Poisson counts with a rate per segment.
     *
     * @param rates the rate of each segment
     * @param seed  the seed of the generator
     * @return the univariate signal and its change points
     */
    public SignalWithChangePoints generatePoisson(double[] rates, long seed) {
        checkParameters(rates);
        Random rng = new Random(seed);
        double[] series = new double[totalLength()];
        int t = 0;
        for (int s = 0; s < segmentLengths.length; s++) {
            double limit = Math.exp(-rates[s]);
            for (int i = 0; i < segmentLengths[s]; i++) {
                // Knuth's multiplication method, fine for small rates
                int count = -1;
                double product = 1;
                do {
                    count++;
                    product *= rng.nextDouble();
                } while (product > limit);
                series[t++] = count;
            }
        }
        return new SignalWithChangePoints(new double[][] { series }, changePoints());
    }

    /**
     * Bernoulli trials with a success probability per segment.
     *
     * @param probabilities the success probability of each segment
     * @param seed          the seed of the generator
     * @return the univariate signal and its change points
     */
    public SignalWithChangePoints generateBernoulli(double[] probabilities, long seed) {
        checkParameters(probabilities);
        Random rng = new Random(seed);
        double[] series = new double[totalLength()];
        int t = 0;
        for (int s = 0; s < segmentLengths.length; s++) {
            for (int i = 0; i < segmentLengths[s]; i++) {
                series[t++] = rng.nextDouble() < probabilities[s] ? 1 : 0;
            }
        }
        return new SignalWithChangePoints(new double[][] { series }, changePoints());
    }

    public int totalLength() {
        int total = 0;
        for (int length : segmentLengths) {
            total += length;
        }
        return total;
    }

    public int[] changePoints() {
        int[] result = new int[segmentLengths.length - 1];
        int t = 0;
        for (int s = 0; s < result.length; s++) {
            t += segmentLengths[s];
            result[s] = t;
        }
        return result;
    }

    private void checkParameters(double[] parameters) {
        if (parameters.length != segmentLengths.length) {
            throw new IllegalArgumentException("one parameter per segment is required");
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
