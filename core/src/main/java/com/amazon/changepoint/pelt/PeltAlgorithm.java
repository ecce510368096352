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

import static com.amazon.changepoint.CommonUtils.checkArgument;
import static com.amazon.changepoint.CommonUtils.checkNotNull;
import static com.amazon.changepoint.CommonUtils.validateInternalState;

import java.util.Arrays;
import java.util.concurrent.CancellationException;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.changepoint.UninitializedDataException;
import com.amazon.changepoint.cost.ICostFunction;
import com.amazon.changepoint.util.ArrayUtils;

/**
 * Pruned Exact Linear Time (PELT) segmentation. The dynamic program finds, for
 * every candidate boundary {@code t}, the cheapest segmentation of
 * {@code [0, t)}, and discards predecessors that can no longer be part of an
 * optimal segmentation. The objective is
 *
 * <pre>
 * sum of segment costs + penalty * number of change points
 * </pre>
 *
 * over the segmentations whose segments hold at least {@code minSize} samples.
 * With {@code jump == 1} and {@code minSize == 1} the result is its exact
 * optimum. With {@code minSize > 1} the pruning can discard a predecessor that
 * only a later boundary could have used, so the result may be suboptimal; a
 * larger {@code jump} restricts the candidates and is approximate as well.
 *
 * Candidate change points are the multiples of {@code jump} in
 * {@code [minSize, N)}. The engine keeps the fitted signal and delegates every
 * segment cost to the configured cost function; a call to {@link #detect} does
 * not modify the engine.
 */
@Slf4j
public class PeltAlgorithm implements IPeltAlgorithm {

    @Getter
    private final PeltOptions options;

    private double[][] signal;

    @Getter
    private int signalLength;

    public PeltAlgorithm() {
        this(PeltOptions.builder().build());
    }

    public PeltAlgorithm(PeltOptions options) {
        this.options = checkNotNull(options, "options must not be null");
    }

    @Override
    public IPeltAlgorithm fit(double[] signal) {
        checkNotNull(signal, "signal must not be null");
        return fit(new double[][] { signal });
    }

    @Override
    public IPeltAlgorithm fit(double[][] signal) {
        double[][] copy = ArrayUtils.cleanCopy(signal);
        options.getCostFunction().fit(copy);
        this.signal = copy;
        this.signalLength = ArrayUtils.numberOfSamples(copy);
        log.debug("fitted signal with {} dimension(s) and {} sample(s)", copy.length, signalLength);
        return this;
    }

    /**
     * @return true once the engine has been fitted
     */
    public boolean isFitted() {
        return signal != null;
    }

    @Override
    public int[] detect(double penalty) {
        if (signal == null) {
            throw new UninitializedDataException("data not initialized, fit() must be called before detect()");
        }
        checkArgument(penalty >= 0, "penalty must be non-negative");
        int minSize = options.getMinSize();
        if (signalLength < 2 * minSize) {
            log.debug("signal of length {} is too short for two segments of at least {} samples", signalLength,
                    minSize);
            return new int[0];
        }
        int[] predecessor = segment(penalty);
        return backtrack(predecessor);
    }

    /**
     * The dynamic program over the candidate boundaries.
     *
     * @param penalty the penalty per change point
     * @return for every boundary {@code t} that ends a best partition, the start
     *         of its last segment; -1 for other indices
     */
    int[] segment(double penalty) {
        ICostFunction costFunction = options.getCostFunction();
        int minSize = options.getMinSize();
        int jump = options.getJump();
        int n = signalLength;

        double[] bestCost = new double[n + 1];
        int[] predecessor = new int[n + 1];
        boolean[] partitioned = new boolean[n + 1];
        Arrays.fill(predecessor, -1);
        partitioned[0] = true;

        // admissible predecessors, in increasing order
        int[] admissible = new int[n + 1];
        double[] candidateCost = new double[n + 1];
        int admissibleCount = 0;

        for (int t : boundaries(n, minSize, jump)) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("segmentation interrupted at boundary " + t);
            }
            int newPoint = ((t - minSize) / jump) * jump;
            if (admissibleCount == 0 || admissible[admissibleCount - 1] != newPoint) {
                admissible[admissibleCount++] = newPoint;
            }

            int bestTau = -1;
            double best = Double.POSITIVE_INFINITY;
            for (int i = 0; i < admissibleCount; i++) {
                int tau = admissible[i];
                if (!partitioned[tau]) {
                    continue;
                }
                double cost = bestCost[tau] + costFunction.computeCost(tau, t) + penalty;
                if (Double.isNaN(cost)) {
                    cost = Double.POSITIVE_INFINITY;
                }
                candidateCost[i] = cost;
                if (bestTau < 0 || cost < best) {
                    best = cost;
                    bestTau = tau;
                }
            }
            validateInternalState(bestTau >= 0, "no admissible predecessor for boundary " + t);
            bestCost[t] = best;
            predecessor[t] = bestTau;
            partitioned[t] = true;

            double threshold = best + penalty;
            int kept = 0;
            for (int i = 0; i < admissibleCount; i++) {
                int tau = admissible[i];
                if (partitioned[tau] && candidateCost[i] <= threshold) {
                    admissible[kept] = tau;
                    candidateCost[kept] = candidateCost[i];
                    kept++;
                }
            }
            admissibleCount = kept;
        }
        return predecessor;
    }

    /**
     * @return the multiples of {@code jump} in {@code [minSize, n)} followed by
     *         {@code n}
     */
    static int[] boundaries(int n, int minSize, int jump) {
        int first = ((minSize + jump - 1) / jump) * jump;
        int count = (first < n) ? (n - 1 - first) / jump + 1 : 0;
        int[] result = new int[count + 1];
        for (int i = 0; i < count; i++) {
            result[i] = first + i * jump;
        }
        result[count] = n;
        return result;
    }

    private int[] backtrack(int[] predecessor) {
        int count = 0;
        for (int t = predecessor[signalLength]; t > 0; t = predecessor[t]) {
            count++;
        }
        int[] changePoints = new int[count];
        int index = count;
        for (int t = predecessor[signalLength]; t > 0; t = predecessor[t]) {
            changePoints[--index] = t;
        }
        return changePoints;
    }
}
