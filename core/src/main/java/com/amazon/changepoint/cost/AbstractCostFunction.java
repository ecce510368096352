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

import static com.amazon.changepoint.CommonUtils.checkSegmentBounds;
import static com.amazon.changepoint.CommonUtils.checkSegmentLength;

import lombok.Getter;

import com.amazon.changepoint.UninitializedDataException;
import com.amazon.changepoint.util.ArrayUtils;

/**
 * Common plumbing of the cost functions: copying the signal on fit, checking
 * segment queries and adding up the per-dimension costs.
 */
public abstract class AbstractCostFunction implements ICostFunction {

    @Getter
    protected int numberOfDimensions;

    @Getter
    protected int numberOfSamples;

    @Getter
    protected boolean fitted;

    /**
     * for every dimension and sample, the first index of the run of equal values
     * that ends at that sample
     */
    private int[][] runStart;

    @Override
    public ICostFunction fit(double[] signal) {
        if (signal == null) {
            throw new UninitializedDataException("data not initialized, the signal must not be null");
        }
        return fit(new double[][] { signal });
    }

    @Override
    public ICostFunction fit(double[][] signal) {
        if (signal == null) {
            throw new UninitializedDataException("data not initialized, the signal must not be null");
        }
        double[][] data = ArrayUtils.cleanCopy(signal);
        fitted = false;
        initialize(data);
        numberOfDimensions = data.length;
        numberOfSamples = ArrayUtils.numberOfSamples(data);
        runStart = new int[numberOfDimensions][numberOfSamples];
        for (int d = 0; d < numberOfDimensions; d++) {
            for (int i = 0; i < numberOfSamples; i++) {
                runStart[d][i] = (i > 0 && data[d][i] == data[d][i - 1]) ? runStart[d][i - 1] : i;
            }
        }
        fitted = true;
        return this;
    }

    /**
     * Builds the derived structures for a freshly copied signal.
     *
     * @param signal the signal, indexed by dimension and then by time; owned by
     *               the cost function
     */
    protected abstract void initialize(double[][] signal);

    /**
     * The cost of a segment that has already been checked.
     *
     * @param start first index, inclusive
     * @param end   last index, exclusive
     * @return the cost
     */
    protected abstract double segmentCost(int start, int end);

    @Override
    public double computeCost() {
        checkFitted();
        if (numberOfSamples == 0) {
            return 0;
        }
        return computeCost(0, numberOfSamples);
    }

    @Override
    public double computeCost(int start, int end) {
        checkSegment(start, end);
        return segmentCost(start, end);
    }

    protected void checkSegment(int start, int end) {
        checkFitted();
        checkSegmentLength(start, end, 1);
        checkSegmentBounds(start, end, numberOfSamples);
    }

    protected void checkFitted() {
        if (!fitted) {
            throw new UninitializedDataException(
                    "data not initialized, " + getClass().getSimpleName() + " must be fitted before computing costs");
        }
    }

    /**
     * @param dimension the dimension
     * @param start     first index, inclusive
     * @param end       last index, exclusive
     * @return true if every sample of the segment in that dimension is equal
     */
    protected boolean isConstant(int dimension, int start, int end) {
        return runStart[dimension][end - 1] <= start;
    }
}
