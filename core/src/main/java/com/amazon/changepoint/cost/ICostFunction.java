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
 * A segment cost function. A cost function is fitted once to a signal and then
 * answers cost queries for half-open segments {@code [start, end)} of that
 * signal. For multivariate signals the cost of a segment is the sum of the
 * costs of its dimensions.
 */
public interface ICostFunction {

    /**
     * Fit the cost function to a univariate signal. Any state derived from a
     * previous fit is discarded.
     *
     * @param signal the signal
     * @return this cost function, fitted
     */
    ICostFunction fit(double[] signal);

    /**
     * Fit the cost function to a multivariate signal indexed by dimension and
     * then by time. Any state derived from a previous fit is discarded.
     *
     * @param signal the signal
     * @return this cost function, fitted
     */
    ICostFunction fit(double[][] signal);

    /**
     * @return the cost of the whole fitted signal
     */
    double computeCost();

    /**
     * The cost of the segment {@code [start, end)}.
     *
     * @param start first index of the segment, inclusive
     * @param end   last index of the segment, exclusive
     * @return the cost of the segment
     * @throws com.amazon.changepoint.UninitializedDataException if the cost
     *                                                           function has not
     *                                                           been fitted
     * @throws com.amazon.changepoint.SegmentLengthException     if the segment
     *                                                           holds no sample
     * @throws IndexOutOfBoundsException                         if the segment
     *                                                           leaves the signal
     */
    double computeCost(int start, int end);
}
