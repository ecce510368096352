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

/**
 * A change-point segmentation engine. The engine is fitted to a signal once and
 * can then be asked for the optimal segmentation under any number of
 * penalties.
 */
public interface IPeltAlgorithm {

    /**
     * @return the configuration of the engine
     */
    PeltOptions getOptions();

    /**
     * Fit the engine, and its cost function, to a univariate signal.
     *
     * @param signal the signal
     * @return this engine, fitted
     */
    IPeltAlgorithm fit(double[] signal);

    /**
     * Fit the engine, and its cost function, to a multivariate signal indexed by
     * dimension and then by time.
     *
     * @param signal the signal
     * @return this engine, fitted
     */
    IPeltAlgorithm fit(double[][] signal);

    /**
     * The change points of the segmentation of the fitted signal that minimizes
     * the total segment cost plus {@code penalty} per segment.
     *
     * @param penalty the cost of adding a change point, non-negative
     * @return the change points in increasing order, each strictly between 0 and
     *         the length of the signal
     */
    int[] detect(double penalty);

    /**
     * Equivalent to {@code fit(signal).detect(penalty)}.
     *
     * @param signal  the signal
     * @param penalty the cost of adding a change point
     * @return the change points in increasing order
     */
    default int[] fitAndDetect(double[] signal, double penalty) {
        return fit(signal).detect(penalty);
    }

    /**
     * Equivalent to {@code fit(signal).detect(penalty)}.
     *
     * @param signal  the multivariate signal
     * @param penalty the cost of adding a change point
     * @return the change points in increasing order
     */
    default int[] fitAndDetect(double[][] signal, double penalty) {
        return fit(signal).detect(penalty);
    }
}
