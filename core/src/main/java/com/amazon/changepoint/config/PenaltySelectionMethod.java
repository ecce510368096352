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

package com.amazon.changepoint.config;

/**
 * Information criteria used to choose a penalty. Each criterion trades the
 * likelihood metric {@code M} (that is {@code -2 log L}) of a segmentation
 * against the number of its parameters {@code k}; lower is better.
 */
public enum PenaltySelectionMethod {

    /**
     * Bayesian information criterion, {@code M + k ln N}
     */
    BIC {
        @Override
        public double score(double likelihoodMetric, double parameters, int signalLength) {
            return likelihoodMetric + parameters * Math.log(signalLength);
        }
    },
    /**
     * Akaike information criterion, {@code M + 2k}
     */
    AIC {
        @Override
        public double score(double likelihoodMetric, double parameters, int signalLength) {
            return likelihoodMetric + 2 * parameters;
        }
    },
    /**
     * Akaike information criterion corrected for small samples,
     * {@code AIC + 2k(k+1)/(N-k-1)}; infinite when {@code N <= k + 1}
     */
    AICC {
        @Override
        public double score(double likelihoodMetric, double parameters, int signalLength) {
            if (signalLength <= parameters + 1) {
                return Double.POSITIVE_INFINITY;
            }
            return AIC.score(likelihoodMetric, parameters, signalLength)
                    + 2 * parameters * (parameters + 1) / (signalLength - parameters - 1);
        }
    };

    /**
     * The score of a segmentation.
     *
     * @param likelihoodMetric the summed {@code -2 log L} over all segments
     * @param parameters       the number of fitted parameters, including one per
     *                         change point
     * @param signalLength     the number of samples {@code N}
     * @return the score, lower is better
     */
    public abstract double score(double likelihoodMetric, double parameters, int signalLength);
}
