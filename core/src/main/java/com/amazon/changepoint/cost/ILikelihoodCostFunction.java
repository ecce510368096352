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
 * A cost function that can also express the fit of a segment as a likelihood.
 * This is the capability the information criteria (BIC, AIC, AICc) need.
 */
public interface ILikelihoodCostFunction extends ICostFunction {

    /**
     * The likelihood metric of the segment {@code [start, end)}, that is
     * {@code -2 log L} of the segment under the maximum likelihood parameters,
     * up to an additive constant. Lower is better.
     *
     * @param start first index of the segment, inclusive
     * @param end   last index of the segment, exclusive
     * @return the likelihood metric of the segment
     */
    double computeLikelihoodMetric(int start, int end);

    /**
     * @param segmentLength the length of a segment
     * @return the number of parameters fitted for a segment of that length
     */
    int getSegmentParameterCount(int segmentLength);

    /**
     * @return true if the likelihood metric can be used with information
     *         criteria
     */
    boolean supportsInformationCriteria();
}
