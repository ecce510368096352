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
 * Gaussian likelihood with a mean and a variance per segment and dimension.
 * The metric of a dimension is {@code n * ln(variance)} with the maximum
 * likelihood variance, floored at {@code MIN_VARIANCE}.
 */
public class GaussianLikelihoodCostFunction extends AbstractLikelihoodCostFunction {

    public static final double MIN_VARIANCE = 1e-10;

    @Override
    protected double dimensionMetric(int length, double sum, double sumOfSquares, boolean constant) {
        double mean = sum / length;
        double variance = constant ? 0 : sumOfSquares / length - mean * mean;
        return length * Math.log(Math.max(variance, MIN_VARIANCE));
    }

    @Override
    protected int getParametersPerDimension() {
        return 2;
    }
}
