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

/**
 * Bernoulli likelihood with one success probability per segment and dimension.
 * Values must be 0 or 1, up to {@code TOLERANCE}.
 */
public class BernoulliLikelihoodCostFunction extends AbstractLikelihoodCostFunction {

    public static final double TOLERANCE = 1e-9;

    @Override
    protected double validate(double value, int dimension, int index) {
        if (Math.abs(value) <= TOLERANCE) {
            return 0;
        }
        checkArgument(Math.abs(value - 1) <= TOLERANCE, "Bernoulli data must be 0 or 1, found " + value
                + " at index " + index + " of dimension " + dimension);
        return 1;
    }

    @Override
    protected double dimensionMetric(int length, double sum, double sumOfSquares, boolean constant) {
        if (sum <= TOLERANCE || sum >= length - TOLERANCE) {
            return 0;
        }
        double failures = length - sum;
        return -2 * (sum * Math.log(sum) + failures * Math.log(failures) - length * Math.log(length));
    }

    @Override
    protected int getParametersPerDimension() {
        return 1;
    }
}
