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
 * Poisson likelihood with one rate per segment and dimension, for count data.
 * Values must be non-negative; values within {@code TOLERANCE} below zero are
 * treated as zero.
 */
public class PoissonLikelihoodCostFunction extends AbstractLikelihoodCostFunction {

    public static final double TOLERANCE = 1e-9;

    @Override
    protected double validate(double value, int dimension, int index) {
        checkArgument(value >= -TOLERANCE, "Poisson data must be non-negative, found " + value + " at index " + index
                + " of dimension " + dimension);
        return Math.max(0, value);
    }

    @Override
    protected double dimensionMetric(int length, double sum, double sumOfSquares, boolean constant) {
        if (sum <= TOLERANCE) {
            return 0;
        }
        return 2 * (sum - sum * Math.log(sum) + sum * Math.log(length));
    }

    @Override
    protected int getParametersPerDimension() {
        return 1;
    }
}
