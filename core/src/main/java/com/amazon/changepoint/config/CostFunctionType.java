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

import static com.amazon.changepoint.CommonUtils.checkArgument;
import static com.amazon.changepoint.CommonUtils.checkNotNull;

import java.util.Optional;

import com.amazon.changepoint.cost.ARCostFunction;
import com.amazon.changepoint.cost.BernoulliLikelihoodCostFunction;
import com.amazon.changepoint.cost.BinomialLikelihoodCostFunction;
import com.amazon.changepoint.cost.GaussianLikelihoodCostFunction;
import com.amazon.changepoint.cost.ICostFunction;
import com.amazon.changepoint.cost.L1CostFunction;
import com.amazon.changepoint.cost.L2CostFunction;
import com.amazon.changepoint.cost.PoissonLikelihoodCostFunction;
import com.amazon.changepoint.cost.RBFCostFunction;

/**
 * The cost functions shipped with the library, used wherever a cost function
 * is named rather than constructed (command line, saved configuration).
 */
public enum CostFunctionType {

    /**
     * absolute deviation from the segment median, robust to outliers
     */
    L1,
    /**
     * squared deviation from the segment mean, detects shifts in the mean
     */
    L2,
    /**
     * Gaussian kernel cost, detects changes in the distribution
     */
    RBF,
    /**
     * Gaussian likelihood, detects changes in mean and variance
     */
    GAUSSIAN,
    /**
     * Poisson likelihood for counts
     */
    POISSON,
    /**
     * Bernoulli likelihood for 0/1 data
     */
    BERNOULLI,
    /**
     * binomial likelihood for paired rows of successes and trials
     */
    BINOMIAL,
    /**
     * least squares autoregressive model, detects changes in the dynamics
     */
    AR;

    /**
     * Creates a new, unfitted cost function of this type.
     *
     * @param gamma the bandwidth of the kernel; only meaningful for {@code RBF},
     *              estimated from the data when empty
     * @param order the number of lags; only meaningful for {@code AR},
     *              {@link ARCostFunction#DEFAULT_ORDER} when empty
     * @return the cost function
     */
    public ICostFunction newInstance(Optional<Double> gamma, Optional<Integer> order) {
        checkNotNull(gamma, "gamma must not be null, use Optional.empty()");
        checkNotNull(order, "order must not be null, use Optional.empty()");
        checkArgument(this == RBF || !gamma.isPresent(), "gamma only applies to the RBF cost function");
        checkArgument(this == AR || !order.isPresent(), "order only applies to the AR cost function");
        switch (this) {
        case L1:
            return new L1CostFunction();
        case L2:
            return new L2CostFunction();
        case RBF:
            return gamma.map(RBFCostFunction::new).orElseGet(RBFCostFunction::new);
        case GAUSSIAN:
            return new GaussianLikelihoodCostFunction();
        case POISSON:
            return new PoissonLikelihoodCostFunction();
        case BERNOULLI:
            return new BernoulliLikelihoodCostFunction();
        case BINOMIAL:
            return new BinomialLikelihoodCostFunction();
        default:
            return new ARCostFunction(order.orElse(ARCostFunction.DEFAULT_ORDER));
        }
    }

    public ICostFunction newInstance(Optional<Double> gamma) {
        return newInstance(gamma, Optional.empty());
    }

    public ICostFunction newInstance() {
        return newInstance(Optional.empty());
    }

    /**
     * The type of a cost function instance.
     *
     * @param costFunction a cost function
     * @return its type
     * @throws IllegalArgumentException for cost functions that are not part of
     *                                  the library
     */
    public static CostFunctionType of(ICostFunction costFunction) {
        checkNotNull(costFunction, "costFunction must not be null");
        if (costFunction instanceof L1CostFunction) {
            return L1;
        } else if (costFunction instanceof L2CostFunction) {
            return L2;
        } else if (costFunction instanceof RBFCostFunction) {
            return RBF;
        } else if (costFunction instanceof GaussianLikelihoodCostFunction) {
            return GAUSSIAN;
        } else if (costFunction instanceof PoissonLikelihoodCostFunction) {
            return POISSON;
        } else if (costFunction instanceof BernoulliLikelihoodCostFunction) {
            return BERNOULLI;
        } else if (costFunction instanceof BinomialLikelihoodCostFunction) {
            return BINOMIAL;
        } else if (costFunction instanceof ARCostFunction) {
            return AR;
        }
        throw new IllegalArgumentException("unknown cost function " + costFunction.getClass().getName());
    }
}
