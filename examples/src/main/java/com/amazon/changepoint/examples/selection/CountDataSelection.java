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

package com.amazon.changepoint.examples.selection;

import java.util.Arrays;

import com.amazon.changepoint.config.PenaltySelectionMethod;
import com.amazon.changepoint.cost.BernoulliLikelihoodCostFunction;
import com.amazon.changepoint.cost.PoissonLikelihoodCostFunction;
import com.amazon.changepoint.examples.Example;
import com.amazon.changepoint.pelt.PeltAlgorithm;
import com.amazon.changepoint.pelt.PeltOptions;
import com.amazon.changepoint.pelt.PeltPenaltySelector;
import com.amazon.changepoint.pelt.PenaltySelectionOptions;
import com.amazon.changepoint.returntypes.PenaltySelectionResult;
import com.amazon.changepoint.testutils.PiecewiseSignalTestData;
import com.amazon.changepoint.testutils.SignalWithChangePoints;

/**
 * Segment event counts and binary outcomes, selecting the penalty with each of
 * the information criteria.
 */
public class CountDataSelection implements Example {

    public static void main(String[] args) throws Exception {
        new CountDataSelection().run();
    }

    @Override
    public String command() {
        return "counts";
    }

    @Override
    public String description() {
        return "segment Poisson counts and Bernoulli outcomes with BIC, AIC and AICc";
    }

    @Override
    public void run() throws Exception {
        PiecewiseSignalTestData testData = new PiecewiseSignalTestData(100, 60, 140);
        SignalWithChangePoints counts = testData.generatePoisson(new double[] { 2, 7, 3 }, 11L);
        SignalWithChangePoints outcomes = testData.generateBernoulli(new double[] { 0.1, 0.7, 0.3 }, 13L);
        System.out.printf("true change points = %s%n", Arrays.toString(testData.changePoints()));

        for (PenaltySelectionMethod method : PenaltySelectionMethod.values()) {
            PenaltySelectionOptions options = PenaltySelectionOptions.builder().method(method).build();

            PeltPenaltySelector poisson = new PeltPenaltySelector(new PeltAlgorithm(
                    PeltOptions.builder().costFunction(new PoissonLikelihoodCostFunction()).minSize(3).build()));
            PenaltySelectionResult countResult = poisson.fitAndSelect(counts.univariate(), options);

            PeltPenaltySelector bernoulli = new PeltPenaltySelector(new PeltAlgorithm(
                    PeltOptions.builder().costFunction(new BernoulliLikelihoodCostFunction()).minSize(10).build()));
            PenaltySelectionResult outcomeResult = bernoulli.fitAndSelect(outcomes.univariate(), options);

            System.out.printf("%-4s poisson: penalty = %8.3f %s, bernoulli: penalty = %8.3f %s%n", method,
                    countResult.getSelectedPenalty(), Arrays.toString(countResult.getOptimalBreakpoints()),
                    outcomeResult.getSelectedPenalty(), Arrays.toString(outcomeResult.getOptimalBreakpoints()));
        }
    }
}
