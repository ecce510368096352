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
import com.amazon.changepoint.cost.GaussianLikelihoodCostFunction;
import com.amazon.changepoint.examples.Example;
import com.amazon.changepoint.pelt.PeltAlgorithm;
import com.amazon.changepoint.pelt.PeltOptions;
import com.amazon.changepoint.pelt.PeltPenaltySelector;
import com.amazon.changepoint.pelt.PenaltySelectionOptions;
import com.amazon.changepoint.returntypes.PenaltyDiagnostic;
import com.amazon.changepoint.returntypes.PenaltySelectionResult;
import com.amazon.changepoint.testutils.PiecewiseSignalTestData;
import com.amazon.changepoint.testutils.SignalWithChangePoints;

/**
 * Let the Bayesian information criterion pick the penalty for a Gaussian
 * likelihood cost, and print the score of every candidate of the sweep.
 */
public class GaussianPenaltySelection implements Example {

    public static void main(String[] args) throws Exception {
        new GaussianPenaltySelection().run();
    }

    @Override
    public String command() {
        return "bic";
    }

    @Override
    public String description() {
        return "select the penalty of a Gaussian likelihood segmentation with BIC";
    }

    @Override
    public void run() throws Exception {
        PiecewiseSignalTestData testData = new PiecewiseSignalTestData(200, 150, 250);
        SignalWithChangePoints data = testData.generateNormal(new double[] { 10, 13, 9 }, 1.0, 1, 42L);

        PeltAlgorithm pelt = new PeltAlgorithm(
                PeltOptions.builder().costFunction(new GaussianLikelihoodCostFunction()).minSize(5).build());
        PenaltySelectionOptions options = PenaltySelectionOptions.builder().method(PenaltySelectionMethod.BIC)
                .numPenaltySteps(25).parallelExecutionEnabled(true).build();

        PenaltySelectionResult result = new PeltPenaltySelector(pelt).fitAndSelect(data.univariate(), options);

        for (PenaltyDiagnostic diagnostic : result.getDiagnostics()) {
            System.out.printf("penalty = %10.3f, change points = %3d, %s = %.3f%n", diagnostic.getPenalty(),
                    diagnostic.getChangePointCount(), result.getMethod(), diagnostic.getScore());
        }
        System.out.printf("selected penalty = %.3f, change points = %s, true change points = %s%n",
                result.getSelectedPenalty(), Arrays.toString(result.getOptimalBreakpoints()),
                Arrays.toString(data.changePoints));
    }
}
