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

package com.amazon.changepoint.examples.segmentation;

import java.util.Arrays;

import com.amazon.changepoint.cost.L2CostFunction;
import com.amazon.changepoint.examples.Example;
import com.amazon.changepoint.pelt.PeltAlgorithm;
import com.amazon.changepoint.pelt.PeltOptions;
import com.amazon.changepoint.testutils.PiecewiseSignalTestData;
import com.amazon.changepoint.testutils.SignalWithChangePoints;

/**
 * Detect shifts of the mean of a noisy signal with the least squares cost, and
 * show how the penalty trades the number of change points against the fit.
 */
public class MeanShiftSegmentation implements Example {

    public static void main(String[] args) throws Exception {
        new MeanShiftSegmentation().run();
    }

    @Override
    public String command() {
        return "mean_shift";
    }

    @Override
    public String description() {
        return "detect mean shifts with the L2 cost for a range of penalties";
    }

    @Override
    public void run() throws Exception {
        PiecewiseSignalTestData testData = new PiecewiseSignalTestData(150, 100, 200, 50);
        SignalWithChangePoints data = testData.generateNormal(new double[] { 0, 4, -2, 3 }, 1.0, 1, 17L);

        PeltAlgorithm pelt = new PeltAlgorithm(
                PeltOptions.builder().costFunction(new L2CostFunction()).minSize(5).build());
        pelt.fit(data.univariate());

        System.out.printf("true change points = %s%n", Arrays.toString(data.changePoints));
        for (double penalty : new double[] { 1, 5, 20, 100, 1000 }) {
            int[] changePoints = pelt.detect(penalty);
            System.out.printf("penalty = %7.1f, %2d change points %s%n", penalty, changePoints.length,
                    Arrays.toString(changePoints));
        }
    }
}
