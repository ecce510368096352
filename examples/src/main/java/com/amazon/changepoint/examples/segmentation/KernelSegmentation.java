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

import com.amazon.changepoint.cost.RBFCostFunction;
import com.amazon.changepoint.examples.Example;
import com.amazon.changepoint.pelt.PeltAlgorithm;
import com.amazon.changepoint.pelt.PeltOptions;
import com.amazon.changepoint.testutils.PiecewiseSignalTestData;
import com.amazon.changepoint.testutils.SignalWithChangePoints;

/**
 * Segment a two dimensional signal with the RBF kernel cost, which reacts to
 * changes of the whole distribution rather than only of the mean. A jump
 * larger than one restricts the change points to a coarser grid.
 */
public class KernelSegmentation implements Example {

    public static void main(String[] args) throws Exception {
        new KernelSegmentation().run();
    }

    @Override
    public String command() {
        return "kernel";
    }

    @Override
    public String description() {
        return "segment a multivariate signal with the RBF cost";
    }

    @Override
    public void run() throws Exception {
        PiecewiseSignalTestData testData = new PiecewiseSignalTestData(120, 80, 100);
        SignalWithChangePoints data = testData.generateNormal(new double[] { 0, 3, 0.5 }, 0.5, 2, 5L);
        RBFCostFunction costFunction = new RBFCostFunction();

        for (int jump : new int[] { 1, 5, 10 }) {
            PeltAlgorithm pelt = new PeltAlgorithm(
                    PeltOptions.builder().costFunction(costFunction).minSize(10).jump(jump).build());
            long start = System.nanoTime();
            int[] changePoints = pelt.fitAndDetect(data.signal, 5.0);
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            System.out.printf("jump = %2d, change points = %s (%d ms)%n", jump, Arrays.toString(changePoints),
                    elapsed);
        }
        System.out.printf("true change points = %s, estimated gammas = %s%n", Arrays.toString(data.changePoints),
                Arrays.toString(costFunction.getFittedGammas()));
    }
}
