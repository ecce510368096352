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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class LikelihoodCostFunctionTest {

    @Test
    public void testGaussian() {
        GaussianLikelihoodCostFunction costFunction = new GaussianLikelihoodCostFunction();
        costFunction.fit(new double[] { 1, 2, 3, 4 });
        assertEquals(4 * Math.log(1.25), costFunction.computeLikelihoodMetric(0, 4), 1e-12);
        assertEquals(costFunction.computeLikelihoodMetric(0, 4), costFunction.computeCost(0, 4), 0.0);
        assertEquals(2, costFunction.getSegmentParameterCount(4));
        assertTrue(costFunction.supportsInformationCriteria());
    }

    @Test
    public void testGaussianVarianceFloor() {
        GaussianLikelihoodCostFunction costFunction = new GaussianLikelihoodCostFunction();
        costFunction.fit(new double[] { 0.1, 0.1, 0.1 });
        assertEquals(3 * Math.log(GaussianLikelihoodCostFunction.MIN_VARIANCE),
                costFunction.computeLikelihoodMetric(0, 3), 1e-9);
    }

    @Test
    public void testGaussianMultivariate() {
        GaussianLikelihoodCostFunction costFunction = new GaussianLikelihoodCostFunction();
        costFunction.fit(new double[][] { { 1, 2, 3, 4 }, { 2, 4, 6, 8 } });
        assertEquals(4 * Math.log(1.25) + 4 * Math.log(5.0), costFunction.computeLikelihoodMetric(0, 4), 1e-9);
        assertEquals(4, costFunction.getSegmentParameterCount(4));
    }

    @Test
    public void testPoisson() {
        PoissonLikelihoodCostFunction costFunction = new PoissonLikelihoodCostFunction();
        costFunction.fit(new double[] { 1, 2, 3, 0, 0 });
        assertEquals(12 - 12 * Math.log(2), costFunction.computeLikelihoodMetric(0, 3), 1e-12);
        assertEquals(0.0, costFunction.computeLikelihoodMetric(3, 5));
        assertEquals(1, costFunction.getSegmentParameterCount(5));
    }

    @Test
    public void testPoissonRejectsNegativeCounts() {
        PoissonLikelihoodCostFunction costFunction = new PoissonLikelihoodCostFunction();
        assertThrows(IllegalArgumentException.class, () -> costFunction.fit(new double[] { 1, -1, 2 }));
        costFunction.fit(new double[] { -1e-12, 0, 0 });
        assertEquals(0.0, costFunction.computeLikelihoodMetric(0, 3));
    }

    @Test
    public void testBernoulli() {
        BernoulliLikelihoodCostFunction costFunction = new BernoulliLikelihoodCostFunction();
        costFunction.fit(new double[] { 1, 0, 1, 0, 1, 1 });
        assertEquals(8 * Math.log(2), costFunction.computeLikelihoodMetric(0, 4), 1e-12);
        assertEquals(0.0, costFunction.computeLikelihoodMetric(4, 6));
        assertEquals(1, costFunction.getSegmentParameterCount(6));
    }

    @Test
    public void testBernoulliRejectsOtherValues() {
        BernoulliLikelihoodCostFunction costFunction = new BernoulliLikelihoodCostFunction();
        assertThrows(IllegalArgumentException.class, () -> costFunction.fit(new double[] { 0, 0.5, 1 }));
        costFunction.fit(new double[] { 1 + 1e-12, 1, 1 });
        assertEquals(0.0, costFunction.computeLikelihoodMetric(0, 3));
    }

    @Test
    public void testSplittingNeverIncreasesMetric() {
        GaussianLikelihoodCostFunction costFunction = new GaussianLikelihoodCostFunction();
        costFunction.fit(new double[] { 0.2, -0.4, 0.1, 0.3, 5.2, 4.8, 5.1, 4.7 });
        double whole = costFunction.computeLikelihoodMetric(0, 8);
        double split = costFunction.computeLikelihoodMetric(0, 4) + costFunction.computeLikelihoodMetric(4, 8);
        assertTrue(split < whole);
    }
}
