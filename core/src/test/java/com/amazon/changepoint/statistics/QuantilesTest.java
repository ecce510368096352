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

package com.amazon.changepoint.statistics;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class QuantilesTest {

    @Test
    public void testMedian() {
        assertEquals(3.0, Quantiles.median(new double[] { 5, 1, 3 }));
        assertEquals(2.5, Quantiles.median(new double[] { 4, 1, 3, 2 }));
        assertEquals(7.0, Quantiles.median(new double[] { 7 }));
    }

    @Test
    public void testMedianOfRange() {
        double[] values = new double[] { 100, 5, 1, 3, -100 };
        assertEquals(3.0, Quantiles.median(values, 1, 4));
        assertArrayEquals(new double[] { 100, 5, 1, 3, -100 }, values, 0.0);
    }

    @Test
    public void testInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> Quantiles.median(new double[0]));
        assertThrows(IllegalArgumentException.class, () -> Quantiles.median(new double[] { 1, 2 }, 1, 3));
        assertThrows(NullPointerException.class, () -> Quantiles.median(null));
    }
}
