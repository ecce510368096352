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

import static com.amazon.changepoint.CommonUtils.checkArgument;
import static com.amazon.changepoint.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Order statistics over arrays of doubles.
 */
public class Quantiles {

    private Quantiles() {
    }

    /**
     * The median of all the values. For an even number of values this is the
     * average of the two middle values. The input is not modified.
     *
     * @param values the values
     * @return the median
     */
    public static double median(double[] values) {
        checkNotNull(values, "values must not be null");
        return median(values, 0, values.length);
    }

    /**
     * The median of {@code values[from]} to {@code values[to - 1]}. The input is
     * not modified.
     *
     * @param values the values
     * @param from   first index, inclusive
     * @param to     last index, exclusive
     * @return the median of the range
     */
    public static double median(double[] values, int from, int to) {
        checkNotNull(values, "values must not be null");
        checkArgument(0 <= from && from < to && to <= values.length, "incorrect range for a median");
        double[] sorted = Arrays.copyOfRange(values, from, to);
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[middle];
        }
        return 0.5 * (sorted[middle - 1] + sorted[middle]);
    }
}
