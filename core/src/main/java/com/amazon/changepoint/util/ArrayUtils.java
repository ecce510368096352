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

package com.amazon.changepoint.util;

import static com.amazon.changepoint.CommonUtils.checkArgument;
import static com.amazon.changepoint.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * A utility class for signal arrays. Multivariate signals are laid out as
 * {@code double[dimension][time]}.
 */
public class ArrayUtils {

    private ArrayUtils() {
    }

    /**
     * Returns a clean deep copy of the series. Current clean-ups include changing
     * negative zero -0.0 to positive zero 0.0.
     *
     * @param series The original series.
     * @return a clean deep copy of the original series.
     */
    public static double[] cleanCopy(double[] series) {
        double[] seriesCopy = Arrays.copyOf(series, series.length);
        for (int i = 0; i < series.length; i++) {
            if (seriesCopy[i] == 0.0) {
                seriesCopy[i] = 0.0;
            }
        }
        return seriesCopy;
    }

    /**
     * Returns a clean deep copy of a multivariate signal after checking that
     * every dimension holds the same number of samples.
     *
     * @param signal the signal, indexed by dimension and then by time
     * @return a clean deep copy of the signal
     * @throws NullPointerException     if the signal or one of its rows is null
     * @throws IllegalArgumentException if the rows have different lengths
     */
    public static double[][] cleanCopy(double[][] signal) {
        checkNotNull(signal, "signal must not be null");
        double[][] copy = new double[signal.length][];
        for (int i = 0; i < signal.length; i++) {
            checkNotNull(signal[i], "dimension " + i + " of the signal must not be null");
            checkArgument(signal[i].length == signal[0].length, "every dimension of the signal must have "
                    + signal[0].length + " samples, dimension " + i + " has " + signal[i].length);
            copy[i] = cleanCopy(signal[i]);
        }
        return copy;
    }

    /**
     * @param signal a signal indexed by dimension and then by time
     * @return the number of samples of the signal, 0 for a signal without
     *         dimensions
     */
    public static int numberOfSamples(double[][] signal) {
        return signal.length == 0 ? 0 : signal[0].length;
    }

    /**
     * Converts rows of observations, one array per time step, into a signal
     * indexed by dimension and then by time.
     *
     * @param rows the observations in time order
     * @return the transposed signal
     */
    public static double[][] transpose(double[][] rows) {
        checkNotNull(rows, "rows must not be null");
        if (rows.length == 0) {
            return new double[0][0];
        }
        int dimensions = rows[0].length;
        double[][] signal = new double[dimensions][rows.length];
        for (int t = 0; t < rows.length; t++) {
            checkArgument(rows[t].length == dimensions,
                    "row " + t + " has " + rows[t].length + " values, expected " + dimensions);
            for (int d = 0; d < dimensions; d++) {
                signal[d][t] = rows[t][d];
            }
        }
        return signal;
    }
}
