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

package com.amazon.changepoint.testutils;

/**
 * A generated signal together with the change points it was generated with.
 * The signal is indexed by dimension and then by time.
 */
public class SignalWithChangePoints {
    public double[][] signal;
    public int[] changePoints;

    public SignalWithChangePoints(double[][] signal, int[] changePoints) {
        this.signal = signal;
        this.changePoints = changePoints;
    }

    /**
     * @return the first dimension of the signal
     */
    public double[] univariate() {
        return signal[0];
    }
}
