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

package com.amazon.changepoint.returntypes;

import static com.amazon.changepoint.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.changepoint.config.PenaltySelectionMethod;

/**
 * The result of a penalty sweep: the selected penalty, its segmentation and
 * the diagnostics of every candidate in sweep order.
 */
public class PenaltySelectionResult {

    @Getter
    private final double selectedPenalty;

    @Getter
    private final double selectedScore;

    private final int[] optimalBreakpoints;

    @Getter
    private final PenaltySelectionMethod method;

    @Getter
    private final List<PenaltyDiagnostic> diagnostics;

    public PenaltySelectionResult(double selectedPenalty, double selectedScore, int[] optimalBreakpoints,
            PenaltySelectionMethod method, List<PenaltyDiagnostic> diagnostics) {
        checkNotNull(optimalBreakpoints, "optimalBreakpoints must not be null");
        checkNotNull(method, "method must not be null");
        checkNotNull(diagnostics, "diagnostics must not be null");
        this.selectedPenalty = selectedPenalty;
        this.selectedScore = selectedScore;
        this.optimalBreakpoints = Arrays.copyOf(optimalBreakpoints, optimalBreakpoints.length);
        this.method = method;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    /**
     * @return the change points of the selected segmentation, in increasing
     *         order
     */
    public int[] getOptimalBreakpoints() {
        return Arrays.copyOf(optimalBreakpoints, optimalBreakpoints.length);
    }
}
