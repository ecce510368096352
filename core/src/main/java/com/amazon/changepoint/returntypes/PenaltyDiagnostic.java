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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The outcome of one candidate penalty of a sweep. A candidate whose
 * segmentation failed has a NaN score and a change point count of -1; a
 * candidate with an invalid segmentation has an infinite score.
 */
@Getter
@AllArgsConstructor
public class PenaltyDiagnostic {

    private final double penalty;

    private final double score;

    private final int changePointCount;

    /**
     * @return true if the segmentation for this penalty failed
     */
    public boolean isFailed() {
        return changePointCount < 0;
    }

    @Override
    public String toString() {
        return "PenaltyDiagnostic(penalty=" + penalty + ", score=" + score + ", changePointCount="
                + changePointCount + ")";
    }
}
