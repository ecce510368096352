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

package com.amazon.changepoint.state;

import static com.amazon.changepoint.CommonUtils.checkArgument;
import static com.amazon.changepoint.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.amazon.changepoint.config.PenaltySelectionMethod;
import com.amazon.changepoint.returntypes.PenaltyDiagnostic;
import com.amazon.changepoint.returntypes.PenaltySelectionResult;

public class PenaltySelectionResultMapper implements IStateMapper<PenaltySelectionResult, PenaltySelectionResultState> {

    @Override
    public PenaltySelectionResultState toState(PenaltySelectionResult model) {
        checkNotNull(model, "result must not be null");
        List<PenaltyDiagnostic> diagnostics = model.getDiagnostics();
        double[] penalties = new double[diagnostics.size()];
        double[] scores = new double[diagnostics.size()];
        int[] changePointCounts = new int[diagnostics.size()];
        for (int i = 0; i < diagnostics.size(); i++) {
            penalties[i] = diagnostics.get(i).getPenalty();
            scores[i] = diagnostics.get(i).getScore();
            changePointCounts[i] = diagnostics.get(i).getChangePointCount();
        }
        PenaltySelectionResultState state = new PenaltySelectionResultState();
        state.setMethod(model.getMethod().name());
        state.setSelectedPenalty(model.getSelectedPenalty());
        state.setSelectedScore(model.getSelectedScore());
        state.setOptimalBreakpoints(model.getOptimalBreakpoints());
        state.setPenalties(penalties);
        state.setScores(scores);
        state.setChangePointCounts(changePointCounts);
        return state;
    }

    @Override
    public PenaltySelectionResult toModel(PenaltySelectionResultState state) {
        checkNotNull(state, "state must not be null");
        checkNotNull(state.getPenalties(), "penalties must not be null");
        checkNotNull(state.getScores(), "scores must not be null");
        checkNotNull(state.getChangePointCounts(), "changePointCounts must not be null");
        int count = state.getPenalties().length;
        checkArgument(state.getScores().length == count && state.getChangePointCounts().length == count,
                "incorrect diagnostics, every column must have the same length");
        List<PenaltyDiagnostic> diagnostics = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            diagnostics.add(new PenaltyDiagnostic(state.getPenalties()[i], state.getScores()[i],
                    state.getChangePointCounts()[i]));
        }
        return new PenaltySelectionResult(state.getSelectedPenalty(), state.getSelectedScore(),
                state.getOptimalBreakpoints(), PenaltySelectionMethod.valueOf(state.getMethod()), diagnostics);
    }
}
