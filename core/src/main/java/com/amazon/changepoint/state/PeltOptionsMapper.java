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

import java.util.Optional;

import com.amazon.changepoint.config.CostFunctionType;
import com.amazon.changepoint.cost.ARCostFunction;
import com.amazon.changepoint.cost.ICostFunction;
import com.amazon.changepoint.cost.RBFCostFunction;
import com.amazon.changepoint.pelt.PeltOptions;

public class PeltOptionsMapper implements IStateMapper<PeltOptions, PeltOptionsState> {

    @Override
    public PeltOptionsState toState(PeltOptions model) {
        checkNotNull(model, "options must not be null");
        ICostFunction costFunction = model.getCostFunction();
        PeltOptionsState state = new PeltOptionsState();
        state.setCostFunctionType(CostFunctionType.of(costFunction).name());
        if (costFunction instanceof RBFCostFunction) {
            state.setGamma(((RBFCostFunction) costFunction).getGamma().orElse(null));
        } else if (costFunction instanceof ARCostFunction) {
            ARCostFunction autoregressive = (ARCostFunction) costFunction;
            state.setOrder(autoregressive.getOrder());
            state.setIncludeIntercept(autoregressive.isIncludeIntercept());
        }
        state.setMinSize(model.getMinSize());
        state.setJump(model.getJump());
        return state;
    }

    @Override
    public PeltOptions toModel(PeltOptionsState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(state.getCostFunctionType() != null, "the state does not name a cost function");
        CostFunctionType type = CostFunctionType.valueOf(state.getCostFunctionType());
        ICostFunction costFunction = type.newInstance(Optional.ofNullable(state.getGamma()),
                Optional.ofNullable(state.getOrder()));
        if (Boolean.FALSE.equals(state.getIncludeIntercept())) {
            checkArgument(type == CostFunctionType.AR, "includeIntercept only applies to the AR cost function");
            costFunction = new ARCostFunction(((ARCostFunction) costFunction).getOrder(), false);
        }
        return PeltOptions.builder().costFunction(costFunction).minSize(state.getMinSize()).jump(state.getJump())
                .build();
    }
}
