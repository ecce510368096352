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

package com.amazon.changepoint.examples.serialization;

import java.util.Arrays;

import com.amazon.changepoint.config.PenaltySelectionMethod;
import com.amazon.changepoint.cost.GaussianLikelihoodCostFunction;
import com.amazon.changepoint.examples.Example;
import com.amazon.changepoint.pelt.PeltAlgorithm;
import com.amazon.changepoint.pelt.PeltOptions;
import com.amazon.changepoint.pelt.PeltPenaltySelector;
import com.amazon.changepoint.pelt.PenaltySelectionOptions;
import com.amazon.changepoint.returntypes.PenaltySelectionResult;
import com.amazon.changepoint.serialize.SegmentationSerDe;
import com.amazon.changepoint.testutils.PiecewiseSignalTestData;
import com.amazon.changepoint.testutils.SignalWithChangePoints;
import com.google.gson.GsonBuilder;

/**
 * Serialize a segmentation configuration and a selection result to JSON using
 * <a href="https://github.com/google/gson">Gson</a>, then rebuild the engine
 * from the saved configuration and reproduce the segmentation.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "serialize segmentation options and a penalty selection result as JSON strings";
    }

    @Override
    public void run() throws Exception {
        SignalWithChangePoints data = new PiecewiseSignalTestData(80, 80).generateNormal(new double[] { 0, 2 }, 1.0,
                1, 3L);
        PeltOptions options = PeltOptions.builder().costFunction(new GaussianLikelihoodCostFunction()).minSize(4)
                .build();
        PenaltySelectionResult result = new PeltPenaltySelector(new PeltAlgorithm(options)).fitAndSelect(
                data.univariate(),
                PenaltySelectionOptions.builder().method(PenaltySelectionMethod.AIC).numPenaltySteps(10).build());

        SegmentationSerDe serDe = new SegmentationSerDe(
                new GsonBuilder().serializeSpecialFloatingPointValues().setPrettyPrinting().create());
        String optionsJson = serDe.toJson(options);
        String resultJson = serDe.toJson(result);
        System.out.println(optionsJson);
        System.out.printf("result JSON size = %d bytes%n", resultJson.getBytes().length);

        // the restored options hold a fresh cost function, so the engine is fitted again
        PeltOptions restored = serDe.optionsFromJson(optionsJson);
        int[] changePoints = new PeltAlgorithm(restored).fitAndDetect(data.univariate(),
                serDe.resultFromJson(resultJson).getSelectedPenalty());
        System.out.printf("selected = %s, reproduced = %s%n", Arrays.toString(result.getOptimalBreakpoints()),
                Arrays.toString(changePoints));
    }
}
