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

package com.amazon.changepoint.serialize;

import static com.amazon.changepoint.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.changepoint.pelt.PeltOptions;
import com.amazon.changepoint.returntypes.PenaltySelectionResult;
import com.amazon.changepoint.state.PeltOptionsMapper;
import com.amazon.changepoint.state.PeltOptionsState;
import com.amazon.changepoint.state.PenaltySelectionResultMapper;
import com.amazon.changepoint.state.PenaltySelectionResultState;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * JSON serialization of segmentation configurations and penalty selection
 * results. Internally the mappers of the state package convert the model
 * objects into state objects, and
 * <a href="https://github.com/google/gson">Gson</a> writes the state objects as
 * JSON strings. The Gson instance is exposed so users can customize the output
 * (e.g., by enabling pretty printing); it must write special floating point
 * values, since failed penalty candidates carry NaN scores.
 */
@Getter
public class SegmentationSerDe {

    private final PeltOptionsMapper optionsMapper;
    private final PenaltySelectionResultMapper resultMapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization.
     */
    public SegmentationSerDe() {
        this(new GsonBuilder().serializeSpecialFloatingPointValues().create());
    }

    /**
     * Create a SerDe instance using the provided Gson object.
     *
     * @param gson A Gson instance that will be used to generate JSON for the
     *             state objects.
     */
    public SegmentationSerDe(Gson gson) {
        this.optionsMapper = new PeltOptionsMapper();
        this.resultMapper = new PenaltySelectionResultMapper();
        this.gson = checkNotNull(gson, "gson must not be null");
    }

    /**
     * Serializes segmentation options to a json string.
     *
     * @param options options whose cost function is one of the library
     * @return a json string
     */
    public String toJson(PeltOptions options) {
        return gson.toJson(optionsMapper.toState(options));
    }

    /**
     * Serializes a penalty selection result to a json string.
     *
     * @param result a penalty selection result
     * @return a json string
     */
    public String toJson(PenaltySelectionResult result) {
        return gson.toJson(resultMapper.toState(result));
    }

    /**
     * Deserializes options written by {@link #toJson(PeltOptions)}. The cost
     * function is a new, unfitted instance.
     *
     * @param json a json string
     * @return the options
     */
    public PeltOptions optionsFromJson(String json) {
        return optionsMapper.toModel(gson.fromJson(json, PeltOptionsState.class));
    }

    /**
     * Deserializes a result written by {@link #toJson(PenaltySelectionResult)}.
     *
     * @param json a json string
     * @return the result
     */
    public PenaltySelectionResult resultFromJson(String json) {
        return resultMapper.toModel(gson.fromJson(json, PenaltySelectionResultState.class));
    }
}
