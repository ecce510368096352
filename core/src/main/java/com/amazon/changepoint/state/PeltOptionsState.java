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

import static com.amazon.changepoint.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

/**
 * The serializable form of {@link com.amazon.changepoint.pelt.PeltOptions}.
 * Only cost functions of the library can be represented; {@code gamma} is null
 * unless an RBF cost function has a fixed bandwidth, {@code order} and
 * {@code includeIntercept} are null unless the cost function is
 * autoregressive.
 */
@Data
public class PeltOptionsState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = V1_0;
    private String costFunctionType;
    private Double gamma;
    private Integer order;
    private Boolean includeIntercept;
    private int minSize;
    private int jump;
}
