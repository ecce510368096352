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

package com.amazon.changepoint.pelt;

import static com.amazon.changepoint.CommonUtils.checkArgument;
import static com.amazon.changepoint.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.changepoint.cost.ICostFunction;
import com.amazon.changepoint.cost.L2CostFunction;

/**
 * The configuration of a {@link PeltAlgorithm}. Instances are immutable and are
 * created with {@link #builder()}.
 */
@Getter
public class PeltOptions {

    /**
     * Default minimum number of samples of a segment.
     */
    public static final int DEFAULT_MIN_SIZE = 1;

    /**
     * Default stride between candidate change points.
     */
    public static final int DEFAULT_JUMP = 1;

    /**
     * The cost function used to score segments. The options hold the instance
     * and the engine fits it, so one instance must not be shared between engines
     * that are used concurrently.
     */
    private final ICostFunction costFunction;

    /**
     * The minimum number of samples of a segment.
     */
    private final int minSize;

    /**
     * Candidate change points are the multiples of {@code jump}. A jump larger
     * than 1 trades exactness for speed.
     */
    private final int jump;

    protected PeltOptions(Builder<?> builder) {
        this.costFunction = builder.costFunction;
        this.minSize = builder.minSize;
        this.jump = builder.jump;
    }

    /**
     * @return a builder initialized with the L2 cost function, a minimum segment
     *         size of 1 and a jump of 1
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @return a builder initialized with the values of these options
     */
    public Builder<?> toBuilder() {
        return new Builder<>().costFunction(costFunction).minSize(minSize).jump(jump);
    }

    public static class Builder<T extends Builder<T>> {

        protected ICostFunction costFunction = new L2CostFunction();
        protected int minSize = DEFAULT_MIN_SIZE;
        protected int jump = DEFAULT_JUMP;

        void validate() {
            checkNotNull(costFunction, "costFunction must not be null");
            checkArgument(minSize >= 1, "minSize must be at least 1");
            checkArgument(jump >= 1, "jump must be at least 1");
        }

        public PeltOptions build() {
            validate();
            return new PeltOptions(this);
        }

        public T costFunction(ICostFunction costFunction) {
            this.costFunction = costFunction;
            return (T) this;
        }

        public T minSize(int minSize) {
            this.minSize = minSize;
            return (T) this;
        }

        public T jump(int jump) {
            this.jump = jump;
            return (T) this;
        }
    }
}
