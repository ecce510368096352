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

import java.util.Optional;

import lombok.Getter;

import com.amazon.changepoint.config.PenaltySelectionMethod;

/**
 * The configuration of a penalty sweep of {@link PeltPenaltySelector}.
 * Penalties are spaced logarithmically between the minimum and the maximum
 * penalty, both inclusive. A bound that is not set is estimated from the
 * length of the signal and the cost function.
 */
@Getter
public class PenaltySelectionOptions {

    public static final PenaltySelectionMethod DEFAULT_METHOD = PenaltySelectionMethod.BIC;

    public static final int DEFAULT_NUMBER_OF_PENALTY_STEPS = 50;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final PenaltySelectionMethod method;

    private final Optional<Double> minPenalty;

    private final Optional<Double> maxPenalty;

    private final int numPenaltySteps;

    /**
     * If true, the candidate penalties are evaluated in a private thread pool.
     */
    private final boolean parallelExecutionEnabled;

    /**
     * Number of threads of the pool when parallel execution is enabled. Defaults
     * to the number of available processors minus one, and at least one.
     */
    private final int threadPoolSize;

    protected PenaltySelectionOptions(Builder<?> builder) {
        this.method = builder.method;
        this.minPenalty = builder.minPenalty;
        this.maxPenalty = builder.maxPenalty;
        this.numPenaltySteps = builder.numPenaltySteps;
        this.parallelExecutionEnabled = builder.parallelExecutionEnabled;
        this.threadPoolSize = builder.threadPoolSize
                .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        protected PenaltySelectionMethod method = DEFAULT_METHOD;
        protected Optional<Double> minPenalty = Optional.empty();
        protected Optional<Double> maxPenalty = Optional.empty();
        protected int numPenaltySteps = DEFAULT_NUMBER_OF_PENALTY_STEPS;
        protected boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        protected Optional<Integer> threadPoolSize = Optional.empty();

        void validate() {
            checkNotNull(method, "method must not be null");
            minPenalty.ifPresent(
                    x -> checkArgument(x > 0 && Double.isFinite(x), "minPenalty must be positive and finite"));
            maxPenalty.ifPresent(
                    x -> checkArgument(x > 0 && Double.isFinite(x), "maxPenalty must be positive and finite"));
            if (minPenalty.isPresent() && maxPenalty.isPresent()) {
                checkArgument(maxPenalty.get() >= minPenalty.get(),
                        "maxPenalty must be greater than or equal to minPenalty");
            }
            checkArgument(numPenaltySteps >= 1, "numPenaltySteps must be at least 1");
            threadPoolSize.ifPresent(x -> checkArgument(x > 0, "threadPoolSize must be positive"));
            if (threadPoolSize.isPresent()) {
                checkArgument(parallelExecutionEnabled,
                        "threadPoolSize can only be set when parallel execution is enabled");
            }
        }

        public PenaltySelectionOptions build() {
            validate();
            return new PenaltySelectionOptions(this);
        }

        public T method(PenaltySelectionMethod method) {
            this.method = method;
            return (T) this;
        }

        public T minPenalty(double minPenalty) {
            this.minPenalty = Optional.of(minPenalty);
            return (T) this;
        }

        public T maxPenalty(double maxPenalty) {
            this.maxPenalty = Optional.of(maxPenalty);
            return (T) this;
        }

        public T numPenaltySteps(int numPenaltySteps) {
            this.numPenaltySteps = numPenaltySteps;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }
    }
}
