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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.changepoint.config.PenaltySelectionMethod;
import com.amazon.changepoint.cost.ICostFunction;
import com.amazon.changepoint.cost.ILikelihoodCostFunction;
import com.amazon.changepoint.returntypes.PenaltyDiagnostic;
import com.amazon.changepoint.returntypes.PenaltySelectionResult;
import com.amazon.changepoint.util.ArrayUtils;

/**
 * Chooses the penalty of a {@link IPeltAlgorithm} with an information
 * criterion. The engine is fitted once, a range of penalties is swept, every
 * resulting segmentation is scored with the likelihood of its segments and its
 * number of parameters, and the penalty with the lowest score wins. Ties are
 * resolved in favor of fewer change points and then of the earlier candidate.
 *
 * The information criteria need the cost function of the engine to implement
 * {@link ILikelihoodCostFunction}.
 */
@Slf4j
public class PeltPenaltySelector {

    /**
     * scores closer than this are considered equal
     */
    public static final double SCORE_TOLERANCE = 1e-9;

    /**
     * parameter count per segment assumed when the cost function cannot tell
     */
    public static final int DEFAULT_SEGMENT_PARAMETER_COUNT = 2;

    public static final double MIN_ESTIMATED_PENALTY = 0.1;

    @Getter
    private final IPeltAlgorithm peltAlgorithm;

    public PeltPenaltySelector(IPeltAlgorithm peltAlgorithm) {
        checkNotNull(peltAlgorithm, "peltAlgorithm must not be null");
        PeltOptions options = checkNotNull(peltAlgorithm.getOptions(), "the options of the engine must not be null");
        checkNotNull(options.getCostFunction(), "the cost function of the engine must not be null");
        checkArgument(options.getMinSize() >= 1, "minSize must be at least 1");
        checkArgument(options.getJump() >= 1, "jump must be at least 1");
        this.peltAlgorithm = peltAlgorithm;
    }

    public PenaltySelectionResult fitAndSelect(double[] signal, PenaltySelectionOptions selectionOptions) {
        checkNotNull(signal, "signal must not be null");
        return fitAndSelect(new double[][] { signal }, selectionOptions);
    }

    /**
     * Fit the engine to the signal and select the penalty.
     *
     * @param signal           the signal, indexed by dimension and then by time
     * @param selectionOptions the sweep configuration
     * @return the selected penalty, its segmentation and the diagnostics of all
     *         candidates
     * @throws UnsupportedOperationException if the cost function of the engine
     *                                       does not support information criteria
     * @throws NoSuitablePenaltyException    if no candidate produced a finite
     *                                       score
     */
    public PenaltySelectionResult fitAndSelect(double[][] signal, PenaltySelectionOptions selectionOptions) {
        checkNotNull(signal, "signal must not be null");
        checkNotNull(selectionOptions, "selectionOptions must not be null");
        PenaltySelectionMethod method = selectionOptions.getMethod();
        ILikelihoodCostFunction likelihood = likelihoodOf(peltAlgorithm.getOptions().getCostFunction(), method);

        int signalLength = ArrayUtils.numberOfSamples(signal);
        peltAlgorithm.fit(signal);

        double minPenalty = selectionOptions.getMinPenalty()
                .orElseGet(() -> estimateMinPenalty(signalLength, likelihood));
        double maxPenalty = selectionOptions.getMaxPenalty().orElseGet(() -> estimateMaxPenalty(signalLength,
                minPenalty));
        double lower = minPenalty;
        if (lower > maxPenalty) {
            log.warn("estimated minimum penalty {} exceeds the maximum penalty {}, using the maximum", lower,
                    maxPenalty);
            lower = maxPenalty;
        }
        double[] penalties = generatePenalties(lower, maxPenalty, selectionOptions.getNumPenaltySteps());
        log.debug("sweeping {} penalties in [{}, {}] with {}", penalties.length, lower, maxPenalty, method);

        List<Candidate> candidates = evaluate(penalties, signalLength, method, likelihood, selectionOptions);

        Candidate best = null;
        for (Candidate candidate : candidates) {
            if (!Double.isFinite(candidate.score)) {
                continue;
            }
            if (best == null || candidate.score < best.score - SCORE_TOLERANCE) {
                best = candidate;
            } else if (Math.abs(candidate.score - best.score) <= SCORE_TOLERANCE
                    && candidate.changePoints.length < best.changePoints.length) {
                best = candidate;
            }
        }
        List<PenaltyDiagnostic> diagnostics = candidates.stream().map(Candidate::toDiagnostic)
                .collect(Collectors.toList());
        if (best == null) {
            log.error("no suitable penalty among {} candidates in [{}, {}]", penalties.length, lower, maxPenalty);
            throw new NoSuitablePenaltyException("Could not find a suitable penalty. All tested penalties in ["
                    + lower + ", " + maxPenalty + "] resulted in errors, invalid segmentations, or infinite/NaN "
                    + method + " scores. Diagnostics: " + diagnostics);
        }
        log.info("selected penalty {} with {} score {} and {} change point(s)", best.penalty, method, best.score,
                best.changePoints.length);
        return new PenaltySelectionResult(best.penalty, best.score, best.changePoints, method, diagnostics);
    }

    private List<Candidate> evaluate(double[] penalties, int signalLength, PenaltySelectionMethod method,
            ILikelihoodCostFunction likelihood, PenaltySelectionOptions selectionOptions) {
        if (!selectionOptions.isParallelExecutionEnabled()) {
            List<Candidate> candidates = new ArrayList<>(penalties.length);
            for (double penalty : penalties) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("penalty selection interrupted");
                }
                candidates.add(evaluate(penalty, signalLength, method, likelihood));
            }
            return candidates;
        }
        ForkJoinPool forkJoinPool = new ForkJoinPool(selectionOptions.getThreadPoolSize());
        try {
            return forkJoinPool.submit(() -> IntStream.range(0, penalties.length).parallel()
                    .mapToObj(i -> evaluate(penalties[i], signalLength, method, likelihood))
                    .collect(Collectors.toList())).join();
        } finally {
            forkJoinPool.shutdown();
        }
    }

    private Candidate evaluate(double penalty, int signalLength, PenaltySelectionMethod method,
            ILikelihoodCostFunction likelihood) {
        int[] changePoints;
        try {
            changePoints = peltAlgorithm.detect(penalty);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("segmentation failed for penalty {}", penalty, e);
            return new Candidate(penalty, Double.NaN, null);
        }
        double score = score(changePoints, signalLength, method, likelihood);
        log.debug("penalty {} gives {} change point(s) with {} score {}", penalty, changePoints.length, method,
                score);
        return new Candidate(penalty, score, changePoints);
    }

    /**
     * The information criterion of a segmentation.
     *
     * @param changePoints the change points, increasing
     * @param signalLength the number of samples
     * @param method       the criterion
     * @param likelihood   the fitted likelihood cost function
     * @return the score, or positive infinity if a segment is shorter than the
     *         minimum size or its likelihood is not a finite number
     */
    double score(int[] changePoints, int signalLength, PenaltySelectionMethod method,
            ILikelihoodCostFunction likelihood) {
        int minSize = peltAlgorithm.getOptions().getMinSize();
        double metric = 0;
        double parameters = 0;
        int start = 0;
        for (int i = 0; i <= changePoints.length; i++) {
            int end = (i < changePoints.length) ? changePoints[i] : signalLength;
            if (end - start < minSize) {
                log.warn("segment [{}, {}) is shorter than the minimum size {}", start, end, minSize);
                return Double.POSITIVE_INFINITY;
            }
            double segmentMetric;
            try {
                segmentMetric = likelihood.computeLikelihoodMetric(start, end);
                parameters += likelihood.getSegmentParameterCount(end - start);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("likelihood of segment [{}, {}) failed", start, end, e);
                return Double.POSITIVE_INFINITY;
            }
            if (!Double.isFinite(segmentMetric)) {
                log.warn("likelihood of segment [{}, {}) is {}", start, end, segmentMetric);
                return Double.POSITIVE_INFINITY;
            }
            metric += segmentMetric;
            start = end;
        }
        return method.score(metric, parameters + changePoints.length, signalLength);
    }

    /**
     * Penalties spaced logarithmically from {@code minPenalty} to
     * {@code maxPenalty}, both included.
     *
     * @param minPenalty smallest penalty, positive
     * @param maxPenalty largest penalty, at least {@code minPenalty}
     * @param steps      number of penalties, at least 1; a single step yields
     *                   {@code minPenalty}
     * @return the penalties in increasing order
     */
    public static double[] generatePenalties(double minPenalty, double maxPenalty, int steps) {
        checkArgument(minPenalty > 0 && Double.isFinite(minPenalty), "minPenalty must be positive and finite");
        checkArgument(maxPenalty >= minPenalty && Double.isFinite(maxPenalty),
                "maxPenalty must be finite and at least minPenalty");
        checkArgument(steps >= 1, "steps must be at least 1");
        if (steps == 1) {
            return new double[] { minPenalty };
        }
        double[] penalties = new double[steps];
        double ratio = maxPenalty / minPenalty;
        for (int i = 0; i < steps - 1; i++) {
            penalties[i] = minPenalty * Math.pow(ratio, (double) i / (steps - 1));
        }
        penalties[steps - 1] = maxPenalty;
        return penalties;
    }

    /**
     * A lower bound for the sweep when none is configured:
     * {@code k * ln(max(2, N))} for the number {@code k} of parameters of a
     * typical segment, and at least {@code MIN_ESTIMATED_PENALTY}.
     */
    double estimateMinPenalty(int signalLength, ILikelihoodCostFunction likelihood) {
        int minSize = peltAlgorithm.getOptions().getMinSize();
        int sampleLength = Math.max(minSize, Math.min(signalLength, 10));
        int parameters = DEFAULT_SEGMENT_PARAMETER_COUNT;
        try {
            int count = likelihood.getSegmentParameterCount(sampleLength);
            if (count > 0) {
                parameters = count;
            }
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("could not obtain the parameter count of a segment, assuming {}", parameters, e);
        }
        return Math.max(MIN_ESTIMATED_PENALTY, parameters * Math.log(Math.max(2, signalLength)));
    }

    /**
     * An upper bound for the sweep when none is configured:
     * {@code max(N ln N, 20 * minPenalty)}, and strictly above
     * {@code minPenalty}.
     */
    static double estimateMaxPenalty(int signalLength, double minPenalty) {
        double estimate = Math.max(signalLength * Math.log(Math.max(1, signalLength)), 20 * minPenalty);
        return Math.max(estimate, Math.max(1, 1.1 * minPenalty + 1));
    }

    private static ILikelihoodCostFunction likelihoodOf(ICostFunction costFunction, PenaltySelectionMethod method) {
        if (!(costFunction instanceof ILikelihoodCostFunction)) {
            throw new UnsupportedOperationException(method + " needs a cost function implementing "
                    + ILikelihoodCostFunction.class.getSimpleName() + ", " + costFunction.getClass().getSimpleName()
                    + " does not");
        }
        ILikelihoodCostFunction likelihood = (ILikelihoodCostFunction) costFunction;
        if (!likelihood.supportsInformationCriteria()) {
            throw new UnsupportedOperationException(
                    costFunction.getClass().getSimpleName() + " does not support information criteria");
        }
        return likelihood;
    }

    private static class Candidate {
        private final double penalty;
        private final double score;
        private final int[] changePoints;

        Candidate(double penalty, double score, int[] changePoints) {
            this.penalty = penalty;
            this.score = score;
            this.changePoints = changePoints;
        }

        PenaltyDiagnostic toDiagnostic() {
            return new PenaltyDiagnostic(penalty, score, changePoints == null ? -1 : changePoints.length);
        }
    }
}
