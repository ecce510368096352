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


package com.amazon.changepoint.cost;

import static com.amazon.changepoint.CommonUtils.checkArgument;
import static com.amazon.changepoint.CommonUtils.checkSegmentLength;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

import com.amazon.changepoint.util.ArrayUtils;

/**
 * Autoregressive cost. Every segment and dimension gets its own AR(p) model
 *
 * <pre>
 * y[t] = c + a_1 * y[t - 1] + ... + a_p * y[t - p] + e[t]
 * </pre>
 *
 * fitted by ordinary least squares on the {@code n - p} equations the segment
 * provides; the intercept {@code c} is optional. The cost of a segment is the
 * residual sum of squares summed over the dimensions, so the cost function
 * reacts to changes in the dynamics of a signal rather than only to shifts of
 * its level.
 *
 * A segment must hold enough samples to form the equations and to determine
 * the coefficients, see {@link #getMinimumSegmentLength()}. A fit that cannot
 * be determined (a constant segment with an intercept, a singular design)
 * costs {@code +Infinity}.
 */
@Slf4j
public class ARCostFunction extends AbstractCostFunction implements ILikelihoodCostFunction {

    public static final int DEFAULT_ORDER = 1;

    /**
     * residual variance below which the likelihood of a segment is unbounded
     */
    public static final double MIN_VARIANCE = 1e-10;

    /**
     * diagonal elements of R below this value mark the design as singular
     */
    public static final double SINGULARITY_THRESHOLD = 1e-12;

    @Getter
    private final int order;

    @Getter
    private final boolean includeIntercept;

    private double[][] signal;

    public ARCostFunction() {
        this(DEFAULT_ORDER);
    }

    public ARCostFunction(int order) {
        this(order, true);
    }

    /**
     * @param order            number of lags, at least 1
     * @param includeIntercept whether every segment model has an intercept
     */
    public ARCostFunction(int order, boolean includeIntercept) {
        checkArgument(order >= 1, "order must be at least 1");
        this.order = order;
        this.includeIntercept = includeIntercept;
    }

    /**
     * @return the fewest samples a segment must hold: {@code p + 1} to form one
     *         equation, and at least as many equations as coefficients
     */
    public int getMinimumSegmentLength() {
        return Math.max(order + 1, includeIntercept ? 2 * order + 1 : 2 * order);
    }

    @Override
    protected void initialize(double[][] signal) {
        int length = ArrayUtils.numberOfSamples(signal);
        checkArgument(length == 0 || length > order, "an AR(" + order + ") model needs at least " + (order + 1)
                + " samples, the signal has " + length);
        for (int d = 0; d < signal.length; d++) {
            for (int i = 0; i < length; i++) {
                checkArgument(Double.isFinite(signal[d][i]),
                        "AR data must be finite, found " + signal[d][i] + " at index " + i + " of dimension " + d);
            }
        }
        this.signal = signal;
    }

    @Override
    protected void checkSegment(int start, int end) {
        super.checkSegment(start, end);
        checkSegmentLength(start, end, getMinimumSegmentLength());
    }

    @Override
    protected double segmentCost(int start, int end) {
        double cost = 0;
        for (int d = 0; d < numberOfDimensions; d++) {
            cost += residualSumOfSquares(d, start, end);
        }
        return cost;
    }

    /**
     * {@code (n - p) * log(RSS / (n - p))} summed over the dimensions, the
     * Gaussian {@code -2 log L} of the residuals up to an additive constant.
     * Segments whose residual variance vanishes get {@code +Infinity}.
     */
    @Override
    public double computeLikelihoodMetric(int start, int end) {
        checkSegment(start, end);
        int equations = end - start - order;
        double metric = 0;
        for (int d = 0; d < numberOfDimensions; d++) {
            double variance = residualSumOfSquares(d, start, end) / equations;
            if (!Double.isFinite(variance) || variance < MIN_VARIANCE) {
                return Double.POSITIVE_INFINITY;
            }
            metric += equations * Math.log(variance);
        }
        return Double.isFinite(metric) ? metric : Double.POSITIVE_INFINITY;
    }

    /**
     * The coefficients, the intercept when there is one and the residual
     * variance of every dimension.
     */
    @Override
    public int getSegmentParameterCount(int segmentLength) {
        return (order + (includeIntercept ? 1 : 0) + 1) * Math.max(1, numberOfDimensions);
    }

    @Override
    public boolean supportsInformationCriteria() {
        return true;
    }

    double residualSumOfSquares(int dimension, int start, int end) {
        if (includeIntercept && isConstant(dimension, start, end)) {
            return Double.POSITIVE_INFINITY;
        }
        double[] series = signal[dimension];
        int equations = end - start - order;
        int predictors = includeIntercept ? order + 1 : order;
        double[][] design = new double[equations][predictors];
        double[] target = new double[equations];
        for (int i = 0; i < equations; i++) {
            int t = start + order + i;
            target[i] = series[t];
            int column = 0;
            if (includeIntercept) {
                design[i][column++] = 1.0;
            }
            for (int lag = 1; lag <= order; lag++) {
                design[i][column++] = series[t - lag];
            }
        }

        RealMatrix x = new Array2DRowRealMatrix(design, false);
        RealVector y = new ArrayRealVector(target, false);
        try {
            RealVector coefficients = new QRDecomposition(x, SINGULARITY_THRESHOLD).getSolver().solve(y);
            RealVector residuals = y.subtract(x.operate(coefficients));
            double rss = residuals.dotProduct(residuals);
            return Double.isFinite(rss) ? rss : Double.POSITIVE_INFINITY;
        } catch (SingularMatrixException e) {
            log.debug("singular AR({}) design for segment [{}, {}) of dimension {}", order, start, end, dimension);
            return Double.POSITIVE_INFINITY;
        }
    }
}
