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

package com.amazon.changepoint.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

import lombok.extern.slf4j.Slf4j;

import com.amazon.changepoint.config.PenaltySelectionMethod;
import com.amazon.changepoint.pelt.IPeltAlgorithm;
import com.amazon.changepoint.pelt.PeltAlgorithm;
import com.amazon.changepoint.pelt.PeltOptions;
import com.amazon.changepoint.pelt.PeltPenaltySelector;
import com.amazon.changepoint.pelt.PenaltySelectionOptions;
import com.amazon.changepoint.returntypes.PenaltySelectionResult;
import com.amazon.changepoint.util.ArrayUtils;

/**
 * Segments the rows read from the input and writes every row back followed by
 * the index of its segment. Each column is one dimension of the signal. The
 * whole input is read before the first output row is written.
 */
@Slf4j
public class SegmentationRunner {

    public static final String SEGMENT_COLUMN = "segment";

    protected final ArgumentParser argumentParser;
    protected IPeltAlgorithm algorithm;
    protected final List<String[]> lines = new ArrayList<>();
    protected final List<double[]> points = new ArrayList<>();
    protected int dimensions;
    protected int lineNumber;

    public SegmentationRunner() {
        this(new ArgumentParser(SegmentationRunner.class.getName(),
                "Segment the input rows with PELT and append the segment index to the output rows."));
    }

    public SegmentationRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        SegmentationRunner runner = new SegmentationRunner();
        runner.parse(args);
        System.out.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        System.out.println("Done.");
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            String[] values = line.split(argumentParser.getDelimiter());

            if (algorithm == null) {
                prepareAlgorithm(values.length);
            }

            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                writeHeader(values, out);
                continue;
            }

            processLine(values);
        }

        finish(out);
        out.flush();
    }

    protected void prepareAlgorithm(int dimensions) {
        this.dimensions = dimensions;
        PeltOptions options = PeltOptions.builder()
                .costFunction(argumentParser.getCostFunction()
                        .newInstance(argumentParser.getGamma(), argumentParser.getOrder()))
                .minSize(argumentParser.getMinSize()).jump(argumentParser.getJump()).build();
        algorithm = new PeltAlgorithm(options);
    }

    protected void writeHeader(String[] values, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        joiner.add(SEGMENT_COLUMN);
        out.println(joiner.toString());
    }

    protected void processLine(String[] values) {
        if (values.length != dimensions) {
            throw new IllegalArgumentException(
                    String.format("Wrong number of values on line %d. Expected %d but found %d.", lineNumber,
                            dimensions, values.length));
        }

        double[] point = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            point[i] = Double.parseDouble(values[i]);
        }
        lines.add(values);
        points.add(point);
    }

    protected void finish(PrintWriter out) {
        if (points.isEmpty()) {
            return;
        }
        int[] changePoints = segment(ArrayUtils.transpose(points.toArray(new double[0][])));
        int segment = 0;
        for (int t = 0; t < lines.size(); t++) {
            while (segment < changePoints.length && changePoints[segment] <= t) {
                segment++;
            }
            StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
            Arrays.stream(lines.get(t)).forEach(joiner::add);
            joiner.add(Integer.toString(segment));
            out.println(joiner.toString());
        }
    }

    /**
     * @param signal the signal read from the input
     * @return the change points, with the fixed penalty or the selected one
     */
    protected int[] segment(double[][] signal) {
        Optional<PenaltySelectionMethod> method = argumentParser.getSelectionMethod();
        if (!method.isPresent()) {
            return algorithm.fitAndDetect(signal, argumentParser.getPenalty());
        }
        PenaltySelectionOptions.Builder<?> builder = PenaltySelectionOptions.builder().method(method.get())
                .numPenaltySteps(argumentParser.getPenaltySteps());
        argumentParser.getMinPenalty().ifPresent(builder::minPenalty);
        argumentParser.getMaxPenalty().ifPresent(builder::maxPenalty);
        PenaltySelectionResult result = new PeltPenaltySelector(algorithm).fitAndSelect(signal, builder.build());
        log.info("selected penalty {} with {} score {}", result.getSelectedPenalty(), result.getMethod(),
                result.getSelectedScore());
        return result.getOptimalBreakpoints();
    }
}
