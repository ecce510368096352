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

package com.amazon.changepoint.examples;

import static com.amazon.changepoint.CommonUtils.checkArgument;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.changepoint.examples.segmentation.KernelSegmentation;
import com.amazon.changepoint.examples.segmentation.MeanShiftSegmentation;
import com.amazon.changepoint.examples.selection.CountDataSelection;
import com.amazon.changepoint.examples.selection.GaussianPenaltySelection;
import com.amazon.changepoint.examples.serialization.JsonExample;

/**
 * Runs one example, or all of them with {@code all}. Examples are listed in
 * the order they are registered: segmentation with a fixed penalty first, then
 * penalty selection, then serialization.
 */
public class Main {

    public static final String ARCHIVE_NAME = "changepoint-examples-1.0.0.jar";

    public static final String ALL_EXAMPLES = "all";

    public static void main(String[] args) throws Exception {
        new Main().run(args);
    }

    private final Map<String, Example> examples = new LinkedHashMap<>();

    public Main() {
        this(Arrays.asList(new MeanShiftSegmentation(), new KernelSegmentation(), new GaussianPenaltySelection(),
                new CountDataSelection(), new JsonExample()));
    }

    Main(List<Example> examples) {
        for (Example example : examples) {
            checkArgument(!ALL_EXAMPLES.equals(example.command()) && !this.examples.containsKey(example.command()),
                    "duplicate example command " + example.command());
            this.examples.put(example.command(), example);
        }
    }

    public void run(String[] args) throws Exception {
        if (args == null || args.length < 1 || "-h".equals(args[0]) || "--help".equals(args[0])) {
            printUsage();
            return;
        }

        String command = args[0];
        if (ALL_EXAMPLES.equals(command)) {
            for (Example example : examples.values()) {
                System.out.printf("== %s%n", example.command());
                example.run();
            }
            return;
        }

        Example example = examples.get(command);
        if (example == null) {
            throw new IllegalArgumentException("No such example: " + command + ", expected one of "
                    + examples.keySet() + " or " + ALL_EXAMPLES);
        }
        example.run();
    }

    public void printUsage() {
        int width = ALL_EXAMPLES.length();
        for (String command : examples.keySet()) {
            width = Math.max(width, command.length());
        }
        String line = "\t %" + width + "s - %s%n";
        System.out.printf("Usage: java -cp %s %s [example]%n", ARCHIVE_NAME, Main.class.getName());
        System.out.println("Examples:");
        for (Example example : examples.values()) {
            System.out.printf(line, example.command(), example.description());
        }
        System.out.printf(line, ALL_EXAMPLES, "run every example in turn");
    }
}
