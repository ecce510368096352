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

import static com.amazon.changepoint.CommonUtils.checkArgument;
import static com.amazon.changepoint.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import lombok.AccessLevel;
import lombok.Getter;

import com.amazon.changepoint.config.CostFunctionType;
import com.amazon.changepoint.config.PenaltySelectionMethod;
import com.amazon.changepoint.cost.ARCostFunction;

/**
 * Command-line arguments of the segmentation runner. Every argument has a long
 * flag and may have a short one; {@code --help} prints the usage and exits.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "core/target/changepoint-core-1.0.0.jar";

    /**
     * value of {@code --selection-method} that keeps the fixed penalty
     */
    public static final String NO_SELECTION = "none";

    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> flags = new HashMap<>();
    private final List<Argument<?>> arguments = new ArrayList<>();

    private final EnumArgument<CostFunctionType> costFunction;
    private final DoubleArgument penalty;
    private final IntegerArgument minSize;
    private final IntegerArgument jump;
    private final OptionalDoubleArgument gamma;
    private final Argument<Optional<Integer>> order;
    private final Argument<Optional<PenaltySelectionMethod>> selectionMethod;
    private final OptionalDoubleArgument minPenalty;
    private final OptionalDoubleArgument maxPenalty;
    private final IntegerArgument penaltySteps;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;

    /**
     * @param runnerClass       name of the runner, shown in the usage line
     * @param runnerDescription what the runner does, shown below the usage line
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;

        costFunction = addArgument(new EnumArgument<>("-c", "--cost", "Segment cost function.",
                CostFunctionType.class, CostFunctionType.L2));
        penalty = addArgument(new DoubleArgument("-p", "--penalty",
                "Penalty per change point when no selection method is used.", 10.0,
                x -> checkArgument(x >= 0, "penalty should be non-negative")));
        minSize = addArgument(new IntegerArgument("-m", "--min-size", "Minimum number of samples of a segment.", 1,
                n -> checkArgument(n > 0, "minimum segment size should be greater than 0")));
        jump = addArgument(new IntegerArgument("-j", "--jump", "Stride between candidate change points.", 1,
                n -> checkArgument(n > 0, "jump should be greater than 0")));
        gamma = addArgument(new OptionalDoubleArgument("--gamma", "Bandwidth of the rbf cost function.",
                "estimated from the data", x -> checkArgument(x > 0, "gamma should be greater than 0")));
        order = addArgument(new Argument<Optional<Integer>>(null, "--order",
                "Number of lags of the ar cost function; segments need at least 2 * order + 1 samples.",
                Optional.empty(), Integer.toString(ARCostFunction.DEFAULT_ORDER),
                x -> Optional.of(Integer.parseInt(x)),
                x -> x.ifPresent(n -> checkArgument(n > 0, "order should be greater than 0"))));
        selectionMethod = addArgument(new Argument<Optional<PenaltySelectionMethod>>(null, "--selection-method",
                "Information criterion used to select the penalty, one of none, bic, aic or aicc.", Optional.empty(),
                NO_SELECTION, ArgumentParser::parseSelectionMethod, x -> {
                }));
        minPenalty = addArgument(new OptionalDoubleArgument("--min-penalty",
                "Smallest penalty of the selection sweep.", "estimated",
                x -> checkArgument(x > 0, "minimum penalty should be greater than 0")));
        maxPenalty = addArgument(new OptionalDoubleArgument("--max-penalty", "Largest penalty of the selection sweep.",
                "estimated", x -> checkArgument(x > 0, "maximum penalty should be greater than 0")));
        penaltySteps = addArgument(new IntegerArgument(null, "--penalty-steps",
                "Number of penalties of the selection sweep.", 50,
                n -> checkArgument(n > 0, "number of penalty steps should be greater than 0")));
        delimiter = addArgument(
                new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.", ","));
        headerRow = addArgument(
                new BooleanArgument("--header-row", "Set to 'true' if the data contains a header row.", false));
    }

    private static Optional<PenaltySelectionMethod> parseSelectionMethod(String value) {
        if (NO_SELECTION.equalsIgnoreCase(value)) {
            return Optional.empty();
        }
        return Optional.of(PenaltySelectionMethod.valueOf(value.toUpperCase(Locale.ROOT)));
    }

    /**
     * Register an argument under its flags.
     *
     * @param argument the argument
     * @param <A>      the type of the argument
     * @return the argument
     */
    protected <A extends Argument<?>> A addArgument(A argument) {
        checkNotNull(argument, "argument should not be null");
        for (String flag : new String[] { argument.getShortFlag(), argument.getLongFlag() }) {
            if (flag != null) {
                checkArgument(!flags.containsKey(flag),
                        String.format("An argument mapping already exists for %s", flag));
                flags.put(flag, argument);
            }
        }
        arguments.add(argument);
        return argument;
    }

    /**
     * Parse the given command-line arguments. Unknown flags, missing values and
     * invalid values print the usage and exit.
     *
     * @param arguments the command-line arguments
     */
    public void parse(String... arguments) {
        for (int i = 0; i < arguments.length; i++) {
            String flag = arguments[i];
            if ("-h".equals(flag) || "--help".equals(flag)) {
                printUsage();
                Runtime.getRuntime().exit(0);
            }
            try {
                Argument<?> argument = flags.get(flag);
                if (argument == null) {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
                checkArgument(i + 1 < arguments.length, "Missing value for " + flag);
                argument.parse(arguments[++i]);
            } catch (RuntimeException e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.printf("Usage: java -cp %s %s [options] < input_file > output_file%n%n", ARCHIVE_NAME,
                runnerClass);
        System.out.printf("%s%n%nOptions:%n", runnerDescription);
        arguments.stream().map(Argument::getHelpMessage).sorted().forEach(msg -> System.out.println("\t" + msg));
        System.out.printf("%n\t--help, -h: Print this help message and exit.%n");
    }

    /**
     * Print an error message and the usage message, then exit with status 1.
     *
     * @param errorMessage  a format string
     * @param formatObjects the arguments of the format string
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    public CostFunctionType getCostFunction() {
        return costFunction.getValue();
    }

    public double getPenalty() {
        return penalty.getValue();
    }

    public int getMinSize() {
        return minSize.getValue();
    }

    public int getJump() {
        return jump.getValue();
    }

    /**
     * @return the bandwidth of the rbf cost function, empty to estimate it
     */
    public Optional<Double> getGamma() {
        return gamma.getValue();
    }

    /**
     * @return the number of lags of the ar cost function, empty for the default
     */
    public Optional<Integer> getOrder() {
        return order.getValue();
    }

    /**
     * @return the information criterion, empty when the fixed penalty is used
     */
    public Optional<PenaltySelectionMethod> getSelectionMethod() {
        return selectionMethod.getValue();
    }

    public Optional<Double> getMinPenalty() {
        return minPenalty.getValue();
    }

    public Optional<Double> getMaxPenalty() {
        return maxPenalty.getValue();
    }

    public int getPenaltySteps() {
        return penaltySteps.getValue();
    }

    public String getDelimiter() {
        return delimiter.getValue();
    }

    public boolean getHeaderRow() {
        return headerRow.getValue();
    }

    /**
     * A command-line argument holding a value of type {@code T}.
     */
    @Getter
    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        /**
         * the default as shown in the help message
         */
        private final String defaultText;
        @Getter(AccessLevel.NONE)
        private final Function<String, T> parseFunction;
        @Getter(AccessLevel.NONE)
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue, String defaultText,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.longFlag = checkNotNull(longFlag, "longFlag must not be null");
            this.shortFlag = shortFlag;
            this.description = description;
            this.defaultText = defaultText;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            this.value = defaultValue;
        }

        public String getHelpMessage() {
            String names = (shortFlag == null) ? longFlag : longFlag + ", " + shortFlag;
            return String.format("%s: %s (default: %s)", names, description, defaultText);
        }

        public void parse(String string) {
            T parsed = parseFunction.apply(string);
            validateFunction.accept(parsed);
            value = parsed;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, defaultValue, x -> x, x -> {
            });
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String longFlag, String description, boolean defaultValue) {
            super(null, longFlag, description, defaultValue, Boolean.toString(defaultValue), Boolean::parseBoolean,
                    x -> {
                    });
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer.toString(defaultValue), Integer::parseInt,
                    validateFunction);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double.toString(defaultValue), Double::parseDouble,
                    validateFunction);
        }
    }

    /**
     * A numeric argument that is absent unless given.
     */
    public static class OptionalDoubleArgument extends Argument<Optional<Double>> {
        public OptionalDoubleArgument(String longFlag, String description, String defaultText,
                Consumer<Double> validateFunction) {
            super(null, longFlag, description, Optional.empty(), defaultText, x -> Optional.of(Double.parseDouble(x)),
                    x -> x.ifPresent(validateFunction));
        }
    }

    /**
     * An enum argument, matched case-insensitively; the help message lists the
     * constants in lower case.
     */
    public static class EnumArgument<E extends Enum<E>> extends Argument<E> {
        public EnumArgument(String shortFlag, String longFlag, String description, Class<E> type, E defaultValue) {
            super(shortFlag, longFlag, description + " One of " + constants(type) + ".", defaultValue,
                    defaultValue.name().toLowerCase(Locale.ROOT), x -> Enum.valueOf(type, x.toUpperCase(Locale.ROOT)),
                    x -> {
                    });
        }

        private static <E extends Enum<E>> String constants(Class<E> type) {
            StringBuilder builder = new StringBuilder();
            for (E constant : type.getEnumConstants()) {
                if (builder.length() > 0) {
                    builder.append(", ");
                }
                builder.append(constant.name().toLowerCase(Locale.ROOT));
            }
            return builder.toString();
        }
    }
}
