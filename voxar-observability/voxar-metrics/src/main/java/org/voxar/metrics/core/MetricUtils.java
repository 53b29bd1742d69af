// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utility class for metric name and label validation.
 */
public final class MetricUtils {

    /** Regex for validating metric names. */
    public static final String METRIC_NAME_REGEX = "^[a-zA-Z_:][a-zA-Z0-9_:]*$";

    /** Regex for validating label names. */
    public static final String LABEL_NAME_REGEX = "^[a-zA-Z_][a-zA-Z0-9_]*$";

    /**
     * Label names produced by the exposition format itself. Callers may not use them,
     * otherwise exported series would collide with the generated ones.
     */
    public static final Set<String> RESERVED_LABEL_NAMES = Set.of("le", "quantile");

    /** Prefix reserved for internal labels. */
    public static final String RESERVED_LABEL_PREFIX = "__";

    private static final Pattern METRIC_NAME_PATTERN = Pattern.compile(METRIC_NAME_REGEX);
    private static final Pattern LABEL_NAME_PATTERN = Pattern.compile(LABEL_NAME_REGEX);

    private MetricUtils() {}

    /**
     * Validates that the provided metric name adheres to the required character set. <br>
     * Pattern to validate is: {@value #METRIC_NAME_REGEX}
     *
     * @param metricName the name to validate
     * @return the validated name
     * @throws NullPointerException if metric name is {@code null}
     * @throws IllegalArgumentException if metric name is blank or contains invalid characters
     */
    @NonNull
    public static String validateMetricName(String metricName) {
        return validateNameCharacters(METRIC_NAME_PATTERN, metricName, "metric name");
    }

    /**
     * Validates that the provided label name adheres to the required character set and is not reserved. <br>
     * Pattern to validate is: {@value #LABEL_NAME_REGEX}. Names in {@link #RESERVED_LABEL_NAMES} and names
     * starting with {@value #RESERVED_LABEL_PREFIX} are rejected.
     *
     * @param labelName the label name to validate
     * @return the validated name
     * @throws NullPointerException if label name is {@code null}
     * @throws IllegalArgumentException if label name is blank, contains invalid characters or is reserved
     */
    @NonNull
    public static String validateLabelName(String labelName) {
        validateNameCharacters(LABEL_NAME_PATTERN, labelName, "label name");
        if (RESERVED_LABEL_NAMES.contains(labelName) || labelName.startsWith(RESERVED_LABEL_PREFIX)) {
            throw new IllegalArgumentException("Label name is reserved: " + labelName);
        }
        return labelName;
    }

    private static String validateNameCharacters(Pattern pattern, String name, String argumentName) {
        throwArgBlank(name, argumentName);
        if (!pattern.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Name contains illegal character: " + name + ". Required pattern is " + pattern.pattern());
        }
        return name;
    }

    /**
     * Validates that provided argument is not null or blank.
     *
     * @param argument     the argument checked
     * @param argumentName the name of the argument
     * @return the argument
     * @throws NullPointerException of passed argument is {@code null}
     * @throws IllegalArgumentException of passed argument is blank using {@link String#isBlank()}
     */
    @NonNull
    public static String throwArgBlank(@NonNull final String argument, @NonNull final String argumentName)
            throws NullPointerException, IllegalArgumentException {
        Objects.requireNonNull(argument, argumentName + " cannot be null");
        if (argument.isBlank()) {
            throw new IllegalArgumentException(argumentName + " cannot be blank");
        }
        return argument;
    }

    /**
     * Escape newline {@code \n}, double quote {@code "} and backslash {@code \} characters in label values.
     *
     * @param value the string value to escape
     * @return the escaped string
     */
    @NonNull
    public static String escapeLabelValue(final String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
