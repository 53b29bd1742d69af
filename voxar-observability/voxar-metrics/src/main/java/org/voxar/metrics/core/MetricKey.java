// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Identity of a single metric series: a metric name plus a set of labels.
 * <p>
 * Labels are kept sorted by name, so two keys built from the same label pairs in a different order
 * are equal and have the same hash code. Label names within a key are unique.
 * Key instance is immutable and is used to bucket counters, gauges and histograms.
 */
public record MetricKey(@NonNull String name, @NonNull List<Label> labels) implements Comparable<MetricKey> {

    private static final Comparator<Iterable<Label>> LABELS_COMPARATOR = (left, right) -> {
        Iterator<Label> leftIt = left.iterator();
        Iterator<Label> rightIt = right.iterator();
        while (leftIt.hasNext() && rightIt.hasNext()) {
            int compare = leftIt.next().compareTo(rightIt.next());
            if (compare != 0) {
                return compare;
            }
        }
        return Boolean.compare(leftIt.hasNext(), rightIt.hasNext());
    };

    /**
     * Creates a new metric key, sorting the provided labels by name.
     *
     * @param name   the name of the metric, must match {@value MetricUtils#METRIC_NAME_REGEX}
     * @param labels the labels of the metric, may be empty
     * @throws NullPointerException     if name, labels or any label is {@code null}
     * @throws IllegalArgumentException if name is invalid or a label name is used more than once
     */
    public MetricKey {
        MetricUtils.validateMetricName(name);
        Objects.requireNonNull(labels, "labels must not be null");

        List<Label> sorted = new ArrayList<>(labels);
        sorted.forEach(label -> Objects.requireNonNull(label, "label must not be null"));
        Collections.sort(sorted);

        Set<String> names = new HashSet<>();
        for (Label label : sorted) {
            if (!names.add(label.name())) {
                throw new IllegalArgumentException("Duplicate label name: " + label.name() + " for metric " + name);
            }
        }
        labels = List.copyOf(sorted);
    }

    /**
     * Creates a key without labels.
     */
    @NonNull
    public static MetricKey of(@NonNull String name) {
        return new MetricKey(name, List.of());
    }

    /**
     * Creates a key from a label mapping. Iteration order of the map is irrelevant.
     *
     * @param name   the metric name
     * @param labels label names mapped to values, may be empty
     * @return the key
     */
    @NonNull
    public static MetricKey of(@NonNull String name, @NonNull Map<String, String> labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        List<Label> list = new ArrayList<>(labels.size());
        labels.forEach((labelName, labelValue) -> list.add(new Label(labelName, labelValue)));
        return new MetricKey(name, list);
    }

    /**
     * Creates a key from alternating label names and values, e.g. {@code "map_id", "m1", "op", "load"}.
     *
     * @param name           the metric name
     * @param namesAndValues alternating label names and values
     * @return the key
     * @throws IllegalArgumentException if odd number of arguments is provided
     */
    @NonNull
    public static MetricKey of(@NonNull String name, @NonNull String... namesAndValues) {
        Objects.requireNonNull(namesAndValues, "label names and values must not be null");
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Label names and values must come in pairs, got "
                    + namesAndValues.length + " elements");
        }
        List<Label> list = new ArrayList<>(namesAndValues.length / 2);
        for (int i = 0; i < namesAndValues.length; i += 2) {
            list.add(new Label(namesAndValues[i], namesAndValues[i + 1]));
        }
        return new MetricKey(name, list);
    }

    /**
     * Returns a key with the same labels and the given suffix appended to the name.
     *
     * @param suffix the suffix, e.g. {@code "_error_total"}
     * @return a new key
     */
    @NonNull
    public MetricKey withNameSuffix(@NonNull String suffix) {
        Objects.requireNonNull(suffix, "suffix must not be null");
        return new MetricKey(name + suffix, labels);
    }

    /**
     * @return labels as an insertion-ordered (sorted by name) mapping
     */
    @NonNull
    public Map<String, String> labelMap() {
        Map<String, String> map = new LinkedHashMap<>();
        labels.forEach(label -> map.put(label.name(), label.value()));
        return Collections.unmodifiableMap(map);
    }

    @Override
    public int compareTo(MetricKey other) {
        int nameCompare = name.compareTo(other.name);
        return nameCompare != 0 ? nameCompare : LABELS_COMPARATOR.compare(labels, other.labels);
    }

    /**
     * @return the name followed by the labels in exposition style, e.g. {@code op{map_id="m1"}}
     */
    @Override
    public String toString() {
        if (labels.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length() + labels.size() * 16);
        sb.append(name).append('{');
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(labels.get(i));
        }
        return sb.append('}').toString();
    }
}
