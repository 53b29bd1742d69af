// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics.export;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.voxar.metrics.core.MetricKey;
import org.voxar.metrics.stat.HistogramSummary;

/**
 * Structured view of the engine state. Each entry is consistent on its own;
 * entries of different metrics may have been read at slightly different instants.
 * Maps are unmodifiable and sorted by {@link MetricKey}.
 *
 * @param timestamp       when the snapshot was taken
 * @param retentionWindow the histogram retention window in effect
 * @param counters        counter values
 * @param gauges          gauge values
 * @param histograms      histogram summaries, including histograms emptied by retention
 */
public record MetricsSnapshot(
        @NonNull Instant timestamp,
        @NonNull Duration retentionWindow,
        @NonNull SortedMap<MetricKey, Long> counters,
        @NonNull SortedMap<MetricKey, Double> gauges,
        @NonNull SortedMap<MetricKey, HistogramSummary> histograms) {

    public MetricsSnapshot {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(retentionWindow, "retention window must not be null");
        counters = sortedCopy(counters, "counters");
        gauges = sortedCopy(gauges, "gauges");
        histograms = sortedCopy(histograms, "histograms");
    }

    /**
     * @return {@code true} if no counter, gauge or histogram is present
     */
    public boolean isEmpty() {
        return counters.isEmpty() && gauges.isEmpty() && histograms.isEmpty();
    }

    private static <V> SortedMap<MetricKey, V> sortedCopy(Map<MetricKey, V> map, String name) {
        Objects.requireNonNull(map, name + " must not be null");
        return Collections.unmodifiableSortedMap(new TreeMap<>(map));
    }
}
