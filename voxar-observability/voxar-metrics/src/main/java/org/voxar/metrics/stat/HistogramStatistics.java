// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics.stat;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Computes {@link HistogramSummary} values from a copy of histogram sample values.
 * <p>
 * Percentiles use the floor-index rule: for {@code n} ascending finite values, the p-th percentile is the value at
 * index {@code floor(n * p)}, clamped to {@code n - 1}. Higher percentiles need a minimum number of samples
 * ({@value #P90_MIN_SAMPLES} for p90, {@value #P95_MIN_SAMPLES} for p95, {@value #P99_MIN_SAMPLES} for p99);
 * below that they report the maximum. This is an approximation, not an interpolated order statistic.
 */
public final class HistogramStatistics {

    static final int P90_MIN_SAMPLES = 10;
    static final int P95_MIN_SAMPLES = 20;
    static final int P99_MIN_SAMPLES = 100;

    private HistogramStatistics() {}

    /**
     * Summarizes the given values. The array is not modified.
     *
     * @param values     sample values in stored order, may contain non-finite values
     * @param thresholds ascending finite upper bounds for cumulative counts, {@code +Inf} is appended
     * @return the summary, {@link HistogramSummary#empty()} if there are no values
     */
    @NonNull
    public static HistogramSummary summarize(@NonNull double[] values, @NonNull List<Double> thresholds) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(thresholds, "thresholds must not be null");
        if (values.length == 0) {
            return HistogramSummary.empty();
        }

        final double[] sorted = finiteSorted(values);
        final long nonFinite = values.length - sorted.length;

        HistogramSummary.Distribution distribution = null;
        if (sorted.length > 0) {
            double sum = 0.0;
            for (double value : sorted) {
                sum += value;
            }
            distribution = new HistogramSummary.Distribution(
                    sum,
                    sum / sorted.length,
                    sorted[0],
                    sorted[sorted.length - 1],
                    percentile(sorted, 0.5),
                    sorted.length >= P90_MIN_SAMPLES ? percentile(sorted, 0.9) : sorted[sorted.length - 1],
                    sorted.length >= P95_MIN_SAMPLES ? percentile(sorted, 0.95) : sorted[sorted.length - 1],
                    sorted.length >= P99_MIN_SAMPLES ? percentile(sorted, 0.99) : sorted[sorted.length - 1]);
        }

        return new HistogramSummary(
                values.length, nonFinite, distribution, cumulativeCounts(sorted, values.length, thresholds));
    }

    /**
     * Floor-index percentile over an ascending array.
     *
     * @param sorted     ascending values, must not be empty
     * @param percentile fraction in {@code [0, 1]}
     * @return the value at {@code floor(n * percentile)}, clamped to the last index
     */
    public static double percentile(@NonNull double[] sorted, double percentile) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Cannot compute percentile of no values");
        }
        if (percentile < 0.0 || percentile > 1.0) {
            throw new IllegalArgumentException("Percentile must be within [0, 1], but was: " + percentile);
        }
        int index = (int) Math.floor(sorted.length * percentile);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    private static double[] finiteSorted(double[] values) {
        double[] finite = new double[values.length];
        int size = 0;
        for (double value : values) {
            if (Double.isFinite(value)) {
                finite[size++] = value;
            }
        }
        double[] sorted = Arrays.copyOf(finite, size);
        Arrays.sort(sorted);
        return sorted;
    }

    private static List<HistogramSummary.CumulativeCount> cumulativeCounts(
            double[] sortedFinite, long totalCount, List<Double> thresholds) {
        List<HistogramSummary.CumulativeCount> counts = new ArrayList<>(thresholds.size() + 1);
        int index = 0;
        for (double threshold : thresholds) {
            while (index < sortedFinite.length && sortedFinite[index] <= threshold) {
                index++;
            }
            counts.add(new HistogramSummary.CumulativeCount(threshold, index));
        }
        // non-finite samples only land in the +Inf bucket, which must always equal the total count
        counts.add(new HistogramSummary.CumulativeCount(Double.POSITIVE_INFINITY, totalCount));
        return counts;
    }
}
